package net.arpguard;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic task that expires ARP requests nobody answered.
 * Scheduled at a fixed rate by {@link ArpGuard}; it runs until the
 * executor is shut down with the process.
 */
public class ExpiryWatchdog implements Runnable {
	protected static Logger log = LoggerFactory.getLogger(ExpiryWatchdog.class);
	public static final long DEFAULT_MAX_AGE_MS = 5000;

	private final PendingRequestTracker tracker;
	private final Clock clock;
	private final long maxAgeMillis;

	public ExpiryWatchdog(PendingRequestTracker tracker,Clock clock,long maxAgeMillis){
		this.tracker = tracker;
		this.clock = clock;
		this.maxAgeMillis = maxAgeMillis;
	}

	@Override
	public void run() {
		// an exception escaping here would cancel the fixed-rate schedule
		try {
			log.trace("Monitoring the ARP request table");
			int cleared = tracker.sweep(clock.millis(),maxAgeMillis);
			if(cleared > 0){
				log.debug("Expired {} unanswered ARP requests, {} still pending",cleared,tracker.pendingCount());
			}
		}catch(RuntimeException e){
			log.error("ARP request sweep failed",e);
		}
	}
}
