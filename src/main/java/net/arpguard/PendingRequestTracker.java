package net.arpguard;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;

import org.projectfloodlight.openflow.types.IPv4Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * Outstanding ARP requests keyed by (sender IP, target IP).
 * A key that is not in the map reads as {@link PendingRequest#ABSENT}.
 * All access goes through the tracker lock; the expiry sweep and the
 * packet handlers never see a half-applied update.
 */
public class PendingRequestTracker{
	protected static Logger log = LoggerFactory.getLogger(PendingRequestTracker.class);
	private final HashMap<RequestKey,Long> map;
	public PendingRequestTracker(){
		map = new HashMap<>();
	}

	public synchronized void record(IPv4Address sender,IPv4Address target,long now){
		map.put(new RequestKey(sender,target),now);
	}

	public synchronized void clear(IPv4Address sender,IPv4Address target){
		map.remove(new RequestKey(sender,target));
	}

	/**
	 * Clears the entry only if one is pending.
	 * @return true if a pending entry was cleared
	 */
	public synchronized boolean clearIfPending(IPv4Address sender,IPv4Address target){
		return map.remove(new RequestKey(sender,target)) != null;
	}

	public synchronized PendingRequest isPending(IPv4Address sender,IPv4Address target){
		Long ts = map.get(new RequestKey(sender,target));
		return ts == null ? PendingRequest.ABSENT : PendingRequest.pending(ts);
	}

	/**
	 * Clears every request that has been pending for more than maxAgeMillis.
	 * @return the number of requests cleared
	 */
	public synchronized int sweep(long now,long maxAgeMillis){
		int cleared = 0;
		Iterator<Entry<RequestKey,Long>> itr = map.entrySet().iterator();
		while(itr.hasNext()){
			Entry<RequestKey,Long> e = itr.next();
			if(PendingRequest.pending(e.getValue()).isOlderThan(now,maxAgeMillis)){
				log.debug("Cleaned up the state of request {}",e.getKey());
				itr.remove();
				cleared++;
			}
		}
		return cleared;
	}

	public synchronized int pendingCount(){
		return map.size();
	}

	/**
	 * @return a copy of the pending requests and the time each was recorded
	 */
	public synchronized Map<RequestKey,Long> getPendingRequests(){
		return ImmutableMap.copyOf(map);
	}
}
