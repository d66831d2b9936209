package net.arpguard;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of validating one ARP packet.
 * A spoof verdict carries every failed check in evaluation order;
 * the first one is the reported reason.
 */
public final class ArpVerdict{
	public static final ArpVerdict VALID = new ArpVerdict(ImmutableList.<SpoofReason>of(),false);

	private final List<SpoofReason> reasons;
	private final boolean terminal;

	private ArpVerdict(List<SpoofReason> reasons,boolean terminal){
		this.reasons = reasons;
		this.terminal = terminal;
	}

	/**
	 * @param terminal true if the packet must not go on to learning and forwarding
	 */
	public static ArpVerdict spoof(List<SpoofReason> reasons,boolean terminal){
		if(reasons.isEmpty()) throw new IllegalArgumentException("a spoof verdict needs a reason");
		return new ArpVerdict(ImmutableList.copyOf(reasons),terminal);
	}

	public static ArpVerdict spoof(SpoofReason reason,boolean terminal){
		return new ArpVerdict(ImmutableList.of(reason),terminal);
	}

	public boolean isValid(){
		return reasons.isEmpty();
	}

	public boolean isSpoof(){
		return !reasons.isEmpty();
	}

	/**
	 * @return the first failed check, or null for a valid packet
	 */
	public SpoofReason getReason(){
		return reasons.isEmpty() ? null : reasons.get(0);
	}

	public List<SpoofReason> getReasons(){
		return reasons;
	}

	public boolean isTerminal(){
		return terminal;
	}

	@Override
	public String toString(){
		return isValid() ? "VALID" : "SPOOF" + reasons;
	}
}
