package net.arpguard;

/**
 * State of an ARP request key: either pending since a timestamp or absent.
 * Absent covers both "never requested" and "already answered or expired".
 */
public final class PendingRequest{
	public static final PendingRequest ABSENT = new PendingRequest(false,0L);

	private final boolean pending;
	private final long timestamp;

	private PendingRequest(boolean pending,long timestamp){
		this.pending = pending;
		this.timestamp = timestamp;
	}

	public static PendingRequest pending(long timestamp){
		return new PendingRequest(true,timestamp);
	}

	public boolean isPending(){
		return pending;
	}

	/**
	 * @return the time (epoch millis) the request was recorded
	 * @throws IllegalStateException if this value is {@link #ABSENT}
	 */
	public long getTimestamp(){
		if(!pending) throw new IllegalStateException("no pending request");
		return timestamp;
	}

	/**
	 * @return true if the request has been outstanding for longer than maxAgeMillis at now
	 */
	public boolean isOlderThan(long now,long maxAgeMillis){
		return pending && now - timestamp > maxAgeMillis;
	}

	@Override
	public boolean equals(Object ob){
		if(!(ob instanceof PendingRequest)) return false;
		PendingRequest ref = (PendingRequest) ob;
		return pending == ref.pending && timestamp == ref.timestamp;
	}

	@Override
	public int hashCode(){
		return Boolean.hashCode(pending) * 31 + Long.hashCode(timestamp);
	}

	@Override
	public String toString(){
		return pending ? "Pending(" + timestamp + ")" : "Absent";
	}
}
