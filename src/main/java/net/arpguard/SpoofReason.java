package net.arpguard;

/**
 * Why an ARP packet was classified as spoofed.
 */
public enum SpoofReason {
	ETH_ARP_SRC_MISMATCH("eth/arp src mismatch"),
	ETH_ARP_DST_MISMATCH("eth/arp dst mismatch"),
	UNKNOWN_SOURCE_BINDING("unknown source binding"),
	SOURCE_BINDING_MISMATCH("source binding mismatch"),
	UNKNOWN_DESTINATION("unknown destination"),
	DESTINATION_BINDING_MISMATCH("destination binding mismatch"),
	BROADCAST_REPLY("broadcast reply"),
	NO_OUTSTANDING_REQUEST("no matching outstanding request");

	private final String description;

	SpoofReason(String description){
		this.description = description;
	}

	public String getDescription(){
		return description;
	}

	@Override
	public String toString(){
		return description;
	}
}
