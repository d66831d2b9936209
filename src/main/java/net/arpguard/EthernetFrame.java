package net.arpguard;

import org.projectfloodlight.openflow.types.EthType;
import org.projectfloodlight.openflow.types.MacAddress;

/**
 * Decoded header fields of a packet-in frame. Decoding itself is done by the
 * controller core before the frame reaches this module.
 */
public class EthernetFrame{
	/* 01:80:C2:00:00:00 through 01:80:C2:00:00:0F, never forwarded by bridges */
	private static final long BRIDGE_FILTERED_PREFIX = 0x0180C2000000L;
	private static final long BRIDGE_FILTERED_MASK = 0xFFFFFFFFFFF0L;

	private final MacAddress source;
	private final MacAddress destination;
	private final EthType etherType;
	private final ArpHeader arp;

	public EthernetFrame(MacAddress source,MacAddress destination,EthType etherType,ArpHeader arp){
		this.source = source;
		this.destination = destination;
		this.etherType = etherType;
		this.arp = arp;
	}

	public EthernetFrame(MacAddress source,MacAddress destination,EthType etherType){
		this(source,destination,etherType,null);
	}

	public static EthernetFrame arp(MacAddress source,MacAddress destination,ArpHeader arp){
		return new EthernetFrame(source,destination,EthType.ARP,arp);
	}

	public MacAddress getSourceMACAddress() {
		return source;
	}

	public MacAddress getDestinationMACAddress() {
		return destination;
	}

	public EthType getEtherType() {
		return etherType;
	}

	public boolean isArp(){
		return EthType.ARP.equals(etherType);
	}

	public boolean isLldp(){
		return EthType.LLDP.equals(etherType);
	}

	/**
	 * @return the ARP payload of an ARP frame
	 * @throws MalformedPacketException if the frame has no complete ARP payload
	 */
	public ArpHeader getArp(){
		if(arp == null) throw new MalformedPacketException("ARP frame from " + source + " has no ARP payload");
		arp.checkComplete();
		return arp;
	}

	public boolean isBridgeFilteredDestination(){
		return isBridgeFiltered(destination);
	}

	public static boolean isBridgeFiltered(MacAddress mac){
		return (mac.getLong() & BRIDGE_FILTERED_MASK) == BRIDGE_FILTERED_PREFIX;
	}

	/**
	 * @throws MalformedPacketException if the Ethernet header is incomplete
	 */
	public void checkComplete(){
		if(source == null) throw new MalformedPacketException("frame source address missing");
		if(destination == null) throw new MalformedPacketException("frame destination address missing");
		if(etherType == null) throw new MalformedPacketException("frame ethertype missing");
	}

	@Override
	public String toString(){
		return source + " -> " + destination + " (" + etherType + ")" + (arp == null ? "" : " " + arp);
	}
}
