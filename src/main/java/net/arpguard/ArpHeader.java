package net.arpguard;

import org.projectfloodlight.openflow.types.ArpOpcode;
import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;

/**
 * Decoded ARP payload of an Ethernet frame.
 */
public class ArpHeader{
	private final ArpOpcode opcode;
	private final MacAddress senderHardwareAddress;
	private final IPv4Address senderProtocolAddress;
	private final MacAddress targetHardwareAddress;
	private final IPv4Address targetProtocolAddress;

	public ArpHeader(ArpOpcode opcode,MacAddress senderHardwareAddress,IPv4Address senderProtocolAddress,
			MacAddress targetHardwareAddress,IPv4Address targetProtocolAddress){
		this.opcode = opcode;
		this.senderHardwareAddress = senderHardwareAddress;
		this.senderProtocolAddress = senderProtocolAddress;
		this.targetHardwareAddress = targetHardwareAddress;
		this.targetProtocolAddress = targetProtocolAddress;
	}

	public static ArpHeader request(MacAddress sha,IPv4Address spa,IPv4Address tpa){
		return new ArpHeader(ArpOpcode.REQUEST,sha,spa,MacAddress.NONE,tpa);
	}

	public static ArpHeader reply(MacAddress sha,IPv4Address spa,MacAddress tha,IPv4Address tpa){
		return new ArpHeader(ArpOpcode.REPLY,sha,spa,tha,tpa);
	}

	public ArpOpcode getOpcode() {
		return opcode;
	}

	public MacAddress getSenderHardwareAddress() {
		return senderHardwareAddress;
	}

	public IPv4Address getSenderProtocolAddress() {
		return senderProtocolAddress;
	}

	public MacAddress getTargetHardwareAddress() {
		return targetHardwareAddress;
	}

	public IPv4Address getTargetProtocolAddress() {
		return targetProtocolAddress;
	}

	public boolean isRequest(){
		return ArpOpcode.REQUEST.equals(opcode);
	}

	public boolean isReply(){
		return ArpOpcode.REPLY.equals(opcode);
	}

	/**
	 * @throws MalformedPacketException if a field needed for validation is missing
	 */
	public void checkComplete(){
		if(opcode == null) throw new MalformedPacketException("ARP opcode missing");
		if(senderHardwareAddress == null) throw new MalformedPacketException("ARP sender hardware address missing");
		if(senderProtocolAddress == null) throw new MalformedPacketException("ARP sender protocol address missing");
		if(targetProtocolAddress == null) throw new MalformedPacketException("ARP target protocol address missing");
		if(isReply() && targetHardwareAddress == null) throw new MalformedPacketException("ARP target hardware address missing");
	}

	@Override
	public String toString(){
		return "ARP[" + opcode + " " + senderProtocolAddress + "/" + senderHardwareAddress
			+ " -> " + targetProtocolAddress + "/" + targetHardwareAddress + "]";
	}
}
