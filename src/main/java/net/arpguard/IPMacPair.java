package net.arpguard;

import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;

/**
 * A leased address binding: the MAC address that currently owns an IPv4 address.
 */
public class IPMacPair{
	private final IPv4Address ip;
	private final MacAddress mac;

	public IPMacPair(IPv4Address ip,MacAddress mac){
		this.ip = ip;
		this.mac = mac;
	}
	/**
	 * @return the ip
	 */
	public IPv4Address getIp() {
		return ip;
	}

	/**
	 * @return the mac
	 */
	public MacAddress getMac() {
		return mac;
	}

	@Override
	public boolean equals(Object ob){
		if(ob instanceof IPMacPair){
			IPMacPair pair = (IPMacPair) ob;
			return (ip.equals(pair.ip) && mac.equals(pair.mac));
		}
		return false;
	}

	@Override
	public int hashCode(){
		return 31 * ip.hashCode() + mac.hashCode();
	}

	@Override
	public String toString(){
		return ip.toString() + " -----> " + mac.toString();
	}
}
