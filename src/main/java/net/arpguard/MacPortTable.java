package net.arpguard;

import java.util.HashMap;

import org.projectfloodlight.openflow.types.MacAddress;
import org.projectfloodlight.openflow.types.OFPort;

/**
 * MAC to port table of a single switch. Owned by one {@link LearningSwitch}
 * and only touched from that switch's packet-in handling, so it is not synchronized.
 */
public class MacPortTable{
	private HashMap<MacAddress,OFPort> map;
	public MacPortTable(){
		map = new HashMap<>();
	}
	public OFPort getPortForMac(MacAddress mac){
		return map.get(mac);
	}
	/**
	 * @return true if the address was already known, on any port
	 */
	public boolean addEntry(MacAddress addr,OFPort port){
		return map.put(addr,port) != null;
	}
	public boolean macExists(MacAddress addr){
		return map.containsKey(addr);
	}
	public int size(){
		return map.size();
	}
}
