package net.arpguard;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map.Entry;

import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Process-wide IPv4 to MAC registry fed by DHCP lease events.
 * Every operation holds the table lock, so packet handlers on different
 * switches can read it while leases are being recorded.
 */
public class AddressBindingTable{
	protected static Logger log = LoggerFactory.getLogger(AddressBindingTable.class);
	private final HashMap<IPv4Address,MacAddress> map;
	public AddressBindingTable(){
		map = new HashMap<>();
	}

	/**
	 * Binds ip to mac, replacing any earlier binding for ip.
	 * @return true if an earlier binding for ip existed
	 */
	public synchronized boolean register(IPv4Address ip,MacAddress mac){
		Preconditions.checkNotNull(ip,"ip");
		Preconditions.checkNotNull(mac,"mac");
		MacAddress old = map.put(ip,mac);
		if(old != null && !old.equals(mac)){
			log.info("Binding for {} moved from {} to {}",new Object[]{ip,old,mac});
		}else if(old == null){
			log.debug("Registered binding {} -> {}",ip,mac);
		}
		return old != null;
	}

	/**
	 * @return the bound MAC, or null if ip has no binding
	 */
	public synchronized MacAddress lookup(IPv4Address ip){
		return map.get(ip);
	}

	public synchronized boolean contains(IPv4Address ip){
		return map.containsKey(ip);
	}

	public synchronized int size(){
		return map.size();
	}

	/**
	 * @return a copy of every binding, ordered by address
	 */
	public synchronized List<IPMacPair> getBindings(){
		List<IPMacPair> list = new ArrayList<>(map.size());
		for(Entry<IPv4Address,MacAddress> e : map.entrySet()){
			list.add(new IPMacPair(e.getKey(),e.getValue()));
		}
		list.sort((a,b) -> a.getIp().compareTo(b.getIp()));
		return ImmutableList.copyOf(list);
	}
}
