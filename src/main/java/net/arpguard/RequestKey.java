package net.arpguard;

import org.projectfloodlight.openflow.types.IPv4Address;

/**
 * Identifies an outstanding ARP request by the asking host and the address it asked for.
 */
public class RequestKey{
	private final IPv4Address sender;
	private final IPv4Address target;
	public RequestKey(IPv4Address sender,IPv4Address target){
		this.sender = sender;
		this.target = target;
	}

	/**
	 * @return the IP of the host that sent the request
	 */
	public IPv4Address getSender() {
		return sender;
	}

	/**
	 * @return the IP being resolved
	 */
	public IPv4Address getTarget() {
		return target;
	}

	@Override
	public boolean equals(Object ob){
		if(ob instanceof RequestKey){
			RequestKey ref = (RequestKey) ob;
			if(ref.sender.equals(sender) && ref.target.equals(target)) return true;
		}
		return false;
	}

	@Override
	public int hashCode(){
		return 31 * sender.hashCode() + target.hashCode();
	}

	@Override
	public String toString(){
		return sender.toString() + " -----> " + target.toString();
	}

}
