package net.arpguard;

import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFPort;

/**
 * Everything the forwarding decision needs to know about one packet-in.
 */
public class PacketInContext{
	private final ISwitchConnection sw;
	private final OFPort inPort;
	private final EthernetFrame eth;
	private final OFBufferId bufferId;
	private final byte[] data;

	public PacketInContext(ISwitchConnection sw,OFPort inPort,EthernetFrame eth,OFBufferId bufferId,byte[] data){
		this.sw = sw;
		this.inPort = inPort;
		this.eth = eth;
		this.bufferId = bufferId == null ? OFBufferId.NO_BUFFER : bufferId;
		this.data = data == null ? new byte[0] : data;
	}

	public ISwitchConnection getSwitch() {
		return sw;
	}

	public OFPort getInPort() {
		return inPort;
	}

	public EthernetFrame getFrame() {
		return eth;
	}

	public OFBufferId getBufferId() {
		return bufferId;
	}

	/**
	 * @return the raw frame, used when the switch did not buffer the packet
	 */
	public byte[] getData() {
		return data;
	}

	public boolean isBuffered(){
		return !OFBufferId.NO_BUFFER.equals(bufferId);
	}
}
