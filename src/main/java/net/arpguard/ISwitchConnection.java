package net.arpguard;

import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.types.DatapathId;

/**
 * A connected OpenFlow switch as seen by this module. The controller core
 * owns the channel; this module only builds messages and hands them over.
 */
public interface ISwitchConnection {
	public DatapathId getId();

	/**
	 * @return the time (epoch millis) the switch connected
	 */
	public long getConnectTime();

	public OFFactory getOFFactory();

	/**
	 * Queues a message for the switch without waiting for it to be sent.
	 * @return false if the message could not be queued
	 * @throws ActionDeliveryException if the connection is already closed
	 */
	public boolean write(OFMessage m);
}
