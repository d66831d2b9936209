package net.arpguard;

import org.projectfloodlight.openflow.types.DatapathId;

/**
 * Raised by a switch connection that could not accept an outbound message.
 */
public class ActionDeliveryException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public ActionDeliveryException(DatapathId dpid, String message) {
		super("Switch " + dpid + ": " + message);
	}

	public ActionDeliveryException(DatapathId dpid, String message, Throwable cause) {
		super("Switch " + dpid + ": " + message, cause);
	}
}
