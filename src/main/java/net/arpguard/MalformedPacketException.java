package net.arpguard;

/**
 * A packet-in whose payload lacks fields required to process it.
 * Contained to the packet that caused it.
 */
public class MalformedPacketException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public MalformedPacketException(String message) {
		super(message);
	}
}
