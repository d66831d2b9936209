package net.arpguard.telemetry;

/**
 * Receives spoof and loop events as the switch engines raise them.
 * Called on the packet-in thread; implementations must not block.
 */
public interface IGuardEventListener {
	public void guardEvent(GuardEvent event);
}
