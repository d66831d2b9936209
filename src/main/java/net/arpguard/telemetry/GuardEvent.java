package net.arpguard.telemetry;

import java.util.List;

import org.projectfloodlight.openflow.types.DatapathId;
import org.projectfloodlight.openflow.types.MacAddress;
import org.projectfloodlight.openflow.types.OFPort;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;

import net.arpguard.SpoofReason;

/**
 * Something a switch engine blocked: a spoofed ARP packet or a frame
 * echoed back to its ingress port.
 */
@JsonSerialize(using=GuardEventJsonSerializer.class)
public class GuardEvent{
	public enum Kind { ARP_SPOOF, SAME_PORT_LOOP }

	private final Kind kind;
	private final DatapathId switchId;
	private final OFPort inPort;
	private final MacAddress source;
	private final MacAddress destination;
	private final List<SpoofReason> reasons;
	private final long timestamp;

	public GuardEvent(Kind kind,DatapathId switchId,OFPort inPort,MacAddress source,MacAddress destination,
			List<SpoofReason> reasons,long timestamp){
		this.kind = kind;
		this.switchId = switchId;
		this.inPort = inPort;
		this.source = source;
		this.destination = destination;
		this.reasons = reasons == null ? ImmutableList.<SpoofReason>of() : ImmutableList.copyOf(reasons);
		this.timestamp = timestamp;
	}

	public static GuardEvent spoof(DatapathId switchId,OFPort inPort,MacAddress source,MacAddress destination,
			List<SpoofReason> reasons,long timestamp){
		return new GuardEvent(Kind.ARP_SPOOF,switchId,inPort,source,destination,reasons,timestamp);
	}

	public static GuardEvent loop(DatapathId switchId,OFPort inPort,MacAddress source,MacAddress destination,long timestamp){
		return new GuardEvent(Kind.SAME_PORT_LOOP,switchId,inPort,source,destination,null,timestamp);
	}

	public Kind getKind() {
		return kind;
	}

	public DatapathId getSwitchId() {
		return switchId;
	}

	public OFPort getInPort() {
		return inPort;
	}

	public MacAddress getSource() {
		return source;
	}

	public MacAddress getDestination() {
		return destination;
	}

	public List<SpoofReason> getReasons() {
		return reasons;
	}

	public long getTimestamp() {
		return timestamp;
	}

	@Override
	public String toString(){
		return kind + " on " + switchId + "/" + inPort + " " + source + " -> " + destination
			+ (reasons.isEmpty() ? "" : " " + reasons);
	}
}
