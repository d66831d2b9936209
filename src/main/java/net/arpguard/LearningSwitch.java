package net.arpguard;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.projectfloodlight.openflow.protocol.OFFactory;
import org.projectfloodlight.openflow.protocol.OFFlowAdd;
import org.projectfloodlight.openflow.protocol.OFMessage;
import org.projectfloodlight.openflow.protocol.OFPacketOut;
import org.projectfloodlight.openflow.protocol.OFVersion;
import org.projectfloodlight.openflow.protocol.action.OFAction;
import org.projectfloodlight.openflow.protocol.instruction.OFInstruction;
import org.projectfloodlight.openflow.protocol.match.Match;
import org.projectfloodlight.openflow.protocol.match.MatchField;
import org.projectfloodlight.openflow.types.EthType;
import org.projectfloodlight.openflow.types.IpProtocol;
import org.projectfloodlight.openflow.types.MacAddress;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFPort;
import org.projectfloodlight.openflow.types.TransportPort;
import org.projectfloodlight.openflow.types.U64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.arpguard.telemetry.GuardEvent;
import net.arpguard.telemetry.GuardEvents;
import net.arpguard.telemetry.IGuardEventListener;

/**
 * The learning switch "brain" of a single OpenFlow switch.
 *
 * <p>For each packet from the switch:
 * <ol>
 * <li>If the packet is ARP, validate it. A spoofed packet gets a drop flow
 *     at its ingress port; unless the verdict is terminal, processing goes on.</li>
 * <li>Learn the source address on the ingress port, unless it is a group address.</li>
 * <li>If not transparent, drop LLDP and bridge-filtered destinations.</li>
 * <li>Flood multicast and broadcast destinations.</li>
 * <li>Flood unknown destinations.</li>
 * <li>If the destination was learned on the ingress port, drop the flow for a while.</li>
 * <li>Otherwise install a flow to the learned port and send the packet there.</li>
 * </ol>
 * Flooding is held down for a configurable time after the switch connects.
 */
public class LearningSwitch{
	protected static Logger log = LoggerFactory.getLogger(LearningSwitch.class);

	public enum Decision { SPOOF_BLOCKED, DROP, FLOOD, FLOOD_HELD_DOWN, SAME_PORT_DROP, FORWARD }

	public static final long COOKIE = 135719;
	public static final int FLOWMOD_PERMANENT = 0;
	public static final int FLOWMOD_DEFAULT_IDLE_TIMEOUT = 10;
	public static final int FLOWMOD_DEFAULT_HARD_TIMEOUT = 30;
	public static final int SPOOF_DROP_IDLE_TIMEOUT = 10;
	public static final int SPOOF_DROP_HARD_TIMEOUT = 60;
	public static final int SAME_PORT_DROP_TIMEOUT = 10;

	/* spoof drops beat the capture rules, which beat learned flows */
	public static final int SPOOF_DROP_PRIORITY = 30000;
	public static final int CAPTURE_PRIORITY = 20000;
	public static final int FLOWMOD_DEFAULT_PRIORITY = 100;

	public static final TransportPort DHCP_SERVER_PORT = TransportPort.of(67);
	public static final TransportPort DHCP_CLIENT_PORT = TransportPort.of(68);

	private final ISwitchConnection sw;
	private final ArpValidator validator;
	private final boolean transparent;
	private final long holdDownMillis;
	private final Clock clock;
	private final IGuardEventListener eventSink;
	private final MacPortTable macToPort;
	private boolean holdDownExpired;

	public LearningSwitch(ISwitchConnection sw,ArpValidator validator,boolean transparent,long holdDownMillis,
			Clock clock,IGuardEventListener eventSink){
		this.sw = sw;
		this.validator = validator;
		this.transparent = transparent;
		this.holdDownMillis = holdDownMillis;
		this.clock = clock;
		this.eventSink = eventSink;
		this.macToPort = new MacPortTable();
		this.holdDownExpired = holdDownMillis == 0;
		log.debug("Initializing LearningSwitch for {}, transparent={}",sw.getId(),transparent);
	}

	public ISwitchConnection getSwitch(){
		return sw;
	}

	public MacPortTable getMacPortTable(){
		return macToPort;
	}

	public boolean isHoldDownExpired(){
		return holdDownExpired;
	}

	/**
	 * Sends all ARP traffic and all DHCP server replies to the controller for
	 * the lifetime of the connection.
	 */
	public void installCaptureRules(){
		OFFactory factory = sw.getOFFactory();
		Match arpMatch = factory.buildMatch()
			.setExact(MatchField.ETH_TYPE,EthType.ARP)
			.build();
		Match dhcpMatch = factory.buildMatch()
			.setExact(MatchField.ETH_TYPE,EthType.IPv4)
			.setExact(MatchField.IP_PROTO,IpProtocol.UDP)
			.setExact(MatchField.UDP_SRC,DHCP_SERVER_PORT)
			.setExact(MatchField.UDP_DST,DHCP_CLIENT_PORT)
			.build();
		List<OFAction> toController = Collections.singletonList(
				(OFAction) factory.actions().output(OFPort.CONTROLLER,Integer.MAX_VALUE));
		write(buildFlow(arpMatch,toController,FLOWMOD_PERMANENT,FLOWMOD_PERMANENT,CAPTURE_PRIORITY,OFBufferId.NO_BUFFER));
		write(buildFlow(dhcpMatch,toController,FLOWMOD_PERMANENT,FLOWMOD_PERMANENT,CAPTURE_PRIORITY,OFBufferId.NO_BUFFER));
		log.debug("Installed ARP and DHCP capture rules on {}",sw.getId());
	}

	/**
	 * Handles one packet-in from this switch.
	 * @throws MalformedPacketException if an ARP frame has no usable ARP payload
	 */
	public Decision receive(PacketInContext cntx){
		EthernetFrame eth = cntx.getFrame();
		eth.checkComplete();
		MacAddress src = eth.getSourceMACAddress();
		MacAddress dst = eth.getDestinationMACAddress();

		if(eth.isArp()){
			ArpVerdict verdict = validator.validate(eth,clock.millis());
			if(verdict.isSpoof()){
				handleSpoof(cntx,verdict);
				if(verdict.isTerminal()) return Decision.SPOOF_BLOCKED;
			}
		}

		// group addresses are never valid sources
		if(src.isBroadcast() || src.isMulticast()){
			log.debug("Not learning group source address {} on {}.{}",new Object[]{src,sw.getId(),cntx.getInPort()});
		}else{
			macToPort.addEntry(src,cntx.getInPort());
		}
		if(!transparent){
			if(eth.isLldp() || eth.isBridgeFilteredDestination()){
				drop(cntx);
				return Decision.DROP;
			}
		}
		// MacAddress.isMulticast() is false for ff:ff:ff:ff:ff:ff
		if(dst.isBroadcast() || dst.isMulticast()){
			return flood(cntx,null);
		}
		OFPort outPort = macToPort.getPortForMac(dst);
		if(outPort == null){
			return flood(cntx,"Port for " + dst + " unknown -- flooding");
		}
		if(outPort.equals(cntx.getInPort())){
			log.warn("Same port for packet from {} -> {} on {}.{}. Drop.",new Object[]{src,dst,sw.getId(),outPort});
			dropFlow(cntx,SAME_PORT_DROP_TIMEOUT,SAME_PORT_DROP_TIMEOUT,FLOWMOD_DEFAULT_PRIORITY,cntx.getBufferId());
			eventSink.guardEvent(GuardEvent.loop(sw.getId(),cntx.getInPort(),src,dst,clock.millis()));
			return Decision.SAME_PORT_DROP;
		}
		log.debug("installing flow for {}.{} -> {}.{}",new Object[]{src,cntx.getInPort(),dst,outPort});
		List<OFAction> actions = Collections.singletonList(
				(OFAction) sw.getOFFactory().actions().output(outPort,Integer.MAX_VALUE));
		write(buildFlow(createMatch(cntx),actions,FLOWMOD_DEFAULT_IDLE_TIMEOUT,FLOWMOD_DEFAULT_HARD_TIMEOUT,
				FLOWMOD_DEFAULT_PRIORITY,OFBufferId.NO_BUFFER));
		pushPacket(cntx,actions);
		return Decision.FORWARD;
	}

	/**
	 * Floods the packet unless the hold-down after connect is still running,
	 * in which case a buffered packet is released without output.
	 */
	protected Decision flood(PacketInContext cntx,String message){
		List<OFAction> actions = new ArrayList<>();
		boolean flooding = clock.millis() - sw.getConnectTime() >= holdDownMillis;
		if(flooding){
			if(!holdDownExpired){
				holdDownExpired = true;
				log.info("{}: Flood hold-down expired -- flooding",sw.getId());
			}
			if(message != null) log.debug(message);
			actions.add(sw.getOFFactory().actions().output(OFPort.FLOOD,Integer.MAX_VALUE));
			pushPacket(cntx,actions);
			return Decision.FLOOD;
		}
		log.trace("Holding down flood for {}",sw.getId());
		if(cntx.isBuffered()) pushPacket(cntx,actions);
		return Decision.FLOOD_HELD_DOWN;
	}

	/**
	 * Drops this packet, releasing the switch buffer if it holds one.
	 */
	protected void drop(PacketInContext cntx){
		if(cntx.isBuffered()){
			pushPacket(cntx,Collections.<OFAction>emptyList());
		}
	}

	/**
	 * Installs a flow that drops packets like this one, arriving on the same port, for a while.
	 */
	protected void dropFlow(PacketInContext cntx,int idleTimeout,int hardTimeout,int priority,OFBufferId bufferId){
		write(buildFlow(createMatch(cntx),Collections.<OFAction>emptyList(),idleTimeout,hardTimeout,priority,bufferId));
	}

	/**
	 * Blocks the flow a spoofed ARP packet belongs to and reports it.
	 * The buffered packet goes with the drop flow only when processing stops
	 * here; otherwise the rest of the pipeline still owns the buffer.
	 */
	protected void handleSpoof(PacketInContext cntx,ArpVerdict verdict){
		EthernetFrame eth = cntx.getFrame();
		OFBufferId bufferId = verdict.isTerminal() ? cntx.getBufferId() : OFBufferId.NO_BUFFER;
		dropFlow(cntx,SPOOF_DROP_IDLE_TIMEOUT,SPOOF_DROP_HARD_TIMEOUT,SPOOF_DROP_PRIORITY,bufferId);
		GuardEvent event = GuardEvent.spoof(sw.getId(),cntx.getInPort(),eth.getSourceMACAddress(),
				eth.getDestinationMACAddress(),verdict.getReasons(),clock.millis());
		log.warn("ARP spoofing detected ({}), dropping flow from port {}: {}",
				new Object[]{verdict.getReason(),cntx.getInPort(),GuardEvents.toJson(event)});
		eventSink.guardEvent(event);
	}

	/**
	 * Sends the packet-in's packet back to the switch with the given actions.
	 */
	protected void pushPacket(PacketInContext cntx,List<OFAction> actions){
		OFPacketOut.Builder pob = sw.getOFFactory().buildPacketOut();
		pob.setActions(actions);
		pob.setBufferId(cntx.getBufferId());
		pob.setInPort(cntx.getInPort());
		/* use the raw packet when the switch did not buffer it */
		if(!cntx.isBuffered()){
			pob.setData(cntx.getData());
		}
		write(pob.build());
	}

	/**
	 * Matches this exact L2 flow at its ingress port.
	 */
	protected Match createMatch(PacketInContext cntx){
		EthernetFrame eth = cntx.getFrame();
		return sw.getOFFactory().buildMatch()
			.setExact(MatchField.IN_PORT,cntx.getInPort())
			.setExact(MatchField.ETH_SRC,eth.getSourceMACAddress())
			.setExact(MatchField.ETH_DST,eth.getDestinationMACAddress())
			.setExact(MatchField.ETH_TYPE,eth.getEtherType())
			.build();
	}

	protected OFFlowAdd buildFlow(Match match,List<OFAction> actions,int idleTimeout,int hardTimeout,int priority,OFBufferId bufferId){
		OFFactory factory = sw.getOFFactory();
		OFFlowAdd.Builder fmb = factory.buildFlowAdd()
			.setMatch(match)
			.setCookie(U64.of(COOKIE))
			.setIdleTimeout(idleTimeout)
			.setHardTimeout(hardTimeout)
			.setPriority(priority)
			.setBufferId(bufferId);
		// OpenFlow 1.1+ carries actions inside an apply-actions instruction
		if(factory.getVersion().compareTo(OFVersion.OF_10) == 0){
			fmb.setActions(actions);
		}else{
			fmb.setInstructions(Collections.singletonList((OFInstruction) factory.instructions().applyActions(actions)));
		}
		return fmb.build();
	}

	/**
	 * Hands a message to the switch. Delivery failures only cost this message.
	 */
	protected void write(OFMessage m){
		try{
			if(!sw.write(m)){
				log.warn("Switch {} did not accept {}",sw.getId(),m.getType());
			}
		}catch(ActionDeliveryException e){
			log.warn("Could not deliver {}: {}",m.getType(),e.getMessage());
		}
	}
}
