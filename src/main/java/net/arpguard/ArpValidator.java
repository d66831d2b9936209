package net.arpguard;

import java.util.ArrayList;
import java.util.List;

import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies ARP packets against the leased address bindings and the
 * outstanding request table.
 *
 * <p>Requests stop at the first failed check. Replies run every check so
 * that all inconsistencies are reported; the first failure is the verdict's
 * reason. A valid request is recorded as outstanding, a valid reply clears
 * the request it answers.
 *
 * <p>Two failures end processing of the packet: a request whose Ethernet
 * source differs from its ARP sender, and a reply nobody asked for. Any
 * other spoof verdict still lets the packet through to learning.
 */
public class ArpValidator{
	protected static Logger log = LoggerFactory.getLogger(ArpValidator.class);

	private final AddressBindingTable bindings;
	private final PendingRequestTracker requests;

	public ArpValidator(AddressBindingTable bindings,PendingRequestTracker requests){
		this.bindings = bindings;
		this.requests = requests;
	}

	/**
	 * @throws MalformedPacketException if the frame has no complete ARP payload
	 */
	public ArpVerdict validate(EthernetFrame eth,long now){
		ArpHeader arp = eth.getArp();
		if(arp.isRequest()){
			return validateRequest(eth,arp,now);
		}else if(arp.isReply()){
			return validateReply(eth,arp);
		}
		log.debug("Ignoring ARP opcode {} from {}",arp.getOpcode(),eth.getSourceMACAddress());
		return ArpVerdict.VALID;
	}

	protected ArpVerdict validateRequest(EthernetFrame eth,ArpHeader arp,long now){
		IPv4Address spa = arp.getSenderProtocolAddress();
		IPv4Address tpa = arp.getTargetProtocolAddress();
		MacAddress sha = arp.getSenderHardwareAddress();

		if(!eth.getSourceMACAddress().equals(sha)){
			return ArpVerdict.spoof(SpoofReason.ETH_ARP_SRC_MISMATCH,true);
		}
		MacAddress bound = bindings.lookup(spa);
		if(bound == null){
			return ArpVerdict.spoof(SpoofReason.UNKNOWN_SOURCE_BINDING,false);
		}
		if(!bound.equals(sha)){
			return ArpVerdict.spoof(SpoofReason.SOURCE_BINDING_MISMATCH,false);
		}
		if(!bindings.contains(tpa)){
			return ArpVerdict.spoof(SpoofReason.UNKNOWN_DESTINATION,false);
		}
		requests.record(spa,tpa,now);
		log.trace("Recorded ARP request {} -> {}",spa,tpa);
		return ArpVerdict.VALID;
	}

	protected ArpVerdict validateReply(EthernetFrame eth,ArpHeader arp){
		IPv4Address spa = arp.getSenderProtocolAddress();
		IPv4Address tpa = arp.getTargetProtocolAddress();
		MacAddress sha = arp.getSenderHardwareAddress();
		MacAddress tha = arp.getTargetHardwareAddress();
		List<SpoofReason> reasons = new ArrayList<>();

		if(!eth.getSourceMACAddress().equals(sha)){
			reasons.add(SpoofReason.ETH_ARP_SRC_MISMATCH);
		}
		if(!eth.getDestinationMACAddress().equals(tha)){
			reasons.add(SpoofReason.ETH_ARP_DST_MISMATCH);
		}
		MacAddress srcBound = bindings.lookup(spa);
		if(srcBound == null){
			reasons.add(SpoofReason.UNKNOWN_SOURCE_BINDING);
		}else if(!srcBound.equals(sha)){
			reasons.add(SpoofReason.SOURCE_BINDING_MISMATCH);
		}
		MacAddress dstBound = bindings.lookup(tpa);
		if(dstBound == null){
			reasons.add(SpoofReason.UNKNOWN_DESTINATION);
		}else if(!dstBound.equals(tha)){
			reasons.add(SpoofReason.DESTINATION_BINDING_MISMATCH);
		}
		// replies are always unicast
		if(eth.getDestinationMACAddress().isBroadcast()){
			reasons.add(SpoofReason.BROADCAST_REPLY);
		}

		// the reply answers the request sent in the opposite direction
		if(reasons.isEmpty()){
			if(requests.clearIfPending(tpa,spa)){
				return ArpVerdict.VALID;
			}
			return ArpVerdict.spoof(SpoofReason.NO_OUTSTANDING_REQUEST,true);
		}
		boolean unsolicited = !requests.isPending(tpa,spa).isPending();
		if(unsolicited){
			reasons.add(SpoofReason.NO_OUTSTANDING_REQUEST);
		}
		return ArpVerdict.spoof(reasons,unsolicited);
	}
}
