package net.arpguard;

import java.util.List;
import java.util.Map;

import org.projectfloodlight.openflow.types.DatapathId;
import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFPort;

import net.arpguard.telemetry.IGuardEventListener;

public interface IArpGuardService {
	//Switch and packet events delivered by the controller core
	public void switchConnected(ISwitchConnection sw);
	public void switchDisconnected(DatapathId dpid);
	public LearningSwitch.Decision receive(DatapathId dpid,OFPort inPort,EthernetFrame eth,OFBufferId bufferId,byte[] data);

	//Lease events from the DHCP server
	public void addressLeased(IPv4Address ip,MacAddress mac);

	public void addGuardEventListener(IGuardEventListener listener);

	public List<IPMacPair> getBindings();
	public String getBindingsJson();
	public Map<RequestKey,Long> getPendingRequests();
}
