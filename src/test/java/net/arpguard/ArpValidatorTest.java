package net.arpguard;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;
import org.projectfloodlight.openflow.types.ArpOpcode;
import org.projectfloodlight.openflow.types.EthType;
import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;

public class ArpValidatorTest {
	private AddressBindingTable bindings;
	private PendingRequestTracker requests;
	private ArpValidator validator;

	private IPv4Address ip1 = IPv4Address.of("10.0.0.1");
	private IPv4Address ip2 = IPv4Address.of("10.0.0.2");
	private MacAddress mac1 = MacAddress.of("00:00:00:00:00:01");
	private MacAddress mac2 = MacAddress.of("00:00:00:00:00:02");
	private MacAddress attacker = MacAddress.of("00:00:00:00:00:66");

	@Before
	public void setUp() {
		bindings = new AddressBindingTable();
		requests = new PendingRequestTracker();
		validator = new ArpValidator(bindings, requests);
		bindings.register(ip1, mac1);
		bindings.register(ip2, mac2);
	}

	private EthernetFrame request(MacAddress ethSrc, MacAddress sha, IPv4Address spa, IPv4Address tpa) {
		return EthernetFrame.arp(ethSrc, MacAddress.BROADCAST, ArpHeader.request(sha, spa, tpa));
	}

	private EthernetFrame reply(MacAddress ethSrc, MacAddress ethDst, MacAddress sha, IPv4Address spa,
			MacAddress tha, IPv4Address tpa) {
		return EthernetFrame.arp(ethSrc, ethDst, ArpHeader.reply(sha, spa, tha, tpa));
	}

	@Test
	public void testValidRequestIsRecorded() {
		ArpVerdict v = validator.validate(request(mac1, mac1, ip1, ip2), 0);
		assertTrue(v.isValid());
		assertNull(v.getReason());
		assertEquals(0, requests.isPending(ip1, ip2).getTimestamp());
	}

	@Test
	public void testRequestSourceMismatchIsAlwaysSpoof() {
		ArpVerdict v = validator.validate(request(attacker, mac1, ip1, ip2), 0);
		assertTrue(v.isSpoof());
		assertEquals(SpoofReason.ETH_ARP_SRC_MISMATCH, v.getReason());
		assertTrue(v.isTerminal());
		assertFalse(requests.isPending(ip1, ip2).isPending());

		/* no bindings at all makes no difference */
		ArpValidator empty = new ArpValidator(new AddressBindingTable(), requests);
		assertEquals(SpoofReason.ETH_ARP_SRC_MISMATCH, empty.validate(request(attacker, mac1, ip1, ip2), 0).getReason());
	}

	@Test
	public void testRequestFromUnknownSourceIsSpoof() {
		IPv4Address unbound = IPv4Address.of("10.0.0.9");
		ArpVerdict v = validator.validate(request(attacker, attacker, unbound, ip2), 0);
		assertEquals(SpoofReason.UNKNOWN_SOURCE_BINDING, v.getReason());
		assertFalse(v.isTerminal());
		assertFalse(requests.isPending(unbound, ip2).isPending());
	}

	@Test
	public void testRequestClaimingAnotherHostsAddressIsSpoof() {
		ArpVerdict v = validator.validate(request(attacker, attacker, ip1, ip2), 0);
		assertEquals(SpoofReason.SOURCE_BINDING_MISMATCH, v.getReason());
		assertFalse(requests.isPending(ip1, ip2).isPending());
	}

	@Test
	public void testRequestForUnknownDestinationIsSpoof() {
		ArpVerdict v = validator.validate(request(mac1, mac1, ip1, IPv4Address.of("10.0.0.77")), 0);
		assertEquals(SpoofReason.UNKNOWN_DESTINATION, v.getReason());
		assertEquals("unknown destination", v.getReason().getDescription());
	}

	@Test
	public void testRequestThenReplyClearsPendingEntry() {
		assertTrue(validator.validate(request(mac1, mac1, ip1, ip2), 0).isValid());

		ArpVerdict v = validator.validate(reply(mac2, mac1, mac2, ip2, mac1, ip1), 1000);
		assertTrue(v.isValid());
		assertFalse(requests.isPending(ip1, ip2).isPending());

		ArpVerdict again = validator.validate(reply(mac2, mac1, mac2, ip2, mac1, ip1), 1500);
		assertTrue(again.isSpoof());
		assertEquals(SpoofReason.NO_OUTSTANDING_REQUEST, again.getReason());
		assertEquals("no matching outstanding request", again.getReason().getDescription());
		assertTrue(again.isTerminal());
	}

	@Test
	public void testUnsolicitedReplyIsSpoof() {
		ArpVerdict v = validator.validate(reply(mac2, mac1, mac2, ip2, mac1, ip1), 0);
		assertEquals(Arrays.asList(SpoofReason.NO_OUTSTANDING_REQUEST), v.getReasons());
	}

	@Test
	public void testBroadcastReplyIsAlwaysSpoof() {
		validator.validate(request(mac1, mac1, ip1, ip2), 0);
		ArpVerdict v = validator.validate(reply(mac2, MacAddress.BROADCAST, mac2, ip2, MacAddress.BROADCAST, ip1), 100);
		assertTrue(v.isSpoof());
		assertTrue(v.getReasons().contains(SpoofReason.BROADCAST_REPLY));
		/* a spoofed reply does not answer the request */
		assertTrue(requests.isPending(ip1, ip2).isPending());
	}

	@Test
	public void testReplyEvaluatesEveryCheck() {
		validator.validate(request(mac1, mac1, ip1, ip2), 0);
		/* attacker answers for ip2 with its own MAC, sent to broadcast */
		ArpVerdict v = validator.validate(reply(attacker, MacAddress.BROADCAST, mac2, ip2, mac1, ip1), 100);
		assertEquals(Arrays.asList(SpoofReason.ETH_ARP_SRC_MISMATCH, SpoofReason.ETH_ARP_DST_MISMATCH,
				SpoofReason.BROADCAST_REPLY), v.getReasons());
		assertEquals(SpoofReason.ETH_ARP_SRC_MISMATCH, v.getReason());
		assertFalse(v.isTerminal());
	}

	@Test
	public void testPoisoningReplyIsSpoof() {
		validator.validate(request(mac1, mac1, ip1, ip2), 0);
		ArpVerdict v = validator.validate(reply(attacker, mac1, attacker, ip2, mac1, ip1), 100);
		assertEquals(SpoofReason.SOURCE_BINDING_MISMATCH, v.getReason());
		assertEquals(1, v.getReasons().size());
	}

	@Test
	public void testReplyAfterExpiryIsSpoof() {
		validator.validate(request(mac1, mac1, ip1, ip2), 0);
		requests.sweep(5001, ExpiryWatchdog.DEFAULT_MAX_AGE_MS);
		ArpVerdict v = validator.validate(reply(mac2, mac1, mac2, ip2, mac1, ip1), 5001);
		assertEquals(SpoofReason.NO_OUTSTANDING_REQUEST, v.getReason());
	}

	@Test
	public void testOtherOpcodesPass() {
		EthernetFrame rarp = EthernetFrame.arp(mac1, MacAddress.BROADCAST,
				new ArpHeader(ArpOpcode.of(3), mac1, ip1, mac1, ip1));
		assertTrue(validator.validate(rarp, 0).isValid());
		assertEquals(0, requests.pendingCount());
	}

	@Test(expected = MalformedPacketException.class)
	public void testArpFrameWithoutPayload() {
		validator.validate(new EthernetFrame(mac1, MacAddress.BROADCAST, EthType.ARP), 0);
	}

	@Test(expected = MalformedPacketException.class)
	public void testArpPayloadWithoutSenderAddress() {
		validator.validate(EthernetFrame.arp(mac1, MacAddress.BROADCAST, ArpHeader.request(mac1, null, ip2)), 0);
	}
}
