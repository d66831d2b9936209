package net.arpguard;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;
import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;

public class AddressBindingTableTest {
	private AddressBindingTable table;
	private IPv4Address ip1 = IPv4Address.of("10.0.0.1");
	private IPv4Address ip2 = IPv4Address.of("10.0.0.2");
	private MacAddress mac1 = MacAddress.of("00:00:00:00:00:01");
	private MacAddress mac2 = MacAddress.of("00:00:00:00:00:02");

	@Before
	public void setUp() {
		table = new AddressBindingTable();
	}

	@Test
	public void testLookupReturnsRegisteredMac() {
		assertFalse(table.register(ip1, mac1));
		assertEquals(mac1, table.lookup(ip1));
		assertTrue(table.contains(ip1));
	}

	@Test
	public void testLookupMissIsNull() {
		assertNull(table.lookup(ip1));
		assertFalse(table.contains(ip1));
	}

	@Test
	public void testLaterRegistrationWins() {
		table.register(ip1, mac1);
		assertTrue(table.register(ip1, mac2));
		assertEquals(mac2, table.lookup(ip1));
		assertEquals(1, table.size());
	}

	@Test
	public void testRegisterIsIdempotent() {
		table.register(ip1, mac1);
		table.register(ip1, mac1);
		assertEquals(mac1, table.lookup(ip1));
		assertEquals(1, table.size());
	}

	@Test(expected = NullPointerException.class)
	public void testRegisterRejectsNullMac() {
		table.register(ip1, null);
	}

	@Test
	public void testBindingsSnapshotIsOrderedCopy() {
		table.register(ip2, mac2);
		table.register(ip1, mac1);
		List<IPMacPair> bindings = table.getBindings();
		assertEquals(2, bindings.size());
		assertEquals(new IPMacPair(ip1, mac1), bindings.get(0));
		assertEquals(new IPMacPair(ip2, mac2), bindings.get(1));

		table.register(IPv4Address.of("10.0.0.3"), mac1);
		assertEquals(2, bindings.size());
	}

	@Test(timeout = 30000)
	public void testConcurrentRegistration() throws Exception {
		final int writers = 8;
		final int perWriter = 1000;
		final AtomicInteger replaced = new AtomicInteger();
		final CountDownLatch start = new CountDownLatch(1);
		final CountDownLatch writersDone = new CountDownLatch(writers);
		ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
		List<Future<?>> futures = new ArrayList<>();

		for (int t = 0; t < writers; t++) {
			final int writer = t;
			futures.add(pool.submit(() -> {
				start.await();
				for (int i = 0; i < perWriter; i++) {
					int addr = (writer << 16) | i;
					if (table.register(IPv4Address.of(addr), MacAddress.of(addr))) {
						replaced.incrementAndGet();
					}
				}
				writersDone.countDown();
				return null;
			}));
		}
		/* snapshots taken during registration must stay consistent */
		futures.add(pool.submit(() -> {
			start.await();
			while (writersDone.getCount() > 0) {
				for (IPMacPair pair : table.getBindings()) {
					assertEquals(pair.getIp().getInt(), pair.getMac().getLong());
				}
			}
			return null;
		}));

		start.countDown();
		for (Future<?> f : futures) {
			f.get();
		}
		pool.shutdown();
		assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

		assertEquals(0, replaced.get());
		assertEquals(writers * perWriter, table.size());
		for (int t = 0; t < writers; t++) {
			for (int i = 0; i < perWriter; i++) {
				int addr = (t << 16) | i;
				assertEquals(MacAddress.of(addr), table.lookup(IPv4Address.of(addr)));
			}
		}
	}
}
