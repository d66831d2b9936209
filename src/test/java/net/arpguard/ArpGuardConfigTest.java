package net.arpguard;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class ArpGuardConfigTest {

	@Test
	public void testDefaults() throws Exception {
		ArpGuardConfig config = ArpGuardConfig.fromParams(new HashMap<String, String>());
		assertFalse(config.isTransparent());
		assertEquals(0, config.getHoldDownSeconds());
		assertEquals(5, config.getPendingMaxAgeSeconds());
		assertEquals(1, config.getSweepIntervalSeconds());
	}

	@Test
	public void testConfiguredValues() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("transparent", "True");
		params.put("hold-down", " 15 ");
		params.put("pending-max-age", "8");
		ArpGuardConfig config = ArpGuardConfig.fromParams(params);
		assertTrue(config.isTransparent());
		assertEquals(15, config.getHoldDownSeconds());
		assertEquals(8, config.getPendingMaxAgeSeconds());
	}

	@Test
	public void testNegativeHoldDownFails() {
		Map<String, String> params = new HashMap<>();
		params.put("hold-down", "-1");
		try {
			ArpGuardConfig.fromParams(params);
			fail("negative hold-down accepted");
		} catch (ConfigurationException e) {
			assertTrue(e.getMessage().contains("hold-down"));
		}
	}

	@Test(expected = ConfigurationException.class)
	public void testNonNumericHoldDownFails() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("hold-down", "soon");
		ArpGuardConfig.fromParams(params);
	}

	@Test(expected = ConfigurationException.class)
	public void testBadTransparentFails() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("transparent", "maybe");
		ArpGuardConfig.fromParams(params);
	}

	@Test(expected = ConfigurationException.class)
	public void testZeroSweepIntervalFails() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("sweep-interval", "0");
		ArpGuardConfig.fromParams(params);
	}

	@Test
	public void testLoadDefaultResource() throws Exception {
		ArpGuardConfig config = ArpGuardConfig.load();
		assertFalse(config.isTransparent());
		assertEquals(0, config.getHoldDownSeconds());
	}

	@Test(expected = ConfigurationException.class)
	public void testMissingResourceFails() throws Exception {
		ArpGuardConfig.load("no-such-file.properties");
	}

	@Test
	public void testCamelCaseHoldDown() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("holdDown", "3");
		assertEquals(3, ArpGuardConfig.fromParams(params).getHoldDownSeconds());
	}

	@Test(expected = ConfigurationException.class)
	public void testBothHoldDownSpellingsFail() throws Exception {
		Map<String, String> params = new HashMap<>();
		params.put("holdDown", "3");
		params.put("hold-down", "3");
		ArpGuardConfig.fromParams(params);
	}

	@Test
	public void testUnknownOptionFails() {
		Map<String, String> params = new HashMap<>();
		params.put("hold_down", "3");
		try {
			ArpGuardConfig.fromParams(params);
			fail("misspelled option accepted");
		} catch (ConfigurationException e) {
			assertTrue(e.getMessage().contains("hold_down"));
		}
	}
}
