package net.arpguard.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON rendering for guard events and table dumps.
 */
public final class GuardEvents {
	protected static Logger log = LoggerFactory.getLogger(GuardEvents.class);
	private static final ObjectMapper mapper = new ObjectMapper();

	private GuardEvents() {
	}

	/**
	 * @return the JSON form of value, or its toString() if it cannot be serialized
	 */
	public static String toJson(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			log.warn("Could not serialize {}: {}", value, e.getMessage());
			return String.valueOf(value);
		}
	}
}
