package net.arpguard.telemetry;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import net.arpguard.SpoofReason;

public class GuardEventJsonSerializer extends JsonSerializer<GuardEvent> {

	@Override
	public void serialize(GuardEvent event, JsonGenerator gen, SerializerProvider serial) throws IOException, JsonProcessingException {
		gen.writeStartObject();
		gen.writeStringField("event",event.getKind().name());
		gen.writeStringField("switch",event.getSwitchId().toString());
		gen.writeNumberField("in-port",event.getInPort().getPortNumber());
		gen.writeStringField("src-mac",event.getSource().toString());
		gen.writeStringField("dst-mac",event.getDestination().toString());
		if(!event.getReasons().isEmpty()){
			gen.writeStringField("reason",event.getReasons().get(0).getDescription());
			gen.writeArrayFieldStart("failed-checks");
			for(SpoofReason reason : event.getReasons()){
				gen.writeString(reason.name());
			}
			gen.writeEndArray();
		}
		gen.writeNumberField("time",event.getTimestamp());
		gen.writeEndObject();
	}
}
