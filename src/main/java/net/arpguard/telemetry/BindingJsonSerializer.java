package net.arpguard.telemetry;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import net.arpguard.IPMacPair;

public class BindingJsonSerializer extends JsonSerializer<BindingJsonMap> {

	@Override
	public void serialize(BindingJsonMap jmap, JsonGenerator gen, SerializerProvider serial) throws IOException, JsonProcessingException {
		gen.writeStartArray();
		List<IPMacPair> bindings = jmap.getBindings();
		if(bindings != null){
			for(IPMacPair pair : bindings){
				gen.writeStartObject();
				gen.writeStringField(pair.getIp().toString(),pair.getMac().toString());
				gen.writeEndObject();
			}
		}
		gen.writeEndArray();
	}
}
