package net.arpguard.telemetry;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import net.arpguard.IPMacPair;

@JsonSerialize(using=BindingJsonSerializer.class)
public class BindingJsonMap{
	private List<IPMacPair> bindings;
	public BindingJsonMap(List<IPMacPair> bindings){
		this.bindings = bindings;
	}
	public List<IPMacPair> getBindings(){
		return bindings;
	}
}
