package net.arpguard;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

/**
 * Module options, read from a parameter map the way controller modules get
 * their configuration. Unknown keys and bad values fail startup.
 */
public class ArpGuardConfig{
	protected static Logger log = LoggerFactory.getLogger(ArpGuardConfig.class);

	public static final String DEFAULT_RESOURCE = "arpguard.properties";
	public static final String TRANSPARENT = "transparent";
	public static final String HOLD_DOWN = "hold-down";
	public static final String PENDING_MAX_AGE = "pending-max-age";
	public static final String SWEEP_INTERVAL = "sweep-interval";
	/* camel-case spelling of hold-down */
	public static final String HOLD_DOWN_ALIAS = "holdDown";

	private static final ImmutableSet<String> KNOWN_KEYS =
			ImmutableSet.of(TRANSPARENT,HOLD_DOWN,HOLD_DOWN_ALIAS,PENDING_MAX_AGE,SWEEP_INTERVAL);

	public static final boolean DEFAULT_TRANSPARENT = false;
	public static final int DEFAULT_HOLD_DOWN_SEC = 0;
	public static final int DEFAULT_PENDING_MAX_AGE_SEC = 5;
	public static final int DEFAULT_SWEEP_INTERVAL_SEC = 1;

	private final boolean transparent;
	private final int holdDownSeconds;
	private final int pendingMaxAgeSeconds;
	private final int sweepIntervalSeconds;

	public ArpGuardConfig(boolean transparent,int holdDownSeconds,int pendingMaxAgeSeconds,int sweepIntervalSeconds){
		this.transparent = transparent;
		this.holdDownSeconds = holdDownSeconds;
		this.pendingMaxAgeSeconds = pendingMaxAgeSeconds;
		this.sweepIntervalSeconds = sweepIntervalSeconds;
	}

	public static ArpGuardConfig defaults(){
		return new ArpGuardConfig(DEFAULT_TRANSPARENT,DEFAULT_HOLD_DOWN_SEC,DEFAULT_PENDING_MAX_AGE_SEC,DEFAULT_SWEEP_INTERVAL_SEC);
	}

	public static ArpGuardConfig fromParams(Map<String,String> params) throws ConfigurationException{
		for(String key : params.keySet()){
			if(!KNOWN_KEYS.contains(key)){
				throw new ConfigurationException("Unknown option '" + key + "', expected one of " + KNOWN_KEYS);
			}
		}
		if(params.containsKey(HOLD_DOWN_ALIAS)){
			if(params.containsKey(HOLD_DOWN)){
				throw new ConfigurationException("Set only one of " + HOLD_DOWN + " and " + HOLD_DOWN_ALIAS);
			}
			Map<String,String> copy = new HashMap<>(params);
			copy.put(HOLD_DOWN,copy.remove(HOLD_DOWN_ALIAS));
			params = copy;
		}
		boolean transparent = DEFAULT_TRANSPARENT;
		String tmp = params.get(TRANSPARENT);
		if(tmp != null){
			transparent = parseBoolean(TRANSPARENT,tmp);
			log.info("Transparent mode set to {}.",transparent);
		}else{
			log.info("Transparent mode not configured. Using {}.",transparent);
		}
		int holdDown = parseSeconds(params,HOLD_DOWN,DEFAULT_HOLD_DOWN_SEC,0);
		int maxAge = parseSeconds(params,PENDING_MAX_AGE,DEFAULT_PENDING_MAX_AGE_SEC,1);
		int interval = parseSeconds(params,SWEEP_INTERVAL,DEFAULT_SWEEP_INTERVAL_SEC,1);
		return new ArpGuardConfig(transparent,holdDown,maxAge,interval);
	}

	/**
	 * Reads the options from a properties resource on the classpath.
	 */
	public static ArpGuardConfig load(String resource) throws ConfigurationException{
		Properties props = new Properties();
		try(InputStream in = ArpGuardConfig.class.getClassLoader().getResourceAsStream(resource)){
			if(in == null) throw new ConfigurationException("Configuration resource " + resource + " not found");
			props.load(in);
		}catch(IOException e){
			throw new ConfigurationException("Could not read configuration resource " + resource,e);
		}
		Map<String,String> params = new HashMap<>();
		for(String key : props.stringPropertyNames()){
			params.put(key,props.getProperty(key).trim());
		}
		return fromParams(params);
	}

	public static ArpGuardConfig load() throws ConfigurationException{
		return load(DEFAULT_RESOURCE);
	}

	private static boolean parseBoolean(String key,String value) throws ConfigurationException{
		String v = value.trim();
		if(v.equalsIgnoreCase("true")) return true;
		if(v.equalsIgnoreCase("false")) return false;
		throw new ConfigurationException("Expected " + key + " to be true or false, got '" + value + "'");
	}

	private static int parseSeconds(Map<String,String> params,String key,int defaultValue,int min) throws ConfigurationException{
		String tmp = params.get(key);
		if(tmp == null){
			log.info("Option {} not configured. Using {}.",key,defaultValue);
			return defaultValue;
		}
		int value;
		try{
			value = Integer.parseInt(tmp.trim(),10);
		}catch(NumberFormatException e){
			throw new ConfigurationException("Expected " + key + " to be a number, got '" + tmp + "'",e);
		}
		if(value < min){
			throw new ConfigurationException("Expected " + key + " to be at least " + min + ", got " + value);
		}
		log.info("Option {} set to {}.",key,value);
		return value;
	}

	public boolean isTransparent(){
		return transparent;
	}

	public int getHoldDownSeconds(){
		return holdDownSeconds;
	}

	public int getPendingMaxAgeSeconds(){
		return pendingMaxAgeSeconds;
	}

	public int getSweepIntervalSeconds(){
		return sweepIntervalSeconds;
	}

	@Override
	public String toString(){
		return "transparent=" + transparent + ", hold-down=" + holdDownSeconds + "s, pending-max-age="
			+ pendingMaxAgeSeconds + "s, sweep-interval=" + sweepIntervalSeconds + "s";
	}
}
