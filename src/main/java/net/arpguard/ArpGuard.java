package net.arpguard;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.projectfloodlight.openflow.types.DatapathId;
import org.projectfloodlight.openflow.types.IPv4Address;
import org.projectfloodlight.openflow.types.MacAddress;
import org.projectfloodlight.openflow.types.OFBufferId;
import org.projectfloodlight.openflow.types.OFPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.arpguard.telemetry.BindingJsonMap;
import net.arpguard.telemetry.GuardEvent;
import net.arpguard.telemetry.GuardEvents;
import net.arpguard.telemetry.IGuardEventListener;

/**
 * Turns every connecting switch into an ARP-validating learning switch.
 * Owns the address bindings and outstanding requests shared by all
 * switches, and the watchdog that expires unanswered requests.
 */
public class ArpGuard implements IArpGuardService, IGuardEventListener {
	protected static Logger log = LoggerFactory.getLogger(ArpGuard.class);

	private final Clock clock;
	private final AddressBindingTable bindings;
	private final PendingRequestTracker requests;
	private final ArpValidator validator;
	private final ConcurrentHashMap<DatapathId,LearningSwitch> switches;
	private final List<IGuardEventListener> listeners;
	private ArpGuardConfig config;
	private ScheduledExecutorService ses;
	private boolean ownsExecutor;
	private ScheduledFuture<?> watchdogTask;

	public ArpGuard(){
		this(Clock.systemUTC());
	}

	public ArpGuard(Clock clock){
		this.clock = clock;
		this.bindings = new AddressBindingTable();
		this.requests = new PendingRequestTracker();
		this.validator = new ArpValidator(bindings,requests);
		this.switches = new ConcurrentHashMap<>();
		this.listeners = new CopyOnWriteArrayList<>();
		this.config = ArpGuardConfig.defaults();
	}

	public void init(Map<String,String> params) throws ConfigurationException{
		init(ArpGuardConfig.fromParams(params));
	}

	public void init(ArpGuardConfig config){
		this.config = config;
		log.info("ArpGuard configured: {}",config);
	}

	/**
	 * Starts the request watchdog on a dedicated daemon thread.
	 */
	public void startUp(){
		if(ses != null){
			log.warn("ArpGuard already started, ignoring startUp");
			return;
		}
		ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r,"arp-request-watchdog");
			t.setDaemon(true);
			return t;
		});
		startUp(executor);
		ownsExecutor = true;
	}

	/**
	 * Starts the request watchdog on the given scheduler.
	 */
	public void startUp(ScheduledExecutorService executor){
		if(ses != null){
			log.warn("ArpGuard already started, ignoring startUp");
			return;
		}
		this.ses = executor;
		ExpiryWatchdog watchdog = new ExpiryWatchdog(requests,clock,TimeUnit.SECONDS.toMillis(config.getPendingMaxAgeSeconds()));
		long interval = TimeUnit.SECONDS.toMillis(config.getSweepIntervalSeconds());
		watchdogTask = ses.scheduleAtFixedRate(watchdog,interval,interval,TimeUnit.MILLISECONDS);
		log.debug("ARP request watchdog scheduled every {} ms",interval);
	}

	public void shutdown(){
		if(watchdogTask != null){
			watchdogTask.cancel(false);
			watchdogTask = null;
		}
		if(ownsExecutor && ses != null){
			ses.shutdownNow();
		}
		ses = null;
		ownsExecutor = false;
		switches.clear();
	}

	@Override
	public void switchConnected(ISwitchConnection sw){
		log.info("Switch {} connected",sw.getId());
		LearningSwitch ls = new LearningSwitch(sw,validator,config.isTransparent(),
				TimeUnit.SECONDS.toMillis(config.getHoldDownSeconds()),clock,this);
		ls.installCaptureRules();
		LearningSwitch old = switches.put(sw.getId(),ls);
		if(old != null){
			log.info("Switch {} reconnected, forgetting {} learned addresses",sw.getId(),old.getMacPortTable().size());
		}
	}

	@Override
	public void switchDisconnected(DatapathId dpid){
		if(switches.remove(dpid) != null){
			log.info("Switch {} disconnected",dpid);
		}
	}

	@Override
	public LearningSwitch.Decision receive(DatapathId dpid,OFPort inPort,EthernetFrame eth,OFBufferId bufferId,byte[] data){
		LearningSwitch ls = switches.get(dpid);
		if(ls == null){
			log.warn("Packet-in from unknown switch {}, ignoring",dpid);
			return LearningSwitch.Decision.DROP;
		}
		PacketInContext cntx = new PacketInContext(ls.getSwitch(),inPort,eth,bufferId,data);
		try{
			return ls.receive(cntx);
		}catch(MalformedPacketException e){
			log.warn("Dropping malformed packet on {}.{}: {}",new Object[]{dpid,inPort,e.getMessage()});
			ls.drop(cntx);
			return LearningSwitch.Decision.DROP;
		}catch(RuntimeException e){
			log.error("Failed to handle packet-in on " + dpid + "." + inPort,e);
			return LearningSwitch.Decision.DROP;
		}
	}

	@Override
	public void addressLeased(IPv4Address ip,MacAddress mac){
		if(ip == null || mac == null){
			log.debug("Ignoring incomplete lease {} / {}",ip,mac);
			return;
		}
		bindings.register(ip,mac);
	}

	@Override
	public void addGuardEventListener(IGuardEventListener listener){
		listeners.add(listener);
	}

	@Override
	public void guardEvent(GuardEvent event){
		for(IGuardEventListener listener : listeners){
			try{
				listener.guardEvent(event);
			}catch(RuntimeException e){
				log.warn("Guard event listener failed",e);
			}
		}
	}

	@Override
	public List<IPMacPair> getBindings(){
		return bindings.getBindings();
	}

	@Override
	public String getBindingsJson(){
		return GuardEvents.toJson(new BindingJsonMap(bindings.getBindings()));
	}

	@Override
	public Map<RequestKey,Long> getPendingRequests(){
		return requests.getPendingRequests();
	}

	public LearningSwitch getSwitch(DatapathId dpid){
		return switches.get(dpid);
	}

	protected AddressBindingTable getBindingTable(){
		return bindings;
	}

	protected PendingRequestTracker getRequestTracker(){
		return requests;
	}
}
