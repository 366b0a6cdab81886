package rtlilgen.hdl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A hierarchical design unit: statements, the signals they drive grouped by domain, clock domains, ports and named sub-fragments.
 * All collections keep insertion order, so that everything derived from a fragment is reproducible.
 */
public class Fragment {
  /** Name of the combinational pseudo-domain in {@link #getDrivers()}. */
  public static final String COMB = "comb";

  /** A child fragment together with its instance name. */
  public record Subfragment(Fragment fragment, String name) {}

  private final LinkedHashMap<Signal, PortDirection> ports = new LinkedHashMap<>();
  private final LinkedHashMap<String, LinkedHashSet<Signal>> drivers = new LinkedHashMap<>();
  private final LinkedHashMap<Signal, String> driverDomain = new LinkedHashMap<>();
  private final ArrayList<Statement> statements = new ArrayList<>();
  private final ArrayList<Subfragment> subfragments = new ArrayList<>();
  private final LinkedHashMap<String, ClockDomain> domains = new LinkedHashMap<>();

  public static boolean isComb(String domain) { return COMB.equals(domain); }

  //////////   ports   //////////

  public void addPort(Signal signal, PortDirection direction) {
    PortDirection existing = ports.putIfAbsent(signal, direction);
    if (existing != null && existing != direction)
      throw new IllegalArgumentException("Port " + signal.getName() + " already declared as " + existing);
  }
  public Map<Signal, PortDirection> getPorts() { return Collections.unmodifiableMap(ports); }

  //////////   drivers   //////////

  /**
   * Registers {@code signal} as driven from {@code domain} ({@link #COMB} for combinational logic).
   * A signal can only be driven from one domain.
   */
  public void addDriver(Signal signal, String domain) {
    String existing = driverDomain.putIfAbsent(signal, domain);
    if (existing != null && !existing.equals(domain))
      throw new IllegalArgumentException("Signal " + signal.getName() + " is driven from domain " + existing + " and " + domain);
    drivers.computeIfAbsent(domain, d -> new LinkedHashSet<>()).add(signal);
  }
  /** Driven signals grouped by domain, in registration order. */
  public Map<String, Set<Signal>> getDrivers() { return Collections.unmodifiableMap(drivers); }
  public Optional<String> getDriverDomain(Signal signal) { return Optional.ofNullable(driverDomain.get(signal)); }
  public Set<Signal> getDrivenSignals() { return Collections.unmodifiableSet(driverDomain.keySet()); }

  /** All (domain, signal) driver records in registration order, grouped by domain. */
  public List<Map.Entry<String, Signal>> iterDrivers() {
    List<Map.Entry<String, Signal>> ret = new ArrayList<>();
    drivers.forEach((domain, signals) -> signals.forEach(signal -> ret.add(Map.entry(domain, signal))));
    return ret;
  }
  /** Like {@link #iterDrivers()}, restricted to clocked domains. */
  public List<Map.Entry<String, Signal>> iterSync() {
    List<Map.Entry<String, Signal>> ret = iterDrivers();
    ret.removeIf(entry -> isComb(entry.getKey()));
    return ret;
  }
  /** Names of the clocked domains that drive signals of this fragment. */
  public List<String> getSyncDomainNames() {
    return drivers.keySet().stream().filter(domain -> !isComb(domain)).toList();
  }

  //////////   statements   //////////

  public void addStatements(Statement... stmts) { statements.addAll(Arrays.asList(stmts)); }
  public List<Statement> getStatements() { return Collections.unmodifiableList(statements); }

  /**
   * Adds statements executed in {@code domain} and registers every signal they assign as driven from that domain.
   */
  public void add(String domain, Statement... stmts) {
    for (Statement stmt : stmts)
      for (Signal signal : assignedSignals(stmt))
        addDriver(signal, domain);
    addStatements(stmts);
  }

  /** Signals appearing on the left-hand side of {@code stmt} or any statement nested inside it. */
  public static LinkedHashSet<Signal> assignedSignals(Statement stmt) {
    LinkedHashSet<Signal> ret = new LinkedHashSet<>();
    if (stmt instanceof Assign) {
      ret.addAll(((Assign)stmt).target().signals());
    } else if (stmt instanceof Switch) {
      for (Switch.Case c : ((Switch)stmt).cases())
        for (Statement nested : c.body())
          ret.addAll(assignedSignals(nested));
    }
    return ret;
  }

  /** Signals read by {@code stmt}: right-hand sides and switch tests, including nested statements. */
  public static LinkedHashSet<Signal> usedSignals(Statement stmt) {
    LinkedHashSet<Signal> ret = new LinkedHashSet<>();
    if (stmt instanceof Assign) {
      ret.addAll(((Assign)stmt).value().signals());
    } else if (stmt instanceof Switch) {
      Switch sw = (Switch)stmt;
      ret.addAll(sw.test().signals());
      for (Switch.Case c : sw.cases())
        for (Statement nested : c.body())
          ret.addAll(usedSignals(nested));
    }
    return ret;
  }

  //////////   hierarchy   //////////

  public void addSubfragment(Fragment fragment, String name) { subfragments.add(new Subfragment(fragment, name)); }
  public List<Subfragment> getSubfragments() { return Collections.unmodifiableList(subfragments); }

  //////////   domains   //////////

  public void addDomain(ClockDomain domain) {
    if (domains.containsKey(domain.getName()))
      throw new IllegalArgumentException("Domain " + domain.getName() + " is already declared");
    domains.put(domain.getName(), domain);
  }
  public Map<String, ClockDomain> getDomains() { return Collections.unmodifiableMap(domains); }
  /** @throws IllegalStateException if the domain has not been declared (or propagated) */
  public ClockDomain getDomain(String name) {
    ClockDomain ret = domains.get(name);
    if (ret == null)
      throw new IllegalStateException("Domain " + name + " is used but not declared");
    return ret;
  }
}
