package rtlilgen.hdl;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Prepares an elaborated fragment tree for a backend: propagates clock domains down the hierarchy, checks that no signal is driven from
 * two fragments, and infers the ports of every fragment from the signals crossing its boundary.
 * Preparing an already prepared tree again does not change it.
 */
public class FragmentPreparer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HashMap<Fragment, LinkedHashSet<Signal>> subtreeUsedCache = new HashMap<>();
  private final HashMap<Fragment, LinkedHashSet<Signal>> subtreeDrivenCache = new HashMap<>();

  /**
   * Prepares {@code top} in place.
   * @param top the root of the design
   * @param ports signals that must be ports of the top module; driven ones become outputs, the others inputs
   * @return {@code top}
   */
  public Fragment prepare(Fragment top, Collection<Signal> ports) {
    ensureSyncExists(top);
    propagateDomains(top, Map.of());
    checkDriverConflicts(top, new HashMap<>(), "top");

    LinkedHashSet<Signal> requested = new LinkedHashSet<>(ports);
    LinkedHashSet<Signal> driven = subtreeDriven(top);
    for (Signal port : requested) {
      if (!top.getPorts().containsKey(port))
        top.addPort(port, driven.contains(port) ? PortDirection.OUTPUT : PortDirection.INPUT);
    }
    propagatePorts(top, requested);
    return top;
  }

  /** Creates the default "sync" domain on the top fragment if some fragment drives it and none declares it. */
  private void ensureSyncExists(Fragment top) {
    if (usesDomain(top, "sync") && !declaresDomain(top, "sync")) {
      logger.debug("Creating implicit sync domain");
      top.addDomain(new ClockDomain("sync"));
    }
  }
  private static boolean usesDomain(Fragment fragment, String domain) {
    return fragment.getDrivers().containsKey(domain) ||
        fragment.getSubfragments().stream().anyMatch(sub -> usesDomain(sub.fragment(), domain));
  }
  private static boolean declaresDomain(Fragment fragment, String domain) {
    return fragment.getDomains().containsKey(domain) ||
        fragment.getSubfragments().stream().anyMatch(sub -> declaresDomain(sub.fragment(), domain));
  }

  private void propagateDomains(Fragment fragment, Map<String, ClockDomain> inherited) {
    for (ClockDomain domain : inherited.values()) {
      if (!fragment.getDomains().containsKey(domain.getName()))
        fragment.addDomain(domain);
    }
    for (String used : fragment.getSyncDomainNames())
      fragment.getDomain(used); // throws if undeclared
    LinkedHashMap<String, ClockDomain> visible = new LinkedHashMap<>(fragment.getDomains());
    for (Fragment.Subfragment sub : fragment.getSubfragments())
      propagateDomains(sub.fragment(), visible);
  }

  private void checkDriverConflicts(Fragment fragment, Map<Signal, String> owners, String path) {
    for (Signal signal : fragment.getDrivenSignals()) {
      String owner = owners.putIfAbsent(signal, path);
      if (owner != null)
        throw new IllegalStateException("Signal " + signal.getName() + " is driven from both " + owner + " and " + path);
    }
    for (Fragment.Subfragment sub : fragment.getSubfragments())
      checkDriverConflicts(sub.fragment(), owners, path + "." + sub.name());
  }

  /** Signals read by the fragment's own statements and clock domains. */
  private static LinkedHashSet<Signal> selfUsed(Fragment fragment) {
    LinkedHashSet<Signal> ret = new LinkedHashSet<>();
    fragment.getStatements().forEach(stmt -> ret.addAll(Fragment.usedSignals(stmt)));
    for (String domainName : fragment.getSyncDomainNames()) {
      ClockDomain domain = fragment.getDomain(domainName);
      ret.add(domain.getClk());
      ret.add(domain.getRst());
    }
    return ret;
  }

  private LinkedHashSet<Signal> subtreeUsed(Fragment fragment) {
    LinkedHashSet<Signal> cached = subtreeUsedCache.get(fragment);
    if (cached != null)
      return cached;
    LinkedHashSet<Signal> ret = selfUsed(fragment);
    fragment.getSubfragments().forEach(sub -> ret.addAll(subtreeUsed(sub.fragment())));
    subtreeUsedCache.put(fragment, ret);
    return ret;
  }

  private LinkedHashSet<Signal> subtreeDriven(Fragment fragment) {
    LinkedHashSet<Signal> cached = subtreeDrivenCache.get(fragment);
    if (cached != null)
      return cached;
    LinkedHashSet<Signal> ret = new LinkedHashSet<>(fragment.getDrivenSignals());
    fragment.getSubfragments().forEach(sub -> ret.addAll(subtreeDriven(sub.fragment())));
    subtreeDrivenCache.put(fragment, ret);
    return ret;
  }

  /**
   * Inputs are the signals used in the subtree but driven outside of it; outputs are the requested signals driven inside it.
   * A child is requested to provide everything its parent was requested plus everything its parent and siblings use.
   */
  private void propagatePorts(Fragment fragment, LinkedHashSet<Signal> requested) {
    LinkedHashSet<Signal> driven = subtreeDriven(fragment);
    LinkedHashSet<Signal> ins = new LinkedHashSet<>(subtreeUsed(fragment));
    ins.removeAll(driven);
    LinkedHashSet<Signal> outs = new LinkedHashSet<>(requested);
    outs.retainAll(driven);

    ins.stream().filter(signal -> !fragment.getPorts().containsKey(signal)).forEach(signal -> fragment.addPort(signal, PortDirection.INPUT));
    outs.stream().filter(signal -> !fragment.getPorts().containsKey(signal)).forEach(signal -> fragment.addPort(signal, PortDirection.OUTPUT));

    List<Fragment.Subfragment> subs = fragment.getSubfragments();
    for (Fragment.Subfragment sub : subs) {
      LinkedHashSet<Signal> subRequested = new LinkedHashSet<>(requested);
      subRequested.addAll(selfUsed(fragment));
      for (Fragment.Subfragment sibling : subs) {
        if (sibling != sub)
          subRequested.addAll(subtreeUsed(sibling.fragment()));
      }
      propagatePorts(sub.fragment(), subRequested);
    }
  }
}
