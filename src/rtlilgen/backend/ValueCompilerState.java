package rtlilgen.backend;

import java.util.LinkedHashMap;
import rtlilgen.hdl.PortDirection;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.SrcLoc;
import rtlilgen.rtlil.ModuleBuilder;

/**
 * Per-module state of the value compilers: the wires synthesized for each signal, which signals are driven and which are ports.
 * One instance exists per converted fragment and is never shared with parent or child fragments.
 */
public class ValueCompilerState {
  /** The wires representing a signal. {@code next} is null for signals not driven in this module. */
  public record Wires(String curr, String next) {}
  /** Port position and direction of a signal. */
  public record Port(int id, PortDirection kind) {}

  final ModuleBuilder rtlil;
  private final boolean emitSrc;
  private final LinkedHashMap<Signal, Wires> wires = new LinkedHashMap<>();
  private final LinkedHashMap<Signal, Boolean> driven = new LinkedHashMap<>();
  private final LinkedHashMap<Signal, Port> ports = new LinkedHashMap<>();
  private String subName = null;

  public ValueCompilerState(ModuleBuilder rtlil, boolean emitSrc) {
    this.rtlil = rtlil;
    this.emitSrc = emitSrc;
  }

  /** Marks {@code signal} as driven in this module. Must happen before the signal is first resolved. */
  public void addDriven(Signal signal, boolean sync) {
    if (wires.containsKey(signal))
      throw new IllegalStateException("Signal " + signal.getName() + " registered as driven after it was resolved");
    driven.put(signal, sync);
  }

  /** Assigns the next port position to {@code signal}. */
  public void addPort(Signal signal, PortDirection kind) {
    if (wires.containsKey(signal))
      throw new IllegalStateException("Signal " + signal.getName() + " registered as port after it was resolved");
    ports.put(signal, new Port(ports.size(), kind));
  }

  /**
   * Returns the wires of {@code signal}, declaring them on first use. The current wire carries the signal's attributes and, for ports, the
   * port direction and position; driven signals additionally get a {@code $next} wire.
   */
  public Wires resolve(Signal signal) {
    Wires existing = wires.get(signal);
    if (existing != null)
      return existing;

    Port port = ports.get(signal);
    String wireName = subName != null ? subName + "_" + signal.getName() : signal.getName();
    signal.getAttrs().forEach(rtlil::attribute);
    String src = src(signal.getSrcLoc());
    String wireCurr = rtlil.wire(signal.width(), port == null ? null : port.id(), port == null ? null : port.kind(), wireName, src);
    String wireNext = null;
    if (driven.containsKey(signal))
      wireNext = rtlil.wire(signal.width(), wireCurr + "$next", src);
    Wires ret = new Wires(wireCurr, wireNext);
    wires.put(signal, ret);
    return ret;
  }

  public String resolveCurr(Signal signal) { return resolve(signal).curr(); }

  /** Renders a source location as a {@code src} attribute value; null if unknown or disabled. */
  public String src(SrcLoc loc) {
    if (!emitSrc || loc == null)
      return null;
    return loc.toString();
  }

  /**
   * Prefixes names of wires created until the returned scope is closed with {@code name + "_"}.
   * Used while connecting a sub-module so that wires only needed for its ports stay recognizable.
   */
  public HierarchyScope hierarchy(String name) {
    subName = name;
    return new HierarchyScope();
  }

  public class HierarchyScope implements AutoCloseable {
    @Override
    public void close() {
      subName = null;
    }
  }
}
