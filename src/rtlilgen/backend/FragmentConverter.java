package rtlilgen.backend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlilgen.hdl.Assign;
import rtlilgen.hdl.ClockDomain;
import rtlilgen.hdl.Fragment;
import rtlilgen.hdl.PortDirection;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.Statement;
import rtlilgen.hdl.Switch;
import rtlilgen.hdl.Value;
import rtlilgen.rtlil.CaseBuilder;
import rtlilgen.rtlil.ModuleBuilder;
import rtlilgen.rtlil.ProcessBuilder;
import rtlilgen.rtlil.RTLILBuilder;
import rtlilgen.rtlil.SwitchBuilder;
import rtlilgen.rtlil.SyncBuilder;
import rtlilgen.ui.RTLILGenConfig;

/**
 * Converts a prepared fragment tree to RTLIL modules, children before their parents.
 */
public class FragmentConverter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final RTLILGenConfig cfg;

  public FragmentConverter(RTLILGenConfig cfg) { this.cfg = cfg; }

  /**
   * Emits the module for {@code fragment} (and, before it, the modules of all its sub-fragments) into {@code builder}.
   * @param builder the design to add modules to
   * @param fragment a prepared fragment
   * @param name the requested module name, null for "anonymous"
   * @param top whether to mark the module as the design top
   * @return the assigned module name and the port wires correlated with their signals
   */
  public ConvertedModule convertFragment(RTLILBuilder builder, Fragment fragment, String name, boolean top) {
    Map<String, Object> attrs = top ? Map.of("top", 1) : Map.of();
    try (ModuleBuilder module = builder.module(name == null ? "anonymous" : name, attrs)) {
      logger.debug("Converting module {} ({} statements, {} submodules)", module.getName(), fragment.getStatements().size(),
                   fragment.getSubfragments().size());
      ValueCompilerState compilerState = new ValueCompilerState(module, cfg.emit_src);
      RhsValueCompiler rhsCompiler = new RhsValueCompiler(compilerState);
      LhsValueCompiler lhsCompiler = new LhsValueCompiler(compilerState);

      // Driven signals get a $next wire, so they have to be known before anything is resolved.
      for (Map.Entry<String, Signal> driver : fragment.iterDrivers())
        compilerState.addDriven(driver.getValue(), !Fragment.isComb(driver.getKey()));

      // Ports, clocks and resets are resolved before any hierarchy prefix is active, so they keep their plain names.
      for (Map.Entry<Signal, PortDirection> port : fragment.getPorts().entrySet()) {
        compilerState.addPort(port.getKey(), port.getValue());
        rhsCompiler.compile(port.getKey());
      }
      for (String domainName : fragment.getSyncDomainNames()) {
        ClockDomain domain = fragment.getDomain(domainName);
        rhsCompiler.compile(domain.getClk());
        rhsCompiler.compile(domain.getRst());
      }

      int anonymousIndex = 0;
      for (Fragment.Subfragment sub : fragment.getSubfragments()) {
        String instanceName = sub.name() != null ? sub.name() : "U$" + (anonymousIndex++);
        ConvertedModule child = convertFragment(builder, sub.fragment(), instanceName, false);
        try (var scope = compilerState.hierarchy(instanceName)) {
          LinkedHashMap<String, String> connections = new LinkedHashMap<>();
          child.portMap().forEach((portName, signal) -> connections.put(portName, rhsCompiler.compile(signal)));
          module.cell(child.name(), escape(instanceName), Map.of(), connections, null);
        }
      }

      try (ProcessBuilder process = module.process()) {
        CaseBuilder rootCase = process.rootCase();
        // Combinational signals fall back to their reset value, synchronous ones hold their current value.
        for (Map.Entry<String, Signal> driver : fragment.iterDrivers()) {
          Signal signal = driver.getValue();
          Value prevValue = Fragment.isComb(driver.getKey()) ? signal.getResetConst() : signal;
          rootCase.assign(lhsCompiler.compile(signal), rhsCompiler.compile(prevValue));
        }
        convertStatements(rootCase, fragment.getStatements(), rhsCompiler, lhsCompiler);

        // The initial value of registers ends up as their init attribute.
        SyncBuilder init = process.sync("init");
        for (Map.Entry<String, Signal> driver : fragment.iterSync()) {
          Signal signal = driver.getValue();
          init.update(compilerState.resolveCurr(signal), rhsCompiler.compile(signal.getResetConst()));
        }

        for (Map.Entry<String, Set<Signal>> group : fragment.getDrivers().entrySet()) {
          for (Trigger trigger : triggers(fragment, group.getKey(), compilerState)) {
            SyncBuilder sync = process.sync(trigger.kind(), trigger.signal());
            for (Signal signal : group.getValue()) {
              ValueCompilerState.Wires wires = compilerState.resolve(signal);
              sync.update(wires.curr(), wires.next());
            }
          }
        }
      }

      LinkedHashMap<String, Signal> portMap = new LinkedHashMap<>();
      for (Signal signal : fragment.getPorts().keySet())
        portMap.put(compilerState.resolveCurr(signal), signal);
      return new ConvertedModule(module.getName(), portMap);
    }
  }

  /** A sync rule trigger; {@code signal} is null for {@code always}. */
  private record Trigger(String kind, String signal) {}

  /** Sync rules for one domain: {@code always} for combinational logic, the clock edge and, if asynchronous, the reset edge otherwise. */
  private static List<Trigger> triggers(Fragment fragment, String domainName, ValueCompilerState compilerState) {
    if (Fragment.isComb(domainName))
      return List.of(new Trigger("always", null));
    ClockDomain domain = fragment.getDomain(domainName);
    Trigger clkEdge = new Trigger("posedge", compilerState.resolveCurr(domain.getClk()));
    if (!domain.isAsyncReset())
      return List.of(clkEdge);
    return List.of(clkEdge, new Trigger("posedge", compilerState.resolveCurr(domain.getRst())));
  }

  private void convertStatements(CaseBuilder caseBuilder, List<Statement> stmts, RhsValueCompiler rhsCompiler,
                                 LhsValueCompiler lhsCompiler) {
    for (Statement stmt : stmts) {
      if (stmt instanceof Assign) {
        Assign assign = (Assign)stmt;
        int lhsBits = assign.target().width();
        String rhsSigspec;
        if (lhsBits == assign.value().width())
          rhsSigspec = rhsCompiler.compile(assign.value());
        else // RTLIL requires both sides of an assignment to have the same width
          rhsSigspec = rhsCompiler.matchShape(assign.value(), lhsBits, assign.target().shape().signed());
        caseBuilder.assign(lhsCompiler.compile(assign.target()), rhsSigspec);
      } else if (stmt instanceof Switch) {
        Switch sw = (Switch)stmt;
        try (SwitchBuilder switchBuilder = caseBuilder.switchOn(rhsCompiler.compile(sw.test()))) {
          for (Switch.Case c : sw.casesDefaultLast()) {
            CaseBuilder nested = switchBuilder.addCase(c.pattern());
            convertStatements(nested, c.body(), rhsCompiler, lhsCompiler);
          }
        }
      } else {
        throw new IllegalArgumentException("Unexpected statement " + stmt);
      }
    }
  }

  private static String escape(String name) {
    return name.startsWith("\\") || name.startsWith("$") ? name : "\\" + name;
  }
}
