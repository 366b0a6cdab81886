package rtlilgen.backend;

import java.util.Collection;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlilgen.hdl.Fragment;
import rtlilgen.hdl.FragmentPreparer;
import rtlilgen.hdl.Signal;
import rtlilgen.rtlil.RTLILBuilder;
import rtlilgen.ui.RTLILGenConfig;

/**
 * Entry point of the RTLIL backend.
 */
public final class RTLIL {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private RTLIL() {}

  /**
   * Prepares {@code fragment} and converts it, with all sub-fragments, to RTLIL text.
   * @param fragment the top fragment; it is prepared in place
   * @param name name of the top module, null for {@link RTLILGenConfig#top_name}
   * @param ports signals that must be ports of the top module
   * @param cfg tool options
   * @return the RTLIL design
   */
  public static String convert(Fragment fragment, String name, Collection<Signal> ports, RTLILGenConfig cfg) {
    new FragmentPreparer().prepare(fragment, ports);
    RTLILBuilder builder = new RTLILBuilder(cfg.generator);
    ConvertedModule top = new FragmentConverter(cfg).convertFragment(builder, fragment, name != null ? name : cfg.top_name, true);
    logger.debug("Converted design, top module {} with {} ports", top.name(), top.portMap().size());
    return builder.toString();
  }

  public static String convert(Fragment fragment, Collection<Signal> ports) { return convert(fragment, null, ports, new RTLILGenConfig()); }
  public static String convert(Fragment fragment) { return convert(fragment, null, List.of(), new RTLILGenConfig()); }
}
