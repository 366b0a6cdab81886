package rtlilgen.ui;

/**
 * Data-Class to hold tool options.
 */
public class RTLILGenConfig {

  /** Value of the {@code generator} attribute on every emitted module. */
  public String generator = "rtlilgen";
  /** Name of the top module if the design does not name it. */
  public String top_name = "top";
  /** Emit {@code src} attributes for signals and operators with a known source location. */
  public boolean emit_src = true;
}
