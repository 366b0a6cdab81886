package rtlilgen.hdl;

/**
 * A clock/reset context. Signals driven in a clock domain update on the rising edge of its clock.
 */
public class ClockDomain {
  private final String name;
  private final Signal clk;
  private final Signal rst;
  private final boolean asyncReset;

  public ClockDomain(String name, Signal clk, Signal rst, boolean asyncReset) {
    if (Fragment.COMB.equals(name))
      throw new IllegalArgumentException("Domain name '" + Fragment.COMB + "' is reserved for combinational logic");
    this.name = name;
    this.clk = clk;
    this.rst = rst;
    this.asyncReset = asyncReset;
  }

  /**
   * Creates a domain with fresh clock and reset signals. The "sync" domain uses {@code clk}/{@code rst}, others are prefixed with the
   * domain name.
   */
  public ClockDomain(String name, boolean asyncReset) {
    this(name, new Signal(signalName(name, "clk")), new Signal(signalName(name, "rst")), asyncReset);
  }
  public ClockDomain(String name) { this(name, false); }

  private static String signalName(String domain, String suffix) {
    return "sync".equals(domain) ? suffix : domain + "_" + suffix;
  }

  public String getName() { return name; }
  public Signal getClk() { return clk; }
  public Signal getRst() { return rst; }
  public boolean isAsyncReset() { return asyncReset; }

  @Override
  public String toString() {
    return "ClockDomain(" + name + (asyncReset ? ", async" : "") + ")";
  }
}
