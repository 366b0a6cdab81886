package rtlilgen.rtlil;

/**
 * An RTLIL switch. Cases are tried in order; the default case matches anything and therefore has to be the last one.
 */
public class SwitchBuilder implements AutoCloseable {
  private final ProcessBuilder process;
  private final int indent;
  private boolean closed = false;
  private boolean hasDefault = false;

  SwitchBuilder(ProcessBuilder process, String cond, int indent) {
    this.process = process;
    this.indent = indent;
    process.line("  ".repeat(indent) + "switch " + cond);
  }

  /**
   * Opens a case.
   * @param pattern bit pattern, most significant bit first, or null for the default case
   */
  public CaseBuilder addCase(String pattern) {
    if (closed)
      throw new IllegalStateException("Switch is already closed");
    if (hasDefault)
      throw new IllegalStateException("No case may follow the default case");
    String prefix = "  ".repeat(indent + 1);
    if (pattern == null) {
      hasDefault = true;
      process.line(prefix + "case");
    } else {
      process.line(prefix + "case " + pattern.length() + "'" + pattern);
    }
    return new CaseBuilder(process, indent + 2);
  }
  public CaseBuilder defaultCase() { return addCase(null); }

  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    process.line("  ".repeat(indent) + "end");
  }
}
