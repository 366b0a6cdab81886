package rtlilgen.rtlil;

/**
 * Body of a case (or the root case of a process): assignments and nested switches.
 */
public class CaseBuilder {
  private final ProcessBuilder process;
  private final int indent;

  CaseBuilder(ProcessBuilder process, int indent) {
    this.process = process;
    this.indent = indent;
  }

  public void assign(String lhs, String rhs) {
    process.line("  ".repeat(indent) + "assign " + lhs + " " + rhs);
  }

  /** Opens a switch on {@code cond}; its {@code end} is emitted when the returned builder is closed. */
  public SwitchBuilder switchOn(String cond) {
    return new SwitchBuilder(process, cond, indent);
  }
}
