package rtlilgen.rtlil;

/** Updates of one sync rule. */
public class SyncBuilder {
  private final ProcessBuilder process;

  SyncBuilder(ProcessBuilder process) { this.process = process; }

  public void update(String lhs, String rhs) {
    process.line("      update " + lhs + " " + rhs);
  }
}
