package rtlilgen.rtlil;

/**
 * Builds one RTLIL process: a root case holding the decision tree, followed by sync rules.
 */
public class ProcessBuilder extends Bufferer implements AutoCloseable {
  private final ModuleBuilder module;
  private final String name;
  private boolean closed = false;
  private boolean syncStarted = false;

  ProcessBuilder(ModuleBuilder module, String name, String src) {
    this.module = module;
    this.name = name;
    appendSrc("  ", src);
    append("  process " + name + "\n");
  }

  public String getName() { return name; }

  /** The root case of the process. Must be populated before the first sync rule. */
  public CaseBuilder rootCase() {
    checkOpen();
    if (syncStarted)
      throw new IllegalStateException("Process " + name + ": root case must precede sync rules");
    return new CaseBuilder(this, 2);
  }

  /**
   * Starts a sync rule.
   * @param kind one of {@code init}, {@code always}, {@code posedge}, {@code negedge}
   * @param cond the trigger signal, or null for {@code init} and {@code always}
   */
  public SyncBuilder sync(String kind, String cond) {
    checkOpen();
    syncStarted = true;
    if (cond == null)
      append("    sync " + kind + "\n");
    else
      append("    sync " + kind + " " + cond + "\n");
    return new SyncBuilder(this);
  }
  public SyncBuilder sync(String kind) { return sync(kind, null); }

  void checkOpen() {
    if (closed)
      throw new IllegalStateException("Process " + name + " is already closed");
  }

  /** Line inside this process, used by nested builders. */
  void line(String text) {
    checkOpen();
    append(text + "\n");
  }

  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    append("  end\n");
    module.processClosed(toString());
  }
}
