package rtlilgen.rtlil;

import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rtlilgen.hdl.PortDirection;

/**
 * Builds one RTLIL module. Wires, cells and processes share one namespace. Closing the builder terminates the module and hands its text
 * to the enclosing design; use it in a try-with-resources block so that happens on every exit path.
 */
public class ModuleBuilder extends Bufferer implements AutoCloseable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Bufferer parent;
  private final Namer namer = new Namer();
  private final String name;
  private boolean closed = false;

  ModuleBuilder(Bufferer parent, String name, Map<String, Object> attrs) {
    this.parent = parent;
    this.name = name;
    attrs.forEach((attrName, value) -> appendAttribute("", attrName, value));
    append("module " + name + "\n");
  }

  public String getName() { return name; }

  private void checkWritable() {
    if (closed)
      throw new IllegalStateException("Module " + name + " is already closed");
  }

  /** Attribute for the next wire, cell or process. */
  public void attribute(String attrName, Object value) {
    checkWritable();
    appendAttribute("  ", attrName, value);
  }

  /**
   * Declares a wire.
   * @param width width in bits
   * @param portId position of the port, or null if the wire is not a port
   * @param portKind direction of the port, must be non-null iff portId is
   * @param wireName requested name, null for a generated one
   * @param src source location attribute, may be null
   * @return the allocated wire name
   */
  public String wire(int width, Integer portId, PortDirection portKind, String wireName, String src) {
    checkWritable();
    if ((portId == null) != (portKind == null))
      throw new IllegalArgumentException("portId and portKind must be given together");
    appendSrc("  ", src);
    String allocated = namer.makeName(wireName, false);
    if (portId == null)
      append("  wire width " + width + " " + allocated + "\n");
    else
      append("  wire width " + width + " " + portKind.getKeyword() + " " + portId + " " + allocated + "\n");
    return allocated;
  }
  public String wire(int width, String wireName, String src) { return wire(width, null, null, wireName, src); }
  /** Anonymous wire. */
  public String wire(int width) { return wire(width, null, null, null, null); }

  public void connect(String lhs, String rhs) {
    checkWritable();
    append("  connect " + lhs + " " + rhs + "\n");
  }

  /**
   * Instantiates a cell.
   * @param kind cell type, e.g. {@code $add} or the name of another module
   * @param cellName requested instance name, null for a generated one
   * @param params parameters in emission order; strings are quoted, numbers and booleans rendered as integers
   * @param ports port name to connected signal, in emission order
   * @param src source location attribute, may be null
   * @return the allocated cell name
   */
  public String cell(String kind, String cellName, Map<String, Object> params, Map<String, String> ports, String src) {
    checkWritable();
    appendSrc("  ", src);
    String allocated = namer.makeName(cellName, true);
    append("  cell " + kind + " " + allocated + "\n");
    params.forEach((param, value) -> append("    parameter \\" + param + " " + formatValue(value) + "\n"));
    ports.forEach((port, wireName) -> append("    connect " + port + " " + wireName + "\n"));
    append("  end\n");
    logger.trace("Module {}: cell {} {}", name, kind, allocated);
    return allocated;
  }

  /**
   * Opens a process. Wires and cells may still be added to the module while it is open; the process text follows them once closed.
   */
  public ProcessBuilder process(String processName, String src) {
    checkWritable();
    return new ProcessBuilder(this, namer.makeName(processName, true), src);
  }
  public ProcessBuilder process() { return process(null, null); }

  void processClosed(String text) {
    checkWritable();
    write(text);
  }

  @Override
  public void close() {
    if (closed)
      return;
    closed = true;
    append("end\n");
    parent.write(toString());
  }
}
