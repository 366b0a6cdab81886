package rtlilgen.rtlil;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of an RTLIL design. Collects the text of all closed modules; module names are unique within the design.
 */
public class RTLILBuilder extends Bufferer {
  private final Namer namer = new Namer();
  private final String generator;

  /** @param generator value of the {@code generator} attribute put on every module */
  public RTLILBuilder(String generator) { this.generator = generator; }

  /**
   * Opens a module. The module text becomes part of this design when the returned builder is closed.
   * @param name requested module name, escaped as a public name
   * @param attrs module attributes, emitted after {@code generator}
   */
  public ModuleBuilder module(String name, Map<String, Object> attrs) {
    LinkedHashMap<String, Object> allAttrs = new LinkedHashMap<>();
    allAttrs.put("generator", generator);
    allAttrs.putAll(attrs);
    return new ModuleBuilder(this, namer.makeName(name, false), allAttrs);
  }
  public ModuleBuilder module(String name) { return module(name, Map.of()); }
}
