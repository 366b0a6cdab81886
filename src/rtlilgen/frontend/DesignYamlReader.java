package rtlilgen.frontend;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import rtlilgen.hdl.Assign;
import rtlilgen.hdl.Cat;
import rtlilgen.hdl.ClockDomain;
import rtlilgen.hdl.Const;
import rtlilgen.hdl.Fragment;
import rtlilgen.hdl.Operator;
import rtlilgen.hdl.PortDirection;
import rtlilgen.hdl.Repl;
import rtlilgen.hdl.Shape;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.Slice;
import rtlilgen.hdl.SrcLoc;
import rtlilgen.hdl.Statement;
import rtlilgen.hdl.Switch;
import rtlilgen.hdl.Value;

/**
 * Reads a YAML design description into a fragment tree.
 *
 * Signals are declared once at the top level and referenced by name from every fragment. Expressions are either a signal name, an
 * integer constant, or a map with one of the keys {@code const}, {@code slice}, {@code cat}, {@code repl}, {@code op} or {@code mux}.
 * Each top-level statement belongs to a domain ({@code comb} unless given) and registers the signals it assigns as driven there.
 */
public class DesignYamlReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, Signal> signals = new LinkedHashMap<>();

  public Design read(File file) throws DesignFormatException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    } catch (FileNotFoundException e) {
      throw new DesignFormatException(file.getPath(), "file could not be opened", e);
    } catch (IOException e) {
      throw new DesignFormatException(file.getPath(), "file could not be read", e);
    }
  }

  public Design read(InputStream in) throws DesignFormatException {
    Object root;
    try {
      root = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new DesignFormatException("<root>", "invalid YAML: " + e.getMessage(), e);
    }
    Map<String, Object> design = asMap(root, "<root>");
    signals.clear();

    String name = design.containsKey("name") ? asString(design.get("name"), "name") : null;
    List<Object> signalDecls = design.containsKey("signals") ? asList(design.get("signals"), "signals") : List.of();
    for (int i = 0; i < signalDecls.size(); ++i)
      readSignal(asMap(signalDecls.get(i), "signals[" + i + "]"), "signals[" + i + "]");

    if (!design.containsKey("top"))
      throw new DesignFormatException("<root>", "missing 'top' fragment");
    Fragment top = readFragment(asMap(design.get("top"), "top"), "top");

    List<Signal> ports = new ArrayList<>();
    if (design.containsKey("ports")) {
      List<Object> portNames = asList(design.get("ports"), "ports");
      for (int i = 0; i < portNames.size(); ++i)
        ports.add(lookupSignal(asString(portNames.get(i), "ports[" + i + "]"), "ports[" + i + "]"));
    }
    logger.debug("Read design {} with {} signals", name, signals.size());
    return new Design(name, top, ports);
  }

  private void readSignal(Map<String, Object> decl, String path) throws DesignFormatException {
    String name = asString(require(decl, "name", path), path + ".name");
    if (signals.containsKey(name))
      throw new DesignFormatException(path, "duplicate signal '" + name + "'");
    int width = decl.containsKey("width") ? asInt(decl.get("width"), path + ".width") : 1;
    boolean signed = decl.containsKey("signed") && asBool(decl.get("signed"), path + ".signed");
    BigInteger reset = decl.containsKey("reset") ? asBigInteger(decl.get("reset"), path + ".reset") : BigInteger.ZERO;
    SrcLoc src = decl.containsKey("src") ? parseSrc(asString(decl.get("src"), path + ".src"), path + ".src") : null;
    Signal signal;
    try {
      signal = new Signal(name, new Shape(width, signed), reset, src);
      if (decl.containsKey("attributes"))
        asMap(decl.get("attributes"), path + ".attributes").forEach(signal::setAttr);
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException(path, e.getMessage(), e);
    }
    signals.put(name, signal);
  }

  private Fragment readFragment(Map<String, Object> decl, String path) throws DesignFormatException {
    Fragment fragment = new Fragment();
    try {
      if (decl.containsKey("domains")) {
        List<Object> domains = asList(decl.get("domains"), path + ".domains");
        for (int i = 0; i < domains.size(); ++i)
          fragment.addDomain(readDomain(asMap(domains.get(i), path + ".domains[" + i + "]"), path + ".domains[" + i + "]"));
      }
      if (decl.containsKey("ports")) {
        Map<String, Object> ports = asMap(decl.get("ports"), path + ".ports");
        for (Map.Entry<String, Object> port : ports.entrySet()) {
          String portPath = path + ".ports." + port.getKey();
          String dirName = asString(port.getValue(), portPath);
          PortDirection dir = PortDirection.fromSerialName(dirName)
                                  .orElseThrow(() -> new DesignFormatException(portPath, "unknown port direction '" + dirName + "'"));
          fragment.addPort(lookupSignal(port.getKey(), portPath), dir);
        }
      }
      if (decl.containsKey("statements")) {
        List<Object> stmts = asList(decl.get("statements"), path + ".statements");
        for (int i = 0; i < stmts.size(); ++i) {
          String stmtPath = path + ".statements[" + i + "]";
          Map<String, Object> stmtDecl = asMap(stmts.get(i), stmtPath);
          String domain = stmtDecl.containsKey("domain") ? asString(stmtDecl.get("domain"), stmtPath + ".domain") : Fragment.COMB;
          fragment.add(domain, readStatement(stmtDecl, stmtPath, domain));
        }
      }
      if (decl.containsKey("submodules")) {
        List<Object> subs = asList(decl.get("submodules"), path + ".submodules");
        for (int i = 0; i < subs.size(); ++i) {
          String subPath = path + ".submodules[" + i + "]";
          Map<String, Object> sub = asMap(subs.get(i), subPath);
          String subName = sub.containsKey("name") ? asString(sub.get("name"), subPath + ".name") : null;
          fragment.addSubfragment(readFragment(asMap(require(sub, "fragment", subPath), subPath + ".fragment"), subPath + ".fragment"),
                                  subName);
        }
      }
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException(path, e.getMessage(), e);
    }
    return fragment;
  }

  private ClockDomain readDomain(Map<String, Object> decl, String path) throws DesignFormatException {
    String name = asString(require(decl, "name", path), path + ".name");
    boolean asyncReset = decl.containsKey("async_reset") && asBool(decl.get("async_reset"), path + ".async_reset");
    if (!decl.containsKey("clk") && !decl.containsKey("rst"))
      return new ClockDomain(name, asyncReset);
    Signal clk = lookupSignal(asString(require(decl, "clk", path), path + ".clk"), path + ".clk");
    Signal rst = lookupSignal(asString(require(decl, "rst", path), path + ".rst"), path + ".rst");
    return new ClockDomain(name, clk, rst, asyncReset);
  }

  private Statement readStatement(Map<String, Object> decl, String path, String domain) throws DesignFormatException {
    if (decl.containsKey("domain") && !asString(decl.get("domain"), path + ".domain").equals(domain))
      throw new DesignFormatException(path, "nested statement must use the domain of its switch (" + domain + ")");
    try {
      if (decl.containsKey("assign")) {
        Value target = readValue(decl.get("assign"), path + ".assign");
        Value value = readValue(require(decl, "value", path), path + ".value");
        return new Assign(target, value);
      }
      if (decl.containsKey("switch")) {
        Value test = readValue(decl.get("switch"), path + ".switch");
        List<Switch.Case> cases = new ArrayList<>();
        Map<String, Object> caseDecls = asMap(require(decl, "cases", path), path + ".cases");
        for (Map.Entry<String, Object> caseDecl : caseDecls.entrySet()) {
          String casePath = path + ".cases." + caseDecl.getKey();
          List<Object> body = asList(caseDecl.getValue(), casePath);
          List<Statement> nested = new ArrayList<>();
          for (int i = 0; i < body.size(); ++i)
            nested.add(readStatement(asMap(body.get(i), casePath + "[" + i + "]"), casePath + "[" + i + "]", domain));
          String pattern = caseDecl.getKey().equals("default") ? null : caseDecl.getKey();
          cases.add(new Switch.Case(pattern, nested));
        }
        return new Switch(test, cases);
      }
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException(path, e.getMessage(), e);
    }
    throw new DesignFormatException(path, "statement must contain 'assign' or 'switch'");
  }

  private Value readValue(Object decl, String path) throws DesignFormatException {
    if (decl instanceof String)
      return lookupSignal((String)decl, path);
    if (decl instanceof Integer || decl instanceof Long || decl instanceof BigInteger)
      return minimalConst(asBigInteger(decl, path));
    Map<String, Object> map = asMap(decl, path);
    try {
      if (map.containsKey("const")) {
        BigInteger value = asBigInteger(map.get("const"), path + ".const");
        Const minimal = minimalConst(value);
        int width = map.containsKey("width") ? asInt(map.get("width"), path + ".width") : minimal.shape().width();
        boolean signed = map.containsKey("signed") ? asBool(map.get("signed"), path + ".signed") : minimal.shape().signed();
        return new Const(value, new Shape(width, signed));
      }
      if (map.containsKey("slice")) {
        Value value = readValue(map.get("slice"), path + ".slice");
        int start = asInt(require(map, "start", path), path + ".start");
        int end = asInt(require(map, "end", path), path + ".end");
        return new Slice(value, start, end);
      }
      if (map.containsKey("cat"))
        return new Cat(readValues(asList(map.get("cat"), path + ".cat"), path + ".cat"));
      if (map.containsKey("repl")) {
        Value value = readValue(map.get("repl"), path + ".repl");
        return new Repl(value, asInt(require(map, "count", path), path + ".count"));
      }
      if (map.containsKey("op")) {
        String symbol = asString(map.get("op"), path + ".op");
        List<Value> operands = readValues(asList(require(map, "operands", path), path + ".operands"), path + ".operands");
        Operator.Op op = Operator.Op.fromSymbol(symbol, operands.size())
                             .orElseThrow(() -> new DesignFormatException(path, "unknown operator '" + symbol + "' with " + operands.size()
                                                                                   + " operands"));
        SrcLoc src = map.containsKey("src") ? parseSrc(asString(map.get("src"), path + ".src"), path + ".src") : null;
        return new Operator(op, operands, src);
      }
      if (map.containsKey("mux")) {
        List<Value> operands = readValues(asList(map.get("mux"), path + ".mux"), path + ".mux");
        if (operands.size() != 3)
          throw new DesignFormatException(path + ".mux", "expected [sel, if_true, if_false]");
        return Value.mux(operands.get(0), operands.get(1), operands.get(2));
      }
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException(path, e.getMessage(), e);
    }
    throw new DesignFormatException(path, "unrecognized expression " + map.keySet());
  }

  /** Constant of the smallest shape holding {@code value}; signed only if negative. */
  private static Const minimalConst(BigInteger value) {
    if (value.signum() < 0)
      return new Const(value, Shape.signed(value.bitLength() + 1));
    return new Const(value, Shape.unsigned(Math.max(1, value.bitLength())));
  }

  private List<Value> readValues(List<Object> decls, String path) throws DesignFormatException {
    List<Value> ret = new ArrayList<>(decls.size());
    for (int i = 0; i < decls.size(); ++i)
      ret.add(readValue(decls.get(i), path + "[" + i + "]"));
    return ret;
  }

  private Signal lookupSignal(String name, String path) throws DesignFormatException {
    Signal signal = signals.get(name);
    if (signal == null)
      throw new DesignFormatException(path, "unknown signal '" + name + "'");
    return signal;
  }

  private static SrcLoc parseSrc(String src, String path) throws DesignFormatException {
    int colon = src.lastIndexOf(':');
    try {
      if (colon > 0)
        return new SrcLoc(src.substring(0, colon), Integer.parseInt(src.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new DesignFormatException(path, "expected 'file:line', got '" + src + "'", e);
    }
    throw new DesignFormatException(path, "expected 'file:line', got '" + src + "'");
  }

  //////////   typed access to the loaded YAML tree   //////////

  private static Object require(Map<String, Object> map, String key, String path) throws DesignFormatException {
    if (!map.containsKey(key))
      throw new DesignFormatException(path, "missing '" + key + "'");
    return map.get(key);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object obj, String path) throws DesignFormatException {
    if (!(obj instanceof Map))
      throw new DesignFormatException(path, "expected a mapping");
    for (Object key : ((Map<Object, Object>)obj).keySet()) {
      if (!(key instanceof String))
        throw new DesignFormatException(path, "key " + key + " must be a string (quote bit patterns)");
    }
    return (Map<String, Object>)obj;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object obj, String path) throws DesignFormatException {
    if (!(obj instanceof List))
      throw new DesignFormatException(path, "expected a list");
    return (List<Object>)obj;
  }

  private static String asString(Object obj, String path) throws DesignFormatException {
    if (!(obj instanceof String))
      throw new DesignFormatException(path, "expected a string");
    return (String)obj;
  }

  private static int asInt(Object obj, String path) throws DesignFormatException {
    if (!(obj instanceof Integer))
      throw new DesignFormatException(path, "expected an integer");
    return (Integer)obj;
  }

  private static boolean asBool(Object obj, String path) throws DesignFormatException {
    if (!(obj instanceof Boolean))
      throw new DesignFormatException(path, "expected true or false");
    return (Boolean)obj;
  }

  private static BigInteger asBigInteger(Object obj, String path) throws DesignFormatException {
    if (obj instanceof BigInteger)
      return (BigInteger)obj;
    if (obj instanceof Integer || obj instanceof Long)
      return BigInteger.valueOf(((Number)obj).longValue());
    throw new DesignFormatException(path, "expected an integer");
  }
}
