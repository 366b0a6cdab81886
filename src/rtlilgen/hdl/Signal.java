package rtlilgen.hdl;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named bit vector wire of the design. Signals compare by identity; two signals with the same name are distinct.
 */
public final class Signal implements Value {
  private final String name;
  private final Shape shape;
  private final BigInteger reset;
  private final SrcLoc srcLoc;
  /** Attribute values are either String or a number/boolean, emitted as integers. */
  private final LinkedHashMap<String, Object> attrs = new LinkedHashMap<>();

  public Signal(String name, Shape shape, BigInteger reset, SrcLoc srcLoc) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Signal name must not be empty");
    this.name = name;
    this.shape = shape;
    this.reset = reset;
    this.srcLoc = srcLoc;
  }
  public Signal(String name, Shape shape, long reset) { this(name, shape, BigInteger.valueOf(reset), null); }
  public Signal(String name, Shape shape) { this(name, shape, 0); }
  public Signal(String name, int width) { this(name, Shape.unsigned(width)); }
  /** One-bit signal. */
  public Signal(String name) { this(name, 1); }

  public String getName() { return name; }
  public BigInteger getReset() { return reset; }
  /** @return the reset value as a constant of this signal's shape */
  public Const getResetConst() { return new Const(reset, shape); }
  /** @return the source location, or null if unknown */
  public SrcLoc getSrcLoc() { return srcLoc; }
  public Map<String, Object> getAttrs() { return Collections.unmodifiableMap(attrs); }

  public Signal setAttr(String key, Object value) {
    if (!(value instanceof String || value instanceof Number || value instanceof Boolean))
      throw new IllegalArgumentException("Attribute " + key + " must be a string, number or boolean");
    attrs.put(key, value);
    return this;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSignal(this);
  }

  @Override
  public String toString() {
    return "(sig " + name + ")";
  }
}
