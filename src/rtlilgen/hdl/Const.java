package rtlilgen.hdl;

import java.math.BigInteger;

/**
 * A constant of a fixed shape. The value is kept as given and only truncated or extended when rendered.
 */
public record Const(BigInteger value, Shape shape) implements Value {

  public Const(long value, Shape shape) { this(BigInteger.valueOf(value), shape); }
  public Const(long value, int width) { this(BigInteger.valueOf(value), Shape.unsigned(width)); }

  /** Constant of the smallest shape that can hold {@code value}. */
  public static Const of(long value) {
    if (value < 0)
      return new Const(value, Shape.signed(BigInteger.valueOf(value).bitLength() + 1));
    return new Const(value, Shape.unsigned(Math.max(1, BigInteger.valueOf(value).bitLength())));
  }

  /** Same value, different shape. */
  public Const withShape(Shape newShape) { return new Const(value, newShape); }

  /**
   * Renders the value as a bit string of exactly {@code shape().width()} characters, most significant bit first, using two's complement
   * for negative values.
   */
  public String bits() {
    int width = shape.width();
    if (width == 0)
      return "";
    BigInteger masked = value.and(BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE));
    StringBuilder ret = new StringBuilder(masked.toString(2));
    while (ret.length() < width)
      ret.insert(0, '0');
    return ret.toString();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitConst(this);
  }

  @Override
  public String toString() {
    return "(const " + shape.width() + "'" + (shape.signed() ? "sd" : "d") + value + ")";
  }
}
