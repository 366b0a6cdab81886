package rtlilgen.hdl;

/**
 * Width and signedness of a value.
 * @param width number of bits, non-negative
 * @param signed true iff the value is interpreted as two's complement
 */
public record Shape(int width, boolean signed) {
  public Shape {
    if (width < 0)
      throw new IllegalArgumentException("Width must be non-negative, got " + width);
  }

  public static Shape unsigned(int width) { return new Shape(width, false); }
  public static Shape signed(int width) { return new Shape(width, true); }

  /**
   * Shape of a bitwise combination of two operands. Mixing signedness widens the unsigned operand by one bit so it still fits into a
   * signed result.
   */
  public static Shape bitwise(Shape a, Shape b) {
    if (a.signed == b.signed)
      return new Shape(Math.max(a.width, b.width), a.signed);
    if (a.signed)
      return new Shape(Math.max(a.width, b.width + 1), true);
    return new Shape(Math.max(a.width + 1, b.width), true);
  }

  @Override
  public String toString() {
    return (signed ? "signed(" : "unsigned(") + width + ")";
  }
}
