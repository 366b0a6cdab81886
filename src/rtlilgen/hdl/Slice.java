package rtlilgen.hdl;

/** Bits {@code [start, end)} of a value. */
public record Slice(Value value, int start, int end) implements Value {
  public Slice {
    if (start < 0 || start > end || end > value.width())
      throw new IllegalArgumentException("Slice [" + start + ", " + end + ") out of range for width " + value.width());
  }

  /** True iff the slice covers all bits of its operand. */
  public boolean isWhole() { return start == 0 && end == value.width(); }

  @Override
  public Shape shape() {
    return Shape.unsigned(end - start);
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitSlice(this);
  }
}
