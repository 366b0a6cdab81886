package rtlilgen.hdl;

/** Dynamic part-select: {@code width} bits of {@code value} starting at the run-time bit {@code offset}. */
public record Part(Value value, Value offset, int width) implements Value {
  public Part {
    if (width < 0)
      throw new IllegalArgumentException("Part width must be non-negative, got " + width);
  }

  @Override
  public Shape shape() {
    return Shape.unsigned(width);
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitPart(this);
  }
}
