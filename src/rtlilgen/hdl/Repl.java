package rtlilgen.hdl;

/** {@code count} copies of a value, concatenated. */
public record Repl(Value value, int count) implements Value {
  public Repl {
    if (count < 0)
      throw new IllegalArgumentException("Replication count must be non-negative, got " + count);
  }

  @Override
  public Shape shape() {
    return Shape.unsigned(value.width() * count);
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitRepl(this);
  }
}
