package rtlilgen.hdl;

import java.util.List;

/** Concatenation. {@code operands.get(0)} occupies the least significant bits. */
public record Cat(List<Value> operands) implements Value {
  public Cat {
    operands = List.copyOf(operands);
  }

  @Override
  public Shape shape() {
    return Shape.unsigned(operands.stream().mapToInt(Value::width).sum());
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitCat(this);
  }
}
