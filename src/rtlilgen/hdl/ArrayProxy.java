package rtlilgen.hdl;

import java.util.List;

/** Selects one of {@code elements} by the run-time {@code index}. */
public record ArrayProxy(List<Value> elements, Value index) implements Value {
  public ArrayProxy {
    if (elements.isEmpty())
      throw new IllegalArgumentException("ArrayProxy needs at least one element");
    elements = List.copyOf(elements);
  }

  @Override
  public Shape shape() {
    return elements.stream().map(Value::shape).reduce(Shape::bitwise).orElseThrow();
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitArrayProxy(this);
  }
}
