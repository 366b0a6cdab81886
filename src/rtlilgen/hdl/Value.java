package rtlilgen.hdl;

import java.util.Arrays;
import java.util.LinkedHashSet;

/**
 * An expression of the design graph. The set of variants is closed; backends dispatch over it with a {@link ValueVisitor}.
 */
public sealed interface Value permits Const, Signal, Slice, Cat, Repl, Operator, Part, ArrayProxy {

  Shape shape();

  <R> R accept(ValueVisitor<R> visitor);

  default int width() { return shape().width(); }

  /** Returns all signals referenced by this expression, in first-encounter order. */
  default LinkedHashSet<Signal> signals() {
    LinkedHashSet<Signal> ret = new LinkedHashSet<>();
    accept(new SignalCollector(ret));
    return ret;
  }

  default Slice slice(int start, int end) { return new Slice(this, start, end); }
  default Slice bit(int index) { return new Slice(this, index, index + 1); }
  default Repl repl(int count) { return new Repl(this, count); }
  default Part part(Value offset, int width) { return new Part(this, offset, width); }

  default Operator not() { return new Operator(Operator.Op.NOT, this); }
  default Operator neg() { return new Operator(Operator.Op.NEG, this); }
  default Operator bool() { return new Operator(Operator.Op.BOOL, this); }
  default Operator add(Value other) { return new Operator(Operator.Op.ADD, this, other); }
  default Operator sub(Value other) { return new Operator(Operator.Op.SUB, this, other); }
  default Operator mul(Value other) { return new Operator(Operator.Op.MUL, this, other); }
  default Operator and(Value other) { return new Operator(Operator.Op.AND, this, other); }
  default Operator or(Value other) { return new Operator(Operator.Op.OR, this, other); }
  default Operator xor(Value other) { return new Operator(Operator.Op.XOR, this, other); }
  default Operator shl(Value other) { return new Operator(Operator.Op.SHL, this, other); }
  default Operator shr(Value other) { return new Operator(Operator.Op.SHR, this, other); }
  default Operator eq(Value other) { return new Operator(Operator.Op.EQ, this, other); }
  default Operator ne(Value other) { return new Operator(Operator.Op.NE, this, other); }
  default Operator lt(Value other) { return new Operator(Operator.Op.LT, this, other); }
  default Operator le(Value other) { return new Operator(Operator.Op.LE, this, other); }
  default Operator gt(Value other) { return new Operator(Operator.Op.GT, this, other); }
  default Operator ge(Value other) { return new Operator(Operator.Op.GE, this, other); }

  /** Concatenation; the first operand ends up in the least significant bits. */
  static Cat cat(Value... operands) { return new Cat(Arrays.asList(operands)); }

  /** Selects {@code ifTrue} when {@code sel} is non-zero, {@code ifFalse} otherwise. */
  static Operator mux(Value sel, Value ifTrue, Value ifFalse) { return new Operator(Operator.Op.MUX, sel, ifTrue, ifFalse); }

  /** Collects referenced signals into an ordered set. */
  static final class SignalCollector implements ValueVisitor<Void> {
    private final LinkedHashSet<Signal> out;
    SignalCollector(LinkedHashSet<Signal> out) { this.out = out; }

    @Override
    public Void visitConst(Const value) {
      return null;
    }
    @Override
    public Void visitSignal(Signal value) {
      out.add(value);
      return null;
    }
    @Override
    public Void visitSlice(Slice value) {
      return value.value().accept(this);
    }
    @Override
    public Void visitCat(Cat value) {
      value.operands().forEach(operand -> operand.accept(this));
      return null;
    }
    @Override
    public Void visitRepl(Repl value) {
      return value.value().accept(this);
    }
    @Override
    public Void visitOperator(Operator value) {
      value.operands().forEach(operand -> operand.accept(this));
      return null;
    }
    @Override
    public Void visitPart(Part value) {
      value.value().accept(this);
      return value.offset().accept(this);
    }
    @Override
    public Void visitArrayProxy(ArrayProxy value) {
      value.elements().forEach(element -> element.accept(this));
      return value.index().accept(this);
    }
  }
}
