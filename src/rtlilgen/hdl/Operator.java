package rtlilgen.hdl;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Unary, binary or ternary (mux) operator application.
 * For {@link Op#MUX} the operands are {@code (sel, ifTrue, ifFalse)}.
 */
public record Operator(Op op, List<Value> operands, SrcLoc srcLoc) implements Value {

  /** Operators known to the design model, with their arity and the RTLIL cell implementing them. */
  public enum Op {
    NOT("~", 1, "$not"),
    NEG("-", 1, "$neg"),
    BOOL("b", 1, "$reduce_bool"),
    ADD("+", 2, "$add"),
    SUB("-", 2, "$sub"),
    MUL("*", 2, "$mul"),
    DIV("/", 2, "$div"),
    MOD("%", 2, "$mod"),
    SHL("<<", 2, "$sshl"),
    SHR(">>", 2, "$sshr"),
    AND("&", 2, "$and"),
    XOR("^", 2, "$xor"),
    OR("|", 2, "$or"),
    EQ("==", 2, "$eq"),
    NE("!=", 2, "$ne"),
    LT("<", 2, "$lt"),
    LE("<=", 2, "$le"),
    GT(">", 2, "$gt"),
    GE(">=", 2, "$ge"),
    MUX("m", 3, "$mux");

    public final String symbol;
    public final int arity;
    public final String cellKind;

    Op(String symbol, int arity, String cellKind) {
      this.symbol = symbol;
      this.arity = arity;
      this.cellKind = cellKind;
    }

    /** Looks up an operator by symbol and arity ({@code "-"} is both negation and subtraction). */
    public static Optional<Op> fromSymbol(String symbol, int arity) {
      return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol) && op.arity == arity).findFirst();
    }
  }

  public Operator {
    operands = List.copyOf(operands);
    if (operands.size() != op.arity)
      throw new IllegalArgumentException("Operator " + op.symbol + " takes " + op.arity + " operands, got " + operands.size());
  }

  public Operator(Op op, Value... operands) { this(op, Arrays.asList(operands), null); }

  public Operator withSrcLoc(SrcLoc loc) { return new Operator(op, operands, loc); }

  @Override
  public Shape shape() {
    if (op.arity == 1) {
      Shape a = operands.get(0).shape();
      switch (op) {
      case NEG:
        return a.signed() ? a : Shape.signed(a.width() + 1);
      case BOOL:
        return Shape.unsigned(1);
      default:
        return a;
      }
    }
    if (op == Op.MUX)
      return Shape.bitwise(operands.get(1).shape(), operands.get(2).shape());

    Shape a = operands.get(0).shape();
    Shape b = operands.get(1).shape();
    switch (op) {
    case ADD:
    case SUB: {
      Shape bitwise = Shape.bitwise(a, b);
      return new Shape(bitwise.width() + 1, bitwise.signed());
    }
    case MUL:
      return new Shape(a.width() + b.width(), a.signed() || b.signed());
    case DIV:
      return new Shape(a.width(), a.signed() || b.signed());
    case MOD:
      return b;
    case AND:
    case XOR:
    case OR:
      return Shape.bitwise(a, b);
    case SHL: {
      int extra = b.signed() ? pow2(b.width() - 1) - 1 : pow2(b.width()) - 1;
      return new Shape(Math.addExact(a.width(), extra), a.signed());
    }
    case SHR: {
      int extra = b.signed() ? pow2(b.width() - 1) : 0;
      return new Shape(Math.addExact(a.width(), extra), a.signed());
    }
    default: // comparisons
      return Shape.unsigned(1);
    }
  }

  private static int pow2(int exponent) {
    if (exponent < 0)
      return 0;
    if (exponent >= 30)
      throw new IllegalArgumentException("Shift amount too wide: " + exponent + " bits");
    return 1 << exponent;
  }

  @Override
  public <R> R accept(ValueVisitor<R> visitor) {
    return visitor.visitOperator(this);
  }
}
