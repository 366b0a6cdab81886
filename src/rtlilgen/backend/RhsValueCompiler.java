package rtlilgen.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import rtlilgen.hdl.Cat;
import rtlilgen.hdl.Const;
import rtlilgen.hdl.Operator;
import rtlilgen.hdl.Repl;
import rtlilgen.hdl.Shape;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.Slice;
import rtlilgen.hdl.Value;

/**
 * Lowers expressions that are read. Every cell emitted here gets data ports of the widths RTLIL expects; operands whose shapes disagree
 * are brought to a common shape with {@link #matchShape(Value, int, boolean)} first.
 */
public class RhsValueCompiler extends ValueCompiler {

  public RhsValueCompiler(ValueCompilerState state) { super(state); }

  @Override
  public String visitConst(Const value) {
    return value.shape().width() + "'" + value.bits();
  }

  @Override
  public String visitSignal(Signal value) {
    return s.resolveCurr(value);
  }

  @Override
  public String visitSlice(Slice value) {
    if (value.isWhole())
      return compile(value.value());
    if (value.start() == value.end())
      return sigspecGroup(List.of());
    if (value.start() + 1 == value.end())
      return compile(value.value()) + " [" + value.start() + "]";
    return compile(value.value()) + " [" + (value.end() - 1) + ":" + value.start() + "]";
  }

  @Override
  public String visitCat(Cat value) {
    List<String> parts = new ArrayList<>();
    for (Value operand : value.operands())
      parts.add(compile(operand));
    Collections.reverse(parts);
    return sigspecGroup(parts);
  }

  @Override
  public String visitRepl(Repl value) {
    String operand = compile(value.value());
    return sigspecGroup(Collections.nCopies(value.count(), operand));
  }

  private static String sigspecGroup(List<String> parts) {
    if (parts.isEmpty())
      return "{ }";
    return "{ " + String.join(" ", parts) + " }";
  }

  @Override
  public String visitOperator(Operator value) {
    switch (value.op().arity) {
    case 1:
      return compileUnary(value);
    case 2:
      return compileBinary(value);
    default:
      return compileMux(value);
    }
  }

  private String compileUnary(Operator value) {
    Value arg = value.operands().get(0);
    Shape argShape = arg.shape();
    Shape resShape = value.shape();
    String argWire = compile(arg);
    String res = s.rtlil.wire(resShape.width());
    LinkedHashMap<String, Object> params = new LinkedHashMap<>();
    params.put("A_SIGNED", argShape.signed());
    params.put("A_WIDTH", argShape.width());
    params.put("Y_WIDTH", resShape.width());
    LinkedHashMap<String, String> ports = new LinkedHashMap<>();
    ports.put("\\A", argWire);
    ports.put("\\Y", res);
    s.rtlil.cell(value.op().cellKind, null, params, ports, s.src(value.srcLoc()));
    return res;
  }

  private String compileBinary(Operator value) {
    Value lhs = value.operands().get(0);
    Value rhs = value.operands().get(1);
    int lhsBits = lhs.width();
    boolean lhsSign = lhs.shape().signed();
    int rhsBits = rhs.width();
    boolean rhsSign = rhs.shape().signed();
    String lhsWire;
    String rhsWire;
    if (lhsSign == rhsSign) {
      lhsWire = compile(lhs);
      rhsWire = compile(rhs);
    } else {
      lhsSign = rhsSign = true;
      lhsBits = rhsBits = Math.max(lhsBits, rhsBits);
      lhsWire = matchShape(lhs, lhsBits, lhsSign);
      rhsWire = matchShape(rhs, rhsBits, rhsSign);
    }
    Shape resShape = value.shape();
    String res = s.rtlil.wire(resShape.width());
    LinkedHashMap<String, Object> params = new LinkedHashMap<>();
    params.put("A_SIGNED", lhsSign);
    params.put("A_WIDTH", lhsBits);
    params.put("B_SIGNED", rhsSign);
    params.put("B_WIDTH", rhsBits);
    params.put("Y_WIDTH", resShape.width());
    LinkedHashMap<String, String> ports = new LinkedHashMap<>();
    ports.put("\\A", lhsWire);
    ports.put("\\B", rhsWire);
    ports.put("\\Y", res);
    s.rtlil.cell(value.op().cellKind, null, params, ports, s.src(value.srcLoc()));
    return res;
  }

  private String compileMux(Operator value) {
    Value sel = value.operands().get(0);
    Value ifTrue = value.operands().get(1);
    Value ifFalse = value.operands().get(2);
    if (sel.width() != 1)
      sel = new Operator(Operator.Op.BOOL, sel);
    int width = Math.max(value.width(), Math.max(ifTrue.width(), ifFalse.width()));
    // $mux outputs B when S is set
    String falseWire = matchShape(ifFalse, width, ifFalse.shape().signed());
    String trueWire = matchShape(ifTrue, width, ifTrue.shape().signed());
    String selWire = compile(sel);
    String res = s.rtlil.wire(width);
    LinkedHashMap<String, Object> params = new LinkedHashMap<>();
    params.put("WIDTH", width);
    LinkedHashMap<String, String> ports = new LinkedHashMap<>();
    ports.put("\\A", falseWire);
    ports.put("\\B", trueWire);
    ports.put("\\S", selWire);
    ports.put("\\Y", res);
    s.rtlil.cell(value.op().cellKind, null, params, ports, s.src(value.srcLoc()));
    return res;
  }

  /**
   * Lowers {@code value} as a signal of exactly {@code newBits} bits. Constants are re-rendered at the new shape, wider values are
   * truncated, narrower ones extended by a {@code $pos} cell according to their own signedness.
   * @param newSign the signedness of the consumer; only affects how constants are re-rendered
   */
  public String matchShape(Value value, int newBits, boolean newSign) {
    if (value instanceof Const)
      return compile(((Const)value).withShape(new Shape(newBits, newSign)));

    Shape valueShape = value.shape();
    if (newBits <= valueShape.width())
      return compile(new Slice(value, 0, newBits));

    String valueWire = compile(value);
    String res = s.rtlil.wire(newBits);
    LinkedHashMap<String, Object> params = new LinkedHashMap<>();
    params.put("A_SIGNED", valueShape.signed());
    params.put("A_WIDTH", valueShape.width());
    params.put("Y_WIDTH", newBits);
    LinkedHashMap<String, String> ports = new LinkedHashMap<>();
    ports.put("\\A", valueWire);
    ports.put("\\Y", res);
    s.rtlil.cell("$pos", null, params, ports, srcOf(value));
    return res;
  }

  private String srcOf(Value value) {
    if (value instanceof Operator)
      return s.src(((Operator)value).srcLoc());
    if (value instanceof Signal)
      return s.src(((Signal)value).getSrcLoc());
    return null;
  }
}
