package rtlilgen.backend;

import rtlilgen.hdl.Cat;
import rtlilgen.hdl.Const;
import rtlilgen.hdl.Operator;
import rtlilgen.hdl.Repl;
import rtlilgen.hdl.Signal;
import rtlilgen.hdl.Slice;

/**
 * Lowers assignment targets. Only whole signals can be assigned; they resolve to their {@code $next} wire.
 */
public class LhsValueCompiler extends ValueCompiler {

  public LhsValueCompiler(ValueCompilerState state) { super(state); }

  @Override
  public String visitSignal(Signal value) {
    ValueCompilerState.Wires wires = s.resolve(value);
    if (wires.next() == null)
      throw new IllegalArgumentException("Cannot return lhs for non-driven signal " + value);
    return wires.next();
  }

  @Override
  public String visitConst(Const value) {
    throw new UnsupportedOperationException("Cannot assign to constant " + value);
  }

  @Override
  public String visitOperator(Operator value) {
    throw new UnsupportedOperationException("Cannot assign to the result of operator " + value.op().symbol);
  }

  @Override
  public String visitRepl(Repl value) {
    throw new UnsupportedOperationException("Cannot assign to a replication");
  }

  @Override
  public String visitSlice(Slice value) {
    throw new UnsupportedOperationException("Cannot assign to a slice; only whole signals are assignable");
  }

  @Override
  public String visitCat(Cat value) {
    throw new UnsupportedOperationException("Cannot assign to a concatenation; only whole signals are assignable");
  }
}
