package rtlilgen.hdl;

/**
 * Visitor over the closed set of {@link Value} variants.
 * @param <R> the result type
 */
public interface ValueVisitor<R> {
  R visitConst(Const value);
  R visitSignal(Signal value);
  R visitSlice(Slice value);
  R visitCat(Cat value);
  R visitRepl(Repl value);
  R visitOperator(Operator value);
  R visitPart(Part value);
  R visitArrayProxy(ArrayProxy value);
}
