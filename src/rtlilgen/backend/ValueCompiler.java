package rtlilgen.backend;

import rtlilgen.hdl.ArrayProxy;
import rtlilgen.hdl.Part;
import rtlilgen.hdl.Value;
import rtlilgen.hdl.ValueVisitor;

/**
 * Lowers a design expression to an RTLIL signal specification, emitting wires and cells into the module as needed.
 */
public abstract class ValueCompiler implements ValueVisitor<String> {
  protected final ValueCompilerState s;

  protected ValueCompiler(ValueCompilerState state) { this.s = state; }

  public String compile(Value value) { return value.accept(this); }

  @Override
  public String visitPart(Part value) {
    throw new UnsupportedOperationException("Dynamic part-select is not supported by the RTLIL backend");
  }

  @Override
  public String visitArrayProxy(ArrayProxy value) {
    throw new UnsupportedOperationException("Array multiplexers are not supported by the RTLIL backend");
  }
}
