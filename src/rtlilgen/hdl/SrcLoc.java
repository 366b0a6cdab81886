package rtlilgen.hdl;

/**
 * Source location of a design object, passed through to the emitted RTLIL as a {@code src} attribute.
 */
public record SrcLoc(String file, int line) {
  @Override
  public String toString() {
    return file + ":" + line;
  }
}
