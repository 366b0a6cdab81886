package rtlilgen.rtlil;

import java.math.BigInteger;

/**
 * Accumulates RTLIL text of one scope.
 */
public class Bufferer {
  private final StringBuilder buffer = new StringBuilder();

  protected void append(String text) { buffer.append(text); }

  /** Appends the text of a closed child scope. */
  void write(String text) { buffer.append(text); }

  protected void appendAttribute(String indent, String name, Object value) {
    append(indent + "attribute \\" + name + " " + formatValue(value) + "\n");
  }

  /** Emits a {@code src} attribute unless {@code src} is null or empty. */
  protected void appendSrc(String indent, String src) {
    if (src != null && !src.isEmpty())
      appendAttribute(indent, "src", src);
  }

  /** Strings are quoted with embedded quotes escaped; numbers and booleans are rendered as integers. */
  static String formatValue(Object value) {
    if (value instanceof String)
      return "\"" + ((String)value).replace("\"", "\\\"") + "\"";
    if (value instanceof Boolean)
      return (Boolean)value ? "1" : "0";
    if (value instanceof BigInteger)
      return value.toString();
    if (value instanceof Number)
      return Long.toString(((Number)value).longValue());
    throw new IllegalArgumentException("Cannot render attribute value of type " + (value == null ? "null" : value.getClass().getName()));
  }

  @Override
  public String toString() {
    return buffer.toString();
  }
}
