package rtlilgen.rtlil;

import java.util.HashSet;

/**
 * Allocates identifiers that are unique within one RTLIL scope. Public names are escaped with {@code \}, generated ones start with
 * {@code $}. A name is never released once allocated.
 */
public class Namer {
  private int index = 0;
  private final HashSet<String> names = new HashSet<>();

  /**
   * @param name the requested name, or null to generate one
   * @param local if false, a requested name without an escape marker gets a leading {@code \}
   * @return a name not previously returned by this Namer
   */
  public String makeName(String name, boolean local) {
    if (name == null) {
      name = "$" + (++index);
    } else if (!local && !name.startsWith("\\") && !name.startsWith("$")) {
      name = "\\" + name;
    }
    String candidate = name;
    while (names.contains(candidate))
      candidate = name + "$" + (++index);
    names.add(candidate);
    return candidate;
  }
}
