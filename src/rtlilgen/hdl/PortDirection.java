package rtlilgen.hdl;

import java.util.Arrays;
import java.util.Optional;

/** Direction of a module port. */
public enum PortDirection {
  INPUT("i", "input"),
  OUTPUT("o", "output"),
  INOUT("io", "inout");

  private final String serialName;
  private final String keyword;

  PortDirection(String serialName, String keyword) {
    this.serialName = serialName;
    this.keyword = keyword;
  }

  /** @return the keyword used in RTLIL wire declarations */
  public String getKeyword() { return keyword; }

  public static Optional<PortDirection> fromSerialName(String name) {
    return Arrays.stream(values()).filter(dir -> dir.serialName.equals(name) || dir.keyword.equals(name)).findFirst();
  }
}
