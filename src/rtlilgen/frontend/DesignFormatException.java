package rtlilgen.frontend;

/**
 * A design description could not be turned into fragments.
 */
public class DesignFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String path;

  /**
   * @param path location of the offending entry, e.g. {@code top.statements[2].value}
   * @param message what is wrong with it
   */
  public DesignFormatException(String path, String message) {
    super(path + ": " + message);
    this.path = path;
  }
  public DesignFormatException(String path, String message, Throwable cause) {
    super(path + ": " + message, cause);
    this.path = path;
  }

  public String getPath() { return path; }
}
