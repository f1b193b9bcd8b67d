package equivstruct.util;

/**
 * Thrown when a netlist file cannot be turned into a design.
 */
public class NetlistFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String location;

  public NetlistFormatException(String location, String message) {
    super(location.isEmpty() ? message : location + ": " + message);
    this.location = location;
  }

  public NetlistFormatException(String location, String message, Throwable cause) {
    super(location.isEmpty() ? message : location + ": " + message, cause);
    this.location = location;
  }

  /** Path of the offending element inside the file, e.g. "modules.top.cells.add0". */
  public String getLocation() { return location; }
}
