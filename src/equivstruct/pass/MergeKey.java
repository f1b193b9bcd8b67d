package equivstruct.pass;

import equivstruct.netlist.Const;
import equivstruct.netlist.SigBit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural fingerprint of a cell: type, sorted parameters, sorted port widths and a connection digest.
 * The {@link Direction} tag keeps forward digests (all input bits) and backward digests (one output bit)
 * apart even though both live in the same table.
 */
public final class MergeKey {
  public enum Direction {
    FORWARD("Fwd"),
    BACKWARD("Bwd");

    private final String label;
    Direction(String label) { this.label = label; }
    public String getLabel() { return label; }
  }

  /** One bit of a port, after canonicalization. */
  public record PortBit(String port, int index, SigBit sig) implements Comparable<PortBit> {
    private static final Comparator<PortBit> ORDER =
        Comparator.comparing(PortBit::port).thenComparingInt(PortBit::index).thenComparing(PortBit::sig);

    @Override
    public int compareTo(PortBit other) {
      return ORDER.compare(this, other);
    }
    @Override
    public String toString() {
      return String.format("%s[%d]=%s", port, index, sig);
    }
  }

  private final Direction direction;
  private final String type;
  private final List<Map.Entry<String, Const>> parameters;
  private final List<Map.Entry<String, Integer>> portSizes;
  private final List<PortBit> connections;
  private final int hash;

  /**
   * @param direction forward or backward digest
   * @param type the cell type
   * @param parameters parameters sorted by name
   * @param portSizes port widths sorted by port name
   * @param connections the digest; sorted for forward keys, a single element for backward keys
   */
  MergeKey(Direction direction, String type, List<Map.Entry<String, Const>> parameters, List<Map.Entry<String, Integer>> portSizes,
           List<PortBit> connections) {
    this.direction = direction;
    this.type = type;
    this.parameters = parameters;
    this.portSizes = portSizes;
    this.connections = List.copyOf(connections);
    this.hash = Objects.hash(direction, type, parameters, portSizes, this.connections);
  }

  public Direction getDirection() { return direction; }
  public String getType() { return type; }
  public List<Map.Entry<String, Const>> getParameters() { return parameters; }
  public List<Map.Entry<String, Integer>> getPortSizes() { return portSizes; }
  public List<PortBit> getConnections() { return connections; }

  @Override
  public int hashCode() {
    return hash;
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    MergeKey other = (MergeKey)obj;
    return hash == other.hash && direction == other.direction && type.equals(other.type) && connections.equals(other.connections) &&
        parameters.equals(other.parameters) && portSizes.equals(other.portSizes);
  }
  @Override
  public String toString() {
    return String.format("%s %s %s %s", direction.getLabel(), type, parameters, connections);
  }
}
