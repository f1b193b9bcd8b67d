package equivstruct.netlist;

import java.util.Objects;

/**
 * A single-bit signal: either a constant {@link State} or one bit of a {@link Wire}.
 * Instances are immutable and compare by value; wires compare by identity.
 */
public final class SigBit implements Comparable<SigBit> {
  private final Wire wire;
  private final int offset;
  private final State data;

  private static final SigBit[] constants = new SigBit[State.values().length];
  static {
    for (State state : State.values())
      constants[state.ordinal()] = new SigBit(null, 0, state);
  }

  private SigBit(Wire wire, int offset, State data) {
    this.wire = wire;
    this.offset = offset;
    this.data = data;
  }

  public static SigBit of(State state) { return constants[state.ordinal()]; }

  public static SigBit of(Wire wire, int offset) {
    Objects.requireNonNull(wire);
    if (offset < 0 || offset >= wire.getWidth())
      throw new IllegalArgumentException(String.format("bit %d out of range for wire %s[%d]", offset, wire.getName(), wire.getWidth()));
    return new SigBit(wire, offset, null);
  }

  public boolean isConst() { return wire == null; }
  public Wire getWire() { return wire; }
  public int getOffset() { return offset; }
  /** Returns the constant value, or null for wire bits. */
  public State getData() { return data; }

  @Override
  public int compareTo(SigBit other) {
    if (isConst() != other.isConst())
      return isConst() ? -1 : 1;
    if (isConst())
      return data.compareTo(other.data);
    int byName = wire.getName().compareTo(other.wire.getName());
    if (byName != 0)
      return byName;
    if (wire != other.wire)
      return Integer.compare(System.identityHashCode(wire), System.identityHashCode(other.wire));
    return Integer.compare(offset, other.offset);
  }

  @Override
  public int hashCode() {
    return isConst() ? data.hashCode() : Objects.hash(System.identityHashCode(wire), offset);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    SigBit other = (SigBit)obj;
    return wire == other.wire && offset == other.offset && data == other.data;
  }
  @Override
  public String toString() {
    if (isConst())
      return "1'b" + data.getSymbol();
    return wire.getWidth() == 1 ? wire.getName() : String.format("%s[%d]", wire.getName(), offset);
  }
}
