package equivstruct.netlist;

/**
 * A named multi-bit net inside a {@link Module}. Module ports are wires with a port direction.
 */
public class Wire {
  public enum PortDirection {
    NONE,
    INPUT,
    OUTPUT,
    INOUT;

    public boolean isInput() { return this == INPUT || this == INOUT; }
    public boolean isOutput() { return this == OUTPUT || this == INOUT; }
  }

  private final String name;
  private final int width;
  private final PortDirection direction;

  Wire(String name, int width, PortDirection direction) {
    if (width < 1)
      throw new IllegalArgumentException("wire " + name + " must be at least one bit wide");
    this.name = name;
    this.width = width;
    this.direction = direction;
  }

  public String getName() { return name; }
  public int getWidth() { return width; }
  public PortDirection getDirection() { return direction; }
  public boolean isPort() { return direction != PortDirection.NONE; }

  /** Returns the full wire as a signal, LSB first. */
  public SigSpec asSigSpec() { return SigSpec.of(this); }

  /** Returns a single bit of this wire. */
  public SigBit bit(int offset) { return SigBit.of(this, offset); }

  @Override
  public String toString() {
    return name;
  }
}
