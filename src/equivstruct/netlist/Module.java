package equivstruct.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A module of a {@link Design}: wires, cells and direct wire-to-wire connections.
 * Cells live in an arena indexed by their id; removing a cell clears its slot so that ids held elsewhere
 * resolve to null instead of a stale object.
 */
public class Module {
  /** Direct connection, lhs is driven by rhs. */
  public record Connection(SigSpec lhs, SigSpec rhs) {}

  private final Design design;
  private final String name;

  private final LinkedHashMap<String, Wire> wires = new LinkedHashMap<>();
  private final ArrayList<Cell> cellArena = new ArrayList<>();
  private final HashMap<String, Integer> cellIdsByName = new HashMap<>();
  private final ArrayList<Connection> connections = new ArrayList<>();
  private int liveCells = 0;

  Module(Design design, String name) {
    this.design = design;
    this.name = name;
  }

  public Design getDesign() { return design; }
  public String getName() { return name; }

  public Wire addWire(String wireName, int width) { return addWire(wireName, width, Wire.PortDirection.NONE); }

  /**
   * Adds a wire.
   * @param wireName unique wire name
   * @param width wire width in bits
   * @param direction port direction, or {@link Wire.PortDirection#NONE} for internal wires
   * @return the new wire
   */
  public Wire addWire(String wireName, int width, Wire.PortDirection direction) {
    if (wires.containsKey(wireName))
      throw new IllegalArgumentException("duplicate wire " + wireName + " in module " + name);
    Wire wire = new Wire(wireName, width, direction);
    wires.put(wireName, wire);
    return wire;
  }

  /** Returns the wire with the given name, or null. */
  public Wire wire(String wireName) { return wires.get(wireName); }
  public Collection<Wire> wires() { return Collections.unmodifiableCollection(wires.values()); }
  public List<Wire> ports() { return wires.values().stream().filter(Wire::isPort).collect(Collectors.toList()); }

  /**
   * Adds a cell without ports or parameters.
   * @param cellName unique cell name
   * @param type the cell type
   * @return the new cell
   */
  public Cell addCell(String cellName, String type) {
    if (cellIdsByName.containsKey(cellName))
      throw new IllegalArgumentException("duplicate cell " + cellName + " in module " + name);
    Cell cell = new Cell(this, cellArena.size(), cellName, type);
    cellArena.add(cell);
    cellIdsByName.put(cellName, cell.getId());
    ++liveCells;
    return cell;
  }

  /**
   * Adds an equivalence-assertion cell asserting a == b, with the trusted value on y.
   * All three signals must be single bits.
   */
  public Cell addEquiv(String cellName, SigBit a, SigBit b, SigBit y) {
    Cell cell = addCell(cellName, CellTypes.EQUIV);
    cell.setPort(CellTypes.EQUIV_A, SigSpec.of(a));
    cell.setPort(CellTypes.EQUIV_B, SigSpec.of(b));
    cell.setPort(CellTypes.EQUIV_Y, SigSpec.of(y));
    return cell;
  }

  /** Resolves a cell id, returning null once the cell has been removed. */
  public Cell cell(int id) {
    if (id < 0 || id >= cellArena.size())
      return null;
    return cellArena.get(id);
  }

  /** Returns the live cell with the given name, or null. */
  public Cell cell(String cellName) {
    Integer id = cellIdsByName.get(cellName);
    return id == null ? null : cellArena.get(id);
  }

  /** Live cells in creation order. The returned list is a snapshot. */
  public List<Cell> cells() { return cellArena.stream().filter(Objects::nonNull).collect(Collectors.toList()); }

  public int cellCount() { return liveCells; }

  /**
   * Removes a cell. Its id is invalidated and never reused.
   * @throws IllegalArgumentException if the cell is not a live cell of this module
   */
  public void remove(Cell cell) {
    if (cell.getModule() != this || cell(cell.getId()) != cell)
      throw new IllegalArgumentException("cell " + cell.getName() + " is not a live cell of module " + name);
    cellArena.set(cell.getId(), null);
    cellIdsByName.remove(cell.getName());
    --liveCells;
  }

  /**
   * Adds a direct connection, lhs being driven by rhs.
   * @throws IllegalArgumentException if the widths differ
   */
  public void connect(SigSpec lhs, SigSpec rhs) {
    if (lhs.size() != rhs.size())
      throw new IllegalArgumentException(String.format("width mismatch connecting %s (%d) to %s (%d)", lhs, lhs.size(), rhs, rhs.size()));
    connections.add(new Connection(lhs, rhs));
  }

  public List<Connection> connections() { return Collections.unmodifiableList(connections); }

  /** Returns a name that is unique across the design. */
  public String newId(String tag) {
    String id;
    do {
      id = design.newId(tag);
    } while (wires.containsKey(id) || cellIdsByName.containsKey(id));
    return id;
  }

  /** Allocates a fresh one-bit wire and returns its bit. */
  public SigBit freshBit(String tag) { return addWire(newId(tag), 1).bit(0); }

  @Override
  public String toString() {
    return name;
  }
}
