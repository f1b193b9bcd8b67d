package equivstruct.netlist;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A typed vertex of a {@link Module}. Cells are created through {@link Module#addCell(String, String)}
 * and identified by a stable integer id that is never reused after removal.
 */
public class Cell {
  private final Module module;
  private final int id;
  private final String name;
  private final String type;

  private final LinkedHashMap<String, Const> parameters = new LinkedHashMap<>();
  private final LinkedHashMap<String, SigSpec> connections = new LinkedHashMap<>();
  private final LinkedHashMap<String, LinkedHashSet<String>> attributes = new LinkedHashMap<>();

  Cell(Module module, int id, String name, String type) {
    this.module = module;
    this.id = id;
    this.name = name;
    this.type = type;
  }

  public Module getModule() { return module; }
  public int getId() { return id; }
  public String getName() { return name; }
  public String getType() { return type; }

  /** Returns true iff this cell has not been removed from its module. */
  public boolean isAlive() { return module.cell(id) == this; }

  public Map<String, Const> parameters() { return Collections.unmodifiableMap(parameters); }
  public Const getParam(String paramName) { return parameters.get(paramName); }
  public void setParam(String paramName, Const value) { parameters.put(paramName, value); }

  /** Port name to connected signal, in port creation order. */
  public Map<String, SigSpec> connections() { return Collections.unmodifiableMap(connections); }

  public boolean hasPort(String port) { return connections.containsKey(port); }

  /**
   * Returns the signal connected to a port.
   * @throws IllegalArgumentException if the cell has no such port
   */
  public SigSpec getPort(String port) {
    SigSpec sig = connections.get(port);
    if (sig == null)
      throw new IllegalArgumentException("cell " + name + " has no port " + port);
    return sig;
  }

  /**
   * Connects a port. A port keeps its width once connected; reconnecting with another width is rejected.
   * @param port the port name
   * @param sig the new signal
   */
  public void setPort(String port, SigSpec sig) {
    SigSpec prev = connections.get(port);
    if (prev != null && prev.size() != sig.size())
      throw new IllegalArgumentException(
          String.format("cannot reconnect %s.%s from width %d to width %d", name, port, prev.size(), sig.size()));
    for (SigBit bit : sig)
      if (!bit.isConst() && module.wire(bit.getWire().getName()) != bit.getWire())
        throw new IllegalArgumentException("signal " + sig + " does not belong to module " + module.getName());
    connections.put(port, sig);
  }

  public boolean input(String port) { return module.getDesign().input(type, port); }
  public boolean output(String port) { return module.getDesign().output(type, port); }

  /** Returns a copy of a string-set attribute (empty if unset). */
  public Set<String> getStrPoolAttribute(String attrName) {
    Set<String> values = attributes.get(attrName);
    return values == null ? new LinkedHashSet<>() : new LinkedHashSet<>(values);
  }

  /** Adds all values to a string-set attribute, creating it if needed. */
  public void addStrPoolAttribute(String attrName, Collection<String> values) {
    attributes.computeIfAbsent(attrName, key_ -> new LinkedHashSet<>()).addAll(values);
  }

  public Set<String> attributeNames() { return Collections.unmodifiableSet(attributes.keySet()); }

  @Override
  public String toString() {
    return name + " (" + type + ")";
  }
}
