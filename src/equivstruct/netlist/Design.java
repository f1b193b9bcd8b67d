package equivstruct.netlist;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

/**
 * A set of modules plus the primitive cell type table. Cell types naming a module are hierarchical.
 */
public class Design {
  private final LinkedHashMap<String, Module> modules = new LinkedHashMap<>();
  private final CellTypes cellTypes = new CellTypes();
  private int autoIdx = 1;

  public Module addModule(String name) {
    if (modules.containsKey(name))
      throw new IllegalArgumentException("duplicate module " + name);
    Module module = new Module(this, name);
    modules.put(name, module);
    return module;
  }

  /** Returns the module with the given name, or null. */
  public Module module(String name) { return modules.get(name); }
  public Collection<Module> modules() { return Collections.unmodifiableCollection(modules.values()); }

  public CellTypes getCellTypes() { return cellTypes; }

  /** Returns true iff the cell type names a module of this design. */
  public boolean isHierarchical(String type) { return modules.containsKey(type); }

  public boolean input(String type, String port) {
    Module sub = modules.get(type);
    if (sub != null) {
      Wire portWire = sub.wire(port);
      return portWire != null && portWire.getDirection().isInput();
    }
    return cellTypes.input(type, port);
  }

  public boolean output(String type, String port) {
    Module sub = modules.get(type);
    if (sub != null) {
      Wire portWire = sub.wire(port);
      return portWire != null && portWire.getDirection().isOutput();
    }
    return cellTypes.output(type, port);
  }

  /** Returns true iff the direction of the type's ports is known, be it hierarchical or primitive. */
  public boolean isKnownType(String type) { return isHierarchical(type) || cellTypes.isKnown(type); }

  String newId(String tag) { return String.format("$auto$%s$%d", tag, autoIdx++); }
}
