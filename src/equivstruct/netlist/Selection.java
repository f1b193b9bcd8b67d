package equivstruct.netlist;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Restricts which modules, and which cells inside them, a pass may look at.
 */
public class Selection {
  // null: all modules
  private final Set<String> moduleNames;
  // module name -> selected cell names; modules without entry have all cells selected
  private final Map<String, Set<String>> cellNames = new HashMap<>();

  private Selection(Set<String> moduleNames) { this.moduleNames = moduleNames; }

  /** Selects every cell of every module. */
  public static Selection wholeDesign() { return new Selection(null); }

  /** Selects every cell of the named modules. */
  public static Selection ofModules(Collection<String> moduleNames) { return new Selection(new LinkedHashSet<>(moduleNames)); }

  /**
   * Narrows the selection of one module to the given cells.
   * The module is added to the selected modules if it is not part of it yet.
   * @return this
   */
  public Selection withCells(String moduleName, Collection<String> cells) {
    if (moduleNames != null)
      moduleNames.add(moduleName);
    cellNames.computeIfAbsent(moduleName, key_ -> new LinkedHashSet<>()).addAll(cells);
    return this;
  }

  public boolean isSelected(Module module) { return moduleNames == null || moduleNames.contains(module.getName()); }

  public boolean isSelected(Cell cell) {
    if (!isSelected(cell.getModule()))
      return false;
    Set<String> names = cellNames.get(cell.getModule().getName());
    return names == null || names.contains(cell.getName());
  }

  public List<Module> selectedModules(Design design) {
    return design.modules().stream().filter(this::isSelected).collect(Collectors.toList());
  }

  /** Selected live cells of a module, in creation order. */
  public List<Cell> selectedCells(Module module) {
    return module.cells().stream().filter(this::isSelected).collect(Collectors.toList());
  }
}
