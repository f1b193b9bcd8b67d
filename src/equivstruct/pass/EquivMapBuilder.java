package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.CellTypes;
import equivstruct.netlist.Module;
import equivstruct.netlist.Selection;
import equivstruct.netlist.SigBit;
import equivstruct.netlist.SigMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scans the selected cells of a module once, collecting the equivalence map and the merge candidates.
 * Equivalence-assertion cells are always candidates; hierarchical instances are candidates;
 * primitive cells only if requested.
 */
public class EquivMapBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Module module;
  private final Selection selection;
  private final boolean includePrimitives;

  public EquivMapBuilder(Module module, Selection selection, boolean includePrimitives) {
    this.module = module;
    this.selection = selection;
    this.includePrimitives = includePrimitives;
  }

  public EquivMap build() {
    SigMap sigmap = new SigMap(module);
    SigMap equivBits = new SigMap(sigmap);
    LinkedHashSet<SigBit> assertedSignals = new LinkedHashSet<>();
    List<Integer> equivCells = new ArrayList<>();
    List<Integer> candidates = new ArrayList<>();

    for (Cell cell : selection.selectedCells(module)) {
      if (cell.getType().equals(CellTypes.EQUIV)) {
        SigBit sigA = sigmap.apply(cell.getPort(CellTypes.EQUIV_A).asBit());
        SigBit sigB = sigmap.apply(cell.getPort(CellTypes.EQUIV_B).asBit());
        equivBits.add(sigB, sigA);
        assertedSignals.add(sigA);
        assertedSignals.add(sigB);
        equivCells.add(cell.getId());
        candidates.add(cell.getId());
      } else if (includePrimitives || module.getDesign().isHierarchical(cell.getType())) {
        candidates.add(cell.getId());
      } else {
        logger.trace("Not considering primitive cell {}", cell);
      }
    }
    return new EquivMap(sigmap, equivBits, assertedSignals, equivCells, candidates);
  }
}
