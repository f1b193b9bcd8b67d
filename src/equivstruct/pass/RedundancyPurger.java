package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.CellTypes;
import equivstruct.netlist.Module;
import equivstruct.netlist.SigBit;
import equivstruct.netlist.SigMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Removes equivalence-assertion cells that compare a signal with itself while their trusted output is already
 * an operand of some assertion.
 */
public class RedundancyPurger {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Module module;

  public RedundancyPurger(Module module) { this.module = module; }

  /**
   * Purges all redundant assertion cells named by the map.
   * @param equivMap the map built at the start of this iteration
   * @param stats receives the number of purged cells, or null
   * @return the number of removed cells
   */
  public int purge(EquivMap equivMap, EquivStructStats stats) {
    SigMap sigmap = equivMap.getSigMap();
    int purged = 0;
    for (int cellId : equivMap.getEquivCells()) {
      Cell cell = module.cell(cellId);
      if (cell == null)
        continue;
      SigBit sigA = sigmap.apply(cell.getPort(CellTypes.EQUIV_A).asBit());
      SigBit sigB = sigmap.apply(cell.getPort(CellTypes.EQUIV_B).asBit());
      SigBit sigY = sigmap.apply(cell.getPort(CellTypes.EQUIV_Y).asBit());
      if (sigA.equals(sigB) && equivMap.getAssertedSignals().contains(sigY)) {
        logger.info("    Purging redundant $equiv cell {}.", cell.getName());
        module.remove(cell);
        ++purged;
      }
    }
    if (stats != null)
      stats.purged += purged;
    return purged;
  }
}
