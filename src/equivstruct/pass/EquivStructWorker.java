package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Module;
import equivstruct.netlist.Selection;
import equivstruct.ui.EquivStructConfig;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One iteration of the pass on one module: purge, then forward merges, then backward merges.
 * The first step that changes the module ends the iteration, since every later step would work on stale keys.
 */
public class EquivStructWorker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Module module;
  private final Selection selection;
  private final EquivStructConfig cfg;
  private final RepresentativePolicy policy;
  private final EquivStructStats stats;

  public EquivStructWorker(Module module, Selection selection, EquivStructConfig cfg, RepresentativePolicy policy,
                           EquivStructStats stats) {
    this.module = module;
    this.selection = selection;
    this.cfg = cfg;
    this.policy = policy;
    this.stats = stats;
  }

  /**
   * Runs the iteration.
   * @return the number of mutations (purged cells or merged pairs); zero once the module has reached its fixpoint
   */
  public int run() {
    logger.debug("  Starting new iteration.");
    ++stats.iterations;

    EquivMap equivMap = new EquivMapBuilder(module, selection, cfg.mode_icells).build();

    int purged = new RedundancyPurger(module).purge(equivMap, stats);
    if (purged > 0)
      return purged;

    MergeKeyBuilder keyBuilder = new MergeKeyBuilder(equivMap.getEquivBits());
    MergeGroupSelector selector = new MergeGroupSelector(policy);
    for (int cellId : equivMap.getCandidates()) {
      Cell cell = module.cell(cellId);
      selector.add(cellId, keyBuilder.build(cell));
    }

    CellMerger merger = new CellMerger(module, equivMap.getSigMap());
    for (MergeKey.Direction direction : MergeKey.Direction.values()) {
      if (direction == MergeKey.Direction.BACKWARD && !cfg.backward_phase) {
        logger.debug("    Backward phase disabled.");
        break;
      }
      int mergeCount = 0;
      for (MergeKey key : selector.queue(direction)) {
        Optional<MergeGroupSelector.MergeGroup> group = selector.resolve(key, module);
        if (group.isEmpty())
          continue;
        Cell goldCell = group.get().representative();
        for (Cell gateCell : group.get().targets()) {
          logger.info("    {} merging cells {} and {}.", direction.getLabel(), goldCell.getName(), gateCell.getName());
          String gateName = gateCell.getName();
          stats.newEquivCells += merger.merge(goldCell, gateCell);
          stats.addEvent(new EquivStructStats.MergeEvent(module.getName(), direction, goldCell.getType(), goldCell.getName(), gateName));
          ++mergeCount;
        }
      }
      if (mergeCount > 0)
        return mergeCount;
    }

    logger.debug("    Nothing to merge.");
    return 0;
  }
}
