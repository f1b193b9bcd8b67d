package equivstruct.pass;

import equivstruct.netlist.Design;
import equivstruct.netlist.Module;
import equivstruct.netlist.Selection;
import equivstruct.ui.EquivStructConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural equivalence pass.
 *
 * Adds equivalence-assertion cells based on the assumption that the gold and gate circuits of a module are
 * structurally equivalent, and de-duplicates cells along the way. This can introduce wrong assertions where the
 * netlists are not structurally equivalent, e.g. for cells with commutative inputs; the assertions are meant to
 * be proven by a later step.
 */
public class EquivStructPass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final EquivStructConfig cfg;
  private RepresentativePolicy policy;

  public EquivStructPass(EquivStructConfig cfg) {
    this.cfg = cfg;
    this.policy = RepresentativePolicy.preferNameSuffix(cfg.gold_suffix);
  }

  /** Replaces the representative policy derived from {@link EquivStructConfig#gold_suffix}. */
  public void setRepresentativePolicy(RepresentativePolicy policy) { this.policy = policy; }

  /**
   * Runs the pass on all selected modules, each to its fixpoint.
   * @param design the design to modify in place
   * @param selection the modules and cells to consider
   * @return the accumulated statistics
   */
  public EquivStructStats execute(Design design, Selection selection) {
    logger.info("Executing EQUIV_STRUCT pass.");
    if (cfg.mode_fwd)
      logger.debug("Forward-only mode requested; the backward phase is controlled by the backward phase setting.");
    EquivStructStats stats = new EquivStructStats();
    for (Module module : selection.selectedModules(design))
      stats.add(runOnModule(module, selection));
    return stats;
  }

  /**
   * Iterates {@link EquivStructWorker} on one module until an iteration changes nothing.
   * @return the statistics for this module
   */
  public EquivStructStats runOnModule(Module module, Selection selection) {
    logger.info("Running equiv_struct on module {}:", module.getName());
    EquivStructStats stats = new EquivStructStats();
    while (true) {
      EquivStructWorker worker = new EquivStructWorker(module, selection, cfg, policy, stats);
      if (worker.run() == 0)
        break;
    }
    logger.debug("Module {}: {}", module.getName(), stats);
    return stats;
  }
}
