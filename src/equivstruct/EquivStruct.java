package equivstruct;

import equivstruct.netlist.Design;
import equivstruct.netlist.Selection;
import equivstruct.pass.EquivStructPass;
import equivstruct.pass.EquivStructStats;
import equivstruct.ui.EquivStructConfig;
import equivstruct.util.NetlistFormatException;
import equivstruct.util.NetlistReader;
import equivstruct.util.NetlistWriter;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads a netlist, runs the structural equivalence pass on the configured selection and writes the result.
 */
public class EquivStruct {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final EquivStructConfig cfg;

  public EquivStruct(EquivStructConfig cfg) { this.cfg = cfg; }

  /** Builds the selection described by the module and cell lists of the config. */
  public Selection buildSelection() {
    if (cfg.modules.isEmpty() && cfg.cells.isEmpty())
      return Selection.wholeDesign();
    if (cfg.cells.isEmpty())
      return Selection.ofModules(cfg.modules);
    if (cfg.modules.size() != 1) {
      logger.error("Cell selection needs exactly one module, got {}", cfg.modules);
      throw new IllegalArgumentException("cell selection needs exactly one module");
    }
    return Selection.ofModules(cfg.modules).withCells(cfg.modules.get(0), cfg.cells);
  }

  /**
   * Runs the pass on an in-memory design.
   * @param design the design to modify
   * @return the pass statistics
   */
  public EquivStructStats run(Design design) {
    Selection selection = buildSelection();
    for (String moduleName : cfg.modules)
      if (design.module(moduleName) == null)
        logger.warn("Selected module {} does not exist", moduleName);
    EquivStructStats stats = new EquivStructPass(cfg).execute(design, selection);
    logger.info("EQUIV_STRUCT: {}", stats);
    return stats;
  }

  /**
   * Reads {@link EquivStructConfig#input_file}, runs the pass and writes {@link EquivStructConfig#output_file} if set.
   * @return the pass statistics
   */
  public EquivStructStats run() throws IOException, NetlistFormatException {
    Design design = new NetlistReader().read(new File(cfg.input_file));
    EquivStructStats stats = run(design);
    if (!cfg.output_file.isEmpty())
      new NetlistWriter().write(design, Path.of(cfg.output_file));
    return stats;
  }
}
