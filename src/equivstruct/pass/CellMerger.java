package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Module;
import equivstruct.netlist.SigBit;
import equivstruct.netlist.SigMap;
import equivstruct.netlist.SigSpec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Merges a target cell into a representative of the same structure.
 *
 * Input bits on which the two cells disagree are not resolved here: each such pair gets a new
 * equivalence-assertion cell, and the representative reads the assertion's trusted output instead.
 * The target's outputs are then driven by the representative's outputs and the target is removed.
 */
public class CellMerger {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** String-set attribute on survivors listing the names of the cells merged into them. */
  public static final String EQUIV_MERGED_ATTR = "equiv_merged";
  static final String ID_TAG = "equiv_struct";

  private final Module module;
  private final SigMap sigmap;

  /**
   * @param module the module both cells belong to
   * @param sigmap the wire-level alias map of the current iteration
   */
  public CellMerger(Module module, SigMap sigmap) {
    this.module = module;
    this.sigmap = sigmap;
  }

  private static void invariantViolation(String message) {
    logger.fatal(message);
    throw new IllegalStateException(message);
  }

  /**
   * Merges gate into gold.
   * @param gold the surviving cell
   * @param gate the cell to remove
   * @return the number of equivalence-assertion cells inserted for differing inputs
   * @throws IllegalStateException if the cells are not structurally compatible (a fingerprint defect)
   */
  public int merge(Cell gold, Cell gate) {
    if (!gold.getType().equals(gate.getType()) || !gold.connections().keySet().equals(gate.connections().keySet()))
      invariantViolation(String.format("Cannot merge %s into %s: port sets differ", gate, gold));

    List<SigBit> inputsA = new ArrayList<>();
    List<SigBit> inputsB = new ArrayList<>();
    List<String> inputPorts = new ArrayList<>();
    List<Integer> inputOffsets = new ArrayList<>();
    List<String> inputNames = new ArrayList<>();

    for (Map.Entry<String, SigSpec> portA : gold.connections().entrySet()) {
      String port = portA.getKey();
      SigSpec bitsA = sigmap.apply(portA.getValue());
      SigSpec bitsB = sigmap.apply(gate.getPort(port));

      if (bitsA.size() != bitsB.size())
        invariantViolation(String.format("Cannot merge %s into %s: port %s has width %d vs. %d", gate, gold, port, bitsA.size(),
                                         bitsB.size()));

      if (!gold.output(port))
        for (int i = 0; i < bitsA.size(); ++i)
          if (!bitsA.get(i).equals(bitsB.get(i))) {
            inputsA.add(bitsA.get(i));
            inputsB.add(bitsB.get(i));
            inputPorts.add(port);
            inputOffsets.add(i);
            inputNames.add(bitsA.size() == 1 ? port : String.format("%s[%d]", port, i));
          }
    }

    // port -> offset -> trusted bit, for the differing positions themselves
    HashMap<String, HashMap<Integer, SigBit>> trustedBits = new HashMap<>();
    // wire bit -> trusted bit, for other reads of the same signal; constants are not substituted
    HashMap<SigBit, SigBit> substitution = new HashMap<>();
    for (int i = 0; i < inputsA.size(); ++i) {
      SigBit bitA = inputsA.get(i);
      SigBit bitB = inputsB.get(i);
      SigBit bitY = module.freshBit(ID_TAG);
      logger.debug("      New $equiv for input {}: A: {}, B: {}, Y: {}", inputNames.get(i), bitA, bitB, bitY);
      module.addEquiv(module.newId(ID_TAG), bitA, bitB, bitY);
      trustedBits.computeIfAbsent(inputPorts.get(i), port_ -> new HashMap<>()).put(inputOffsets.get(i), bitY);
      if (!bitA.isConst())
        substitution.putIfAbsent(bitA, bitY);
      if (!bitB.isConst())
        substitution.putIfAbsent(bitB, bitY);
    }

    List<String> outportNames = new ArrayList<>();
    List<String> inportNames = new ArrayList<>();
    for (String port : gold.connections().keySet()) {
      if (gold.output(port))
        outportNames.add(port);
      else
        inportNames.add(port);
    }

    for (String port : inportNames) {
      SigSpec bits = sigmap.apply(gold.getPort(port));
      Map<Integer, SigBit> portTrusted = trustedBits.getOrDefault(port, new HashMap<>());
      List<SigBit> rewritten = new ArrayList<>(bits.size());
      for (int i = 0; i < bits.size(); ++i) {
        SigBit trusted = portTrusted.get(i);
        rewritten.add(trusted != null ? trusted : substitution.getOrDefault(bits.get(i), bits.get(i)));
      }
      gold.setPort(port, SigSpec.of(rewritten));
    }

    for (String port : outportNames)
      module.connect(gate.getPort(port), gold.getPort(port));

    Set<String> mergedAttr = gate.getStrPoolAttribute(EQUIV_MERGED_ATTR);
    mergedAttr.add(gate.getName());
    gold.addStrPoolAttribute(EQUIV_MERGED_ATTR, mergedAttr);
    module.remove(gate);
    return inputsA.size();
  }
}
