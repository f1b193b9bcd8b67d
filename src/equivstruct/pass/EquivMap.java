package equivstruct.pass;

import equivstruct.netlist.SigBit;
import equivstruct.netlist.SigMap;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Per-iteration snapshot of the equivalence relations of a module.
 * Built from scratch by {@link EquivMapBuilder} at the start of every iteration and never patched.
 */
public class EquivMap {
  private final SigMap sigmap;
  private final SigMap equivBits;
  private final Set<SigBit> assertedSignals;
  private final List<Integer> equivCells;
  private final List<Integer> candidates;

  EquivMap(SigMap sigmap, SigMap equivBits, Set<SigBit> assertedSignals, List<Integer> equivCells, List<Integer> candidates) {
    this.sigmap = sigmap;
    this.equivBits = equivBits;
    this.assertedSignals = Collections.unmodifiableSet(assertedSignals);
    this.equivCells = Collections.unmodifiableList(equivCells);
    this.candidates = Collections.unmodifiableList(candidates);
  }

  /** Wire-level alias map of the module. */
  public SigMap getSigMap() { return sigmap; }
  /** Alias map extended by B -> A of every selected equivalence-assertion cell. */
  public SigMap getEquivBits() { return equivBits; }
  /** Canonical A and B operands of every selected equivalence-assertion cell. */
  public Set<SigBit> getAssertedSignals() { return assertedSignals; }
  /** Ids of the selected equivalence-assertion cells, in module order. */
  public List<Integer> getEquivCells() { return equivCells; }
  /** Ids of the cells taking part in merging this iteration, in module order. */
  public List<Integer> getCandidates() { return candidates; }
}
