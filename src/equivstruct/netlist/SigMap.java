package equivstruct.netlist;

import java.util.HashMap;

/**
 * Union-find canonicalizer over {@link SigBit}s. Bits that are connected (directly or transitively) map
 * to one representative. Constants always win as representatives; otherwise the representative of the
 * second argument of {@link #add(SigBit, SigBit)} survives. Two different constants are never merged.
 */
public class SigMap {
  private final HashMap<SigBit, SigBit> parent = new HashMap<>();

  public SigMap() {}

  /** Creates a map seeded from all direct connections of a module. */
  public SigMap(Module module) {
    for (Module.Connection conn : module.connections())
      add(conn.lhs(), conn.rhs());
  }

  /** Creates an independent copy of another map. */
  public SigMap(SigMap other) { parent.putAll(other.parent); }

  private SigBit find(SigBit bit) {
    SigBit root = bit;
    SigBit next;
    while ((next = parent.get(root)) != null)
      root = next;
    // path compression
    while (!bit.equals(root)) {
      next = parent.get(bit);
      parent.put(bit, root);
      bit = next;
    }
    return root;
  }

  /**
   * Merges the classes of from and to.
   * @param from the bit whose class is merged
   * @param to the bit whose representative is kept (unless from's representative is a constant)
   */
  public void add(SigBit from, SigBit to) {
    SigBit rootFrom = find(from);
    SigBit rootTo = find(to);
    if (rootFrom.equals(rootTo))
      return;
    if (rootFrom.isConst() && rootTo.isConst())
      return;
    if (rootFrom.isConst() && !rootTo.isConst())
      parent.put(rootTo, rootFrom);
    else
      parent.put(rootFrom, rootTo);
  }

  /** Bitwise {@link #add(SigBit, SigBit)}; the widths must match. */
  public void add(SigSpec from, SigSpec to) {
    if (from.size() != to.size())
      throw new IllegalArgumentException("width mismatch: " + from + " vs. " + to);
    for (int i = 0; i < from.size(); ++i)
      add(from.get(i), to.get(i));
  }

  public SigBit apply(SigBit bit) { return find(bit); }

  public SigSpec apply(SigSpec sig) { return sig.map(this::find); }
}
