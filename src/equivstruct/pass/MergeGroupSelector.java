package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Module;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Groups cells by {@link MergeKey} and hands out representative/target groups for the keys that were seen more than once.
 * Members are stored as cell ids and resolved against the module only when a group is requested, so removals
 * by earlier merges simply drop out.
 */
public class MergeGroupSelector {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A resolved group: the representative and the cells to merge into it. */
  public record MergeGroup(MergeKey key, Cell representative, List<Cell> targets) {}

  private final HashMap<MergeKey, LinkedHashSet<Integer>> mergeCache = new HashMap<>();
  private final LinkedHashSet<MergeKey> fwdQueue = new LinkedHashSet<>();
  private final LinkedHashSet<MergeKey> bwdQueue = new LinkedHashSet<>();
  private final RepresentativePolicy policy;

  public MergeGroupSelector(RepresentativePolicy policy) { this.policy = policy; }

  /**
   * Registers a cell under all of its keys. A key that already had members is queued for its phase.
   * @param cellId the cell id
   * @param keys the keys of the cell, see {@link MergeKeyBuilder#build(Cell)}
   */
  public void add(int cellId, MergeKeyBuilder.CellKeys keys) {
    for (MergeKey key : keys.backward())
      insert(cellId, key, bwdQueue);
    insert(cellId, keys.forward(), fwdQueue);
  }

  private void insert(int cellId, MergeKey key, Set<MergeKey> queue) {
    LinkedHashSet<Integer> members = mergeCache.get(key);
    if (members == null) {
      members = new LinkedHashSet<>();
      mergeCache.put(key, members);
    } else {
      queue.add(key);
    }
    members.add(cellId);
  }

  /** Keys seen more than once for the given phase, in the order they were first matched. */
  public List<MergeKey> queue(MergeKey.Direction direction) {
    return new ArrayList<>(direction == MergeKey.Direction.FORWARD ? fwdQueue : bwdQueue);
  }

  /** Returns the ids registered under a key (read-only). */
  public Set<Integer> members(MergeKey key) {
    Set<Integer> members = mergeCache.get(key);
    return members == null ? Set.of() : Collections.unmodifiableSet(members);
  }

  /**
   * Resolves the members of a key against the live module and applies the representative policy.
   * Removed cells are dropped from the group.
   * @param key the key
   * @param module the module the ids belong to
   * @return the group, or an empty Optional if fewer than two members are alive
   */
  public Optional<MergeGroup> resolve(MergeKey key, Module module) {
    LinkedHashSet<Integer> members = mergeCache.get(key);
    if (members == null)
      return Optional.empty();
    members.removeIf(cellId -> module.cell(cellId) == null);
    if (members.size() < 2) {
      logger.trace("Skipping group of {} live cell(s) for {}", members.size(), key);
      return Optional.empty();
    }
    List<Cell> live = new ArrayList<>(members.size());
    for (int cellId : members)
      live.add(module.cell(cellId));
    Cell representative = policy.select(live);
    if (representative == null || !live.contains(representative))
      throw new IllegalStateException("representative policy returned a cell outside of the group");
    List<Cell> targets = new ArrayList<>(live.size() - 1);
    for (Cell cell : live)
      if (cell != representative)
        targets.add(cell);
    return Optional.of(new MergeGroup(key, representative, targets));
  }
}
