package equivstruct.pass;

import equivstruct.netlist.Cell;
import java.util.List;
import java.util.function.Predicate;

/**
 * Chooses the surviving cell of a merge group.
 */
@FunctionalInterface
public interface RepresentativePolicy {
  /**
   * Selects the representative.
   * @param members the live members of the group in first-seen order, at least two
   * @return one of members
   */
  Cell select(List<Cell> members);

  /** Keeps the first member. */
  static RepresentativePolicy firstSeen() { return members -> members.get(0); }

  /**
   * Keeps the last member matching tagged, or the first member if none does.
   * @param tagged predicate marking preferred survivors
   */
  static RepresentativePolicy preferTagged(Predicate<Cell> tagged) {
    return members -> {
      Cell chosen = null;
      for (Cell member : members)
        if (chosen == null || tagged.test(member))
          chosen = member;
      return chosen;
    };
  }

  /**
   * Prefers cells whose name ends with suffix (e.g. "_gold" for the reference design).
   * An empty suffix selects {@link #firstSeen()}.
   */
  static RepresentativePolicy preferNameSuffix(String suffix) {
    if (suffix == null || suffix.isEmpty())
      return firstSeen();
    return preferTagged(cell -> cell.getName().endsWith(suffix));
  }
}
