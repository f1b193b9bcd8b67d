package equivstruct.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters collected over one or more runs of the pass.
 */
public class EquivStructStats {
  /** One merged pair. */
  public record MergeEvent(String module, MergeKey.Direction direction, String type, String survivor, String removed) {}

  int iterations = 0;
  int purged = 0;
  int fwdMerges = 0;
  int bwdMerges = 0;
  int newEquivCells = 0;
  private final List<MergeEvent> events = new ArrayList<>();

  /** Number of worker iterations, including the final one that found nothing to do. */
  public int getIterations() { return iterations; }
  public int getPurged() { return purged; }
  public int getFwdMerges() { return fwdMerges; }
  public int getBwdMerges() { return bwdMerges; }
  public int getNewEquivCells() { return newEquivCells; }
  /** Total number of graph mutations (purged cells and merged pairs). */
  public int getMutations() { return purged + fwdMerges + bwdMerges; }
  public List<MergeEvent> getEvents() { return Collections.unmodifiableList(events); }

  void addEvent(MergeEvent event) {
    events.add(event);
    if (event.direction() == MergeKey.Direction.FORWARD)
      ++fwdMerges;
    else
      ++bwdMerges;
  }

  /** Adds the counters and events of other to this. */
  public void add(EquivStructStats other) {
    iterations += other.iterations;
    purged += other.purged;
    fwdMerges += other.fwdMerges;
    bwdMerges += other.bwdMerges;
    newEquivCells += other.newEquivCells;
    events.addAll(other.events);
  }

  @Override
  public String toString() {
    return String.format("%d iteration(s), %d purged $equiv cell(s), %d forward and %d backward merge(s), %d new $equiv cell(s)",
                         iterations, purged, fwdMerges, bwdMerges, newEquivCells);
  }
}
