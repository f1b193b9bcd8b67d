package equivstruct.ui;

import java.util.ArrayList;
import java.util.List;

/**
 * Data-Class to hold tool options.
 */
public class EquivStructConfig {

  /** Restrict to forward sweeps. Accepted and reported, but does not disable the backward phase (see backward_phase). */
  public boolean mode_fwd = false;
  /** Also consider primitive (non-hierarchical) cells. */
  public boolean mode_icells = false;
  /** Run the backward phase when the forward phase found nothing to merge. */
  public boolean backward_phase = true;
  /** Name suffix of preferred survivors, e.g. "_gold"; empty to keep the first cell of each group. */
  public String gold_suffix = "";

  // selection scope, empty for the whole design
  public List<String> modules = new ArrayList<>();
  public List<String> cells = new ArrayList<>();

  public String input_file = "";
  public String output_file = "";
}
