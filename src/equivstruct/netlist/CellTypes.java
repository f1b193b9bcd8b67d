package equivstruct.netlist;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Port direction table for primitive cell types. Hierarchical cell types (types naming a module of the
 * design) are resolved by {@link Design} from the module's port wires instead.
 */
public class CellTypes {
  /** Reserved type of equivalence-assertion cells. */
  public static final String EQUIV = "$equiv";
  public static final String EQUIV_A = "A";
  public static final String EQUIV_B = "B";
  public static final String EQUIV_Y = "Y";

  public record CellType(String type, Set<String> inputs, Set<String> outputs) {
    public CellType {
      inputs = Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
      outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
    }
  }

  private final HashMap<String, CellType> types = new HashMap<>();
  private final LinkedHashSet<String> customTypes = new LinkedHashSet<>();

  /** Creates a table holding the internal word-level and gate-level types. */
  public CellTypes() {
    define(EQUIV, List.of(EQUIV_A, EQUIV_B), List.of(EQUIV_Y));

    for (String type : List.of("$not", "$pos", "$neg", "$reduce_and", "$reduce_or", "$reduce_xor", "$reduce_xnor", "$reduce_bool",
                               "$logic_not"))
      define(type, List.of("A"), List.of("Y"));
    for (String type : List.of("$and", "$or", "$xor", "$xnor", "$shl", "$shr", "$sshl", "$sshr", "$lt", "$le", "$eq", "$ne", "$ge",
                               "$gt", "$add", "$sub", "$mul", "$div", "$mod", "$logic_and", "$logic_or"))
      define(type, List.of("A", "B"), List.of("Y"));
    define("$mux", List.of("A", "B", "S"), List.of("Y"));
    define("$pmux", List.of("A", "B", "S"), List.of("Y"));
    define("$dff", List.of("CLK", "D"), List.of("Q"));
    define("$adff", List.of("CLK", "ARST", "D"), List.of("Q"));

    define("$_BUF_", List.of("A"), List.of("Y"));
    define("$_NOT_", List.of("A"), List.of("Y"));
    for (String type : List.of("$_AND_", "$_NAND_", "$_OR_", "$_NOR_", "$_XOR_", "$_XNOR_", "$_ANDNOT_", "$_ORNOT_"))
      define(type, List.of("A", "B"), List.of("Y"));
    define("$_MUX_", List.of("A", "B", "S"), List.of("Y"));
    define("$_DFF_P_", List.of("C", "D"), List.of("Q"));
    define("$_DFF_N_", List.of("C", "D"), List.of("Q"));
  }

  /**
   * Registers (or replaces) a primitive cell type.
   * @param type the type name
   * @param inputs names of the input ports
   * @param outputs names of the output ports
   */
  public void setup(String type, Iterable<String> inputs, Iterable<String> outputs) {
    define(type, inputs, outputs);
    customTypes.add(type);
  }

  private void define(String type, Iterable<String> inputs, Iterable<String> outputs) {
    Set<String> in = new LinkedHashSet<>();
    inputs.forEach(in::add);
    Set<String> out = new LinkedHashSet<>();
    outputs.forEach(out::add);
    if (in.stream().anyMatch(out::contains))
      throw new IllegalArgumentException("cell type " + type + " declares a port as both input and output");
    types.put(type, new CellType(type, in, out));
  }

  /** Types registered through {@link #setup(String, Iterable, Iterable)}, in registration order. */
  public List<CellType> customTypes() { return customTypes.stream().map(types::get).collect(Collectors.toList()); }

  public Optional<CellType> get(String type) { return Optional.ofNullable(types.get(type)); }

  public boolean isKnown(String type) { return types.containsKey(type); }

  public boolean input(String type, String port) {
    CellType cellType = types.get(type);
    return cellType != null && cellType.inputs().contains(port);
  }

  public boolean output(String type, String port) {
    CellType cellType = types.get(type);
    return cellType != null && cellType.outputs().contains(port);
  }
}
