package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Const;
import equivstruct.netlist.SigMap;
import equivstruct.netlist.SigSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes the merge keys of a cell against the equivalence map of the current iteration.
 */
public class MergeKeyBuilder {
  /** Keys of one cell: one backward key per output bit and a single forward key over all input bits. */
  public record CellKeys(List<MergeKey> backward, MergeKey forward) {}

  private final SigMap equivBits;

  public MergeKeyBuilder(SigMap equivBits) { this.equivBits = equivBits; }

  public CellKeys build(Cell cell) {
    List<Map.Entry<String, Const>> parameters = new ArrayList<>();
    cell.parameters().forEach((paramName, value) -> parameters.add(Map.entry(paramName, value)));
    parameters.sort(Map.Entry.comparingByKey());

    List<Map.Entry<String, Integer>> portSizes = new ArrayList<>();
    cell.connections().forEach((port, sig) -> portSizes.add(Map.entry(port, sig.size())));
    portSizes.sort(Map.Entry.comparingByKey());

    List<Map.Entry<String, Const>> parameters_ = Collections.unmodifiableList(parameters);
    List<Map.Entry<String, Integer>> portSizes_ = Collections.unmodifiableList(portSizes);

    List<MergeKey> backward = new ArrayList<>();
    List<MergeKey.PortBit> fwdConnections = new ArrayList<>();
    for (Map.Entry<String, SigSpec> conn : cell.connections().entrySet()) {
      String port = conn.getKey();
      SigSpec sig = equivBits.apply(conn.getValue());

      if (cell.input(port))
        for (int i = 0; i < sig.size(); ++i)
          fwdConnections.add(new MergeKey.PortBit(port, i, sig.get(i)));

      if (cell.output(port))
        for (int i = 0; i < sig.size(); ++i)
          backward.add(new MergeKey(MergeKey.Direction.BACKWARD, cell.getType(), parameters_, portSizes_,
                                    List.of(new MergeKey.PortBit(port, i, sig.get(i)))));
    }

    Collections.sort(fwdConnections);
    MergeKey forward = new MergeKey(MergeKey.Direction.FORWARD, cell.getType(), parameters_, portSizes_, fwdConnections);
    return new CellKeys(backward, forward);
  }
}
