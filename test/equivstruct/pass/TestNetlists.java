package equivstruct.pass;

import equivstruct.netlist.Design;
import equivstruct.util.NetlistFormatException;
import equivstruct.util.NetlistReader;

/**
 * Small gold/gate netlists shared by the pass tests.
 */
public class TestNetlists {

  static final String ADD2_LIB = """
      ADD2:
        ports:
          A: { direction: input, width: 4 }
          B: { direction: input, width: 4 }
          Y: { direction: output, width: 4 }
      SUB2:
        ports:
          A: { direction: input, width: 4 }
          B: { direction: input, width: 4 }
          Y: { direction: output, width: 4 }
      CMP:
        ports:
          A: { direction: input, width: 4 }
          B: { direction: input, width: 4 }
          Y: { direction: output, width: 1 }
    """;

  /** Two ADD2 instances reading the same signals, driving different wires. */
  public static final String DUPLICATE_ADD = "modules:\n" + ADD2_LIB + """
      top:
        wires: { w1: 4, w2: 4, o1: 4, o2: 4 }
        cells:
          add_a: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: w1, B: w2, Y: o1 } }
          add_b: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: w1, B: w2, Y: o2 } }
    """;

  /**
   * Gold and gate comparators whose outputs are asserted equivalent, with B differing in bit 0.
   */
  public static final String PARTIAL_MISMATCH = "modules:\n" + ADD2_LIB + """
      top:
        wires: { w1: 4, w2: 4, v: 1, y_gold: 1, y_gate: 1, y_trusted: 1 }
        cells:
          cmp_gate: { type: CMP, connections: { A: w1, B: ["w2[3:1]", v], Y: y_gate } }
          cmp_gold: { type: CMP, connections: { A: w1, B: w2, Y: y_gold } }
          eq_out: { type: $equiv, connections: { A: y_gold, B: y_gate, Y: y_trusted } }
    """;

  /** A self-comparing assertion whose output is checked by another assertion, next to two duplicates. */
  public static final String REDUNDANT_EQUIV = "modules:\n" + ADD2_LIB + """
      top:
        wires: { a: 1, b: 1, y1: 1, y2: 1, w1: 4, o1: 4, o2: 4 }
        cells:
          eq_self: { type: $equiv, connections: { A: a, B: a, Y: y1 } }
          eq_next: { type: $equiv, connections: { A: y1, B: b, Y: y2 } }
          add_a: { type: ADD2, connections: { A: w1, B: w1, Y: o1 } }
          add_b: { type: ADD2, connections: { A: w1, B: w1, Y: o2 } }
    """;

  /** Identical primitive cells next to identical hierarchical cells. */
  public static final String PRIMITIVES = "modules:\n" + ADD2_LIB + """
      top:
        wires: { a: 4, b: 4, p1: 4, p2: 4, o1: 4, o2: 4 }
        cells:
          and_1: { type: $and, parameters: { A_WIDTH: 4, B_WIDTH: 4, Y_WIDTH: 4 }, connections: { A: a, B: b, Y: p1 } }
          and_2: { type: $and, parameters: { A_WIDTH: 4, B_WIDTH: 4, Y_WIDTH: 4 }, connections: { A: a, B: b, Y: p2 } }
          add_1: { type: ADD2, connections: { A: p1, B: b, Y: o1 } }
          add_2: { type: ADD2, connections: { A: p2, B: b, Y: o2 } }
    """;

  /** Same inputs, but types or parameters differ; plus operands swapped. */
  public static final String LOOKALIKES = "modules:\n" + ADD2_LIB + """
      top:
        wires: { a: 4, b: 4, o1: 4, o2: 4, o3: 4, o4: 4, o5: 4, o6: 4 }
        cells:
          add_w4: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: a, B: b, Y: o1 } }
          add_w5: { type: ADD2, parameters: { WIDTH: 5 }, connections: { A: a, B: b, Y: o2 } }
          sub_w4: { type: SUB2, parameters: { WIDTH: 4 }, connections: { A: a, B: b, Y: o3 } }
          add_swapped: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: b, B: a, Y: o4 } }
          sub_dup: { type: SUB2, parameters: { WIDTH: 4 }, connections: { A: a, B: b, Y: o5 } }
          add_dup: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: a, B: b, Y: o6 } }
    """;

  /**
   * Gold and gate chains of the given depth. Level i reads level i-1 and the shared input, so merging one level
   * makes the next one identical.
   */
  public static String chains(int depth) {
    StringBuilder wires = new StringBuilder("in: 4");
    StringBuilder cells = new StringBuilder();
    for (String side : new String[] {"gold", "gate"}) {
      for (int i = 0; i < depth; ++i) {
        wires.append(String.format(", o_%s%d: 4", side, i));
        String prev = (i == 0) ? "in" : String.format("o_%s%d", side, i - 1);
        cells.append(String.format("      add%d_%s: { type: ADD2, connections: { A: %s, B: in, Y: o_%s%d } }\n", i, side, prev, side, i));
      }
    }
    return "modules:\n" + ADD2_LIB + "  top:\n    wires: { " + wires + " }\n    cells:\n" + cells;
  }

  public static Design read(String yaml) {
    try {
      return new NetlistReader().read(yaml);
    } catch (NetlistFormatException e) {
      throw new IllegalArgumentException("bad test netlist", e);
    }
  }
}
