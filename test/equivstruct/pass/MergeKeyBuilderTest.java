package equivstruct.pass;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Const;
import equivstruct.netlist.Design;
import equivstruct.netlist.Module;
import equivstruct.netlist.Selection;
import equivstruct.netlist.SigMap;
import equivstruct.netlist.Wire;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MergeKeyBuilderTest {

  @Test
  void testKeysOfDuplicates() {
    Design design = TestNetlists.read(TestNetlists.DUPLICATE_ADD);
    Module top = design.module("top");
    MergeKeyBuilder builder = new MergeKeyBuilder(new SigMap(top));

    MergeKeyBuilder.CellKeys keysA = builder.build(top.cell("add_a"));
    MergeKeyBuilder.CellKeys keysB = builder.build(top.cell("add_b"));

    Assertions.assertEquals(keysA.forward(), keysB.forward());
    Assertions.assertEquals(keysA.forward().hashCode(), keysB.forward().hashCode());
    Assertions.assertEquals(MergeKey.Direction.FORWARD, keysA.forward().getDirection());
    // one backward key per output bit
    Assertions.assertEquals(4, keysA.backward().size());
    for (int i = 0; i < 4; ++i) {
      Assertions.assertEquals(MergeKey.Direction.BACKWARD, keysA.backward().get(i).getDirection());
      Assertions.assertNotEquals(keysA.backward().get(i), keysB.backward().get(i));
    }
    Assertions.assertEquals(8, keysA.forward().getConnections().size());
  }

  @Test
  void testForwardDigestIsSorted() {
    Design design = TestNetlists.read(TestNetlists.LOOKALIKES);
    MergeKey key = new MergeKeyBuilder(new SigMap(design.module("top"))).build(design.module("top").cell("add_swapped")).forward();
    for (int i = 1; i < key.getConnections().size(); ++i)
      Assertions.assertTrue(key.getConnections().get(i - 1).compareTo(key.getConnections().get(i)) < 0);
    Assertions.assertEquals("A", key.getConnections().get(0).port());
  }

  @Test
  void testParameterOrderDoesNotMatter() {
    Design design = new Design();
    Module top = design.addModule("top");
    Wire a = top.addWire("a", 2);
    Cell first = top.addCell("first", "$not");
    first.setParam("A_WIDTH", Const.fromInt(2));
    first.setParam("Y_WIDTH", Const.fromInt(2));
    first.setPort("A", a.asSigSpec());
    first.setPort("Y", top.addWire("y1", 2).asSigSpec());
    Cell second = top.addCell("second", "$not");
    second.setParam("Y_WIDTH", Const.fromInt(2));
    second.setParam("A_WIDTH", Const.fromInt(2));
    second.setPort("A", a.asSigSpec());
    second.setPort("Y", top.addWire("y2", 2).asSigSpec());

    MergeKeyBuilder builder = new MergeKeyBuilder(new SigMap(top));
    Assertions.assertEquals(builder.build(first).forward(), builder.build(second).forward());

    second.setParam("A_WIDTH", Const.fromInt(2, 8));
    Assertions.assertNotEquals(builder.build(first).forward(), builder.build(second).forward());
  }

  @Test
  void testDirectionSeparatesEqualDigests() {
    Design design = new Design();
    Module lib = design.addModule("IO1");
    lib.addWire("P", 1, Wire.PortDirection.INOUT);
    Module top = design.addModule("top");
    Cell pad = top.addCell("pad", "IO1");
    pad.setPort("P", top.addWire("p", 1).asSigSpec());

    MergeKeyBuilder.CellKeys keys = new MergeKeyBuilder(new SigMap(top)).build(pad);
    Assertions.assertEquals(1, keys.backward().size());
    // same type, parameters, widths and connection list; only the tag differs
    Assertions.assertEquals(keys.forward().getConnections(), keys.backward().get(0).getConnections());
    Assertions.assertNotEquals(keys.forward(), keys.backward().get(0));
  }

  @Test
  void testEquivalenceMapCanonicalizesInputs() {
    Design design = TestNetlists.read(TestNetlists.PARTIAL_MISMATCH);
    Module top = design.module("top");
    EquivMap equivMap = new EquivMapBuilder(top, Selection.wholeDesign(), false).build();
    MergeKeyBuilder builder = new MergeKeyBuilder(equivMap.getEquivBits());

    MergeKeyBuilder.CellKeys gate = builder.build(top.cell("cmp_gate"));
    MergeKeyBuilder.CellKeys gold = builder.build(top.cell("cmp_gold"));
    // y_gate is asserted equal to y_gold
    Assertions.assertEquals(gold.backward().get(0), gate.backward().get(0));
    Assertions.assertNotEquals(gold.forward(), gate.forward());
  }
}
