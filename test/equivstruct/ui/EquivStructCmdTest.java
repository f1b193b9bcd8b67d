package equivstruct.ui;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EquivStructCmdTest {

  static CommandLine parse(String... args) throws ParseException {
    return new DefaultParser().parse(EquivStructCmd.buildOptions(), args);
  }

  @Test
  void testDefaults() throws ParseException {
    EquivStructConfig cfg = EquivStructCmd.toConfig(parse("-i", "in.yaml"));
    Assertions.assertEquals("in.yaml", cfg.input_file);
    Assertions.assertEquals("", cfg.output_file);
    Assertions.assertFalse(cfg.mode_fwd);
    Assertions.assertFalse(cfg.mode_icells);
    Assertions.assertTrue(cfg.backward_phase);
    Assertions.assertEquals("", cfg.gold_suffix);
    Assertions.assertTrue(cfg.modules.isEmpty());
    Assertions.assertTrue(cfg.cells.isEmpty());
  }

  @Test
  void testAllOptions() throws ParseException {
    CommandLine line = parse("-i", "in.yaml", "-o", "out.yaml", "-m", "top", "-c", "u1", "-c", "u2", "-fwd", "-nobwd", "-icells", "-g", "_ref");
    EquivStructConfig cfg = EquivStructCmd.toConfig(line);
    Assertions.assertEquals("out.yaml", cfg.output_file);
    Assertions.assertEquals(List.of("top"), cfg.modules);
    Assertions.assertEquals(List.of("u1", "u2"), cfg.cells);
    Assertions.assertTrue(cfg.mode_fwd);
    Assertions.assertTrue(cfg.mode_icells);
    Assertions.assertFalse(cfg.backward_phase);
    Assertions.assertEquals("_ref", cfg.gold_suffix);
  }

  @Test
  void testForwardFlagKeepsBackwardPhase() throws ParseException {
    EquivStructConfig cfg = EquivStructCmd.toConfig(parse("-i", "in.yaml", "-fwd"));
    Assertions.assertTrue(cfg.mode_fwd);
    Assertions.assertTrue(cfg.backward_phase);
  }

  @Test
  void testInvalidCombinations() {
    Assertions.assertThrows(ParseException.class, () -> EquivStructCmd.toConfig(parse("-o", "out.yaml")));
    Assertions.assertThrows(ParseException.class, () -> EquivStructCmd.toConfig(parse("-i", "in.yaml", "-c", "u1")));
    Assertions.assertThrows(ParseException.class, () -> EquivStructCmd.toConfig(parse("-i", "in.yaml", "-m", "a", "-m", "b", "-c", "u1")));
    Assertions.assertThrows(ParseException.class, () -> parse("-i", "in.yaml", "-bogus"));
  }

  @Test
  void testLogLevel() throws ParseException {
    Assertions.assertEquals(Level.INFO, EquivStructCmd.toLogLevel(parse("-i", "x")));
    Assertions.assertEquals(Level.OFF, EquivStructCmd.toLogLevel(parse("-i", "x", "-q")));
    Assertions.assertEquals(Level.DEBUG, EquivStructCmd.toLogLevel(parse("-i", "x", "-v")));
    Assertions.assertEquals(Level.TRACE, EquivStructCmd.toLogLevel(parse("-i", "x", "-vv")));
  }

  @Test
  void testExitStatus(@TempDir Path dir) throws Exception {
    EquivStructConfig cfg = new EquivStructConfig();
    cfg.input_file = dir.resolve("missing.yaml").toString();
    Assertions.assertEquals(1, EquivStructCmd.run(cfg));

    Path broken = dir.resolve("broken.yaml");
    Files.writeString(broken, "modules: { top: { cells: { u: { connections: { A: a } } } } }");
    cfg.input_file = broken.toString();
    Assertions.assertEquals(1, EquivStructCmd.run(cfg));

    Path good = dir.resolve("good.yaml");
    Files.writeString(good, "modules: { top: { wires: { a: 1 } } }");
    cfg.input_file = good.toString();
    cfg.output_file = dir.resolve("out.yaml").toString();
    Assertions.assertEquals(0, EquivStructCmd.run(cfg));
    Assertions.assertTrue(Files.exists(dir.resolve("out.yaml")));
  }
}
