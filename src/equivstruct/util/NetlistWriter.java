package equivstruct.util;

import equivstruct.netlist.Cell;
import equivstruct.netlist.CellTypes;
import equivstruct.netlist.Const;
import equivstruct.netlist.Design;
import equivstruct.netlist.Module;
import equivstruct.netlist.Wire;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes a {@link Design} in the format read by {@link NetlistReader}.
 * Bit vector parameters are written as MSB-first bit strings.
 */
public class NetlistWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public void write(Design design, Path file) throws IOException {
    try (Writer out = new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8)) {
      write(design, out);
    }
    logger.info("Wrote netlist to {}", file);
  }

  public void write(Design design, Writer out) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    new Yaml(options).dump(toYamlTree(design), out);
  }

  public String writeToString(Design design) {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    return new Yaml(options).dump(toYamlTree(design));
  }

  Map<String, Object> toYamlTree(Design design) {
    Map<String, Object> modules = new LinkedHashMap<>();
    for (Module module : design.modules())
      modules.put(module.getName(), moduleTree(module));
    Map<String, Object> root = new LinkedHashMap<>();
    if (!design.getCellTypes().customTypes().isEmpty()) {
      Map<String, Object> cellTypes = new LinkedHashMap<>();
      for (CellTypes.CellType cellType : design.getCellTypes().customTypes()) {
        Map<String, Object> typeDesc = new LinkedHashMap<>();
        typeDesc.put("inputs", new ArrayList<>(cellType.inputs()));
        typeDesc.put("outputs", new ArrayList<>(cellType.outputs()));
        cellTypes.put(cellType.type(), typeDesc);
      }
      root.put("celltypes", cellTypes);
    }
    root.put("modules", modules);
    return root;
  }

  private static Map<String, Object> moduleTree(Module module) {
    Map<String, Object> ports = new LinkedHashMap<>();
    Map<String, Object> wires = new LinkedHashMap<>();
    for (Wire wire : module.wires()) {
      if (wire.isPort()) {
        Map<String, Object> portDesc = new LinkedHashMap<>();
        portDesc.put("direction", wire.getDirection().name().toLowerCase());
        portDesc.put("width", wire.getWidth());
        ports.put(wire.getName(), portDesc);
      } else {
        wires.put(wire.getName(), wire.getWidth());
      }
    }

    Map<String, Object> cells = new LinkedHashMap<>();
    for (Cell cell : module.cells()) {
      Map<String, Object> cellDesc = new LinkedHashMap<>();
      cellDesc.put("type", cell.getType());
      if (!cell.parameters().isEmpty()) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, Const> param : cell.parameters().entrySet())
          parameters.put(param.getKey(), param.getValue().toBitString());
        cellDesc.put("parameters", parameters);
      }
      Map<String, Object> connections = new LinkedHashMap<>();
      cell.connections().forEach((port, sig) -> connections.put(port, SigSpecSyntax.format(sig)));
      cellDesc.put("connections", connections);
      if (!cell.attributeNames().isEmpty()) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String attrName : cell.attributeNames())
          attributes.put(attrName, new ArrayList<>(cell.getStrPoolAttribute(attrName)));
        cellDesc.put("attributes", attributes);
      }
      cells.put(cell.getName(), cellDesc);
    }

    List<Object> connections = new ArrayList<>();
    for (Module.Connection conn : module.connections())
      connections.add(List.of(SigSpecSyntax.format(conn.lhs()), SigSpecSyntax.format(conn.rhs())));

    Map<String, Object> moduleDesc = new LinkedHashMap<>();
    moduleDesc.put("ports", ports);
    moduleDesc.put("wires", wires);
    moduleDesc.put("cells", cells);
    moduleDesc.put("connections", connections);
    return moduleDesc;
  }
}
