package equivstruct.util;

import equivstruct.netlist.Cell;
import equivstruct.netlist.Const;
import equivstruct.netlist.Design;
import equivstruct.netlist.Module;
import equivstruct.netlist.SigSpec;
import equivstruct.netlist.Wire;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link Design} from a YAML netlist file.
 *
 * <pre>
 * celltypes:
 *   MYLIB_AND: { inputs: [A, B], outputs: [Y] }
 * modules:
 *   top:
 *     ports:       { a: { direction: input, width: 4 } }
 *     wires:       { w: 4 }
 *     cells:
 *       u0: { type: ADD2, parameters: { WIDTH: 4 }, connections: { A: a, B: w, Y: "y[3:0]" },
 *             attributes: { equiv_merged: [u1] } }
 *     connections: [ [lhs, rhs] ]
 * </pre>
 */
public class NetlistReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern BITS_PATTERN = Pattern.compile("[01xzXZ]+");

  public Design read(File file) throws IOException, NetlistFormatException {
    try (InputStream readFile = new FileInputStream(file)) {
      return read(readFile);
    }
  }

  public Design read(InputStream input) throws NetlistFormatException {
    Object data;
    try {
      data = new Yaml(new LoaderOptions()).load(input);
    } catch (YAMLException e) {
      throw new NetlistFormatException("", "malformed YAML: " + e.getMessage(), e);
    }
    return build(data);
  }

  public Design read(String yamlText) throws NetlistFormatException {
    Object data;
    try {
      data = new Yaml(new LoaderOptions()).load(yamlText);
    } catch (YAMLException e) {
      throw new NetlistFormatException("", "malformed YAML: " + e.getMessage(), e);
    }
    return build(data);
  }

  private static Map<?, ?> asMap(Object value, String location) throws NetlistFormatException {
    if (value == null)
      return Map.of();
    if (!(value instanceof Map))
      throw new NetlistFormatException(location, "expected a mapping");
    return (Map<?, ?>)value;
  }

  private static List<?> asList(Object value, String location) throws NetlistFormatException {
    if (value == null)
      return List.of();
    if (!(value instanceof List))
      throw new NetlistFormatException(location, "expected a list");
    return (List<?>)value;
  }

  private static int asWidth(Object value, String location) throws NetlistFormatException {
    if (!(value instanceof Integer) || (Integer)value < 1)
      throw new NetlistFormatException(location, "expected a positive width, got " + value);
    return (Integer)value;
  }

  private static List<String> asStrings(Object value, String location) throws NetlistFormatException {
    List<String> ret = new ArrayList<>();
    for (Object entry : asList(value, location))
      ret.add(String.valueOf(entry));
    return ret;
  }

  private Design build(Object data) throws NetlistFormatException {
    Map<?, ?> root = asMap(data, "");
    Design design = new Design();

    for (Map.Entry<?, ?> typeEntry : asMap(root.get("celltypes"), "celltypes").entrySet()) {
      String location = "celltypes." + typeEntry.getKey();
      Map<?, ?> typeDesc = asMap(typeEntry.getValue(), location);
      try {
        design.getCellTypes().setup(typeEntry.getKey().toString(), asStrings(typeDesc.get("inputs"), location + ".inputs"),
                                    asStrings(typeDesc.get("outputs"), location + ".outputs"));
      } catch (IllegalArgumentException e) {
        throw new NetlistFormatException(location, e.getMessage(), e);
      }
    }

    Map<?, ?> modules = asMap(root.get("modules"), "modules");
    // Ports and wires of all modules first, so that hierarchical cell types are known when cells are read.
    for (Map.Entry<?, ?> moduleEntry : modules.entrySet()) {
      String location = "modules." + moduleEntry.getKey();
      Module module;
      try {
        module = design.addModule(moduleEntry.getKey().toString());
      } catch (IllegalArgumentException e) {
        throw new NetlistFormatException(location, e.getMessage(), e);
      }
      Map<?, ?> moduleDesc = asMap(moduleEntry.getValue(), location);
      for (Map.Entry<?, ?> portEntry : asMap(moduleDesc.get("ports"), location + ".ports").entrySet()) {
        String portLocation = location + ".ports." + portEntry.getKey();
        Map<?, ?> portDesc = asMap(portEntry.getValue(), portLocation);
        Wire.PortDirection direction;
        try {
          direction = Wire.PortDirection.valueOf(String.valueOf(portDesc.get("direction")).toUpperCase());
        } catch (IllegalArgumentException e) {
          throw new NetlistFormatException(portLocation, "unknown port direction " + portDesc.get("direction"), e);
        }
        if (direction == Wire.PortDirection.NONE)
          throw new NetlistFormatException(portLocation, "ports need a direction");
        Object width = portDesc.containsKey("width") ? portDesc.get("width") : Integer.valueOf(1);
        addWire(module, portEntry.getKey().toString(), asWidth(width, portLocation + ".width"), direction, portLocation);
      }
      for (Map.Entry<?, ?> wireEntry : asMap(moduleDesc.get("wires"), location + ".wires").entrySet()) {
        String wireLocation = location + ".wires." + wireEntry.getKey();
        addWire(module, wireEntry.getKey().toString(), asWidth(wireEntry.getValue(), wireLocation), Wire.PortDirection.NONE, wireLocation);
      }
    }

    for (Map.Entry<?, ?> moduleEntry : modules.entrySet()) {
      String location = "modules." + moduleEntry.getKey();
      Module module = design.module(moduleEntry.getKey().toString());
      Map<?, ?> moduleDesc = asMap(moduleEntry.getValue(), location);
      for (Map.Entry<?, ?> cellEntry : asMap(moduleDesc.get("cells"), location + ".cells").entrySet())
        readCell(module, cellEntry.getKey().toString(), asMap(cellEntry.getValue(), location + ".cells." + cellEntry.getKey()),
                 location + ".cells." + cellEntry.getKey());

      List<?> connections = asList(moduleDesc.get("connections"), location + ".connections");
      for (int i = 0; i < connections.size(); ++i) {
        String connLocation = location + ".connections[" + i + "]";
        List<?> pair = asList(connections.get(i), connLocation);
        if (pair.size() != 2)
          throw new NetlistFormatException(connLocation, "a connection is a [lhs, rhs] pair");
        SigSpec lhs = SigSpecSyntax.parse(pair.get(0), module, connLocation);
        SigSpec rhs = SigSpecSyntax.parse(pair.get(1), module, connLocation);
        try {
          module.connect(lhs, rhs);
        } catch (IllegalArgumentException e) {
          throw new NetlistFormatException(connLocation, e.getMessage(), e);
        }
      }
      logger.debug("Read module {} with {} wires and {} cells", module.getName(), module.wires().size(), module.cellCount());
    }
    return design;
  }

  private static void addWire(Module module, String name, int width, Wire.PortDirection direction, String location)
      throws NetlistFormatException {
    try {
      module.addWire(name, width, direction);
    } catch (IllegalArgumentException e) {
      throw new NetlistFormatException(location, e.getMessage(), e);
    }
  }

  private void readCell(Module module, String cellName, Map<?, ?> cellDesc, String location) throws NetlistFormatException {
    Object type = cellDesc.get("type");
    if (type == null)
      throw new NetlistFormatException(location, "cell without type");
    Cell cell;
    try {
      cell = module.addCell(cellName, type.toString());
    } catch (IllegalArgumentException e) {
      throw new NetlistFormatException(location, e.getMessage(), e);
    }
    if (!module.getDesign().isKnownType(cell.getType()))
      logger.warn("Cell {} has unknown type {}; its ports are treated as neither inputs nor outputs", cellName, cell.getType());

    for (Map.Entry<?, ?> paramEntry : asMap(cellDesc.get("parameters"), location + ".parameters").entrySet())
      cell.setParam(paramEntry.getKey().toString(), parseConst(paramEntry.getValue(), location + ".parameters." + paramEntry.getKey()));

    for (Map.Entry<?, ?> connEntry : asMap(cellDesc.get("connections"), location + ".connections").entrySet()) {
      String connLocation = location + ".connections." + connEntry.getKey();
      cell.setPort(connEntry.getKey().toString(), SigSpecSyntax.parse(connEntry.getValue(), module, connLocation));
    }

    for (Map.Entry<?, ?> attrEntry : asMap(cellDesc.get("attributes"), location + ".attributes").entrySet())
      cell.addStrPoolAttribute(attrEntry.getKey().toString(), asStrings(attrEntry.getValue(), location + ".attributes." + attrEntry.getKey()));
  }

  /** Integers become 32 bit constants, 0/1/x/z strings bit vectors, anything else a string constant. */
  static Const parseConst(Object value, String location) throws NetlistFormatException {
    if (value instanceof Integer || value instanceof Long)
      return Const.fromInt(((Number)value).longValue());
    if (value instanceof String) {
      String str = (String)value;
      if (BITS_PATTERN.matcher(str).matches())
        return Const.fromBits(str);
      return Const.fromString(str);
    }
    if (value instanceof Boolean)
      return Const.fromInt((Boolean)value ? 1 : 0, 1);
    throw new NetlistFormatException(location, "unsupported parameter value " + value);
  }
}
