package equivstruct.util;

import equivstruct.netlist.Module;
import equivstruct.netlist.SigBit;
import equivstruct.netlist.SigSpec;
import equivstruct.netlist.State;
import equivstruct.netlist.Wire;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual signal syntax of netlist files. A signal is a chunk or a list of chunks, MSB chunk first:
 * "w" (whole wire), "w[3]", "w[7:4]", "4'b10x1", "8'd17" or a single "0", "1", "x", "z".
 */
public class SigSpecSyntax {
  private static final Pattern CONST_PATTERN = Pattern.compile("(\\d+)'([bBdD])([0-9a-zA-Z_]+)");
  private static final Pattern SLICE_PATTERN = Pattern.compile("(.+)\\[(\\d+)(?::(\\d+))?\\]");

  /**
   * Parses a signal against the wires of a module.
   * @param value a String chunk or a List of chunks
   * @param module the module holding the referenced wires
   * @param location location for error messages
   */
  public static SigSpec parse(Object value, Module module, String location) throws NetlistFormatException {
    if (value instanceof String)
      return parseChunk((String)value, module, location);
    if (value instanceof List) {
      SigSpec ret = SigSpec.EMPTY;
      for (Object chunk : (List<?>)value) {
        if (!(chunk instanceof String))
          throw new NetlistFormatException(location, "signal chunks must be strings, got " + chunk);
        // MSB chunk first: every further chunk goes below what was parsed so far
        ret = parseChunk((String)chunk, module, location).append(ret);
      }
      if (ret.isEmpty())
        throw new NetlistFormatException(location, "empty signal");
      return ret;
    }
    if (value instanceof Integer && ((Integer)value == 0 || (Integer)value == 1))
      return SigSpec.of(SigBit.of((Integer)value == 0 ? State.S0 : State.S1));
    throw new NetlistFormatException(location, "cannot parse signal " + value);
  }

  private static SigSpec parseChunk(String chunk, Module module, String location) throws NetlistFormatException {
    chunk = chunk.trim();
    Wire wire = module.wire(chunk);
    if (wire != null)
      return wire.asSigSpec();

    if (chunk.length() == 1) {
      var state = State.fromSymbol(chunk.charAt(0));
      if (state.isPresent())
        return SigSpec.of(SigBit.of(state.get()));
    }

    Matcher constMatcher = CONST_PATTERN.matcher(chunk);
    if (constMatcher.matches())
      return parseConst(Integer.parseInt(constMatcher.group(1)), constMatcher.group(2), constMatcher.group(3).replace("_", ""), location);

    Matcher sliceMatcher = SLICE_PATTERN.matcher(chunk);
    if (sliceMatcher.matches()) {
      wire = module.wire(sliceMatcher.group(1));
      if (wire == null)
        throw new NetlistFormatException(location, "unknown wire " + sliceMatcher.group(1));
      int hi = Integer.parseInt(sliceMatcher.group(2));
      int lo = sliceMatcher.group(3) == null ? hi : Integer.parseInt(sliceMatcher.group(3));
      if (lo > hi || hi >= wire.getWidth())
        throw new NetlistFormatException(location, String.format("slice [%d:%d] out of range for %d bit wire %s", hi, lo, wire.getWidth(),
                                                                 wire.getName()));
      return wire.asSigSpec().extract(lo, hi - lo + 1);
    }
    throw new NetlistFormatException(location, "unknown wire " + chunk);
  }

  private static SigSpec parseConst(int width, String base, String digits, String location) throws NetlistFormatException {
    List<SigBit> bits = new ArrayList<>(width);
    if (base.equalsIgnoreCase("d")) {
      BigInteger value;
      try {
        value = new BigInteger(digits);
      } catch (NumberFormatException e) {
        throw new NetlistFormatException(location, "bad decimal constant " + digits, e);
      }
      for (int i = 0; i < width; ++i)
        bits.add(SigBit.of(value.testBit(i) ? State.S1 : State.S0));
      return SigSpec.of(bits);
    }
    if (digits.length() > width)
      throw new NetlistFormatException(location, "constant " + digits + " wider than " + width + " bits");
    for (int i = 0; i < width; ++i) {
      // zero-extend missing MSBs
      char c = i < digits.length() ? digits.charAt(digits.length() - 1 - i) : '0';
      var state = State.fromSymbol(c);
      if (state.isEmpty())
        throw new NetlistFormatException(location, "illegal bit character '" + c + "'");
      bits.add(SigBit.of(state.get()));
    }
    return SigSpec.of(bits);
  }

  /**
   * Formats a signal as a single chunk string or as a list of chunk strings, MSB chunk first.
   */
  public static Object format(SigSpec sig) {
    List<String> chunks = new ArrayList<>();
    int i = sig.size() - 1;
    while (i >= 0) {
      SigBit bit = sig.get(i);
      int j = i;
      if (bit.isConst()) {
        StringBuilder sb = new StringBuilder();
        while (j >= 0 && sig.get(j).isConst())
          sb.append(sig.get(j--).getData().getSymbol());
        chunks.add(sb.length() + "'b" + sb);
        i = j;
        continue;
      }
      while (j > 0 && sig.get(j - 1).getWire() == bit.getWire() && sig.get(j - 1).getOffset() == sig.get(j).getOffset() - 1)
        --j;
      Wire wire = bit.getWire();
      int lo = sig.get(j).getOffset();
      int hi = bit.getOffset();
      if (lo == 0 && hi == wire.getWidth() - 1)
        chunks.add(wire.getName());
      else if (lo == hi)
        chunks.add(String.format("%s[%d]", wire.getName(), lo));
      else
        chunks.add(String.format("%s[%d:%d]", wire.getName(), hi, lo));
      i = j - 1;
    }
    if (chunks.size() == 1)
      return chunks.get(0);
    return chunks;
  }
}
