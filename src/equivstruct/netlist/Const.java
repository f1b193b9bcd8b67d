package equivstruct.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Constant cell parameter value. Either a bit vector or a plain string.
 */
public final class Const implements Comparable<Const> {
  private final List<State> bits; // LSB first, null for strings
  private final String str;       // null for bit vectors

  private Const(List<State> bits, String str) {
    this.bits = bits;
    this.str = str;
  }

  /** Integer constant of the given width (two's complement, truncated). */
  public static Const fromInt(long value, int width) {
    List<State> bits = new ArrayList<>(width);
    for (int i = 0; i < width; ++i)
      bits.add((i < 64 ? ((value >>> i) & 1) != 0 : value < 0) ? State.S1 : State.S0);
    return new Const(Collections.unmodifiableList(bits), null);
  }

  /** Integer constant with the 32 bit default width used for untyped parameters. */
  public static Const fromInt(long value) { return fromInt(value, 32); }

  /**
   * Parses an MSB-first string over 0, 1, x, z.
   * @throws IllegalArgumentException on any other character
   */
  public static Const fromBits(String msbFirst) {
    List<State> bits = new ArrayList<>(msbFirst.length());
    for (int i = msbFirst.length() - 1; i >= 0; --i) {
      char c = msbFirst.charAt(i);
      bits.add(State.fromSymbol(c).orElseThrow(() -> new IllegalArgumentException("illegal bit character '" + c + "' in " + msbFirst)));
    }
    return new Const(Collections.unmodifiableList(bits), null);
  }

  public static Const fromString(String str) { return new Const(null, Objects.requireNonNull(str)); }

  public boolean isString() { return str != null; }
  public String getString() { return str; }
  public List<State> getBits() { return bits; }
  public int size() { return bits != null ? bits.size() : 8 * str.length(); }

  /** Returns the MSB-first bit string, or the raw string for string constants. */
  public String toBitString() {
    if (isString())
      return str;
    StringBuilder sb = new StringBuilder(bits.size());
    for (int i = bits.size() - 1; i >= 0; --i)
      sb.append(bits.get(i).getSymbol());
    return sb.toString();
  }

  /** Returns true iff the value is a bit vector of only 0 and 1. */
  public boolean isFullyDef() { return !isString() && bits.stream().allMatch(s -> s == State.S0 || s == State.S1); }

  /** Unsigned integer value of a fully defined bit vector, truncated to 64 bits. */
  public long asLong() {
    if (!isFullyDef())
      throw new IllegalStateException("constant " + this + " has no integer value");
    long ret = 0;
    for (int i = Math.min(bits.size(), 64) - 1; i >= 0; --i)
      ret = (ret << 1) | (bits.get(i) == State.S1 ? 1 : 0);
    return ret;
  }

  @Override
  public int compareTo(Const other) {
    if (isString() != other.isString())
      return isString() ? 1 : -1;
    if (isString())
      return str.compareTo(other.str);
    if (bits.size() != other.bits.size())
      return Integer.compare(bits.size(), other.bits.size());
    return toBitString().compareTo(other.toBitString());
  }

  @Override
  public int hashCode() {
    return Objects.hash(bits, str);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Const other = (Const)obj;
    return Objects.equals(bits, other.bits) && Objects.equals(str, other.str);
  }
  @Override
  public String toString() {
    if (isString())
      return "\"" + str + "\"";
    return bits.size() + "'b" + toBitString();
  }
}
