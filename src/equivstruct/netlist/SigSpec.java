package equivstruct.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable ordered list of {@link SigBit}s, index 0 being the LSB.
 */
public final class SigSpec implements Iterable<SigBit> {
  public static final SigSpec EMPTY = new SigSpec(List.of());

  private final List<SigBit> bits;

  private SigSpec(List<SigBit> bits) { this.bits = bits; }

  public static SigSpec of(List<SigBit> bits) { return new SigSpec(List.copyOf(bits)); }

  public static SigSpec of(SigBit... bits) { return new SigSpec(List.of(bits)); }

  public static SigSpec of(Wire wire) {
    List<SigBit> bits = new ArrayList<>(wire.getWidth());
    for (int i = 0; i < wire.getWidth(); ++i)
      bits.add(SigBit.of(wire, i));
    return new SigSpec(Collections.unmodifiableList(bits));
  }

  /** Creates a constant from the low width bits of value. */
  public static SigSpec of(long value, int width) {
    List<SigBit> bits = new ArrayList<>(width);
    for (int i = 0; i < width; ++i)
      bits.add(SigBit.of((i < 64 && ((value >>> i) & 1) != 0) ? State.S1 : State.S0));
    return new SigSpec(Collections.unmodifiableList(bits));
  }

  public int size() { return bits.size(); }
  public boolean isEmpty() { return bits.isEmpty(); }
  public SigBit get(int index) { return bits.get(index); }
  public List<SigBit> bits() { return bits; }

  /**
   * Returns the only bit of a one-bit signal.
   * @throws IllegalArgumentException if the width is not 1
   */
  public SigBit asBit() {
    if (bits.size() != 1)
      throw new IllegalArgumentException("expected a single bit, got " + this);
    return bits.get(0);
  }

  public boolean isFullyConst() { return bits.stream().allMatch(SigBit::isConst); }

  /** Returns this signal with other appended above the MSB. */
  public SigSpec append(SigSpec other) {
    List<SigBit> joined = new ArrayList<>(bits.size() + other.size());
    joined.addAll(bits);
    joined.addAll(other.bits);
    return new SigSpec(Collections.unmodifiableList(joined));
  }

  public SigSpec extract(int offset, int length) { return new SigSpec(List.copyOf(bits.subList(offset, offset + length))); }

  /** Returns a new signal with every bit replaced through mapper. */
  public SigSpec map(UnaryOperator<SigBit> mapper) {
    List<SigBit> mapped = new ArrayList<>(bits.size());
    for (SigBit bit : bits)
      mapped.add(mapper.apply(bit));
    return new SigSpec(Collections.unmodifiableList(mapped));
  }

  @Override
  public Iterator<SigBit> iterator() {
    return bits.iterator();
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return bits.equals(((SigSpec)obj).bits);
  }

  /** Verilog-style rendering, MSB first. */
  @Override
  public String toString() {
    if (bits.size() == 1)
      return bits.get(0).toString();
    List<String> chunks = new ArrayList<>();
    int i = bits.size() - 1;
    while (i >= 0) {
      SigBit bit = bits.get(i);
      if (bit.isConst()) {
        StringBuilder sb = new StringBuilder();
        int j = i;
        while (j >= 0 && bits.get(j).isConst())
          sb.append(bits.get(j--).getData().getSymbol());
        chunks.add(sb.length() + "'b" + sb);
        i = j;
        continue;
      }
      int j = i;
      while (j > 0 && bits.get(j - 1).getWire() == bit.getWire() && bits.get(j - 1).getOffset() == bits.get(j).getOffset() - 1)
        --j;
      Wire wire = bit.getWire();
      if (j != i || bit.getOffset() != 0 || wire.getWidth() != 1) {
        int lo = bits.get(j).getOffset();
        if (lo == 0 && bit.getOffset() == wire.getWidth() - 1)
          chunks.add(wire.getName());
        else if (lo == bit.getOffset())
          chunks.add(String.format("%s[%d]", wire.getName(), lo));
        else
          chunks.add(String.format("%s[%d:%d]", wire.getName(), bit.getOffset(), lo));
      } else {
        chunks.add(wire.getName());
      }
      i = j - 1;
    }
    return chunks.size() == 1 ? chunks.get(0) : "{ " + String.join(" ", chunks) + " }";
  }
}
