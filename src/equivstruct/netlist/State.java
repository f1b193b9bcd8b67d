package equivstruct.netlist;

import java.util.Optional;

/**
 * Value of a single constant bit.
 */
public enum State {
  S0('0'),
  S1('1'),
  Sx('x'),
  Sz('z');

  private final char symbol;

  State(char symbol) { this.symbol = symbol; }

  /** Returns the character used for this state in bit strings. */
  public char getSymbol() { return symbol; }

  /**
   * Parses a bit string character (case insensitive for x and z).
   * @param symbol one of 0, 1, x, z
   * @return the state wrapped in Optional, or an empty Optional for any other character
   */
  public static Optional<State> fromSymbol(char symbol) {
    switch (Character.toLowerCase(symbol)) {
    case '0':
      return Optional.of(S0);
    case '1':
      return Optional.of(S1);
    case 'x':
      return Optional.of(Sx);
    case 'z':
      return Optional.of(Sz);
    default:
      return Optional.empty();
    }
  }
}
