package de.asbestian.jmilp.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses single tokens such as {@code 3.5x}, {@code -y} or {@code +x1} into a {@link Term}.
 *
 * @author Sebastian Schenker
 */
final class TermParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TermParser.class);

  private TermParser() {}

  /**
   * Expects a token without whitespace of the shape {@code [+-]? digits* (. digits*)? identifier}.
   * A missing coefficient counts as 1, a bare sign as +1 or -1.
   */
  static Term parse(final String token, final int line) {
    final int splitIndex = getCoefficientEnd(token);
    if (splitIndex == -1 || !TextUtils.isIdentifier(token.substring(splitIndex))) {
      throw InputException.invalidTermFormat(line, token);
    }
    final String coeffStr = token.substring(0, splitIndex);
    final String name = token.substring(splitIndex);
    final double coeff = switch (coeffStr) {
      case "", "+" -> 1.;
      case "-" -> -1.;
      default -> {
        if (coeffStr.chars().noneMatch(c -> TextUtils.isDigit((char) c))) { // "." or "+."
          throw InputException.invalidTermFormat(line, token);
        }
        yield Double.parseDouble(coeffStr);
      }
    };
    LOGGER.trace("Found {} {}", coeff, name);
    return new Term(coeff, name);
  }

  // index of the first identifier character, -1 if the coefficient part is malformed
  private static int getCoefficientEnd(final String token) {
    int i = 0;
    if (i < token.length() && (token.charAt(i) == '+' || token.charAt(i) == '-')) {
      ++i;
    }
    boolean seenDot = false;
    while (i < token.length()) {
      final char c = token.charAt(i);
      if (c == '.') {
        if (seenDot) {
          return -1;
        }
        seenDot = true;
      } else if (!TextUtils.isDigit(c)) {
        break;
      }
      ++i;
    }
    return i;
  }
}
