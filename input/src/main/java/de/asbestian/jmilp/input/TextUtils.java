package de.asbestian.jmilp.input;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * Line level helpers shared by all parsers.
 *
 * @author Sebastian Schenker
 */
public final class TextUtils {

  private static final String WHITESPACE = " \t\r\n";

  private TextUtils() {}

  /** Removes leading and trailing spaces, tabs, carriage returns and line feeds. */
  public static String trim(final String s) {
    int begin = 0;
    int end = s.length();
    while (begin < end && WHITESPACE.indexOf(s.charAt(begin)) != -1) {
      ++begin;
    }
    while (end > begin && WHITESPACE.indexOf(s.charAt(end - 1)) != -1) {
      --end;
    }
    return s.substring(begin, end);
  }

  /**
   * Splits at every occurrence of the delimiter and trims the pieces. Empty pieces are kept, so
   * {@code "a,,b,"} yields four pieces.
   */
  public static ImmutableList<String> split(final String s, final char delimiter) {
    final MutableList<String> pieces = Lists.mutable.empty();
    int begin = 0;
    int index = s.indexOf(delimiter);
    while (index != -1) {
      pieces.add(trim(s.substring(begin, index)));
      begin = index + 1;
      index = s.indexOf(delimiter, begin);
    }
    pieces.add(trim(s.substring(begin)));
    return pieces.toImmutable();
  }

  public static boolean isBlank(final String s) {
    return trim(s).isEmpty();
  }

  /**
   * Parses a decimal literal such as {@code 10}, {@code -2.5}, {@code .5} or {@code 1e-3}.
   * Surrounding whitespace is ignored.
   *
   * @throws InputException of kind {@code INVALID_NUMBER} if the text is not such a literal
   */
  public static double parseNumber(final String text, final int line) {
    final String literal = trim(text);
    if (!isDecimalLiteral(literal)) {
      throw InputException.invalidNumber(line, literal.isEmpty() ? "''" : literal);
    }
    return Double.parseDouble(literal);
  }

  static boolean isDecimalLiteral(final String s) {
    int i = 0;
    final int n = s.length();
    if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
      ++i;
    }
    int digits = 0;
    while (i < n && isDigit(s.charAt(i))) {
      ++i;
      ++digits;
    }
    if (i < n && s.charAt(i) == '.') {
      ++i;
      while (i < n && isDigit(s.charAt(i))) {
        ++i;
        ++digits;
      }
    }
    if (digits == 0) {
      return false;
    }
    if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      ++i;
      if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
        ++i;
      }
      final int exponentStart = i;
      while (i < n && isDigit(s.charAt(i))) {
        ++i;
      }
      if (i == exponentStart) {
        return false;
      }
    }
    return i == n;
  }

  static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentifierStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  /** Tells whether the whole string is an identifier {@code [A-Za-z_][A-Za-z0-9_]*}. */
  static boolean isIdentifier(final String s) {
    if (s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); ++i) {
      if (!isIdentifierPart(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
