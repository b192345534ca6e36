package de.asbestian.jmilp.input;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns linear expressions like {@code 3x + 2y -z} or {@code 3x+2y-z} into an ordered list of
 * terms.
 *
 * <p>The expression is scanned from left to right. At every position the lexer tries to read an
 * optional sign, optional whitespace, a coefficient made of digits with at most one dot and a
 * variable name. If that succeeds, the token is emitted and scanning resumes behind it, otherwise
 * the character at the current position is skipped. Characters that do not belong to any token
 * are therefore ignored. Terms referring to the same variable are not merged.
 *
 * @author Sebastian Schenker
 */
final class ExpressionParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionParser.class);

  private ExpressionParser() {}

  static ImmutableList<Term> parse(final String expr, final int line) {
    final ImmutableList<String> tokens = tokenize(expr);
    if (tokens.isEmpty()) {
      throw InputException.noTermsFound(line);
    }
    LOGGER.trace("Line {}: tokens {}", line, tokens);
    return tokens.collect(token -> TermParser.parse(token, line));
  }

  /** Returns the tokens of the expression with inner whitespace removed. */
  static ImmutableList<String> tokenize(final String expr) {
    final MutableList<String> tokens = Lists.mutable.empty();
    int pos = 0;
    while (pos < expr.length()) {
      final int end = matchToken(expr, pos);
      if (end == -1) {
        ++pos;
      } else {
        tokens.add(stripWhitespace(expr.substring(pos, end)));
        pos = end;
      }
    }
    return tokens.toImmutable();
  }

  // end index (exclusive) of the token starting at begin, -1 if there is none
  private static int matchToken(final String expr, final int begin) {
    int i = begin;
    if (expr.charAt(i) == '+' || expr.charAt(i) == '-') {
      ++i;
      while (i < expr.length() && Character.isWhitespace(expr.charAt(i))) {
        ++i;
      }
    }
    int dots = 0;
    while (i < expr.length() && (TextUtils.isDigit(expr.charAt(i)) || expr.charAt(i) == '.')) {
      if (expr.charAt(i) == '.') {
        ++dots;
      }
      ++i;
    }
    if (dots > 1 || i == expr.length() || !TextUtils.isIdentifierStart(expr.charAt(i))) {
      return -1;
    }
    ++i;
    while (i < expr.length() && TextUtils.isIdentifierPart(expr.charAt(i))) {
      ++i;
    }
    return i;
  }

  private static String stripWhitespace(final String token) {
    final StringBuilder builder = new StringBuilder(token.length());
    for (int i = 0; i < token.length(); ++i) {
      if (!Character.isWhitespace(token.charAt(i))) {
        builder.append(token.charAt(i));
      }
    }
    return builder.toString();
  }
}
