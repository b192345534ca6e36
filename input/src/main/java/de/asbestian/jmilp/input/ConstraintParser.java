package de.asbestian.jmilp.input;

import de.asbestian.jmilp.input.LinearExpression.ConstraintSense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses constraint lines of the form {@code lhs (<=|>=|=) rhs}, e.g. {@code x + 2y <= 10}.
 *
 * <p>The operator is located at the right-most {@code =} that is followed by at least one
 * character, so everything in front of it belongs to the left-hand side. A {@code <} or {@code >}
 * immediately before that {@code =} is part of the operator.
 *
 * @author Sebastian Schenker
 */
final class ConstraintParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintParser.class);

  private ConstraintParser() {}

  static LinearExpression parse(final String line, final int lineNumber) {
    int opIndex = line.lastIndexOf('=');
    if (opIndex == line.length() - 1) {
      opIndex = line.lastIndexOf('=', opIndex - 1);
    }
    if (opIndex == -1) {
      throw InputException.invalidConstraintFormat(lineNumber);
    }
    int lhsEnd = opIndex;
    if (opIndex > 0 && (line.charAt(opIndex - 1) == '<' || line.charAt(opIndex - 1) == '>')) {
      lhsEnd = opIndex - 1;
    }
    final String lhs = line.substring(0, lhsEnd);
    final var sense = ConstraintSense.from(line.substring(lhsEnd, opIndex + 1));
    final String rhsStr = line.substring(opIndex + 1);
    if (lhs.isEmpty() || ExpressionParser.tokenize(lhs).isEmpty()) {
      throw InputException.invalidConstraintFormat(lineNumber);
    }
    LOGGER.trace("Found constraint sense: {}", sense.representation());
    final var terms = ExpressionParser.parse(lhs, lineNumber);
    final double rhs = TextUtils.parseNumber(rhsStr, lineNumber);
    return new LinearExpression(terms, rhs, sense, lineNumber);
  }
}
