package de.asbestian.jmilp.input;

import java.util.Arrays;
import java.util.Objects;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;

/**
 * An ordered list of terms, optionally compared against a right-hand side. The objective uses
 * {@link ConstraintSense#NONE} and a right-hand side of zero.
 *
 * @author Sebastian Schenker
 */
public record LinearExpression(ImmutableList<Term> terms, double rhs, ConstraintSense sense, int lineNumber) {

  public enum ConstraintSense {
    LE("<="),
    EQ("="),
    GE(">="),
    NONE("");

    public static ConstraintSense from(final String rep) {
      return Arrays.stream(values())
          .filter(sense -> sense.representation.equals(rep)).findFirst().orElseThrow();
    }

    ConstraintSense(final String representation) {
      this.representation = representation;
    }

    public String representation() {
      return representation;
    }

    private final String representation;
  }

  public LinearExpression {
    Objects.requireNonNull(terms);
    Objects.requireNonNull(sense);
    if (lineNumber <= 0) {
      throw new IllegalArgumentException("Expected positive line number.");
    }
  }

  static LinearExpression objective(final ImmutableList<Term> terms, final int lineNumber) {
    return new LinearExpression(terms, 0., ConstraintSense.NONE, lineNumber);
  }

  /** Coefficients per variable, with repeated variables summed up. */
  public ImmutableMap<String, Double> coefficients() {
    final MutableMap<String, Double> coefficients = new UnifiedMap<>();
    terms.forEach(term -> coefficients.merge(term.variable(), term.coefficient(), Double::sum));
    return coefficients.toImmutable();
  }
}
