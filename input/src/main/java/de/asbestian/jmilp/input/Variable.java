package de.asbestian.jmilp.input;

import java.util.Objects;

/**
 * A variable with its resolved domain, as handed to a solver. A free variable has the bounds
 * negative and positive infinity, whatever bounds were declared for it.
 *
 * @author Sebastian Schenker
 */
public record Variable(String name, VariableType type, double lb, double ub) {

  public enum VariableType {
    BINARY,
    INTEGER,
    CONTINUOUS
  }

  public Variable {
    Objects.requireNonNull(name);
    Objects.requireNonNull(type);
    if (name.isBlank()) {
      throw new IllegalArgumentException("Expected non-blank variable name.");
    }
  }

  static Variable of(final String name, final Bound bound) {
    if (bound.free()) {
      return new Variable(name, bound.type(), Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }
    return new Variable(name, bound.type(), bound.lower(), bound.upper());
  }

  public boolean isIntegral() {
    return type != VariableType.CONTINUOUS;
  }
}
