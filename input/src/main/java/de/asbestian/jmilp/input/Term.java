package de.asbestian.jmilp.input;

import java.util.Objects;

/**
 * A signed coefficient together with the name of the variable it multiplies.
 *
 * @author Sebastian Schenker
 */
public record Term(double coefficient, String variable) {

  public Term {
    Objects.requireNonNull(variable);
  }
}
