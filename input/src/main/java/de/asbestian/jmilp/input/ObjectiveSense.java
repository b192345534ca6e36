package de.asbestian.jmilp.input;

import java.util.Arrays;
import java.util.Optional;

/**
 * Optimisation direction, written as {@code Max} or {@code Min} on a line of its own.
 *
 * @author Sebastian Schenker
 */
public enum ObjectiveSense {
  MAX("Max"),
  MIN("Min");

  /** Returns the sense whose representation equals the line, case-sensitively. */
  public static Optional<ObjectiveSense> from(final String line) {
    return Arrays.stream(values()).filter(sense -> sense.representation.equals(line)).findFirst();
  }

  ObjectiveSense(final String representation) {
    this.representation = representation;
  }

  private final String representation;
}
