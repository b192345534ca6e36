package de.asbestian.jmilp.input;

import de.asbestian.jmilp.input.Variable.VariableType;
import java.util.Objects;

/**
 * Bound and type facts declared for one variable. Without any declaration a variable is
 * continuous with bounds negative and positive infinity.
 *
 * @author Sebastian Schenker
 */
public record Bound(double lower, double upper, boolean free, VariableType type) {

  public static final Bound DEFAULT =
      new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false, VariableType.CONTINUOUS);

  public Bound {
    Objects.requireNonNull(type);
  }

  /**
   * Accumulates facts from successive declarations. Each setter overwrites only the fields it is
   * about; {@link #setType(VariableType)} with {@code BINARY} also overwrites the bounds with 0
   * and 1.
   */
  public static final class BoundBuilder {

    private double lower = DEFAULT.lower();
    private double upper = DEFAULT.upper();
    private boolean free = DEFAULT.free();
    private VariableType type = DEFAULT.type();

    public BoundBuilder setLower(final double value) {
      this.lower = value;
      return this;
    }

    public BoundBuilder setUpper(final double value) {
      this.upper = value;
      return this;
    }

    public BoundBuilder setFixed(final double value) {
      this.lower = value;
      this.upper = value;
      return this;
    }

    public BoundBuilder setFree() {
      this.free = true;
      return this;
    }

    public BoundBuilder setType(final VariableType value) {
      this.type = value;
      if (value == VariableType.BINARY) {
        this.lower = 0.;
        this.upper = 1.;
      }
      return this;
    }

    public Bound build() {
      return new Bound(lower, upper, free, type);
    }
  }
}
