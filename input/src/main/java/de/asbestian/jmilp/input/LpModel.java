package de.asbestian.jmilp.input;

import java.util.Objects;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;

/**
 * A parsed linear or mixed-integer program.
 *
 * <p>The bounds map only holds variables that were mentioned in a {@code Bounds:}, {@code
 * Integer:} or {@code Binary:} section. Any other variable is continuous and unbounded in both
 * directions, see {@link #boundOf(String)}.
 *
 * @author Sebastian Schenker
 */
public record LpModel(
    ObjectiveSense sense,
    LinearExpression objective,
    ImmutableList<LinearExpression> constraints,
    ImmutableMap<String, Bound> bounds) {

  public LpModel {
    Objects.requireNonNull(sense);
    Objects.requireNonNull(objective);
    Objects.requireNonNull(constraints);
    Objects.requireNonNull(bounds);
  }

  public Bound boundOf(final String name) {
    final Bound bound = bounds.get(name);
    return bound == null ? Bound.DEFAULT : bound;
  }

  /**
   * Returns all variable names: first as they appear in the objective and the constraints, then
   * the remaining names of the bounds map in lexicographic order.
   */
  public ImmutableList<String> variableNames() {
    final MutableList<String> names = Lists.mutable.empty();
    objective.terms().collect(Term::variable, names);
    constraints.forEach(constraint -> constraint.terms().collect(Term::variable, names));
    names.addAll(bounds.keysView().toSortedList());
    return names.distinct().toImmutable();
  }

  public ImmutableList<Variable> variables() {
    return variableNames().collect(name -> Variable.of(name, boundOf(name)));
  }
}
