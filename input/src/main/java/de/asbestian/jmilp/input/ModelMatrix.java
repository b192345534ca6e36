package de.asbestian.jmilp.input;

import de.asbestian.jmilp.input.LinearExpression.ConstraintSense;
import de.asbestian.jmilp.input.Variable.VariableType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

/**
 * Column oriented view of a {@link LpModel} as consumed by solvers. Column {@code j} belongs to
 * the {@code j}-th entry of {@link LpModel#variableNames()}; row {@code i} to the {@code i}-th
 * constraint. Terms referring to the same variable are summed up.
 *
 * @author Sebastian Schenker
 */
public final class ModelMatrix {

  private final ObjectiveSense objectiveSense;
  private final String[] varName;
  private final double[] lbound;
  private final double[] ubound;
  private final VariableType[] varType;
  private final double[] obj;
  private final double[][] constraint;
  private final ConstraintSense[] sense;
  private final double[] rhs;
  private final MutableObjectIntMap<String> columnOf;

  private ModelMatrix(final LpModel model) {
    final ImmutableList<Variable> variables = model.variables();
    final int noOfVariables = variables.size();
    final int noOfConstraints = model.constraints().size();

    objectiveSense = model.sense();
    varName = new String[noOfVariables];
    lbound = new double[noOfVariables];
    ubound = new double[noOfVariables];
    varType = new VariableType[noOfVariables];
    columnOf = new ObjectIntHashMap<>(noOfVariables);
    variables.forEachWithIndex((variable, j) -> {
      varName[j] = variable.name();
      lbound[j] = variable.lb();
      ubound[j] = variable.ub();
      varType[j] = variable.type();
      columnOf.put(variable.name(), j);
    });

    obj = row(model.objective(), noOfVariables);
    constraint = new double[noOfConstraints][];
    sense = new ConstraintSense[noOfConstraints];
    rhs = new double[noOfConstraints];
    model.constraints().forEachWithIndex((expression, i) -> {
      constraint[i] = row(expression, noOfVariables);
      sense[i] = expression.sense();
      rhs[i] = expression.rhs();
    });
  }

  public static ModelMatrix of(final LpModel model) {
    return new ModelMatrix(model);
  }

  private double[] row(final LinearExpression expression, final int length) {
    final double[] row = new double[length];
    expression.terms().forEach(term -> row[columnOf.getOrThrow(term.variable())] += term.coefficient());
    return row;
  }

  public ObjectiveSense objectiveSense() {
    return objectiveSense;
  }

  public int noOfVariables() {
    return varName.length;
  }

  public int noOfConstraints() {
    return constraint.length;
  }

  /** Returns the column of the variable, or -1 if the model does not know it. */
  public int columnOf(final String name) {
    return columnOf.getIfAbsent(name, -1);
  }

  public String variableName(final int column) {
    return varName[column];
  }

  public double[] lowerBounds() {
    return lbound.clone();
  }

  public double[] upperBounds() {
    return ubound.clone();
  }

  public VariableType[] variableTypes() {
    return varType.clone();
  }

  public double[] objectiveVector() {
    return obj.clone();
  }

  /**
   * @return the lhs coefficients of all constraints as an array of size {@code noOfConstraints()}
   *     &times; {@code noOfVariables()}
   */
  public double[][] constraintsMatrix() {
    final double[][] copy = new double[constraint.length][];
    for (int i = 0; i < constraint.length; ++i) {
      copy[i] = constraint[i].clone();
    }
    return copy;
  }

  public ConstraintSense[] senseVector() {
    return sense.clone();
  }

  public double[] rhsVector() {
    return rhs.clone();
  }
}
