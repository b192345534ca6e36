package de.asbestian.jmilp.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.asbestian.jmilp.input.InputException.ErrorKind;
import de.asbestian.jmilp.input.LinearExpression.ConstraintSense;
import de.asbestian.jmilp.input.Variable.VariableType;
import java.io.BufferedReader;
import java.io.StringReader;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.junit.jupiter.api.Test;

/** @author Sebastian Schenker */
class LpFileReaderTest {

  private static LpFileReader read(final String content) {
    return new LpFileReader(new BufferedReader(new StringReader(content)));
  }

  private static InputException readFailing(final String content) {
    return assertThrows(InputException.class, () -> read(content));
  }

  @Test
  void maximiseOneConstraint() {
    final var path = "src/test/resources/max_one_constraint.lp";

    final LpFileReader input = new LpFileReader(path);
    final var constraint = input.getConstraints().get(0);

    assertEquals(ObjectiveSense.MAX, input.getObjectiveSense());
    assertEquals(Lists.immutable.of(new Term(3., "x"), new Term(2., "y")), input.getObjective().terms());
    assertEquals(ConstraintSense.NONE, input.getObjective().sense());
    assertEquals(2, input.getObjective().lineNumber());
    assertEquals(1, input.getNumberOfConstraints());
    assertEquals(ConstraintSense.LE, constraint.sense());
    assertEquals(10., constraint.rhs());
    assertEquals(Lists.immutable.of(new Term(1., "x"), new Term(2., "y")), constraint.terms());
    assertEquals(3, constraint.lineNumber());
    assertTrue(input.getModel().bounds().isEmpty());
  }

  @Test
  void allSections() {
    final var path = "src/test/resources/all_sections.lp";

    final LpFileReader input = new LpFileReader(path);
    final var model = input.getModel();

    assertEquals(ObjectiveSense.MIN, model.sense());
    assertEquals(Lists.immutable.of(new Term(2.5, "x"), new Term(-1., "y"), new Term(4., "z"), new Term(1., "w")),
        model.objective().terms());
    assertEquals(4, input.getNumberOfVariables());
    assertEquals(4, input.getNumberOfConstraints());
    assertEquals(Lists.immutable.of(ConstraintSense.LE, ConstraintSense.GE, ConstraintSense.EQ, ConstraintSense.GE),
        model.constraints().collect(LinearExpression::sense));
    assertEquals(Lists.immutable.of(40., -3., 1., 0.), model.constraints().collect(LinearExpression::rhs));
    assertEquals(Lists.immutable.of(7, 8, 9, 10), model.constraints().collect(LinearExpression::lineNumber));

    assertEquals(new Bound(1.5, 20., false, VariableType.CONTINUOUS), model.bounds().get("x"));
    assertEquals(new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true, VariableType.INTEGER),
        model.bounds().get("y"));
    assertEquals(new Bound(0., 1., false, VariableType.BINARY), model.bounds().get("z"));
    assertEquals(new Bound(1., 1., false, VariableType.CONTINUOUS), model.bounds().get("w"));

    assertEquals(2, input.getContinuousVariables().size());
    assertEquals(1, input.getIntegerVariables().size());
    assertEquals(1, input.getBinaryVariables().size());
    assertEquals("y", input.getIntegerVariables().get(0).name());
    assertEquals("z", input.getBinaryVariables().get(0).name());
  }

  @Test
  void crlfLineEndings() {
    final var path = "src/test/resources/crlf.lp";

    final LpFileReader input = new LpFileReader(path);

    assertEquals(ObjectiveSense.MIN, input.getObjectiveSense());
    assertEquals(ConstraintSense.GE, input.getConstraints().get(0).sense());
    assertEquals(3., input.getModel().bounds().get("x").upper());
  }

  @Test
  void sameFileTwice_sameModel() {
    final var path = "src/test/resources/all_sections.lp";

    assertEquals(new LpFileReader(path).getModel(), new LpFileReader(path).getModel());
  }

  @Test
  void freeAndOneSidedBounds() {
    final var input = read("Max\nx + y\nx + y <= 4\nBounds:\nx free\ny>=0\ny<=5\n");
    final var bounds = input.getModel().bounds();

    assertTrue(bounds.get("x").free());
    assertEquals(Double.NEGATIVE_INFINITY, bounds.get("x").lower());
    assertEquals(Double.POSITIVE_INFINITY, bounds.get("x").upper());
    assertFalse(bounds.get("y").free());
    assertEquals(0., bounds.get("y").lower());
    assertEquals(5., bounds.get("y").upper());
  }

  @Test
  void infiniteBoundValues() {
    final var bounds = read("Max\nx\nx <= 4\nBounds:\nx >= -inf\ny <= +Infinity\n").getModel().bounds();

    assertEquals(Double.NEGATIVE_INFINITY, bounds.get("x").lower());
    assertEquals(Double.POSITIVE_INFINITY, bounds.get("y").upper());
  }

  @Test
  void binaryAfterBounds_forcesZeroOne() {
    final var path = "src/test/resources/bounds_then_binary.lp";

    final var bounds = new LpFileReader(path).getModel().bounds();

    assertEquals(new Bound(0., 1., false, VariableType.BINARY), bounds.get("a"));
    assertEquals(new Bound(0., 1., false, VariableType.BINARY), bounds.get("b"));
    assertEquals(new Bound(Double.NEGATIVE_INFINITY, 4., false, VariableType.CONTINUOUS), bounds.get("c"));
  }

  @Test
  void boundsAfterBinary_overwriteForcedBounds() {
    final var path = "src/test/resources/binary_then_bounds.lp";

    final var bounds = new LpFileReader(path).getModel().bounds();

    assertEquals(new Bound(0., 0.5, false, VariableType.BINARY), bounds.get("a"));
    assertEquals(new Bound(-1., 1., false, VariableType.BINARY), bounds.get("b"));
  }

  @Test
  void integerAfterBounds_keepsBounds() {
    final var bounds = read("Max\ny\ny <= 20\nBounds:\ny >= 10\ny <= 12\nInteger:\ny\n").getModel().bounds();

    assertEquals(new Bound(10., 12., false, VariableType.INTEGER), bounds.get("y"));
  }

  @Test
  void typeListWithEmptyPieces_skipsThem() {
    final var bounds = read("Max\na + b\na + b <= 1\nInteger:\na, ,b,\n").getModel().bounds();

    assertEquals(Maps.immutable.of(
            "a", new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false, VariableType.INTEGER),
            "b", new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, false, VariableType.INTEGER)),
        bounds);
  }

  @Test
  void sectionsMayRepeat() {
    final var bounds = read("Min\nx + y\nx + y >= 1\nInteger:\nx\nBounds:\nx <= 3\nInteger:\ny\n")
        .getModel().bounds();

    assertEquals(new Bound(Double.NEGATIVE_INFINITY, 3., false, VariableType.INTEGER), bounds.get("x"));
    assertEquals(VariableType.INTEGER, bounds.get("y").type());
  }

  @Test
  void variablesOnlyInConstraints_getNoBoundEntry() {
    final var input = read("Max\nx\nx + y <= 4\nBounds:\nx <= 3\n");

    assertEquals(1, input.getModel().bounds().size());
    assertNull(input.getModel().bounds().get("y"));
    assertEquals(Bound.DEFAULT, input.getModel().boundOf("y"));
    assertEquals(2, input.getNumberOfVariables());
    assertEquals(2, input.getContinuousVariables().size());
  }

  @Test
  void duplicateTerms_keptInOrder_summedInCoefficients() {
    final var objective = read("Min\nx + 2y + x\nx >= 1\n").getObjective();

    assertEquals(3, objective.terms().size());
    assertEquals(Maps.immutable.of("x", 2., "y", 2.), objective.coefficients());
  }

  @Test
  void commentsAndBlankLinesAreSkipped_lineNumbersStillCount() {
    final var input = read("// header\n\nMax\n   \n// objective follows\n x + y \n\nx <= 1\n");

    assertEquals(6, input.getObjective().lineNumber());
    assertEquals(8, input.getConstraints().get(0).lineNumber());
  }

  @Test
  void noConstraints() {
    final var input = read("Min\nx\n");

    assertEquals(0, input.getNumberOfConstraints());
    assertEquals(1, input.getNumberOfVariables());
  }

  @Test
  void duplicateSense_reportsSecondLine() {
    final var path = "src/test/resources/duplicate_sense.lp";

    final var e = assertThrows(InputException.class, () -> new LpFileReader(path));

    assertEquals(ErrorKind.DUPLICATE_OBJECTIVE_SENSE, e.getKind());
    assertEquals(5, e.getLineNumber());
    assertTrue(e.getMessage().startsWith("Line 5:"));
  }

  @Test
  void minAfterMax_isDuplicate() {
    final var e = readFailing("Max\nMin\nx\n");

    assertEquals(ErrorKind.DUPLICATE_OBJECTIVE_SENSE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void invalidBound_reportsLine() {
    final var path = "src/test/resources/invalid_bound.lp";

    final var e = assertThrows(InputException.class, () -> new LpFileReader(path));

    assertEquals(ErrorKind.INVALID_BOUND_FORMAT, e.getKind());
    assertEquals(5, e.getLineNumber());
  }

  @Test
  void malformedBounds() {
    for (final var line : new String[] {"free", "x y free", "x", "<= 3", "2x >= 1", "x >=",
        "x => 5", "x == 5", "x <= 1 <= 2", "x >= 5 y", "x =< 5"}) {
      final var e = readFailing("Max\nx\nx <= 1\nBounds:\n" + line + "\n");
      assertEquals(ErrorKind.INVALID_BOUND_FORMAT, e.getKind(), line);
      assertEquals(5, e.getLineNumber(), line);
    }
  }

  @Test
  void typeListWithInvalidName() {
    for (final var section : new String[] {"Integer:", "Binary:"}) {
      final var e = readFailing("Max\nx + y\nx + y <= 1\n" + section + "\nx y\n");
      assertEquals(ErrorKind.INVALID_BOUND_FORMAT, e.getKind(), section);
      assertEquals(5, e.getLineNumber(), section);
    }
  }

  @Test
  void nonNumericBound() {
    final var e = readFailing("Max\nx\nx <= 1\nBounds:\nx <= ten\n");

    assertEquals(ErrorKind.INVALID_NUMBER, e.getKind());
    assertEquals(5, e.getLineNumber());
  }

  @Test
  void nonNumericRightHandSide() {
    final var e = readFailing("Max\nx\nx + y <= abc\n");

    assertEquals(ErrorKind.INVALID_NUMBER, e.getKind());
    assertEquals(3, e.getLineNumber());
  }

  @Test
  void constraintWithoutOperator() {
    final var e = readFailing("Max\nx\nx + y\n");

    assertEquals(ErrorKind.INVALID_CONSTRAINT_FORMAT, e.getKind());
    assertEquals(3, e.getLineNumber());
  }

  @Test
  void objectiveWithoutTerms() {
    final var e = readFailing("Max\n42\n");

    assertEquals(ErrorKind.NO_TERMS_FOUND, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void missingSense_isMisplacedLine() {
    final var path = "src/test/resources/missing_sense.lp";

    final var e = assertThrows(InputException.class, () -> new LpFileReader(path));

    assertEquals(ErrorKind.MISPLACED_LINE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void sectionHeaderInsteadOfObjective_isMisplacedLine() {
    final var e = readFailing("Max\nBounds:\nx >= 1\n");

    assertEquals(ErrorKind.MISPLACED_LINE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void headersAreCaseSensitive() {
    final var e = readFailing("Max\nx\nx <= 1\nbounds:\nx >= 0\n");

    // "bounds:" is read as a constraint line
    assertEquals(ErrorKind.INVALID_CONSTRAINT_FORMAT, e.getKind());
    assertEquals(4, e.getLineNumber());
  }

  @Test
  void emptyInput_missingObjective() {
    final var e = readFailing("// nothing here\n\n");

    assertEquals(ErrorKind.MISSING_OBJECTIVE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void senseWithoutObjective_missingObjective() {
    final var e = readFailing("Min\n");

    assertEquals(ErrorKind.MISSING_OBJECTIVE, e.getKind());
    assertEquals(1, e.getLineNumber());
  }

  @Test
  void missingFile() {
    final var e = assertThrows(InputException.class, () -> new LpFileReader("src/test/resources/no_such_file.lp"));

    assertEquals(ErrorKind.FILE_UNAVAILABLE, e.getKind());
    assertEquals(0, e.getLineNumber());
  }
}
