package de.asbestian.jmilp.input;

import de.asbestian.jmilp.input.Bound.BoundBuilder;
import de.asbestian.jmilp.input.Variable.VariableType;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class is responsible for reading input files of the following form.
 *
 * <pre>
 * Max | Min
 * objective expression
 * constraint expression (&lt;=|&gt;=|=) number
 * ...
 * Bounds:
 * var (&gt;=|&lt;=|=) number | var free
 * Integer:
 * var, var, ...
 * Binary:
 * var, var, ...
 * </pre>
 *
 * Blank lines and lines starting with {@code //} are ignored. The sections {@code Bounds:},
 * {@code Integer:} and {@code Binary:} are optional, may appear in any order and more than once.
 * Reading stops at the first error; no partial model is kept.
 *
 * @author Sebastian Schenker
 */
public class LpFileReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(LpFileReader.class);

  private static final String COMMENT = "//";
  private static final String FREE = "free";

  private enum Section {
    NONE(""),
    CONSTRAINTS(""),
    BOUNDS("Bounds:"),
    INTEGERS("Integer:"),
    BINARIES("Binary:");

    Section(final String header) {
      this.header = header;
    }

    private final String header;
  }

  private static final List<Section> HEADED_SECTIONS =
      List.of(Section.BOUNDS, Section.INTEGERS, Section.BINARIES);

  private ObjectiveSense objectiveSense;
  private LinearExpression objective;
  private final MutableList<LinearExpression> constraints = Lists.mutable.empty();
  private final MutableMap<String, BoundBuilder> boundBuilders = new UnifiedMap<>();
  private Section currentSection = Section.NONE;
  private int currentLineNumber = 0;

  private final LpModel model;

  /**
   * Reads the file at the given path, assumed to be UTF-8 encoded.
   *
   * @throws InputException if the file cannot be read or is malformed
   */
  public LpFileReader(final String path) {
    try (final BufferedReader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
      model = read(reader);
    } catch (final IOException e) {
      throw InputException.fileUnavailable(path, e);
    }
    LOGGER.debug("Read {} with {} constraints.", path, model.constraints().size());
  }

  /**
   * Reads from the given reader, which is not closed.
   *
   * @throws InputException if reading fails or the input is malformed
   */
  public LpFileReader(final BufferedReader reader) {
    try {
      model = read(reader);
    } catch (final IOException e) {
      throw InputException.fileUnavailable("<reader>", e);
    }
  }

  public LpModel getModel() {
    return model;
  }

  public ObjectiveSense getObjectiveSense() {
    return model.sense();
  }

  public LinearExpression getObjective() {
    return model.objective();
  }

  public ImmutableList<LinearExpression> getConstraints() {
    return model.constraints();
  }

  public int getNumberOfVariables() {
    return model.variableNames().size();
  }

  public int getNumberOfConstraints() {
    return model.constraints().size();
  }

  public List<Variable> getContinuousVariables() { return getVariablesWithType(VariableType.CONTINUOUS); }

  public List<Variable> getIntegerVariables() { return getVariablesWithType(VariableType.INTEGER); }

  public List<Variable> getBinaryVariables() { return getVariablesWithType(VariableType.BINARY); }

  private List<Variable> getVariablesWithType(final VariableType type) {
    return model.variables().select(var -> var.type().equals(type)).castToList();
  }

  private LpModel read(final BufferedReader reader) throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      ++currentLineNumber;
      line = TextUtils.trim(line);
      if (TextUtils.isBlank(line) || line.startsWith(COMMENT)) {
        continue;
      }
      LOGGER.trace("Parsing line {}: {}", currentLineNumber, line);
      parseLine(line);
    }
    if (objectiveSense == null || objective == null) {
      throw InputException.missingObjective(currentLineNumber);
    }
    return new LpModel(objectiveSense, objective, constraints.toImmutable(),
        boundBuilders.collectValues((name, builder) -> builder.build()).toImmutable());
  }

  private void parseLine(final String line) {
    final var sense = ObjectiveSense.from(line);
    if (sense.isPresent()) {
      if (objectiveSense != null) {
        throw InputException.duplicateObjectiveSense(currentLineNumber);
      }
      objectiveSense = sense.get();
      LOGGER.debug("Found optimisation direction {}.", objectiveSense);
      return;
    }
    final var header = HEADED_SECTIONS.stream().filter(sec -> sec.header.equals(line)).findFirst();
    if (objective == null) {
      // the line right after Max/Min is the objective
      if (objectiveSense == null || header.isPresent()) {
        throw InputException.misplacedLine(currentLineNumber);
      }
      objective = LinearExpression.objective(ExpressionParser.parse(line, currentLineNumber), currentLineNumber);
      currentSection = Section.CONSTRAINTS;
      LOGGER.debug("Switching to section {}.", currentSection);
      return;
    }
    if (header.isPresent()) {
      currentSection = header.get();
      LOGGER.debug("Switching to section {}.", currentSection);
      return;
    }
    switch (currentSection) {
      case CONSTRAINTS -> constraints.add(ConstraintParser.parse(line, currentLineNumber));
      case BOUNDS -> parseBound(line);
      case INTEGERS -> parseType(line, VariableType.INTEGER);
      case BINARIES -> parseType(line, VariableType.BINARY);
      default -> throw InputException.misplacedLine(currentLineNumber);
    }
  }

  private BoundBuilder getBoundBuilder(final String name) {
    return boundBuilders.getIfAbsentPut(name, BoundBuilder::new);
  }

  // var free || var >= bound || var <= bound || var = bound
  private void parseBound(final String line) {
    final String[] words = line.split("\\s+");
    if (words.length > 1 && words[words.length - 1].equals(FREE)) {
      final String name = TextUtils.trim(line.substring(0, line.lastIndexOf(FREE)));
      if (!TextUtils.isIdentifier(name)) {
        throw InputException.invalidBoundFormat(currentLineNumber);
      }
      LOGGER.trace("Parsing free variable {}.", name);
      getBoundBuilder(name).setFree();
      return;
    }
    final int opIndex = line.indexOf('=');
    if (opIndex <= 0) {
      throw InputException.invalidBoundFormat(currentLineNumber);
    }
    final char before = line.charAt(opIndex - 1);
    final int nameEnd = before == '<' || before == '>' ? opIndex - 1 : opIndex;
    final String name = TextUtils.trim(line.substring(0, nameEnd));
    final String valueStr = TextUtils.trim(line.substring(opIndex + 1));
    if (!TextUtils.isIdentifier(name) || !isSingleValueToken(valueStr)) {
      throw InputException.invalidBoundFormat(currentLineNumber);
    }
    final double value = parseValue(valueStr, currentLineNumber);
    final BoundBuilder builder = getBoundBuilder(name);
    switch (before) {
      case '>' -> {
        LOGGER.trace("Parsing lower bound of {}.", name);
        builder.setLower(value);
      }
      case '<' -> {
        LOGGER.trace("Parsing upper bound of {}.", name);
        builder.setUpper(value);
      }
      default -> {
        LOGGER.trace("Parsing equality bound of {}.", name);
        builder.setFixed(value);
      }
    }
  }

  // one word without a further operator, e.g. not "> 5" or "1 <= 2"
  private static boolean isSingleValueToken(final String valueStr) {
    if (valueStr.isEmpty()) {
      return false;
    }
    for (int i = 0; i < valueStr.length(); ++i) {
      final char c = valueStr.charAt(i);
      if (c == '<' || c == '>' || c == '=' || Character.isWhitespace(c)) {
        return false;
      }
    }
    return true;
  }

  private void parseType(final String line, final VariableType type) {
    for (final var name : TextUtils.split(line, ',')) {
      if (name.isEmpty()) {
        LOGGER.warn("Line {}: skipping empty variable name.", currentLineNumber);
        continue;
      }
      if (!TextUtils.isIdentifier(name)) {
        throw InputException.invalidBoundFormat(currentLineNumber);
      }
      LOGGER.trace("Declaring {} {}.", type, name);
      getBoundBuilder(name).setType(type);
    }
  }

  private static double parseValue(final String expr, final int currentLine) {
    if (Stream.of("inf", "+inf", "infinity", "+infinity").anyMatch(expr::equalsIgnoreCase)) {
      return Double.POSITIVE_INFINITY;
    }
    else if (Stream.of("-inf", "-infinity").anyMatch(expr::equalsIgnoreCase)) {
      return Double.NEGATIVE_INFINITY;
    }
    else {
      return TextUtils.parseNumber(expr, currentLine);
    }
  }
}
