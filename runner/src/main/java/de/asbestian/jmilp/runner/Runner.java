package de.asbestian.jmilp.runner;

import de.asbestian.jmilp.input.InputException;
import de.asbestian.jmilp.input.LpFileReader;
import de.asbestian.jmilp.input.ModelMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** @author Sebastian Schenker */
public class Runner {

  private static final Logger LOGGER = LoggerFactory.getLogger(Runner.class);

  static final int EXIT_OK = 0;
  static final int EXIT_INPUT_ERROR = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String... args) {
    System.exit(run(args));
  }

  static int run(final String... args) {
    if (args.length != 1) {
      LOGGER.error("Usage: jmilp-runner <input file>");
      return EXIT_USAGE;
    }
    final LpFileReader lpFileReader;
    try {
      lpFileReader = new LpFileReader(args[0]);
    } catch (final InputException e) {
      LOGGER.error("Problem reading input file {}: {}", args[0], e.getMessage());
      return EXIT_INPUT_ERROR;
    }
    final ModelMatrix matrix = ModelMatrix.of(lpFileReader.getModel());
    LOGGER.info("Optimisation direction: {}", matrix.objectiveSense());
    LOGGER.info(String.format("Number of variables: %d", lpFileReader.getNumberOfVariables()));
    LOGGER.info(String.format("Number of constraints: %d", lpFileReader.getNumberOfConstraints()));
    LOGGER.info(String.format("Continuous/integer/binary variables: %d/%d/%d",
        lpFileReader.getContinuousVariables().size(),
        lpFileReader.getIntegerVariables().size(),
        lpFileReader.getBinaryVariables().size()));
    final double[] lb = matrix.lowerBounds();
    final double[] ub = matrix.upperBounds();
    for (int j = 0; j < matrix.noOfVariables(); ++j) {
      LOGGER.debug("Column {}: {} in [{}, {}]", j, matrix.variableName(j), lb[j], ub[j]);
    }
    return EXIT_OK;
  }
}
