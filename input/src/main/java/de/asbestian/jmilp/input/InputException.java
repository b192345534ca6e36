package de.asbestian.jmilp.input;

/**
 * Signals malformed or unreadable input. Every instance carries the 1-based line number it
 * refers to, or 0 if no particular line is involved.
 *
 * @author Sebastian Schenker
 */
public class InputException extends RuntimeException {

  public enum ErrorKind {
    FILE_UNAVAILABLE,
    INVALID_TERM_FORMAT,
    NO_TERMS_FOUND,
    INVALID_CONSTRAINT_FORMAT,
    INVALID_NUMBER,
    DUPLICATE_OBJECTIVE_SENSE,
    INVALID_BOUND_FORMAT,
    MISPLACED_LINE,
    MISSING_OBJECTIVE
  }

  private final ErrorKind kind;
  private final int lineNumber;

  public InputException(final ErrorKind kind, final int lineNumber, final String message) {
    super(String.format("Line %d: %s", lineNumber, message));
    this.kind = kind;
    this.lineNumber = lineNumber;
  }

  public InputException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.lineNumber = 0;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  static InputException fileUnavailable(final String path, final Throwable cause) {
    return new InputException(ErrorKind.FILE_UNAVAILABLE,
        String.format("Could not read input file %s.", path), cause);
  }

  static InputException invalidTermFormat(final int line, final String token) {
    return new InputException(ErrorKind.INVALID_TERM_FORMAT, line,
        String.format("invalid term format '%s'.", token));
  }

  static InputException noTermsFound(final int line) {
    return new InputException(ErrorKind.NO_TERMS_FOUND, line,
        "no valid terms found in expression.");
  }

  static InputException invalidConstraintFormat(final int line) {
    return new InputException(ErrorKind.INVALID_CONSTRAINT_FORMAT, line,
        "invalid constraint format.");
  }

  static InputException invalidNumber(final int line, final String text) {
    return new InputException(ErrorKind.INVALID_NUMBER, line,
        String.format("%s is not a valid number.", text));
  }

  static InputException duplicateObjectiveSense(final int line) {
    return new InputException(ErrorKind.DUPLICATE_OBJECTIVE_SENSE, line,
        "duplicate optimisation direction.");
  }

  static InputException invalidBoundFormat(final int line) {
    return new InputException(ErrorKind.INVALID_BOUND_FORMAT, line, "invalid bound format.");
  }

  static InputException misplacedLine(final int line) {
    return new InputException(ErrorKind.MISPLACED_LINE, line,
        "unexpected line or misplaced section.");
  }

  static InputException missingObjective(final int line) {
    return new InputException(ErrorKind.MISSING_OBJECTIVE, line,
        "input ended before optimisation direction and objective were given.");
  }
}
