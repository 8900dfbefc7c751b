package dscript;

/** A parsed {@link Script} breaks one of the rules enforced by {@link SyntaxChecker}. */
public class ValidationException extends ScriptException {
  private static final long serialVersionUID = 1L;

  private final boolean warning;

  public ValidationException(ScriptParser.Pos pos, String errorMsg) {
    this(pos, errorMsg, false);
  }

  private ValidationException(ScriptParser.Pos pos, String errorMsg, boolean warning) {
    super(pos, errorMsg);
    this.warning = warning;
  }

  static ValidationException warning(ScriptParser.Pos pos, String errorMsg) {
    return new ValidationException(pos, errorMsg, true);
  }

  public boolean isWarning() {
    return warning;
  }

  @Override
  protected String severityLabel() {
    return warning ? "WARNING" : "ERROR";
  }
}
