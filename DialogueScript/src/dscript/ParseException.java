package dscript;

/** The text could not be parsed into a {@link Script}. */
public class ParseException extends ScriptException {
  private static final long serialVersionUID = 1L;

  public ParseException(ScriptParser.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
