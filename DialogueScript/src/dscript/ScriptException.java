package dscript;

import java.io.PrintStream;

/** A problem with the text of a script, located at a {@link ScriptParser.Pos}. */
public class ScriptException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ScriptParser.Pos pos;
  private final String errorMsg;

  public ScriptException(ScriptParser.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public ScriptParser.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  protected String severityLabel() {
    return "ERROR";
  }

  public String format() {
    return String.format(
        "%s: %s@%d:%d %s",
        severityLabel(), pos.file(), pos.lineNumber() + 1, pos.column() + 1, errorMsg);
  }

  public void print(PrintStream out) {
    out.println(format());
  }

  public void print() {
    print(System.out);
  }
}
