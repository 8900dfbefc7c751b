package dscript;

import java.util.Optional;

/** Checks that a script opens with {@code %START%} and a command, and closes with {@code %END%}. */
class BoundaryValidator extends ErrorCollectingValidator {

  private final SyntaxCheckerOptions options;

  private boolean seenFirst = false;
  private boolean seenEnd = false;
  private Optional<ScriptParser.Pos> lastPos = Optional.empty();

  public BoundaryValidator(SyntaxCheckerOptions options) {
    this.options = options;
  }

  @Override
  protected void visitCommand(Command command, Cursor cursor) {
    lastPos = Optional.of(cursor.pos());
    if (isFirst(cursor)) {
      logError(
          cursor.pos(),
          String.format(
              "a script must start with the %s marker, but found: %s", Marker.start(), command));
    }
  }

  @Override
  protected void visitMarker(Marker marker, Cursor cursor) {
    lastPos = Optional.of(cursor.pos());
    if (isFirst(cursor)) {
      if (marker.isStart()) {
        checkAfterStart(cursor);
      } else {
        logError(
            cursor.pos(),
            String.format(
                "marker %s must not be declared before the %s marker", marker, Marker.start()));
      }
    }

    if (marker.isEnd() && cursor.isTopLevel()) {
      seenEnd = true;
      if (cursor.next().isPresent()) {
        logError(
            cursor.pos(),
            String.format("the %s marker must be the last line of the script", marker));
      }
    }
  }

  private void checkAfterStart(Cursor cursor) {
    Optional<Element> next = cursor.next();
    if (!next.isPresent()) {
      logError(
          cursor.pos(),
          String.format("the %s marker must be followed by at least one command", Marker.start()));
    } else if (next.get().isMarker()) {
      Marker following = next.get().line().marker();
      if (following.isEnd()) {
        logError(
            cursor.pos(),
            String.format(
                "a script must contain at least one command between the %s and %s markers",
                Marker.start(),
                following));
      } else {
        logError(
            cursor.pos(),
            String.format(
                "marker %s must not directly follow the %s marker", following, Marker.start()));
      }
    }
  }

  @Override
  protected void visitBlock(Block block, Cursor cursor) {
    if (isFirst(cursor)) {
      logError(
          cursor.pos(),
          String.format(
              "a script must start with the %s marker, but found a block", Marker.start()));
      return;
    }

    if (cursor.isTopLevel() && cursor.previous().filter(BoundaryValidator::isStart).isPresent()) {
      report(
          options.topLevelBlock(),
          cursor.pos(),
          String.format("a block directly follows the %s marker", Marker.start()));
    }
  }

  private static boolean isStart(Element element) {
    return element.isMarker() && element.line().marker().isStart();
  }

  private boolean isFirst(Cursor cursor) {
    if (seenFirst || !cursor.isTopLevel()) return false;
    seenFirst = true;
    return true;
  }

  @Override
  protected void endScript(Script script) {
    if (!seenFirst) {
      logError(
          new ScriptParser.Pos(script.file(), 0, 0),
          String.format(
              "script is empty: a script must have %s and %s markers and at least one command",
              Marker.start(),
              Marker.end()));
    } else if (!seenEnd) {
      logError(
          lastPos.orElse(new ScriptParser.Pos(script.file(), 0, 0)),
          String.format("a script must end with the %s marker", Marker.end()));
    }
  }
}
