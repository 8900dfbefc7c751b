package dscript;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the markers a script declares, rejecting duplicates, nested {@code %START%} or
 * {@code %END%} markers, and markers that no command separates.
 */
final class MarkerRegistry extends ErrorCollectingValidator {
  private final Map<String, ScriptParser.Pos> markers = new LinkedHashMap<>();

  // The previous command or marker in document order, at any depth.
  private Optional<Line> previousLine = Optional.empty();

  public boolean isMarkerDefined(String name) {
    return markers.containsKey(name);
  }

  @Override
  protected void visitCommand(Command command, Cursor cursor) {
    previousLine = Optional.of(Line.of(command));
  }

  @Override
  protected void visitMarker(Marker marker, Cursor cursor) {
    ScriptParser.Pos previousDeclaration = markers.putIfAbsent(marker.name(), cursor.pos());
    if (previousDeclaration != null) {
      logError(
          cursor.pos(), String.format("marker %s must not be declared more than once", marker));
      logError(previousDeclaration, String.format("previous declaration of %s is here", marker));
    }

    if ((marker.isStart() || marker.isEnd()) && !cursor.isTopLevel()) {
      logError(cursor.pos(), String.format("the %s marker must not be inside a block", marker));
    }

    if (previousLine.isPresent() && previousLine.get().isMarker()) {
      Marker previous = previousLine.get().marker();
      // BoundaryValidator reports markers right after a top-level %START%.
      if (!(previous.isStart() && cursor.isTopLevel())) {
        logError(
            cursor.pos(),
            String.format(
                "markers %s and %s must be separated by at least one command", previous, marker));
      }
    }
    previousLine = Optional.of(Line.of(marker));
  }

  @Override
  protected void visitBlock(Block block, Cursor cursor) {
    Optional<Element> owner = cursor.previous();
    if (owner.isPresent() && owner.get().isMarker() && !owner.get().line().marker().isStart()) {
      logError(
          cursor.pos(),
          String.format(
              "a block must not follow marker %s: only a command can own a block",
              owner.get().line().marker()));
    }
  }
}
