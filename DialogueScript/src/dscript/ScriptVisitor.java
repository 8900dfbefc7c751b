package dscript;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/**
 * Walks a {@link Script} depth-first in document order. Subclasses override the hooks they need;
 * comments are skipped.
 */
abstract class ScriptVisitor {

  /** Where the walk is. Neighbours are the adjacent siblings that are not comments. */
  @AutoValue
  abstract static class Cursor {
    abstract ScriptParser.Pos pos();

    /** Zero at the top level. */
    abstract int depth();

    abstract Optional<Element> previous();

    abstract Optional<Element> next();

    final boolean isTopLevel() {
      return depth() == 0;
    }

    static Cursor create(
        ScriptParser.Pos pos, int depth, Optional<Element> previous, Optional<Element> next) {
      return new AutoValue_ScriptVisitor_Cursor(pos, depth, previous, next);
    }
  }

  private Script script;
  // Lines and comments seen so far; indexes Script#positionOf.
  private int ordinal;

  public final void walk(Script script) {
    this.script = script;
    this.ordinal = 0;
    walkElements(script.elements(), 0);
    endScript(script);
  }

  private void walkElements(List<Element> elements, int depth) {
    for (int i = 0; i < elements.size(); i++) {
      Element element = elements.get(i);
      Cursor cursor =
          Cursor.create(
              script.positionOf(ordinal),
              depth,
              neighbour(elements, i, -1),
              neighbour(elements, i, 1));

      switch (element.kind()) {
        case LINE:
          ordinal++;
          Line line = element.line();
          if (line.isCommand()) {
            visitCommand(line.command(), cursor);
          } else {
            visitMarker(line.marker(), cursor);
          }
          break;
        case COMMENT:
          ordinal++;
          break;
        case BLOCK:
          visitBlock(element.block(), cursor);
          walkElements(element.block().elements(), depth + 1);
          break;
      }
    }
  }

  private static Optional<Element> neighbour(List<Element> elements, int index, int step) {
    for (int i = index + step; i >= 0 && i < elements.size(); i += step) {
      if (!elements.get(i).isComment()) {
        return Optional.of(elements.get(i));
      }
    }
    return Optional.empty();
  }

  protected void visitCommand(Command command, Cursor cursor) {}

  protected void visitMarker(Marker marker, Cursor cursor) {}

  /** The cursor is positioned at the first line of the block. */
  protected void visitBlock(Block block, Cursor cursor) {}

  protected void endScript(Script script) {}
}
