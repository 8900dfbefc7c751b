package dscript;

import com.google.auto.value.AutoOneOf;

/** An element of a {@link Script} or {@link Block}: a line, a comment or a nested block. */
@AutoOneOf(Element.Kind.class)
public abstract class Element {
  public enum Kind {
    LINE,
    COMMENT,
    BLOCK;
  }

  public abstract Kind kind();

  public abstract Line line();

  public abstract Comment comment();

  public abstract Block block();

  public static Element of(Line line) {
    return AutoOneOf_Element.line(line);
  }

  public static Element of(Command command) {
    return of(Line.of(command));
  }

  public static Element of(Marker marker) {
    return of(Line.of(marker));
  }

  public static Element of(Comment comment) {
    return AutoOneOf_Element.comment(comment);
  }

  public static Element of(Block block) {
    return AutoOneOf_Element.block(block);
  }

  public boolean isLine() {
    return kind() == Kind.LINE;
  }

  public boolean isComment() {
    return kind() == Kind.COMMENT;
  }

  public boolean isBlock() {
    return kind() == Kind.BLOCK;
  }

  public boolean isCommand() {
    return isLine() && line().isCommand();
  }

  public boolean isMarker() {
    return isLine() && line().isMarker();
  }
}
