package dscript;

import com.google.auto.value.AutoOneOf;

/** A line of a script: either a {@link Command} or a {@link Marker}. */
@AutoOneOf(Line.Kind.class)
public abstract class Line {
  public enum Kind {
    COMMAND,
    MARKER;
  }

  public abstract Kind kind();

  public abstract Command command();

  public abstract Marker marker();

  public static Line of(Command command) {
    return AutoOneOf_Line.command(command);
  }

  public static Line of(Marker marker) {
    return AutoOneOf_Line.marker(marker);
  }

  public boolean isCommand() {
    return kind() == Kind.COMMAND;
  }

  public boolean isMarker() {
    return kind() == Kind.MARKER;
  }

  public String format() {
    switch (kind()) {
      case COMMAND:
        return command().toString();
      case MARKER:
        return marker().toString();
    }
    throw new AssertionError(kind());
  }
}
