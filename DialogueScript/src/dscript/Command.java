package dscript;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * A named instruction, written {@code [PREFIX ]|NAME|[ SUFFIX]}.
 *
 * <p>Equality is structural over the name, prefix and suffix.
 */
@AutoValue
public abstract class Command {
  public static final char DELIMITER = '|';

  public static final String SAY = "SAY";
  public static final String CHOICE = "CHOICE";
  public static final String GOTO = "GOTO";
  // Reserved; validated for shape and emitted, never interpreted.
  public static final String IF = "IF";
  public static final String SET = "SET";
  public static final String TRIGGER = "TRIGGER";

  public static final ImmutableSet<String> BUILT_IN_NAMES =
      ImmutableSet.of(SAY, CHOICE, GOTO, IF, SET, TRIGGER);

  public abstract String name();

  /** The speaker or subject. */
  public abstract Optional<String> prefix();

  public abstract Optional<String> suffix();

  public static Command create(String name, Optional<String> prefix, Optional<String> suffix) {
    Preconditions.checkArgument(Marker.isValidName(name), "invalid command name: '%s'", name);
    return new AutoValue_Command(name, prefix, suffix);
  }

  public static Command of(String name, String suffix) {
    return create(name, Optional.empty(), Optional.of(suffix));
  }

  public static Command of(String prefix, String name, String suffix) {
    return create(name, Optional.of(prefix), Optional.of(suffix));
  }

  public static Command say(String text) {
    return of(SAY, text);
  }

  public static Command say(String speaker, String text) {
    return of(speaker, SAY, text);
  }

  public static Command choice(String text) {
    return of(CHOICE, text);
  }

  public static Command jump(String markerName) {
    return of(GOTO, Marker.DELIMITER + markerName + Marker.DELIMITER);
  }

  public boolean isSay() {
    return name().equals(SAY);
  }

  public boolean isChoice() {
    return name().equals(CHOICE);
  }

  public boolean isGoto() {
    return name().equals(GOTO);
  }

  public boolean isBuiltIn() {
    return BUILT_IN_NAMES.contains(name());
  }

  /** The marker name a {@code |GOTO|} jumps to, if its suffix names one. */
  public Optional<String> jumpTarget() {
    return suffix().flatMap(Marker::parseReference);
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    prefix().ifPresent(p -> sb.append(p).append(' '));
    sb.append(DELIMITER).append(name()).append(DELIMITER);
    suffix().ifPresent(s -> sb.append(' ').append(s));
    return sb.toString();
  }
}
