package dscript;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/** A jump target, written {@code %NAME%}. */
@AutoValue
public abstract class Marker {
  public static final char DELIMITER = '%';

  public static final String START_NAME = "START";
  public static final String END_NAME = "END";

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.is('-'));

  public abstract String name();

  public static Marker create(String name) {
    Preconditions.checkArgument(isValidName(name), "invalid marker name: '%s'", name);
    return new AutoValue_Marker(name);
  }

  public static Marker start() {
    return create(START_NAME);
  }

  public static Marker end() {
    return create(END_NAME);
  }

  /** Marker names are ALL-CAPS-KEBAB-CASE. */
  public static boolean isValidName(String name) {
    return !name.isEmpty() && NAME_CHARS.matchesAllOf(name);
  }

  /**
   * Resolves a reference to a marker as written in the suffix of a {@code |GOTO|}, which may be
   * either {@code %NAME%} or a bare {@code NAME}.
   */
  public static Optional<String> parseReference(String reference) {
    String name = reference;
    if (reference.length() >= 2
        && reference.charAt(0) == DELIMITER
        && reference.charAt(reference.length() - 1) == DELIMITER) {
      name = reference.substring(1, reference.length() - 1);
    }
    return isValidName(name) ? Optional.of(name) : Optional.empty();
  }

  public boolean isStart() {
    return name().equals(START_NAME);
  }

  public boolean isEnd() {
    return name().equals(END_NAME);
  }

  @Override
  public final String toString() {
    return DELIMITER + name() + DELIMITER;
  }
}
