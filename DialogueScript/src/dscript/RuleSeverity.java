package dscript;

import java.util.Locale;

/** How {@link SyntaxChecker} treats a script that breaks a configurable rule. */
public enum RuleSeverity {
  ALLOW,
  WARN,
  DENY;

  /** Parses {@code allow}, {@code warn} or {@code deny}, ignoring case. */
  public static RuleSeverity parse(String value) {
    for (RuleSeverity severity : values()) {
      if (severity.name().equalsIgnoreCase(value.trim())) {
        return severity;
      }
    }
    throw new IllegalArgumentException(
        String.format("unknown rule severity '%s': expected allow, warn or deny", value));
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
