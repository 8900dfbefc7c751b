package dscript;

import com.google.auto.value.AutoValue;

/** Severities of the configurable rules enforced by {@link SyntaxChecker}. */
@AutoValue
public abstract class SyntaxCheckerOptions {
  /** Commands other than the built-in ones. */
  public abstract RuleSeverity unknownCommands();

  /** A block directly after the {@code %START%} marker, with no command to own it. */
  public abstract RuleSeverity topLevelBlock();

  public abstract Builder toBuilder();

  public static SyntaxCheckerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_SyntaxCheckerOptions.Builder()
        .setUnknownCommands(RuleSeverity.DENY)
        .setTopLevelBlock(RuleSeverity.ALLOW);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setUnknownCommands(RuleSeverity severity);

    public abstract Builder setTopLevelBlock(RuleSeverity severity);

    public abstract SyntaxCheckerOptions build();
  }
}
