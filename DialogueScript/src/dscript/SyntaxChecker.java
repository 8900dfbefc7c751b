package dscript;

import java.util.Comparator;

import com.google.common.collect.ImmutableList;

/**
 * Rejects scripts that parse but cannot be executed safely: misplaced or duplicate markers,
 * malformed built-in commands, jumps to undeclared markers and unreachable lines.
 *
 * <p>{@link StateMachine} assumes its script has passed this check.
 */
public class SyntaxChecker extends ErrorCollectingValidator {

  private final Script script;
  private final SyntaxCheckerOptions options;
  private ImmutableList<ValidationException> sortedErrors;

  public SyntaxChecker(Script script, SyntaxCheckerOptions options) {
    this.script = script;
    this.options = options;
  }

  public SyntaxChecker(Script script) {
    this(script, SyntaxCheckerOptions.defaults());
  }

  public static void checkSyntax(Script script) throws ValidationException {
    new SyntaxChecker(script).validate();
  }

  public static void checkSyntax(Script script, SyntaxCheckerOptions options)
      throws ValidationException {
    new SyntaxChecker(script, options).validate();
  }

  public SyntaxCheckerOptions options() {
    return options;
  }

  /** All errors, ordered by position. */
  public ImmutableList<ValidationException> computeErrors() {
    if (sortedErrors != null) return sortedErrors;

    accept(new BoundaryValidator(options));
    MarkerRegistry markerRegistry = new MarkerRegistry();
    accept(markerRegistry);
    accept(new CommandValidator(markerRegistry, options));

    sortedErrors =
        errors().stream()
            .sorted(Comparator.comparing(ValidationException::pos))
            .collect(ImmutableList.toImmutableList());
    return sortedErrors;
  }

  /** Problems with rules configured as {@link RuleSeverity#WARN}. */
  public ImmutableList<ValidationException> warnings() {
    computeErrors();
    return warningList();
  }

  /** Throws the first error, if there is one. */
  public void validate() throws ValidationException {
    ImmutableList<ValidationException> errors = computeErrors();
    if (!errors.isEmpty()) {
      throw errors.get(0);
    }
  }

  private void accept(ErrorCollectingValidator validator) {
    validator.walk(script);
    takeErrors(validator);
  }
}
