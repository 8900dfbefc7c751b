package dscript;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends ScriptVisitor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ErrorCollectingValidator.class);

  private final List<ValidationException> errors = new ArrayList<>();
  private final List<ValidationException> warnings = new ArrayList<>();

  protected ImmutableList<ValidationException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected ImmutableList<ValidationException> warningList() {
    return ImmutableList.copyOf(warnings);
  }

  protected void logError(ScriptParser.Pos pos, String msg) {
    errors.add(new ValidationException(pos, msg));
  }

  protected void logWarning(ScriptParser.Pos pos, String msg) {
    ValidationException warning = ValidationException.warning(pos, msg);
    // Callers report warnings themselves, see SyntaxChecker#warnings().
    LOGGER.debug("{}", warning.format());
    warnings.add(warning);
  }

  /** Logs a problem with a configurable rule according to its {@code severity}. */
  protected void report(RuleSeverity severity, ScriptParser.Pos pos, String msg) {
    switch (severity) {
      case ALLOW:
        break;
      case WARN:
        logWarning(pos, msg);
        break;
      case DENY:
        logError(pos, msg);
        break;
    }
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
    warnings.addAll(other.warnings);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
