package dscript;

import java.util.Optional;

/** Checks the shape of each command and that every {@code |GOTO|} names a declared marker. */
class CommandValidator extends ErrorCollectingValidator {

  private final MarkerRegistry markerRegistry;
  private final SyntaxCheckerOptions options;

  public CommandValidator(MarkerRegistry markerRegistry, SyntaxCheckerOptions options) {
    this.markerRegistry = markerRegistry;
    this.options = options;
  }

  @Override
  protected void visitCommand(Command command, Cursor cursor) {
    switch (command.name()) {
      case Command.SAY:
      case Command.IF:
      case Command.SET:
        requireSuffix(command, cursor);
        break;
      case Command.TRIGGER:
        forbidPrefix(command, cursor);
        requireSuffix(command, cursor);
        break;
      case Command.CHOICE:
        forbidPrefix(command, cursor);
        requireSuffix(command, cursor);
        if (!cursor.next().filter(Element::isBlock).isPresent()) {
          logError(
              cursor.pos(),
              "the CHOICE command must be followed by an indented block of what happens next");
        }
        break;
      case Command.GOTO:
        visitGoto(command, cursor);
        break;
      default:
        report(
            options.unknownCommands(),
            cursor.pos(),
            String.format("unknown command: %s", command.name()));
    }
  }

  private void visitGoto(Command command, Cursor cursor) {
    forbidPrefix(command, cursor);
    if (!command.suffix().isPresent()) {
      logError(cursor.pos(), "the GOTO command requires a marker name, but none was found");
    } else if (!command.jumpTarget().isPresent()) {
      logError(
          cursor.pos(),
          String.format(
              "the GOTO command requires a valid marker name, but '%s' was found",
              command.suffix().get()));
    } else if (!markerRegistry.isMarkerDefined(command.jumpTarget().get())) {
      logError(
          cursor.pos(),
          String.format("undefined marker: %%%s%%", command.jumpTarget().get()));
    }

    Optional<Element> next = cursor.next();
    if (next.isPresent() && next.get().isBlock()) {
      logError(cursor.pos(), "the GOTO command must not be followed by an indented block");
    } else if (next.isPresent() && next.get().isCommand()) {
      logError(
          cursor.pos(),
          "lines after a GOTO command but within the same block will be unreachable");
    }
  }

  private void requireSuffix(Command command, Cursor cursor) {
    if (!command.suffix().isPresent()) {
      logError(
          cursor.pos(),
          String.format("the %s command requires a suffix, but none was found", command.name()));
    }
  }

  private void forbidPrefix(Command command, Cursor cursor) {
    command
        .prefix()
        .ifPresent(
            prefix ->
                logError(
                    cursor.pos(),
                    String.format(
                        "the %s command doesn't allow a prefix, but one was found: %s",
                        command.name(),
                        prefix)));
  }
}
