package dscript;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/** Plays a script on a terminal: speech goes to {@code out}, choices are read from {@code in}. */
public class TerminalRunner {

  private final StateMachine machine;
  private final BufferedReader in;
  private final PrintStream out;

  public TerminalRunner(StateMachine machine, BufferedReader in, PrintStream out) {
    this.machine = machine;
    this.in = in;
    this.out = out;
  }

  /**
   * Runs until the script ends or the input does.
   *
   * @return false if the input ended while a choice was pending
   */
  public boolean run() throws IOException, UnknownMarkerException {
    while (!machine.isFinished()) {
      for (Command command : machine.tick().commands()) {
        handle(command);
      }

      Optional<ImmutableList<Command>> choices = machine.pendingChoices();
      if (choices.isPresent()) {
        Optional<Integer> choice = readChoice(choices.get());
        if (!choice.isPresent()) return false;
        machine.choose(choice.get());
      }
    }
    return true;
  }

  private void handle(Command command) throws UnknownMarkerException {
    switch (command.name()) {
      case Command.SAY:
        say(command);
        break;
      case Command.GOTO:
        machine.goTo(command.suffix().orElse(""));
        break;
      case Command.CHOICE:
        // Shown with the rest of its menu.
        break;
      default:
        out.println("unhandled command: " + command);
    }
  }

  private void say(Command command) {
    String text = command.suffix().orElse("");
    if (command.prefix().isPresent()) {
      out.println(command.prefix().get() + ":\t" + text);
    } else {
      out.println(text);
    }
  }

  private Optional<Integer> readChoice(ImmutableList<Command> choices) throws IOException {
    out.println("Choose:");
    for (int i = 0; i < choices.size(); i++) {
      Command choice = choices.get(i);
      out.println(String.format("\t%d: %s", i, choice.suffix().orElse(choice.toString())));
    }

    String input;
    while ((input = in.readLine()) != null) {
      Integer index = Ints.tryParse(input.trim());
      if (index != null && index >= 0 && index < choices.size()) {
        return Optional.of(index);
      }
      out.println("Invalid choice. Try again.");
    }
    return Optional.empty();
  }
}
