package dscript;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class DialogueMain {

  private static final String USAGE =
      "Usage: dialogue (check|run) script_file"
          + " [--unknown-commands=allow|warn|deny] [--top-level-block=allow|warn|deny]";

  private static final String UNKNOWN_COMMANDS_FLAG = "--unknown-commands=";
  private static final String TOP_LEVEL_BLOCK_FLAG = "--top-level-block=";

  public static void main(String[] args) throws IOException, UnknownMarkerException {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /** Runs the command line {@code args} and returns the process exit code. */
  public static int run(String[] args, InputStream in, PrintStream out, PrintStream err)
      throws IOException, UnknownMarkerException {
    if (args.length < 2 || !(args[0].equals("check") || args[0].equals("run"))) {
      err.println(USAGE);
      return 1;
    }

    SyntaxCheckerOptions options;
    try {
      options = parseOptions(Arrays.asList(args).subList(2, args.length));
    } catch (IllegalArgumentException ex) {
      err.println(ex.getMessage());
      err.println(USAGE);
      return 1;
    }

    File file = new File(args[1]);
    Script script;
    try {
      script = ScriptParser.parse(file.toString(), read(file));
    } catch (ParseException ex) {
      ex.print(out);
      out.println("Script is invalid.  See errors above.");
      return 1;
    }

    SyntaxChecker checker = new SyntaxChecker(script, options);
    ImmutableList<ValidationException> errors = checker.computeErrors();
    checker.warnings().stream().forEach(w -> w.print(out));
    if (!errors.isEmpty()) {
      errors.stream().forEach(e -> e.print(out));
      out.println("Script is invalid.  See errors above.");
      return 1;
    }

    if (args[0].equals("check")) {
      out.println("Congratulations: your script is valid.");
      return 0;
    }

    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    // Ends early, without error, if the input runs out at a choice.
    new TerminalRunner(StateMachine.create(script), reader, out).run();
    return 0;
  }

  static SyntaxCheckerOptions parseOptions(List<String> flags) {
    SyntaxCheckerOptions.Builder builder = SyntaxCheckerOptions.builder();
    for (String flag : flags) {
      if (flag.startsWith(UNKNOWN_COMMANDS_FLAG)) {
        builder.setUnknownCommands(
            RuleSeverity.parse(flag.substring(UNKNOWN_COMMANDS_FLAG.length())));
      } else if (flag.startsWith(TOP_LEVEL_BLOCK_FLAG)) {
        builder.setTopLevelBlock(RuleSeverity.parse(flag.substring(TOP_LEVEL_BLOCK_FLAG.length())));
      } else {
        throw new IllegalArgumentException("unknown flag: " + flag);
      }
    }
    return builder.build();
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
