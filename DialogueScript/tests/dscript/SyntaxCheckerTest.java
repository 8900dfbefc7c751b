package dscript;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class SyntaxCheckerTest {

  private static final SyntaxCheckerOptions DEFAULTS = SyntaxCheckerOptions.defaults();

  private static Script parse(String... lines) throws ParseException {
    return ScriptParser.parse("/test/file.script", String.join("\n", lines) + "\n");
  }

  private static void assertParses(String... lines) throws ScriptException {
    assertParses(DEFAULTS, lines);
  }

  private static void assertParses(SyntaxCheckerOptions options, String... lines)
      throws ScriptException {
    SyntaxChecker.checkSyntax(parse(lines), options);
  }

  private static void assertErrors(String errorSubstr, String... lines) throws ParseException {
    assertErrors(DEFAULTS, errorSubstr, lines);
  }

  private static void assertErrors(
      SyntaxCheckerOptions options, String errorSubstr, String... lines) throws ParseException {
    Script script = parse(lines);
    ValidationException ex =
        assertThrows(
            ValidationException.class, () -> SyntaxChecker.checkSyntax(script, options));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  private static ImmutableList<String> errors(String... lines) throws ParseException {
    return new SyntaxChecker(parse(lines))
        .computeErrors().stream()
            .map(ValidationException::errorMsg)
            .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void exampleScripts() throws IOException, ScriptException {
    for (String name : TestScripts.NAMES) {
      SyntaxChecker.checkSyntax(TestScripts.parse(name));
    }
  }

  @Test
  public void defaults() {
    assertThat(DEFAULTS.unknownCommands()).isEqualTo(RuleSeverity.DENY);
    assertThat(DEFAULTS.topLevelBlock()).isEqualTo(RuleSeverity.ALLOW);
  }

  @Test
  public void scriptStart() throws ScriptException {
    assertParses("// comments may come first", "%START%", "|SAY| hi", "%END%");

    assertErrors("script is empty", "// nothing but a comment");
    assertErrors(
        "marker %INTRO% must not be declared before the %START% marker",
        "%INTRO%",
        "|SAY| hi",
        "%START%",
        "|SAY| hi",
        "%END%");
    assertErrors("must start with the %START% marker", "|SAY| hi", "%START%", "|SAY| hi", "%END%");
  }

  @Test
  public void commandAfterStart() throws ScriptException {
    assertErrors("at least one command between the %START% and %END% markers", "%START%", "%END%");
    assertErrors(
        "marker %A% must not directly follow the %START% marker",
        "%START%",
        "%A%",
        "|SAY| hi",
        "%END%");
    assertErrors("must be followed by at least one command", "%START%");
  }

  @Test
  public void scriptEnd() throws ScriptException {
    assertParses("%START%", "|SAY| hi", "%END%", "// trailing comments are fine");

    assertErrors("must end with the %END% marker", "%START%", "|SAY| hi");
    assertErrors(
        "the %END% marker must be the last line", "%START%", "|SAY| a", "%END%", "|SAY| b");
  }

  @Test
  public void duplicateMarkers() throws ParseException {
    ImmutableList<String> errors =
        errors("%START%", "|SAY| a", "%A%", "|SAY| b", "%A%", "|SAY| c", "%END%");

    assertThat(errors)
        .containsExactly(
            "previous declaration of %A% is here", "marker %A% must not be declared more than once")
        .inOrder();
  }

  @Test
  public void nestedStartAndEnd() throws ParseException {
    assertThat(errors("%START%", "|SAY| a", "    %END%", "    |SAY| b"))
        .containsAtLeast(
            "the %END% marker must not be inside a block",
            "a script must end with the %END% marker");
  }

  @Test
  public void consecutiveMarkers() throws ScriptException {
    assertParses("%START%", "|SAY| a", "%A%", "// a comment", "|SAY| b", "%END%");

    assertErrors(
        "markers %A% and %B% must be separated by at least one command",
        "%START%",
        "|SAY| a",
        "%A%",
        "%B%",
        "|SAY| b",
        "%END%");
    assertErrors(
        "markers %A% and %B% must be separated",
        "%START%",
        "|SAY| a",
        "    |SAY| b",
        "    %A%",
        "%B%",
        "|SAY| c",
        "%END%");
    assertErrors(
        "markers %A% and %END% must be separated", "%START%", "|SAY| a", "%A%", "%END%");
  }

  @Test
  public void blockAfterMarker() throws ParseException {
    assertErrors(
        "a block must not follow marker %A%",
        "%START%",
        "|SAY| a",
        "%A%",
        "    |SAY| b",
        "%END%");
  }

  @Test
  public void blockAfterStart() throws ScriptException {
    String[] script = {"%START%", "    |SAY| a", "|SAY| b", "%END%"};

    assertParses(script);
    assertErrors(
        SyntaxCheckerOptions.builder().setTopLevelBlock(RuleSeverity.DENY).build(),
        "a block directly follows the %START% marker",
        script);

    SyntaxChecker checker =
        new SyntaxChecker(
            parse(script),
            SyntaxCheckerOptions.builder().setTopLevelBlock(RuleSeverity.WARN).build());
    assertThat(checker.computeErrors()).isEmpty();
    assertThat(checker.warnings()).hasSize(1);
    assertThat(checker.warnings().get(0).isWarning()).isTrue();
  }

  @Test
  public void say() throws ScriptException {
    assertParses("%START%", "|SAY| hi", "ALICE |SAY| hi", "%END%");

    assertErrors("the SAY command requires a suffix", "%START%", "ALICE |SAY|", "%END%");
  }

  @Test
  public void choice() throws ScriptException {
    assertParses("%START%", "|CHOICE| a", "    |SAY| b", "%END%");

    assertErrors(
        "the CHOICE command doesn't allow a prefix, but one was found: ALICE",
        "%START%",
        "ALICE |CHOICE| a",
        "    |SAY| b",
        "%END%");
    assertErrors(
        "the CHOICE command requires a suffix", "%START%", "|CHOICE|", "    |SAY| b", "%END%");
    assertErrors(
        "must be followed by an indented block", "%START%", "|CHOICE| a", "|SAY| b", "%END%");
    assertErrors(
        "must be followed by an indented block", "%START%", "|SAY| b", "|CHOICE| a", "%END%");
  }

  @Test
  public void gotoTargets() throws ScriptException {
    assertParses("%START%", "|SAY| a", "|GOTO| %START%", "%END%");
    assertParses("%START%", "|SAY| a", "|GOTO| END", "%END%");

    assertErrors("undefined marker: %NOWHERE%", "%START%", "|GOTO| %NOWHERE%", "%END%");
    assertErrors(
        "requires a valid marker name, but 'nowhere' was found",
        "%START%",
        "|GOTO| nowhere",
        "%END%");
    assertErrors("requires a marker name, but none was found", "%START%", "|GOTO|", "%END%");
    assertErrors(
        "the GOTO command doesn't allow a prefix", "%START%", "ALICE |GOTO| %END%", "%END%");
  }

  @Test
  public void gotoEndsItsBlock() throws ScriptException {
    assertParses("%START%", "|SAY| a", "|GOTO| %B%", "%B%", "|SAY| b", "%END%");
    assertParses("%START%", "|SAY| a", "    |GOTO| %END%", "|SAY| b", "%END%");

    assertErrors(
        "lines after a GOTO command but within the same block will be unreachable",
        "%START%",
        "|GOTO| %END%",
        "// comments do not count",
        "|SAY| unreachable",
        "%END%");
    assertErrors(
        "the GOTO command must not be followed by an indented block",
        "%START%",
        "|GOTO| %END%",
        "    |SAY| a",
        "%END%");
  }

  @Test
  public void reservedCommands() throws ScriptException {
    assertParses("%START%", "|IF| mood", "    |SAY| a", "X |SET| mood", "|TRIGGER| wave", "%END%");

    assertErrors("the IF command requires a suffix", "%START%", "|IF|", "%END%");
    assertErrors("the SET command requires a suffix", "%START%", "|SET|", "%END%");
    assertErrors("the TRIGGER command requires a suffix", "%START%", "|TRIGGER|", "%END%");
    assertErrors(
        "the TRIGGER command doesn't allow a prefix", "%START%", "X |TRIGGER| wave", "%END%");
  }

  @Test
  public void unknownCommands() throws ScriptException {
    String[] script = {"%START%", "|DANCE| tango", "%END%"};

    assertErrors("unknown command: DANCE", script);
    assertParses(
        SyntaxCheckerOptions.builder().setUnknownCommands(RuleSeverity.ALLOW).build(), script);

    SyntaxChecker checker =
        new SyntaxChecker(
            parse(script),
            DEFAULTS.toBuilder().setUnknownCommands(RuleSeverity.WARN).build());
    checker.validate();
    assertThat(checker.warnings()).hasSize(1);
    assertThat(checker.warnings().get(0).format())
        .isEqualTo("WARNING: /test/file.script@2:1 unknown command: DANCE");
  }

  @Test
  public void errorsAreOrderedByPosition() throws ParseException {
    SyntaxChecker checker =
        new SyntaxChecker(parse("%START%", "|SAY|", "|GOTO| %NOWHERE%", "|SAY| a", "%END%"));

    ImmutableList<ValidationException> errors = checker.computeErrors();

    assertThat(errors).hasSize(3);
    assertThat(errors.get(0).format())
        .isEqualTo(
            "ERROR: /test/file.script@2:1 the SAY command requires a suffix, but none was found");
    assertThat(errors.get(1).errorMsg()).contains("undefined marker");
    assertThat(errors.get(2).errorMsg()).contains("unreachable");
    assertThat(errors.get(2).pos().lineNumber()).isEqualTo(2);
    assertThat(checker.hasErrors()).isTrue();
  }

  @Test
  public void severityParsing() {
    assertThat(RuleSeverity.parse("warn")).isEqualTo(RuleSeverity.WARN);
    assertThat(RuleSeverity.parse("DENY")).isEqualTo(RuleSeverity.DENY);
    assertThrows(IllegalArgumentException.class, () -> RuleSeverity.parse("sometimes"));
  }
}
