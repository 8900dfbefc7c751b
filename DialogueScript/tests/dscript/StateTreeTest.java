package dscript;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import dscript.ArenaTree.NodeId;

public class StateTreeTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private StateTree build() throws ParseException {
    return StateTree.build(ScriptParser.parse("/test/file.script", file.toString()));
  }

  @Test
  public void commandsBecomeNodes() throws ParseException {
    println("%START%");
    println("// not a node");
    println("A |SAY| one");
    println("    |SAY| nested");
    println("A |SAY| two");
    println("%END%");

    StateTree stateTree = build();
    ArenaTree<Command> tree = stateTree.tree();

    assertThat(tree.size()).isEqualTo(3);
    assertThat(tree.roots()).hasSize(2);
    NodeId one = tree.roots().get(0);
    assertThat(stateTree.command(one)).isEqualTo(Command.say("A", "one"));
    assertThat(tree.childrenOf(one)).hasSize(1);
    assertThat(stateTree.command(tree.childrenOf(one).get(0))).isEqualTo(Command.say("nested"));
    assertThat(stateTree.firstNode()).isEqualTo(one);
  }

  @Test
  public void markersResolveToFollowingCommand() throws ParseException {
    println("%START%");
    println("|SAY| one");
    println("%MIDDLE%");
    println("// comments are skipped");
    println("|SAY| two");
    println("%END%");

    StateTree stateTree = build();

    NodeId two = stateTree.tree().roots().get(1);
    assertThat(stateTree.markers().keySet()).containsExactly("START", "MIDDLE", "END").inOrder();
    assertThat(stateTree.markerTarget("MIDDLE")).hasValue(two);
    assertThat(stateTree.markerTarget("END")).isEmpty();
    assertThat(stateTree.hasMarker("MISSING")).isFalse();
  }

  @Test
  public void markerInsideBlock() throws ParseException {
    println("%START%");
    println("|SAY| one");
    println("    %INNER%");
    println("    |SAY| inner");
    println("%END%");

    StateTree stateTree = build();

    NodeId inner = stateTree.tree().childrenOf(stateTree.firstNode()).get(0);
    assertThat(stateTree.markerTarget("INNER")).hasValue(inner);
  }

  @Test
  public void blockAfterStartIsFlattened() throws ParseException {
    println("%START%");
    println("    |SAY| one");
    println("    |SAY| two");
    println("|SAY| three");
    println("%END%");

    StateTree stateTree = build();

    assertThat(stateTree.tree().roots()).hasSize(3);
    assertThat(stateTree.command(stateTree.firstNode())).isEqualTo(Command.say("one"));
  }

  @Test
  public void firstNodeWithoutStart() throws ParseException {
    println("|SAY| one");
    println("%LATER%");
    println("|SAY| two");

    StateTree stateTree = build();

    assertThat(stateTree.command(stateTree.firstNode())).isEqualTo(Command.say("one"));
  }

  @Test
  public void noCommands() {
    println("// nothing to run");
    println("%START%");

    assertThrows(IllegalArgumentException.class, this::build);
  }

  @Test
  public void consecutiveMarkers() {
    println("%START%");
    println("|SAY| one");
    println("%A%");
    println("%B%");
    println("|SAY| two");

    assertThrows(IllegalStateException.class, this::build);
  }

  @Test
  public void choiceGroupsAndContinuations() throws ParseException {
    println("%START%");
    println("|SAY| question");
    println("|CHOICE| yes");
    println("    |SAY| yes body");
    println("|CHOICE| no");
    println("    |SAY| no body");
    println("|SAY| after");
    println("%END%");

    StateTree stateTree = build();
    ArenaTree<Command> tree = stateTree.tree();
    NodeId question = tree.roots().get(0);
    NodeId yes = tree.roots().get(1);
    NodeId no = tree.roots().get(2);
    NodeId after = tree.roots().get(3);
    NodeId yesBody = tree.childrenOf(yes).get(0);

    assertThat(stateTree.choiceGroupFrom(yes)).containsExactly(yes, no).inOrder();
    assertThat(stateTree.choiceGroupFrom(no)).containsExactly(no);
    assertThat(stateTree.choiceGroupFrom(question)).isEmpty();
    assertThat(stateTree.continuationOf(question)).hasValue(yes);
    assertThat(stateTree.continuationOf(yes)).hasValue(after);
    assertThat(stateTree.continuationOf(yesBody)).hasValue(after);
    assertThat(stateTree.continuationOf(after)).isEqualTo(Optional.empty());
  }
}
