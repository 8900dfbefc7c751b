package dscript;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoOneOf;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import dscript.ArenaTree.NodeId;

/**
 * Executes a {@link StateTree} one {@link Tick} at a time.
 *
 * <p>Nested blocks run depth-first after the command that owns them. A run of {@code |CHOICE|}
 * siblings is presented as one menu: after its first option is emitted, the caller must {@link
 * #choose} before ticking again. A block whose first line is a {@code |CHOICE|} is a menu of all
 * of its lines. Not thread-safe; use one machine per playthrough.
 */
public final class StateMachine {
  private static final Logger LOGGER = LoggerFactory.getLogger(StateMachine.class);

  @AutoOneOf(State.Kind.class)
  public abstract static class State {
    public enum Kind {
      AWAITING_TICK,
      AWAITING_CHOICE,
      DONE;
    }

    public abstract Kind kind();

    /** The node the next tick emits. */
    public abstract NodeId awaitingTick();

    /** The options of the pending menu. */
    public abstract ImmutableList<NodeId> awaitingChoice();

    public abstract void done();

    static State tickAt(NodeId node) {
      return AutoOneOf_StateMachine_State.awaitingTick(node);
    }

    static State choiceAmong(ImmutableList<NodeId> nodes) {
      return AutoOneOf_StateMachine_State.awaitingChoice(nodes);
    }

    static State finished() {
      return AutoOneOf_StateMachine_State.done();
    }

    static State tickAtOrFinished(Optional<NodeId> node) {
      return node.isPresent() ? tickAt(node.get()) : finished();
    }
  }

  private final StateTree stateTree;
  private State state;
  private int tickNumber = 0;

  public StateMachine(StateTree stateTree) {
    this.stateTree = stateTree;
    this.state = State.tickAt(stateTree.firstNode());
  }

  /** Builds the tree for {@code script}, which is assumed to have passed {@link SyntaxChecker}. */
  public static StateMachine create(Script script) {
    return new StateMachine(StateTree.build(script));
  }

  public StateTree stateTree() {
    return stateTree;
  }

  public State state() {
    return state;
  }

  public boolean isFinished() {
    return state.kind() == State.Kind.DONE;
  }

  /** The commands of the menu awaiting {@link #choose}, if any. */
  public Optional<ImmutableList<Command>> pendingChoices() {
    if (state.kind() != State.Kind.AWAITING_CHOICE) {
      return Optional.empty();
    }
    return Optional.of(
        state.awaitingChoice().stream()
            .map(stateTree::command)
            .collect(ImmutableList.toImmutableList()));
  }

  /**
   * Emits the command at the current position and advances. Once the script has ended every
   * tick is empty.
   *
   * @throws IllegalStateException if a choice is pending
   */
  public Tick tick() {
    switch (state.kind()) {
      case DONE:
        return Tick.empty(tickNumber);
      case AWAITING_CHOICE:
        throw new IllegalStateException(
            String.format(
                "cannot tick while a choice among %d options is pending",
                state.awaitingChoice().size()));
      case AWAITING_TICK:
        break;
    }

    NodeId node = state.awaitingTick();
    Command command = stateTree.command(node);
    tickNumber++;
    transition(nextState(node, command));
    return Tick.of(tickNumber, command);
  }

  private State nextState(NodeId node, Command command) {
    if (command.isChoice()) {
      return State.choiceAmong(stateTree.choiceGroupFrom(node));
    }

    ImmutableList<NodeId> children = stateTree.tree().childrenOf(node);
    if (children.isEmpty()) {
      return State.tickAtOrFinished(stateTree.continuationOf(node));
    }
    // A block led by a choice is a menu of all its lines.
    if (stateTree.command(children.get(0)).isChoice()) {
      return State.choiceAmong(children);
    }
    return State.tickAt(children.get(0));
  }

  /**
   * Picks option {@code index} of the pending menu. A {@code |CHOICE|} option was already shown
   * as part of the menu, so execution continues with its body. Any other option is emitted by
   * the next tick.
   *
   * <p>When a block opens with a choice, none of its {@code |CHOICE|} lines is ever emitted by a
   * {@link Tick}, chosen or not. Render menus from {@link #pendingChoices()}.
   *
   * @throws IllegalStateException if no choice is pending
   * @throws IndexOutOfBoundsException if {@code index} is not an option
   */
  public void choose(int index) {
    Preconditions.checkState(
        state.kind() == State.Kind.AWAITING_CHOICE, "no choice is pending (state: %s)", state);
    ImmutableList<NodeId> options = state.awaitingChoice();
    Preconditions.checkElementIndex(index, options.size(), "choice");

    NodeId option = options.get(index);
    if (!stateTree.command(option).isChoice()) {
      transition(State.tickAt(option));
      return;
    }

    ImmutableList<NodeId> body = stateTree.tree().childrenOf(option);
    transition(
        body.isEmpty()
            ? State.tickAtOrFinished(stateTree.continuationOf(option))
            : State.tickAt(body.get(0)));
  }

  /**
   * Jumps to the command after marker {@code name}, written {@code NAME} or {@code %NAME%},
   * abandoning any pending choice.
   *
   * @throws UnknownMarkerException if the script has no such marker
   */
  public void goTo(String name) throws UnknownMarkerException {
    String markerName = Marker.parseReference(name).orElse(name);
    if (!stateTree.hasMarker(markerName)) {
      throw new UnknownMarkerException(markerName);
    }
    LOGGER.debug("goto {}", markerName);
    transition(State.tickAtOrFinished(stateTree.markerTarget(markerName)));
  }

  private void transition(State next) {
    LOGGER.debug("{} -> {}", state, next);
    state = next;
  }
}
