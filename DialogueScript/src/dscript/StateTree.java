package dscript;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import dscript.ArenaTree.NodeId;

/**
 * The executable form of a {@link Script}: its commands arranged in an {@link ArenaTree}, plus
 * the node each marker resolves to.
 *
 * <p>Markers own no node. A marker resolves to the next command after it in document order, or
 * to nothing if no command follows it.
 */
public final class StateTree {
  private final ArenaTree<Command> tree;
  private final ImmutableMap<String, Optional<NodeId>> markers;
  private final NodeId firstNode;

  private StateTree(
      ArenaTree<Command> tree, ImmutableMap<String, Optional<NodeId>> markers, NodeId firstNode) {
    this.tree = tree;
    this.markers = markers;
    this.firstNode = firstNode;
  }

  public static StateTree build(Script script) {
    return new Builder().build(script);
  }

  public ArenaTree<Command> tree() {
    return tree;
  }

  /** Marker name to the node it resolves to; empty for a terminal marker. */
  public ImmutableMap<String, Optional<NodeId>> markers() {
    return markers;
  }

  /** Where execution begins: the node after {@code %START%}, else the first command. */
  public NodeId firstNode() {
    return firstNode;
  }

  public Command command(NodeId id) {
    return tree.get(id).orElseThrow(() -> new IllegalArgumentException("unknown node " + id));
  }

  public boolean hasMarker(String name) {
    return markers.containsKey(name);
  }

  public Optional<NodeId> markerTarget(String name) {
    Preconditions.checkArgument(hasMarker(name), "no marker named %s", name);
    return markers.get(name);
  }

  private boolean isChoice(NodeId id) {
    return command(id).isChoice();
  }

  /** The run of consecutive {@code |CHOICE|} siblings starting at {@code id}. */
  public ImmutableList<NodeId> choiceGroupFrom(NodeId id) {
    ImmutableList.Builder<NodeId> group = ImmutableList.builder();
    Optional<NodeId> current = Optional.of(id);
    while (current.isPresent() && isChoice(current.get())) {
      group.add(current.get());
      current = tree.nextSiblingOf(current.get());
    }
    return group.build();
  }

  /**
   * The node that runs once {@code id} and its subtree are done. Leaving a choice skips the
   * other options of its group.
   */
  public Optional<NodeId> continuationOf(NodeId id) {
    NodeId last = id;
    if (isChoice(id)) {
      last = choiceGroupFrom(id).reverse().get(0);
    }

    Optional<NodeId> sibling = tree.nextSiblingOf(last);
    if (sibling.isPresent()) return sibling;
    return tree.parentOf(id).flatMap(this::continuationOf);
  }

  private static final class Builder {
    private final ArenaTree<Command> tree = new ArenaTree<>();
    private final Map<String, Optional<NodeId>> markers = new LinkedHashMap<>();
    private Optional<Marker> pending = Optional.empty();

    StateTree build(Script script) {
      addElements(script.elements(), Optional.empty());
      pending.ifPresent(marker -> markers.put(marker.name(), Optional.empty()));

      Optional<NodeId> first = markers.getOrDefault(Marker.START_NAME, Optional.empty());
      if (!first.isPresent()) {
        first = tree.first();
      }
      Preconditions.checkArgument(first.isPresent(), "script %s has no commands", script.file());

      return new StateTree(tree, ImmutableMap.copyOf(markers), first.get());
    }

    private void addElements(List<Element> elements, Optional<NodeId> parent) {
      Optional<NodeId> lastNode = Optional.empty();
      for (Element element : elements) {
        switch (element.kind()) {
          case LINE:
            Line line = element.line();
            if (line.isMarker()) {
              Preconditions.checkState(
                  !pending.isPresent(),
                  "marker %s directly follows marker %s",
                  line.marker(),
                  pending.map(Marker::toString).orElse(""));
              pending = Optional.of(line.marker());
            } else {
              lastNode = Optional.of(addCommand(line.command(), parent));
            }
            break;
          case BLOCK:
            // With no command before it at this level, the block is flattened into the parent.
            addElements(element.block().elements(), lastNode.isPresent() ? lastNode : parent);
            break;
          case COMMENT:
            break;
        }
      }
    }

    private NodeId addCommand(Command command, Optional<NodeId> parent) {
      NodeId id =
          parent.isPresent() ? tree.pushWithParent(command, parent.get()) : tree.push(command);
      pending.ifPresent(marker -> markers.put(marker.name(), Optional.of(id)));
      pending = Optional.empty();
      return id;
    }
  }
}
