package dscript;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

/**
 * An append-only tree of values addressed by {@link NodeId}.
 *
 * <p>Nodes are never removed. Parent, child and sibling relations are kept in maps keyed by id
 * rather than in the nodes themselves. Roots are siblings of one another in insertion order.
 */
public final class ArenaTree<T> {

  /** Opaque node identity; allocated in increasing order by the tree that owns the node. */
  @AutoValue
  public abstract static class NodeId implements Comparable<NodeId> {
    abstract int index();

    static NodeId of(int index) {
      return new AutoValue_ArenaTree_NodeId(index);
    }

    @Override
    public int compareTo(NodeId other) {
      return Integer.compare(index(), other.index());
    }

    @Override
    public final String toString() {
      return "#" + index();
    }
  }

  @AutoValue
  public abstract static class Node<T> {
    public abstract NodeId id();

    public abstract T data();

    static <T> Node<T> create(NodeId id, T data) {
      return new AutoValue_ArenaTree_Node<>(id, data);
    }
  }

  private final List<T> data = new ArrayList<>();
  private final List<NodeId> roots = new ArrayList<>();
  private final Map<NodeId, NodeId> parents = new HashMap<>();
  private final ListMultimap<NodeId, NodeId> children = ArrayListMultimap.create();
  // Index of each node within its parent's children, or within the roots.
  private final Map<NodeId, Integer> siblingIndex = new HashMap<>();

  /** Appends a new root. */
  public NodeId push(T value) {
    NodeId id = allocate(value);
    siblingIndex.put(id, roots.size());
    roots.add(id);
    return id;
  }

  /** Appends a new last child of {@code parent}, which must already be in this tree. */
  public NodeId pushWithParent(T value, NodeId parent) {
    Preconditions.checkArgument(contains(parent), "parent node %s is not in this tree", parent);

    NodeId id = allocate(value);
    siblingIndex.put(id, children.get(parent).size());
    children.put(parent, id);
    parents.put(id, parent);
    return id;
  }

  private NodeId allocate(T value) {
    Preconditions.checkNotNull(value);
    NodeId id = NodeId.of(data.size());
    data.add(value);
    return id;
  }

  public boolean contains(NodeId id) {
    return id.index() >= 0 && id.index() < data.size();
  }

  public int size() {
    return data.size();
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }

  public Optional<T> get(NodeId id) {
    return contains(id) ? Optional.of(data.get(id.index())) : Optional.empty();
  }

  /** The first node ever pushed. */
  public Optional<NodeId> first() {
    return isEmpty() ? Optional.empty() : Optional.of(NodeId.of(0));
  }

  public ImmutableList<NodeId> roots() {
    return ImmutableList.copyOf(roots);
  }

  /** Direct children in insertion order. */
  public ImmutableList<NodeId> childrenOf(NodeId id) {
    return ImmutableList.copyOf(children.get(id));
  }

  public boolean hasChildren(NodeId id) {
    return children.containsKey(id);
  }

  public Optional<NodeId> parentOf(NodeId id) {
    return Optional.ofNullable(parents.get(id));
  }

  public Optional<NodeId> nextSiblingOf(NodeId id) {
    return siblingAt(id, 1);
  }

  public Optional<NodeId> previousSiblingOf(NodeId id) {
    return siblingAt(id, -1);
  }

  private Optional<NodeId> siblingAt(NodeId id, int offset) {
    Integer index = siblingIndex.get(id);
    if (index == null) return Optional.empty();

    List<NodeId> siblings = parentOf(id).map(children::get).orElse(roots);
    int target = index + offset;
    return target >= 0 && target < siblings.size()
        ? Optional.of(siblings.get(target))
        : Optional.empty();
  }

  /**
   * The successor of {@code id} in document order once its subtree is done: its next sibling,
   * or else the successor of its parent. Empty after the last root.
   */
  public Optional<NodeId> next(NodeId id) {
    Optional<NodeId> current = Optional.of(id);
    while (current.isPresent()) {
      Optional<NodeId> sibling = nextSiblingOf(current.get());
      if (sibling.isPresent()) return sibling;
      current = parentOf(current.get());
    }
    return Optional.empty();
  }

  /** Linear scan for the first node, in allocation order, whose value matches. */
  public Optional<Node<T>> findBy(Predicate<? super T> predicate) {
    for (int i = 0; i < data.size(); i++) {
      if (predicate.test(data.get(i))) {
        return Optional.of(Node.create(NodeId.of(i), data.get(i)));
      }
    }
    return Optional.empty();
  }
}
