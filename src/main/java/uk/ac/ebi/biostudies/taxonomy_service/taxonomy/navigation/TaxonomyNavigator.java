package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyTree;

/**
 * Read-only traversals over a {@link TaxonomyTree}.
 *
 * <p>No auxiliary index is kept: every call walks the tree afresh, so each operation is linear in
 * the number of nodes. All returned nodes are stripped of their children unless stated otherwise.
 */
public final class TaxonomyNavigator {

  private TaxonomyNavigator() {}

  /**
   * Finds the handle of the first node with the given id in pre-order.
   *
   * @return the handle, or empty if no node has this id
   */
  public static OptionalInt findHandle(TaxonomyTree tree, String id) {
    Deque<Integer> stack = new ArrayDeque<>();
    pushReversed(stack, tree.rootHandles());
    while (!stack.isEmpty()) {
      int handle = stack.pop();
      if (tree.id(handle).equals(id)) {
        return OptionalInt.of(handle);
      }
      pushReversed(stack, tree.childHandles(handle));
    }
    return OptionalInt.empty();
  }

  /** Finds a node by id, returning it with all of its descendants. */
  public static Optional<TaxonomyNode> findNode(TaxonomyTree tree, String id) {
    OptionalInt handle = findHandle(tree, id);
    return handle.isPresent() ? Optional.of(tree.subtree(handle.getAsInt())) : Optional.empty();
  }

  public static List<TaxonomyNode> immediateChildren(TaxonomyTree tree, int handle) {
    int[] children = tree.childHandles(handle);
    List<TaxonomyNode> result = new ArrayList<>(children.length);
    for (int child : children) {
      result.add(tree.node(child));
    }
    return result;
  }

  public static List<TaxonomyNode> immediateChildren(TaxonomyNode node) {
    return node.childrenOrEmpty().stream().map(TaxonomyNode::withoutChildren).toList();
  }

  /**
   * Returns the ancestors of a node, nearest first and the root last.
   *
   * <p>The tree is walked once in post-order. The walk starts with the queried id as target; every
   * time the visited node is the current target, the target moves to that node's parent, and every
   * matched node after the queried one is collected. This relies on post-order visiting a node's
   * parent strictly after the node itself. Any other traversal order can miss ancestors.
   *
   * @return ancestors from the immediate parent up to the root; empty for a root or unknown id
   */
  public static List<TaxonomyNode> ancestors(TaxonomyTree tree, String id) {
    List<TaxonomyNode> ancestors = new ArrayList<>();
    String target = id;
    boolean queriedNodeSeen = false;

    // entries are {handle, next child index}
    Deque<int[]> stack = new ArrayDeque<>();
    int[] roots = tree.rootHandles();
    for (int i = roots.length - 1; i >= 0; i--) {
      stack.push(new int[] {roots[i], 0});
    }
    while (!stack.isEmpty()) {
      int[] frame = stack.peek();
      int handle = frame[0];
      int[] children = tree.childHandles(handle);
      if (frame[1] < children.length) {
        stack.push(new int[] {children[frame[1]++], 0});
        continue;
      }
      stack.pop();
      if (!tree.id(handle).equals(target)) {
        continue;
      }
      if (queriedNodeSeen) {
        ancestors.add(tree.node(handle));
      }
      queriedNodeSeen = true;
      int parent = tree.parentHandle(handle);
      if (parent == TaxonomyTree.NO_PARENT) {
        break;
      }
      target = tree.id(parent);
    }
    return ancestors;
  }

  /** Total number of nodes, counting every descendant. */
  public static int nodeCount(TaxonomyTree tree) {
    int count = 0;
    Deque<Integer> stack = new ArrayDeque<>();
    pushReversed(stack, tree.rootHandles());
    while (!stack.isEmpty()) {
      count++;
      pushReversed(stack, tree.childHandles(stack.pop()));
    }
    return count;
  }

  /**
   * Describes a node with its ancestors (root first) and immediate children.
   *
   * @return the node details, or empty if no node has this id
   */
  public static Optional<NodeDetails> getNode(TaxonomyTree tree, String id) {
    OptionalInt handle = findHandle(tree, id);
    if (handle.isEmpty()) {
      return Optional.empty();
    }
    List<TaxonomyNode> parents = ancestors(tree, id);
    Collections.reverse(parents);
    return Optional.of(
        new NodeDetails(
            parents,
            tree.node(handle.getAsInt()),
            immediateChildren(tree, handle.getAsInt())));
  }

  /**
   * Returns one level of the tree.
   *
   * @param id parent node id, or {@code null} for the root level
   * @return the root nodes or the node's immediate children; an empty branch for an unknown id
   */
  public static Branch getBranch(TaxonomyTree tree, String id) {
    if (id == null) {
      List<TaxonomyNode> roots = new ArrayList<>();
      for (int root : tree.rootHandles()) {
        roots.add(tree.node(root));
      }
      return new Branch(roots);
    }
    OptionalInt handle = findHandle(tree, id);
    if (handle.isEmpty()) {
      return Branch.empty();
    }
    return new Branch(immediateChildren(tree, handle.getAsInt()));
  }

  /** Every node in pre-order, stripped of its children. */
  public static List<TaxonomyNode> flatten(TaxonomyTree tree) {
    List<TaxonomyNode> nodes = new ArrayList<>(tree.size());
    Deque<Integer> stack = new ArrayDeque<>();
    pushReversed(stack, tree.rootHandles());
    while (!stack.isEmpty()) {
      int handle = stack.pop();
      nodes.add(tree.node(handle));
      pushReversed(stack, tree.childHandles(handle));
    }
    return nodes;
  }

  private static void pushReversed(Deque<Integer> stack, int[] handles) {
    for (int i = handles.length - 1; i >= 0; i--) {
      stack.push(handles[i]);
    }
  }
}
