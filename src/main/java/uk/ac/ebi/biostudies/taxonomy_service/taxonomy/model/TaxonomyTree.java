package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable forest of taxonomy nodes for one taxonomy version.
 *
 * <p>Nodes are stored in an arena and addressed by integer handle. Each entry keeps the handle of
 * its parent ({@link #NO_PARENT} for roots) and the ordered handles of its children. Handles are
 * assigned in insertion order and a parent is always inserted before its children, so a parent's
 * handle is strictly lower than the handles of its children.
 *
 * <p>The nested {@link TaxonomyNode} view of every entry is materialized once at build time and
 * shared by all readers.
 */
public final class TaxonomyTree {

  public static final int NO_PARENT = -1;

  private static final int[] NO_CHILDREN = new int[0];

  private final String[] ids;
  private final String[] names;
  private final JsonNode[] metadata;
  private final int[] parents;
  private final int[][] children;
  private final int[] roots;

  private final TaxonomyNode[] subtrees;
  private final List<TaxonomyNode> rootNodes;

  private TaxonomyTree(Builder builder) {
    int size = builder.ids.size();
    this.ids = builder.ids.toArray(new String[0]);
    this.names = builder.names.toArray(new String[0]);
    this.metadata = builder.metadata.toArray(new JsonNode[0]);
    this.parents = builder.parents.stream().mapToInt(Integer::intValue).toArray();
    this.children = new int[size][];
    for (int handle = 0; handle < size; handle++) {
      List<Integer> childHandles = builder.children.get(handle);
      this.children[handle] =
          childHandles.isEmpty()
              ? NO_CHILDREN
              : childHandles.stream().mapToInt(Integer::intValue).toArray();
    }
    this.roots = builder.roots.stream().mapToInt(Integer::intValue).toArray();

    // Children always have higher handles than their parent, so a reverse sweep sees every child
    // before the node that owns it.
    this.subtrees = new TaxonomyNode[size];
    for (int handle = size - 1; handle >= 0; handle--) {
      List<TaxonomyNode> nested = new ArrayList<>(children[handle].length);
      for (int child : children[handle]) {
        nested.add(subtrees[child]);
      }
      subtrees[handle] = new TaxonomyNode(ids[handle], names[handle], metadata[handle], nested);
    }
    List<TaxonomyNode> tops = new ArrayList<>(roots.length);
    for (int root : roots) {
      tops.add(subtrees[root]);
    }
    this.rootNodes = List.copyOf(tops);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a tree from already nested nodes, keeping root and sibling order.
   *
   * @param roots root nodes with their descendants
   * @return the equivalent arena-backed tree
   */
  public static TaxonomyTree of(List<TaxonomyNode> roots) {
    Builder builder = builder();
    for (TaxonomyNode root : roots) {
      addRecursively(builder, root, NO_PARENT);
    }
    return builder.build();
  }

  private static void addRecursively(Builder builder, TaxonomyNode node, int parent) {
    int handle = builder.add(node.id(), node.name(), node.metadata(), parent);
    for (TaxonomyNode child : node.childrenOrEmpty()) {
      addRecursively(builder, child, handle);
    }
  }

  /** Number of nodes in the tree. */
  public int size() {
    return ids.length;
  }

  public boolean isEmpty() {
    return ids.length == 0;
  }

  public String id(int handle) {
    return ids[handle];
  }

  public String name(int handle) {
    return names[handle];
  }

  public JsonNode metadata(int handle) {
    return metadata[handle];
  }

  /** Returns the parent handle, or {@link #NO_PARENT} for a root. */
  public int parentHandle(int handle) {
    return parents[handle];
  }

  public int[] childHandles(int handle) {
    return children[handle].clone();
  }

  public int[] rootHandles() {
    return roots.clone();
  }

  /** Returns the node at {@code handle} with all of its descendants. */
  public TaxonomyNode subtree(int handle) {
    return subtrees[handle];
  }

  /** Returns the node at {@code handle} stripped of its children. */
  public TaxonomyNode node(int handle) {
    return subtrees[handle].withoutChildren();
  }

  /** Returns the root nodes with all of their descendants, in declaration order. */
  public List<TaxonomyNode> toNodes() {
    return rootNodes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaxonomyTree other)) {
      return false;
    }
    return rootNodes.equals(other.rootNodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rootNodes);
  }

  @Override
  public String toString() {
    return "TaxonomyTree{size=" + size() + ", roots=" + Arrays.toString(roots) + "}";
  }

  /** Incremental arena builder. Parents must be added before their children. */
  public static final class Builder {
    private final List<String> ids = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<JsonNode> metadata = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final List<Integer> roots = new ArrayList<>();

    private Builder() {}

    /**
     * Appends a node and links it to its parent.
     *
     * @param id node id
     * @param name node name
     * @param nodeMetadata opaque metadata, may be {@code null}
     * @param parent handle of an already added node, or {@link #NO_PARENT} for a root
     * @return the handle assigned to the new node
     * @throws IllegalArgumentException if {@code parent} is not an existing handle
     */
    public int add(String id, String name, JsonNode nodeMetadata, int parent) {
      if (parent != NO_PARENT && (parent < 0 || parent >= ids.size())) {
        throw new IllegalArgumentException("Unknown parent handle " + parent);
      }
      int handle = ids.size();
      ids.add(Objects.requireNonNull(id, "id must not be null"));
      names.add(name);
      metadata.add(nodeMetadata);
      parents.add(parent);
      children.add(new ArrayList<>());
      if (parent == NO_PARENT) {
        roots.add(handle);
      } else {
        children.get(parent).add(handle);
      }
      return handle;
    }

    public TaxonomyTree build() {
      return new TaxonomyTree(this);
    }
  }
}
