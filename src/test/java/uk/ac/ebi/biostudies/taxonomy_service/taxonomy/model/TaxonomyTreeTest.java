package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class TaxonomyTreeTest {

  @Test
  void testHandlesFollowInsertionOrder() {
    TaxonomyTree.Builder builder = TaxonomyTree.builder();
    int root = builder.add("1", "One", null, TaxonomyTree.NO_PARENT);
    int child = builder.add("2", "Two", null, root);
    int grandchild = builder.add("3", "Three", null, child);
    TaxonomyTree tree = builder.build();

    assertThat(root).isLessThan(child);
    assertThat(child).isLessThan(grandchild);
    assertEquals(TaxonomyTree.NO_PARENT, tree.parentHandle(root));
    assertEquals(child, tree.parentHandle(grandchild));
    assertThat(tree.childHandles(root)).containsExactly(child);
    assertThat(tree.rootHandles()).containsExactly(root);
  }

  @Test
  void testBuilderRejectsUnknownParentHandle() {
    TaxonomyTree.Builder builder = TaxonomyTree.builder();
    builder.add("1", "One", null, TaxonomyTree.NO_PARENT);

    assertThrows(IllegalArgumentException.class, () -> builder.add("2", "Two", null, 5));
  }

  @Test
  void testOfKeepsStructure() {
    TaxonomyNode three = TaxonomyNode.leaf("3", "Three", null);
    TaxonomyNode two = new TaxonomyNode("2", "Two", null, List.of(three));
    TaxonomyNode one = new TaxonomyNode("1", "One", null, List.of(two));
    List<TaxonomyNode> roots = List.of(one, TaxonomyNode.leaf("4", "Four", null));

    TaxonomyTree tree = TaxonomyTree.of(roots);

    assertEquals(roots, tree.toNodes());
    assertEquals(4, tree.size());
    assertEquals(three, tree.subtree(2));
    assertEquals(TaxonomyNode.leaf("1", "One", null), tree.node(0));
  }

  @Test
  void testChildHandlesAreCopies() {
    TaxonomyNode one =
        new TaxonomyNode("1", "One", null, List.of(TaxonomyNode.leaf("2", "Two", null)));
    TaxonomyTree tree = TaxonomyTree.of(List.of(one));

    tree.childHandles(0)[0] = 42;

    assertThat(tree.childHandles(0)).containsExactly(1);
  }

  @Test
  void testEmptyChildListIsNormalizedToNull() {
    TaxonomyNode node = new TaxonomyNode("1", "One", null, List.of());

    assertThat(node.children()).isNull();
    assertThat(node.childrenOrEmpty()).isEmpty();
    assertThat(node.withoutChildren()).isSameAs(node);
  }
}
