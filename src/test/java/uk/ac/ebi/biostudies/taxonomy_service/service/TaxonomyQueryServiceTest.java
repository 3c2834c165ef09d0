package uk.ac.ebi.biostudies.taxonomy_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;
import static uk.ac.ebi.biostudies.taxonomy_service.TaxonomyTestDataFactory.newTreeBuilder;
import static uk.ac.ebi.biostudies.taxonomy_service.TaxonomyTestDataFactory.referencePayload;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.ac.ebi.biostudies.taxonomy_service.config.TaxonomyConfig;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.NodeNotFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.registry.AvailableTaxonomies;
import uk.ac.ebi.biostudies.taxonomy_service.registry.Taxonomy;
import uk.ac.ebi.biostudies.taxonomy_service.registry.TaxonomyRegistry;
import uk.ac.ebi.biostudies.taxonomy_service.registry.TaxonomyVersions;
import uk.ac.ebi.biostudies.taxonomy_service.search.TaxonomyMatch;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.NodeDetails;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaxonomyQueryService")
class TaxonomyQueryServiceTest {

  @Mock private TaxonomyRegistry registry;

  private final Taxonomy reference =
      new Taxonomy("reference", "1.0", newTreeBuilder().buildTree(referencePayload()), null);

  private TaxonomyQueryService service;

  @BeforeEach
  void setUp() {
    service = new TaxonomyQueryService(registry, new TaxonomyConfig("", 0.7, 1, "*"));
  }

  @Test
  @DisplayName("should return the full tree of the requested version")
  void shouldReturnTree() {
    when(registry.get("reference", "1.0")).thenReturn(reference);

    TreeResponse response = service.getTree("reference", "1.0");

    assertThat(response.tree()).extracting(TaxonomyNode::id).containsExactly("1", "5");
    assertThat(response.tree().get(0).children()).hasSize(2);
  }

  @Test
  @DisplayName("should return the root level for a null node id")
  void shouldReturnRootBranch() {
    when(registry.get("reference", "")).thenReturn(reference);

    assertThat(service.getBranch("reference", "", null).branch())
        .extracting(TaxonomyNode::id)
        .containsExactly("1", "5");
  }

  @Test
  @DisplayName("should return parents root first")
  void shouldReturnNodeDetails() {
    when(registry.get("reference", "1.0")).thenReturn(reference);

    NodeDetails details = service.getNode("reference", "1.0", "3");

    assertThat(details.parents()).extracting(TaxonomyNode::id).containsExactly("1", "2");
    assertThat(details.node().name()).isEqualTo("Three");
    assertThat(details.children()).isEmpty();
  }

  @Test
  @DisplayName("should fail on an unknown node")
  void shouldFailOnUnknownNode() {
    when(registry.get("reference", "1.0")).thenReturn(reference);

    assertThatThrownBy(() -> service.getNode("reference", "1.0", "42"))
        .isInstanceOf(NodeNotFoundException.class)
        .hasMessage("Node 42 does not exist.");
  }

  @Test
  @DisplayName("should apply the configured result count when none is given")
  void shouldApplyDefaultMaxResults() {
    when(registry.get("reference", "1.0")).thenReturn(reference);

    // "One" and "Two" both pass the thresholds for this query, the default keeps one
    SearchResponse limited = service.search("reference", "1.0", "one two", null);
    SearchResponse explicit = service.search("reference", "1.0", "one", 10);

    assertThat(limited.matches()).hasSize(1);
    assertThat(explicit.matches()).extracting(TaxonomyMatch::id).containsExactly("1");
    assertThat(explicit.matches().get(0).metadata().get("code").asText()).isEqualTo("A");
  }

  @Test
  @DisplayName("should reload before listing taxonomies")
  void shouldReloadAndList() {
    AvailableTaxonomies available =
        new AvailableTaxonomies(
            Instant.parse("2024-01-01T00:00:00Z"),
            Map.of("reference", new TaxonomyVersions(List.of("1.0"))));
    when(registry.availableTaxonomies()).thenReturn(available);

    assertThat(service.reload()).isSameAs(available);

    InOrder order = inOrder(registry);
    order.verify(registry).reload();
    order.verify(registry).availableTaxonomies();
  }
}
