package uk.ac.ebi.biostudies.taxonomy_service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import uk.ac.ebi.biostudies.taxonomy_service.registry.TaxonomyRegistry;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;

@SpringBootTest
@ActiveProfiles("test")
class TaxonomyServiceApplicationTests {

  @Autowired TaxonomyRegistry registry;

  @Autowired(required = false)
  EmbeddingProvider embeddingProvider;

  @Test
  void contextLoads() {}

  @Test
  void loadsConfiguredTaxonomiesOnStartup() {
    assertThat(registry.availableTaxonomies().taxonomies()).containsOnlyKeys("animals", "vehicles");
    assertThat(embeddingProvider).isNull();
  }
}
