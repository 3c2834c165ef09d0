package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation;

import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;

/** One level of a taxonomy, without grandchildren. */
public record Branch(List<TaxonomyNode> branch) {

  public static Branch empty() {
    return new Branch(List.of());
  }
}
