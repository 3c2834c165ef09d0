package uk.ac.ebi.biostudies.taxonomy_service.registry;

import java.util.List;
import java.util.Optional;
import lombok.Getter;
import uk.ac.ebi.biostudies.taxonomy_service.search.NormalizedSearcher;
import uk.ac.ebi.biostudies.taxonomy_service.search.TaxonomyMatch;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyTree;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.Branch;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.NodeDetails;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.TaxonomyNavigator;

/**
 * One version of a taxonomy: its tree and the search index derived from it. Immutable; a reload
 * replaces the whole instance.
 */
@Getter
public class Taxonomy {

  private final String name;
  private final String version;
  private final TaxonomyTree tree;
  private final NormalizedSearcher searcher;

  public Taxonomy(String name, String version, TaxonomyTree tree, EmbeddingProvider provider) {
    this.name = name;
    this.version = version;
    this.tree = tree;
    this.searcher = new NormalizedSearcher(TaxonomyNavigator.flatten(tree), provider);
  }

  public List<TaxonomyNode> getRootNodes() {
    return tree.toNodes();
  }

  public int nodeCount() {
    return TaxonomyNavigator.nodeCount(tree);
  }

  public Optional<NodeDetails> getNode(String nodeId) {
    return TaxonomyNavigator.getNode(tree, nodeId);
  }

  public Branch getBranch(String nodeId) {
    return TaxonomyNavigator.getBranch(tree, nodeId);
  }

  public List<TaxonomyMatch> search(String text, int maxResults, double threshold) {
    return searcher.search(text, maxResults, threshold);
  }
}
