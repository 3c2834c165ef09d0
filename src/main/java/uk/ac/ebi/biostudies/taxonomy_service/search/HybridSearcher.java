package uk.ac.ebi.biostudies.taxonomy_service.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import uk.ac.ebi.biostudies.taxonomy_service.analysis.NameNormalizer;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;

/**
 * Ranks taxonomy nodes against free-text queries by combining semantic and lexical similarity.
 *
 * <p>The index is built once from a flat node list and never changes. Nodes whose normalized name
 * has no words are left out. For a query, each document gets the larger of its embedding cosine
 * similarity and its squared {@link LexicalScorer} score. Documents below the absolute threshold
 * are pushed out of the ranking, then every score loses its {@link DepthPenalty}.
 *
 * <p>The ranking is fully deterministic: score descending, then normalized name ascending, then id
 * ascending.
 *
 * <p>Instances are immutable and safe for concurrent searches.
 */
@Slf4j
public class HybridSearcher {

  public static final int DEFAULT_MAX_RESULTS = 20;
  public static final double DEFAULT_THRESHOLD = 0.7;
  public static final double DEFAULT_RELATIVE_THRESHOLD = 0.8;

  private static final double EXCLUDED = -1;

  private final List<SearchDocument> documents;
  private final SemanticScorer semanticScorer;

  /**
   * @param nodes nodes to index, children are ignored
   * @param embeddingProvider provider for semantic scoring, or {@code null} for lexical only
   */
  public HybridSearcher(List<TaxonomyNode> nodes, EmbeddingProvider embeddingProvider) {
    List<SearchDocument> indexed = new ArrayList<>(nodes.size());
    for (TaxonomyNode node : nodes) {
      String name = NameNormalizer.normalize(node.name());
      List<String> tokens = NameNormalizer.tokenize(name);
      if (tokens.isEmpty()) {
        log.debug("Skipping node {} with no searchable words in '{}'", node.id(), node.name());
        continue;
      }
      indexed.add(
          new SearchDocument(node.id(), name, List.copyOf(tokens), DepthPenalty.of(node.id())));
    }
    this.documents = List.copyOf(indexed);
    this.semanticScorer = SemanticScorer.create(embeddingProvider, documents);
  }

  public HybridSearcher(List<TaxonomyNode> nodes) {
    this(nodes, null);
  }

  public List<SearchDocument> getDocuments() {
    return documents;
  }

  public boolean isSemanticEnabled() {
    return semanticScorer.isEnabled();
  }

  public List<ScoredDocument> search(String text) {
    return search(text, DEFAULT_MAX_RESULTS, DEFAULT_THRESHOLD, DEFAULT_RELATIVE_THRESHOLD);
  }

  public List<ScoredDocument> search(String text, int maxResults, double threshold) {
    return search(text, maxResults, threshold, DEFAULT_RELATIVE_THRESHOLD);
  }

  /**
   * Ranks the indexed documents against {@code text}.
   *
   * @param text free-text query
   * @param maxResults maximum number of hits
   * @param threshold minimum combined score, before the depth penalty
   * @param relativeThreshold hits scoring below this fraction of the best hit are dropped
   * @return hits in rank order with their penalized scores; empty for a blank query
   */
  public List<ScoredDocument> search(
      String text, int maxResults, double threshold, double relativeThreshold) {
    String query = NameNormalizer.normalize(text);
    if (query.isEmpty() || maxResults <= 0) {
      return List.of();
    }
    List<String> queryTokens = NameNormalizer.tokenize(query);
    double[] semantic = semanticScorer.score(query);

    List<ScoredDocument> candidates = new ArrayList<>(documents.size());
    for (int i = 0; i < documents.size(); i++) {
      SearchDocument document = documents.get(i);
      double lexical = LexicalScorer.score(queryTokens, document.tokens());
      double score = Math.max(semantic.length > i ? semantic[i] : 0, lexical * lexical);
      if (score < threshold) {
        score = EXCLUDED;
      }
      candidates.add(
          new ScoredDocument(document.id(), document.name(), score - document.penalty()));
    }

    // Stable sorts applied from the least to the most significant key.
    candidates.sort(Comparator.comparing(ScoredDocument::id));
    candidates.sort(Comparator.comparing(ScoredDocument::name));
    candidates.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());

    List<ScoredDocument> top = candidates.subList(0, Math.min(maxResults, candidates.size()));
    if (top.isEmpty()) {
      return List.of();
    }
    double cutoff = top.get(0).score() * relativeThreshold;
    return top.stream().filter(hit -> hit.score() >= cutoff && hit.score() > 0).toList();
  }
}
