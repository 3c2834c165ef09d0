package uk.ac.ebi.biostudies.taxonomy_service.search;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyDataIntegrityException;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;

/**
 * Presents {@link HybridSearcher} hits as full taxonomy records.
 *
 * <p>Scores of one result batch are min-max rescaled into [0, 1] and rounded to three decimals.
 * A batch with fewer than two hits, or with all scores equal, keeps its raw scores.
 */
public class NormalizedSearcher {

  static final String UNCATEGORIZED = "Uncategorized";
  private static final int SCORE_SCALE = 3;

  private final List<TaxonomyNode> records;
  private final HybridSearcher searcher;

  /**
   * @param records taxonomy records, stripped of children, with their metadata
   * @param embeddingProvider provider for semantic scoring, or {@code null}
   */
  public NormalizedSearcher(List<TaxonomyNode> records, EmbeddingProvider embeddingProvider) {
    this.records = List.copyOf(records);
    this.searcher = new HybridSearcher(this.records, embeddingProvider);
  }

  public boolean isSemanticEnabled() {
    return searcher.isSemanticEnabled();
  }

  /**
   * Resolves a hit id to its record.
   *
   * <p>Some taxonomies reuse an id for an unspecified bucket and for a category named {@value
   * #UNCATEGORIZED}. When an id is shared, the {@value #UNCATEGORIZED} record wins.
   *
   * @throws TaxonomyDataIntegrityException if the id is unknown or shared in any other way
   */
  public TaxonomyNode lookup(String id) {
    List<TaxonomyNode> matches = records.stream().filter(r -> r.id().equals(id)).toList();
    if (matches.size() > 1) {
      matches =
          matches.stream()
              .filter(r -> UNCATEGORIZED.equals(r.name()))
              .limit(1)
              .toList();
    }
    if (matches.size() != 1) {
      throw new TaxonomyDataIntegrityException(
          "Expected exactly one taxonomy record with id '" + id + "'");
    }
    return matches.get(0);
  }

  public List<TaxonomyMatch> search(String text, int maxResults, double threshold) {
    List<ScoredDocument> hits = searcher.search(text, maxResults, threshold);
    if (hits.isEmpty()) {
      return List.of();
    }

    double min = hits.stream().mapToDouble(ScoredDocument::score).min().getAsDouble();
    double max = hits.stream().mapToDouble(ScoredDocument::score).max().getAsDouble();
    boolean rescale = max - min > 0;

    List<TaxonomyMatch> matches = new ArrayList<>(hits.size());
    for (ScoredDocument hit : hits) {
      double score = rescale ? (hit.score() - min) / (max - min) : hit.score();
      TaxonomyNode record = lookup(hit.id());
      matches.add(new TaxonomyMatch(round(score), record.id(), record.name(), record.metadata()));
    }
    return matches;
  }

  public List<TaxonomyMatch> search(String text) {
    return search(text, HybridSearcher.DEFAULT_MAX_RESULTS, HybridSearcher.DEFAULT_THRESHOLD);
  }

  static double round(double score) {
    return new BigDecimal(score).setScale(SCORE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
  }
}
