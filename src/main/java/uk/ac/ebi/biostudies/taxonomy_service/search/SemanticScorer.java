package uk.ac.ebi.biostudies.taxonomy_service.search;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.util.VectorUtil;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;

/**
 * Cosine similarity between the embedding of a query and precomputed document embeddings.
 *
 * <p>Disabled, always scoring zero, when no provider is configured or the document embeddings
 * could not be computed. Queries shorter than {@value #MIN_QUERY_LENGTH} characters are not
 * embedded.
 */
@Slf4j
class SemanticScorer {

  static final int MIN_QUERY_LENGTH = 3;

  private final EmbeddingProvider provider;
  private final float[][] documentVectors;

  private SemanticScorer(EmbeddingProvider provider, float[][] documentVectors) {
    this.provider = provider;
    this.documentVectors = documentVectors;
  }

  static SemanticScorer disabled() {
    return new SemanticScorer(null, null);
  }

  /**
   * Embeds every document name up front. A provider failure disables semantic scoring for these
   * documents instead of failing.
   */
  static SemanticScorer create(EmbeddingProvider provider, List<SearchDocument> documents) {
    if (provider == null || documents.isEmpty()) {
      return disabled();
    }
    try {
      List<float[]> vectors =
          provider.embedAll(documents.stream().map(SearchDocument::name).toList());
      if (vectors == null || vectors.size() != documents.size()) {
        log.warn(
            "Embedding provider returned {} vectors for {} documents, semantic scoring disabled",
            vectors == null ? 0 : vectors.size(),
            documents.size());
        return disabled();
      }
      return new SemanticScorer(provider, vectors.toArray(new float[0][]));
    } catch (RuntimeException e) {
      log.warn("Failed to embed taxonomy names, semantic scoring disabled", e);
      return disabled();
    }
  }

  boolean isEnabled() {
    return provider != null && documentVectors != null;
  }

  /** Scores every document against the normalized query, in document order, clamped to >= 0. */
  double[] score(String normalizedQuery) {
    int size = documentVectors == null ? 0 : documentVectors.length;
    double[] scores = new double[size];
    if (!isEnabled() || normalizedQuery.length() < MIN_QUERY_LENGTH) {
      return scores;
    }
    float[] query;
    try {
      query = provider.embed(normalizedQuery);
    } catch (RuntimeException e) {
      log.warn("Failed to embed query '{}', falling back to lexical scoring", normalizedQuery, e);
      return scores;
    }
    if (query == null) {
      return scores;
    }
    for (int i = 0; i < size; i++) {
      scores[i] = cosine(query, documentVectors[i]);
    }
    return scores;
  }

  private static double cosine(float[] query, float[] document) {
    if (document == null || query.length != document.length || query.length == 0) {
      return 0;
    }
    float similarity = VectorUtil.cosine(query, document);
    return Float.isNaN(similarity) ? 0 : Math.max(0, similarity);
  }
}
