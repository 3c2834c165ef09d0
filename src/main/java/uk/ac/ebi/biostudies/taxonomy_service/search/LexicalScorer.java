package uk.ac.ebi.biostudies.taxonomy_service.search;

import java.util.List;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;

/**
 * Word-level Jaro-Winkler similarity between a query and a document name.
 *
 * <p>Every query word is matched against its most similar document word. The per-word maxima are
 * combined with a power mean of exponent 4, which behaves like a soft minimum: a document has to
 * match every query word reasonably well to score high.
 */
public final class LexicalScorer {

  private static final JaroWinklerSimilarity JARO_WINKLER = new JaroWinklerSimilarity();
  private static final double EXPONENT = 4;

  private LexicalScorer() {}

  /**
   * @return the aggregated similarity in [0, 1]; 0 when the query has no words
   */
  public static double score(List<String> queryTokens, List<String> documentTokens) {
    if (queryTokens.isEmpty() || documentTokens.isEmpty()) {
      return 0;
    }
    double sum = 0;
    for (String queryToken : queryTokens) {
      double best = 0;
      for (String documentToken : documentTokens) {
        best = Math.max(best, JARO_WINKLER.apply(queryToken, documentToken));
      }
      sum += Math.pow(best, EXPONENT);
    }
    return Math.pow(sum / queryTokens.size(), 1 / EXPONENT);
  }
}
