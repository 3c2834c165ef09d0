package uk.ac.ebi.biostudies.taxonomy_service.search.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Source of dense vectors for taxonomy names and search queries. Implementations may call remote
 * services and are allowed to fail with any runtime exception; search degrades to lexical scoring
 * when they do.
 */
public interface EmbeddingProvider {

  float[] embed(String text);

  default List<float[]> embedAll(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embed(text));
    }
    return vectors;
  }
}
