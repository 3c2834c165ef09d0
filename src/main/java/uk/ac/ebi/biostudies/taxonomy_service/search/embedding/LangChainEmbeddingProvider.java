package uk.ac.ebi.biostudies.taxonomy_service.search.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Slf4j
public class LangChainEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;

  public LangChainEmbeddingProvider(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  @Override
  public float[] embed(String text) {
    return embeddingModel.embed(text).content().vector();
  }

  @Override
  public List<float[]> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
    log.debug("Embedded {} taxonomy names", embeddings.size());
    return embeddings.stream().map(Embedding::vector).toList();
  }
}
