package uk.ac.ebi.biostudies.taxonomy_service.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.LangChainEmbeddingProvider;

/**
 * Semantic search configuration. Only active with {@code taxonomy.embedding.enabled=true}; without
 * it no {@link EmbeddingProvider} exists and taxonomies are searched lexically.
 */
@Getter
@Configuration
@ConditionalOnProperty(name = "taxonomy.embedding.enabled", havingValue = "true")
public class EmbeddingConfig {

  private final String openAiApiKey;
  private final String modelName;
  private final Integer timeoutSeconds;

  public EmbeddingConfig(
      @Value("${taxonomy.embedding.openai.api-key:}") String openAiApiKey,
      @Value("${taxonomy.embedding.openai.model-name:text-embedding-3-small}") String modelName,
      @Value("${taxonomy.embedding.timeout-seconds:60}") Integer timeoutSeconds) {
    this.openAiApiKey = openAiApiKey;
    this.modelName = modelName;
    this.timeoutSeconds = timeoutSeconds;
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(modelName)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .build();
  }

  @Bean
  public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel) {
    return new LangChainEmbeddingProvider(embeddingModel);
  }
}
