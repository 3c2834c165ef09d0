package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

/**
 * Maps the JSON content of a taxonomy file into a {@link TaxonomyPayload}.
 *
 * <p>Only the JSON structure is checked here. Missing fields are left {@code null} and reported by
 * the payload validator when the tree is built. Unknown attributes are ignored.
 *
 * <pre>{@code
 * TaxonomyPayload payload = mapper.fromJson(json, "taxonomies/animals.json");
 * }</pre>
 */
@Slf4j
@Component
public class TaxonomyPayloadMapper {

  private final ObjectMapper objectMapper;

  public TaxonomyPayloadMapper() {
    objectMapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Parses one taxonomy document.
   *
   * @param json taxonomy file content
   * @param source where the content came from, used in error messages
   * @return the parsed payload
   * @throws TaxonomyLoadException if the content is empty or not a taxonomy document
   */
  public TaxonomyPayload fromJson(String json, String source) {
    String errorMessage;
    if (json == null || json.isBlank()) {
      errorMessage = "Empty taxonomy document in " + source;
      log.error(errorMessage);
      throw new TaxonomyLoadException(errorMessage);
    }

    try {
      TaxonomyPayload payload = objectMapper.readValue(json, TaxonomyPayload.class);
      if (payload == null) {
        throw new TaxonomyLoadException("Taxonomy document in " + source + " is null");
      }
      return payload;
    } catch (JsonProcessingException e) {
      errorMessage = "Failed to parse taxonomy document in " + source;
      log.error("{}: {}", errorMessage, e.getOriginalMessage());
      throw new TaxonomyLoadException(errorMessage, e);
    }
  }
}
