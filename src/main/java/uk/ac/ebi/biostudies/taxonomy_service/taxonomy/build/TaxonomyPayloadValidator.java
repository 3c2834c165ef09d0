package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomySchemaException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

/**
 * Checks a {@link TaxonomyPayload} against the taxonomy file contract before any node is
 * processed. The contract is declared with Bean Validation constraints on the payload classes.
 */
@Slf4j
@Component
public class TaxonomyPayloadValidator {

  private final Validator validator;

  public TaxonomyPayloadValidator(Validator validator) {
    this.validator = validator;
  }

  /**
   * Validates the payload and reports every violation at once.
   *
   * @param payload the raw taxonomy payload
   * @throws TaxonomySchemaException if the payload is missing or violates the contract
   */
  public void validate(TaxonomyPayload payload) {
    if (payload == null) {
      throw new TaxonomySchemaException(List.of("payload must not be null"));
    }
    Set<ConstraintViolation<TaxonomyPayload>> violations = validator.validate(payload);
    if (violations.isEmpty()) {
      return;
    }
    List<String> messages =
        violations.stream()
            .map(TaxonomyPayloadValidator::describe)
            .sorted()
            .toList();
    log.debug("Taxonomy payload {} rejected: {}", payload.getName(), messages);
    throw new TaxonomySchemaException(messages);
  }

  private static String describe(ConstraintViolation<?> violation) {
    String path = violation.getPropertyPath().toString();
    return path.isEmpty() ? violation.getMessage() : path + ": " + violation.getMessage();
  }
}
