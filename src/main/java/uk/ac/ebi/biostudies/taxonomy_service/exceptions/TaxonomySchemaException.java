package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

import java.util.List;
import lombok.Getter;

/** A taxonomy payload is missing required top-level or per-node fields. */
@Getter
public class TaxonomySchemaException extends InvalidTaxonomyException {

  private final List<String> violations;

  public TaxonomySchemaException(List<String> violations) {
    super("Invalid taxonomy payload: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }
}
