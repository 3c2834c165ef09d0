package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

/**
 * Search results could not be resolved to exactly one taxonomy record. Indicates invalid taxonomy
 * data and is never resolved silently.
 */
public class TaxonomyDataIntegrityException extends TaxonomyException {

  public TaxonomyDataIntegrityException(String message) {
    super(message);
  }
}
