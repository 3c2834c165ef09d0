package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

/**
 * Umbrella exception for all taxonomy-related errors.
 *
 * <p>Loading, building, navigating and searching taxonomies report failures through subclasses of
 * this exception, so callers can catch a single unchecked type instead of handling each failure
 * separately.
 */
public class TaxonomyException extends RuntimeException {

  public TaxonomyException(String message) {
    super(message);
  }

  public TaxonomyException(String message, Throwable cause) {
    super(message, cause);
  }
}
