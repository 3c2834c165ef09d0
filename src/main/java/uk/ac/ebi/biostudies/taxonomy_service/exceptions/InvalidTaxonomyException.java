package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

/**
 * Raised when a taxonomy payload cannot be turned into a tree.
 *
 * <p>These failures are unrecoverable for the offending payload and abort the registry reload that
 * triggered them. They are never retried.
 */
public abstract class InvalidTaxonomyException extends TaxonomyException {

  protected InvalidTaxonomyException(String message) {
    super(message);
  }
}
