package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

/** The requested taxonomy name, or the requested version of it, is not registered. */
public class TaxonomyNotFoundException extends TaxonomyException {

  public TaxonomyNotFoundException(String message) {
    super(message);
  }
}
