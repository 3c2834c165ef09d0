package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

/** A taxonomy data source could not read or parse its payloads. */
public class TaxonomyLoadException extends TaxonomyException {

  public TaxonomyLoadException(String message) {
    super(message);
  }

  public TaxonomyLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
