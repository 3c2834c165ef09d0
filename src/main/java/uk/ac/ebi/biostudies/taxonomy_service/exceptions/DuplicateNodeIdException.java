package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

import lombok.Getter;

/** Two nodes of the same taxonomy payload share an id. */
@Getter
public class DuplicateNodeIdException extends InvalidTaxonomyException {

  private final String nodeId;

  public DuplicateNodeIdException(String nodeId) {
    super("Duplicate item id '" + nodeId + "'");
    this.nodeId = nodeId;
  }
}
