package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

import lombok.Getter;

/**
 * A node refers to a parent id that has not been declared yet. Parents must precede their
 * children in the node list.
 */
@Getter
public class UnknownParentException extends InvalidTaxonomyException {

  private final String nodeId;
  private final String parentId;

  public UnknownParentException(String nodeId, String parentId) {
    super(
        "Unknown parent id '"
            + parentId
            + "' for item '"
            + nodeId
            + "'; items must be declared before they can be used as parents");
    this.nodeId = nodeId;
    this.parentId = parentId;
  }
}
