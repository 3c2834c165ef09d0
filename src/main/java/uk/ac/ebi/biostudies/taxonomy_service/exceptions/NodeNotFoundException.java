package uk.ac.ebi.biostudies.taxonomy_service.exceptions;

import lombok.Getter;

/** The requested node id does not exist in the selected taxonomy. */
@Getter
public class NodeNotFoundException extends TaxonomyException {

  private final String nodeId;

  public NodeNotFoundException(String nodeId) {
    super("Node " + nodeId + " does not exist.");
    this.nodeId = nodeId;
  }
}
