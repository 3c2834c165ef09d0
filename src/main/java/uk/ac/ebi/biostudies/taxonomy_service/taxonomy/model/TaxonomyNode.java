package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A single taxonomy entry as exposed to clients.
 *
 * <p>An empty child list is never carried: a node without children has {@code children == null},
 * so the attribute is absent from the serialized JSON. Metadata is an opaque JSON value and is
 * likewise omitted when the node has none.
 *
 * @param id node id, unique within its taxonomy
 * @param name display name
 * @param metadata opaque metadata, or {@code null}
 * @param children ordered child nodes, or {@code null} for a leaf
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "metadata", "children"})
public record TaxonomyNode(String id, String name, JsonNode metadata, List<TaxonomyNode> children) {

  public TaxonomyNode {
    Objects.requireNonNull(id, "id must not be null");
    children = children == null || children.isEmpty() ? null : List.copyOf(children);
  }

  /** Creates a node without children. */
  public static TaxonomyNode leaf(String id, String name, JsonNode metadata) {
    return new TaxonomyNode(id, name, metadata, null);
  }

  public boolean hasChildren() {
    return children != null;
  }

  /** Returns the children, or an empty list for a leaf. */
  public List<TaxonomyNode> childrenOrEmpty() {
    return children == null ? List.of() : children;
  }

  /** Returns a copy of this node stripped of its children. */
  public TaxonomyNode withoutChildren() {
    return children == null ? this : leaf(id, name, metadata);
  }
}
