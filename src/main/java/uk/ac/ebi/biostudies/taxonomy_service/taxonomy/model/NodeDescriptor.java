package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat node entry of a {@link TaxonomyPayload}. A missing or empty {@code parent_id} declares a
 * root node.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "parent_id", "metadata"})
public class NodeDescriptor {

  @NotNull(message = "'id' is a required property")
  private String id;

  @NotNull(message = "'name' is a required property")
  private String name;

  @JsonProperty("parent_id")
  private String parentId;

  private JsonNode metadata;

  public NodeDescriptor(String id, String name) {
    this(id, name, null, null);
  }

  public NodeDescriptor(String id, String name, String parentId) {
    this(id, name, parentId, null);
  }
}
