package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw taxonomy record as read from a data source or written to a taxonomy file.
 *
 * <pre>{@code
 * {"name": "animals", "version": "1.0", "nodes": [{"id": "1", "name": "Mammals"}, ...]}
 * }</pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaxonomyPayload {

  @NotNull(message = "'name' is a required property")
  private String name;

  @NotNull(message = "'version' is a required property")
  private String version;

  @NotNull(message = "'nodes' is a required property")
  private List<@NotNull(message = "node must not be null") @Valid NodeDescriptor> nodes;
}
