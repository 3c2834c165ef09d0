package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.NodeDescriptor;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

class TaxonomyPayloadMapperTest {

  private final TaxonomyPayloadMapper mapper = new TaxonomyPayloadMapper();

  @Test
  void testMapsNodesWithParentAndMetadata() {
    String json =
        """
        {"name": "vehicles", "version": "2024-01", "source": "ignored",
         "nodes": [
           {"id": "01000000", "name": "Car"},
           {"id": "01010000", "name": "Small car", "parent_id": "01000000",
            "metadata": {"seats": 4, "tags": ["city"]}}
         ]}
        """;

    TaxonomyPayload payload = mapper.fromJson(json, "vehicles.json");

    assertThat(payload.getName()).isEqualTo("vehicles");
    assertThat(payload.getVersion()).isEqualTo("2024-01");
    NodeDescriptor small = payload.getNodes().get(1);
    assertThat(small.getParentId()).isEqualTo("01000000");
    assertThat(small.getMetadata().get("seats").asInt()).isEqualTo(4);
    assertThat(small.getMetadata().get("tags").get(0).asText()).isEqualTo("city");
    assertThat(payload.getNodes().get(0).getMetadata()).isNull();
  }

  @Test
  void testLeavesMissingFieldsForValidation() {
    TaxonomyPayload payload = mapper.fromJson("{\"name\": \"partial\"}", "partial.json");

    assertThat(payload.getVersion()).isNull();
    assertThat(payload.getNodes()).isNull();
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  ", "\n"})
  void testRejectsEmptyDocument(String json) {
    assertThatThrownBy(() -> mapper.fromJson(json, "empty.json"))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessage("Empty taxonomy document in empty.json");
  }

  @Test
  void testRejectsJsonNull() {
    assertThatThrownBy(() -> mapper.fromJson("null", "null.json"))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessage("Taxonomy document in null.json is null");
  }

  @Test
  void testRejectsMalformedJson() {
    assertThatThrownBy(() -> mapper.fromJson("[1, 2", "broken.json"))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessage("Failed to parse taxonomy document in broken.json");
  }
}
