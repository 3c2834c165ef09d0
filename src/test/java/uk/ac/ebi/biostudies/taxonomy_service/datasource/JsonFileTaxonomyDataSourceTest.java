package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.ac.ebi.biostudies.taxonomy_service.config.TaxonomyConfig;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

@ExtendWith(MockitoExtension.class)
class JsonFileTaxonomyDataSourceTest {

  private static final String ANIMALS =
      """
      {"name": "animals", "version": "1.0",
       "nodes": [{"id": "1", "name": "Mammals"}, {"id": "2", "name": "Dogs", "parent_id": "1"}]}
      """;

  private static final String PLANTS =
      """
      {"name": "plants", "version": "2024-01", "nodes": [{"id": "1", "name": "Trees"}]}
      """;

  @Mock private S3TaxonomyObjectReader s3Reader;

  @TempDir Path tempDir;

  private JsonFileTaxonomyDataSource dataSource(String locations) {
    return new JsonFileTaxonomyDataSource(
        new TaxonomyConfig(locations, 0.7, 50, "*"), new TaxonomyPayloadMapper(), s3Reader);
  }

  @Test
  void testNoLocationsLoadsNothing() {
    assertThat(dataSource("").loadTaxonomies()).isEmpty();
    verifyNoInteractions(s3Reader);
  }

  @Test
  void testLoadsSingleLocalFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("animals.json"), ANIMALS);

    List<TaxonomyPayload> payloads = dataSource(file.toString()).loadTaxonomies();

    assertThat(payloads).hasSize(1);
    TaxonomyPayload payload = payloads.get(0);
    assertThat(payload.getName()).isEqualTo("animals");
    assertThat(payload.getNodes()).hasSize(2);
    assertThat(payload.getNodes().get(1).getParentId()).isEqualTo("1");
  }

  @Test
  void testScansDirectoryRecursivelyInPathOrder() throws IOException {
    Files.createDirectories(tempDir.resolve("b"));
    Files.writeString(tempDir.resolve("b/plants.json"), PLANTS);
    Files.writeString(tempDir.resolve("a.json"), ANIMALS);
    Files.writeString(tempDir.resolve("notes.txt"), "not a taxonomy");

    List<TaxonomyPayload> payloads = dataSource(tempDir + "/").loadTaxonomies();

    assertThat(payloads).extracting(TaxonomyPayload::getName).containsExactly("animals", "plants");
  }

  @Test
  void testMissingDirectoryFails() {
    String missing = tempDir.resolve("missing") + "/";

    assertThatThrownBy(() -> dataSource(missing).loadTaxonomies())
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageStartingWith("Taxonomy directory not found");
  }

  @Test
  void testMissingFileFails() {
    String missing = tempDir.resolve("missing.json").toString();

    assertThatThrownBy(() -> dataSource(missing).loadTaxonomies())
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("missing.json");
  }

  @Test
  void testMalformedFileFails() throws IOException {
    Path file = Files.writeString(tempDir.resolve("broken.json"), "{\"name\": ");

    assertThatThrownBy(() -> dataSource(file.toString()).loadTaxonomies())
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessage("Failed to parse taxonomy document in " + file);
  }

  @Test
  void testLoadsSingleS3Object() {
    when(s3Reader.readObject("bucket", "taxonomies/animals.json")).thenReturn(ANIMALS);

    List<TaxonomyPayload> payloads =
        dataSource("s3://bucket/taxonomies/animals.json").loadTaxonomies();

    assertThat(payloads).extracting(TaxonomyPayload::getVersion).containsExactly("1.0");
  }

  @Test
  void testLoadsEveryObjectUnderS3Prefix() {
    when(s3Reader.listJsonKeys("bucket", "taxonomies/"))
        .thenReturn(List.of("taxonomies/animals.json", "taxonomies/plants.json"));
    when(s3Reader.readObject("bucket", "taxonomies/animals.json")).thenReturn(ANIMALS);
    when(s3Reader.readObject("bucket", "taxonomies/plants.json")).thenReturn(PLANTS);

    List<TaxonomyPayload> payloads = dataSource("s3://bucket/taxonomies/").loadTaxonomies();

    assertThat(payloads).extracting(TaxonomyPayload::getName).containsExactly("animals", "plants");
  }

  @Test
  void testCombinesLocationsInOrder() throws IOException {
    Path file = Files.writeString(tempDir.resolve("animals.json"), ANIMALS);
    when(s3Reader.readObject("bucket", "plants.json")).thenReturn(PLANTS);

    List<TaxonomyPayload> payloads =
        dataSource(" s3://bucket/plants.json , " + file).loadTaxonomies();

    assertThat(payloads).extracting(TaxonomyPayload::getName).containsExactly("plants", "animals");
  }

  @Test
  void testS3LocationWithoutBucketSeparatorFails() {
    assertThatThrownBy(() -> dataSource("s3://bucket").loadTaxonomies())
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessage("Invalid S3 source: `s3://bucket`; must be in format `s3://bucket_name/...`");
    verifyNoInteractions(s3Reader);
  }
}
