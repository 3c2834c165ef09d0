package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.taxonomy_service.config.TaxonomyConfig;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

/**
 * Loads taxonomy JSON files from the locations listed in {@code taxonomy.data-sources}.
 *
 * <p>The property holds a comma-separated list. Accepted formats:
 *
 * <ul>
 *   <li>{@code path/to/file.json}: a single local file
 *   <li>{@code path/to/dir/}: every {@code *.json} file below the directory, recursively
 *   <li>{@code s3://bucket/path/to/file.json}: a single object
 *   <li>{@code s3://bucket/path/to/prefix/}: every {@code *.json} object under the prefix
 * </ul>
 *
 * <p>A location ending with {@code /} is a directory or prefix; anything else is a single file.
 * Payloads are returned in location order; files of a directory in path order.
 */
@Component
public class JsonFileTaxonomyDataSource implements TaxonomyDataSource {

  static final String S3_SCHEME = "s3://";
  private static final String JSON_SUFFIX = ".json";

  private final TaxonomyConfig taxonomyConfig;
  private final TaxonomyPayloadMapper payloadMapper;
  private final S3TaxonomyObjectReader s3Reader;

  private final Logger logger = LogManager.getLogger(JsonFileTaxonomyDataSource.class.getName());

  public JsonFileTaxonomyDataSource(
      TaxonomyConfig taxonomyConfig,
      TaxonomyPayloadMapper payloadMapper,
      S3TaxonomyObjectReader s3Reader) {
    this.taxonomyConfig = taxonomyConfig;
    this.payloadMapper = payloadMapper;
    this.s3Reader = s3Reader;
  }

  @Override
  public List<TaxonomyPayload> loadTaxonomies() {
    List<String> locations = taxonomyConfig.getDataSourceLocations();
    logger.info("JSON file data source locations: {}", locations);
    List<TaxonomyPayload> payloads = new ArrayList<>();
    for (String location : locations) {
      if (location.startsWith(S3_SCHEME)) {
        payloads.addAll(fromS3(location));
      } else if (location.endsWith("/")) {
        payloads.addAll(fromLocalDirectory(Paths.get(location)));
      } else {
        payloads.add(fromLocalFile(Paths.get(location)));
      }
    }
    return payloads;
  }

  private List<TaxonomyPayload> fromS3(String location) {
    String bucketAndKey = StringUtils.removeStart(location, S3_SCHEME);
    int separator = bucketAndKey.indexOf('/');
    if (separator <= 0) {
      throw new TaxonomyLoadException(
          "Invalid S3 source: `" + location + "`; must be in format `s3://bucket_name/...`");
    }
    String bucket = bucketAndKey.substring(0, separator);
    String key = bucketAndKey.substring(separator + 1);

    if (!location.endsWith("/")) {
      return List.of(fromS3Object(bucket, key));
    }
    List<TaxonomyPayload> payloads = new ArrayList<>();
    for (String objectKey : s3Reader.listJsonKeys(bucket, key)) {
      payloads.add(fromS3Object(bucket, objectKey));
    }
    return payloads;
  }

  private TaxonomyPayload fromS3Object(String bucket, String key) {
    logger.info("Reading taxonomy from S3: s3://{}/{}", bucket, key);
    String source = S3_SCHEME + bucket + "/" + key;
    return payloadMapper.fromJson(s3Reader.readObject(bucket, key), source);
  }

  private List<TaxonomyPayload> fromLocalDirectory(Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new TaxonomyLoadException("Taxonomy directory not found: " + directory);
    }
    List<Path> files;
    try (Stream<Path> walk = Files.walk(directory)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(path -> path.getFileName().toString().endsWith(JSON_SUFFIX))
              .sorted()
              .toList();
    } catch (IOException e) {
      throw new TaxonomyLoadException("Failed to scan taxonomy directory " + directory, e);
    }
    logger.debug("Found {} taxonomy files in {}", files.size(), directory);
    List<TaxonomyPayload> payloads = new ArrayList<>(files.size());
    for (Path file : files) {
      payloads.add(fromLocalFile(file));
    }
    return payloads;
  }

  private TaxonomyPayload fromLocalFile(Path file) {
    logger.info("Reading taxonomy from local file: {}", file);
    String json;
    try {
      json = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TaxonomyLoadException("Failed to read taxonomy file " + file, e);
    }
    return payloadMapper.fromJson(json, file.toString());
  }
}
