package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.taxonomy_service.config.S3Config;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;

/**
 * Reads taxonomy documents from S3-compatible object storage.
 *
 * <p>Objects are small JSON files and are read fully into memory.
 */
@Slf4j
@Service
public class S3TaxonomyObjectReader {

  static final String JSON_SUFFIX = ".json";

  private final AmazonS3 s3Client;

  public S3TaxonomyObjectReader(@Lazy @Qualifier(S3Config.S3_CLIENT) AmazonS3 s3Client) {
    this.s3Client = s3Client;
  }

  /**
   * Lists the keys of all JSON objects under a prefix, following every listing page.
   *
   * @param bucket bucket name
   * @param prefix key prefix, empty for the whole bucket
   * @return matching keys in listing order
   * @throws TaxonomyLoadException if the listing fails
   */
  public List<String> listJsonKeys(String bucket, String prefix) {
    List<String> keys = new ArrayList<>();
    ListObjectsV2Request request =
        new ListObjectsV2Request().withBucketName(bucket).withPrefix(prefix);
    try {
      ListObjectsV2Result result;
      do {
        result = s3Client.listObjectsV2(request);
        for (S3ObjectSummary summary : result.getObjectSummaries()) {
          if (summary.getKey().endsWith(JSON_SUFFIX)) {
            keys.add(summary.getKey());
          }
        }
        request.setContinuationToken(result.getNextContinuationToken());
      } while (result.isTruncated());
    } catch (AmazonClientException e) {
      log.error("Error listing S3 objects under s3://{}/{}", bucket, prefix, e);
      throw new TaxonomyLoadException(
          "Failed to list taxonomies under s3://" + bucket + "/" + prefix, e);
    }
    log.debug("Found {} taxonomy objects under s3://{}/{}", keys.size(), bucket, prefix);
    return keys;
  }

  /**
   * Reads an object as UTF-8 text.
   *
   * @throws TaxonomyLoadException if the object cannot be read
   */
  public String readObject(String bucket, String key) {
    log.debug("Accessing S3 object s3://{}/{}", bucket, key);
    try {
      return s3Client.getObjectAsString(bucket, key);
    } catch (AmazonClientException e) {
      log.error("Error reading S3 object s3://{}/{}", bucket, key, e);
      throw new TaxonomyLoadException("Failed to read taxonomy s3://" + bucket + "/" + key, e);
    }
  }
}
