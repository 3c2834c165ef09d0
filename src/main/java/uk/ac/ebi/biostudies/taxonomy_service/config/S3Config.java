package uk.ac.ebi.biostudies.taxonomy_service.config;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * S3 configuration for taxonomy files kept in object storage.
 *
 * <p>The client is created lazily, on the first {@code s3://} data source. With an explicit
 * endpoint the client uses path-style access, as S3-compatible stores expect; otherwise the region
 * decides. Static credentials are used when both keys are set, the default AWS provider chain
 * otherwise.
 */
@Slf4j
@Getter
@Configuration
public class S3Config {

  public static final String S3_CLIENT = "TaxonomyS3Client";

  private final String endpoint;
  private final String region;
  private final String credentialsAccessKey;
  private final String credentialsSecretKey;
  private final Integer connectionTimeout;
  private final Integer connectionSocketTimeout;

  public S3Config(
      @Value("${s3.endpoint:}") String endpoint,
      @Value("${s3.region:}") String region,
      @Value("${s3.credentials.access-key:}") String credentialsAccessKey,
      @Value("${s3.credentials.secret-key:}") String credentialsSecretKey,
      @Value("${s3.connection.timeout:3000}") Integer connectionTimeout,
      @Value("${s3.connection.socket.timeout:3000}") Integer connectionSocketTimeout) {
    this.endpoint = endpoint;
    this.region = region;
    this.credentialsAccessKey = credentialsAccessKey;
    this.credentialsSecretKey = credentialsSecretKey;
    this.connectionTimeout = connectionTimeout;
    this.connectionSocketTimeout = connectionSocketTimeout;
  }

  private AWSCredentialsProvider credentialsProvider() {
    if (StringUtils.isNoneBlank(credentialsAccessKey, credentialsSecretKey)) {
      return new AWSStaticCredentialsProvider(
          new BasicAWSCredentials(credentialsAccessKey, credentialsSecretKey));
    }
    return DefaultAWSCredentialsProviderChain.getInstance();
  }

  @Lazy
  @Bean(S3_CLIENT)
  public AmazonS3 taxonomyS3Client() {
    AmazonS3ClientBuilder builder =
        AmazonS3ClientBuilder.standard()
            .withClientConfiguration(
                new ClientConfiguration()
                    .withConnectionTimeout(connectionTimeout)
                    .withSocketTimeout(connectionSocketTimeout))
            .withCredentials(credentialsProvider());
    if (StringUtils.isNotBlank(endpoint)) {
      builder
          .withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(endpoint, region))
          .withPathStyleAccessEnabled(true);
    } else if (StringUtils.isNotBlank(region)) {
      builder.withRegion(region);
    }
    log.info("Creating S3 client for taxonomy data sources, endpoint={}", endpoint);
    return builder.build();
  }
}
