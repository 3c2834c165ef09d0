package uk.ac.ebi.biostudies.taxonomy_service.config;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Taxonomy service configuration loaded from application.properties.
 *
 * <p>This is a facade over the {@code taxonomy.*} properties: where taxonomies are read from, the
 * search defaults applied to REST queries and the origins allowed to call the API.
 */
@Getter
@Component
public class TaxonomyConfig {

  private final String dataSources;
  private final Double searchThreshold;
  private final Integer searchDefaultMaxResults;
  private final String corsAllowedOrigins;

  public TaxonomyConfig(
      @Value("${taxonomy.data-sources:}") String dataSources,
      @Value("${taxonomy.search.threshold:0.7}") Double searchThreshold,
      @Value("${taxonomy.search.default-max-results:50}") Integer searchDefaultMaxResults,
      @Value("${taxonomy.cors.allowed-origins:*}") String corsAllowedOrigins) {
    this.dataSources = dataSources;
    this.searchThreshold = searchThreshold;
    this.searchDefaultMaxResults = searchDefaultMaxResults;
    this.corsAllowedOrigins = corsAllowedOrigins;
  }

  /** Configured data source locations, in declaration order, without blanks. */
  public List<String> getDataSourceLocations() {
    return splitList(dataSources);
  }

  public String[] getCorsAllowedOriginList() {
    return splitList(corsAllowedOrigins).toArray(new String[0]);
  }

  private static List<String> splitList(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
