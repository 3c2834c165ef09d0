package uk.ac.ebi.biostudies.taxonomy_service.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.taxonomy_service.config.TaxonomyConfig;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.NodeNotFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.registry.AvailableTaxonomies;
import uk.ac.ebi.biostudies.taxonomy_service.registry.Taxonomy;
import uk.ac.ebi.biostudies.taxonomy_service.registry.TaxonomyRegistry;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.Branch;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.NodeDetails;

/**
 * Read and reload operations offered to the REST layer.
 *
 * <p>An empty or {@code null} version selects the latest version of a taxonomy. Unknown taxonomy
 * names and versions raise {@link
 * uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyNotFoundException}.
 */
@Slf4j
@Service
public class TaxonomyQueryService {

  private final TaxonomyRegistry registry;
  private final TaxonomyConfig taxonomyConfig;

  public TaxonomyQueryService(TaxonomyRegistry registry, TaxonomyConfig taxonomyConfig) {
    this.registry = registry;
    this.taxonomyConfig = taxonomyConfig;
  }

  public AvailableTaxonomies availableTaxonomies() {
    return registry.availableTaxonomies();
  }

  public TreeResponse getTree(String taxonomyName, String version) {
    return new TreeResponse(registry.get(taxonomyName, version).getRootNodes());
  }

  /**
   * @param nodeId parent node id, or {@code null} for the root level
   * @return the branch, empty when the node does not exist
   */
  public Branch getBranch(String taxonomyName, String version, String nodeId) {
    return registry.get(taxonomyName, version).getBranch(nodeId);
  }

  public NodeDetails getNode(String taxonomyName, String version, String nodeId) {
    return registry
        .get(taxonomyName, version)
        .getNode(nodeId)
        .orElseThrow(() -> new NodeNotFoundException(nodeId));
  }

  /**
   * Searches a taxonomy with the configured score threshold.
   *
   * @param maxResults maximum number of matches, or {@code null} for the configured default
   */
  public SearchResponse search(
      String taxonomyName, String version, String query, Integer maxResults) {
    Taxonomy taxonomy = registry.get(taxonomyName, version);
    int limit = maxResults == null ? taxonomyConfig.getSearchDefaultMaxResults() : maxResults;
    log.debug(
        "Searching taxonomy {} version {} for '{}' (max {})",
        taxonomy.getName(),
        taxonomy.getVersion(),
        query,
        limit);
    return new SearchResponse(
        taxonomy.search(query, limit, taxonomyConfig.getSearchThreshold()));
  }

  /** Reloads every data source and returns the resulting registry content. */
  public AvailableTaxonomies reload() {
    registry.reload();
    return registry.availableTaxonomies();
  }
}
