package uk.ac.ebi.biostudies.taxonomy_service.rest;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.ac.ebi.biostudies.taxonomy_service.registry.AvailableTaxonomies;
import uk.ac.ebi.biostudies.taxonomy_service.service.SearchResponse;
import uk.ac.ebi.biostudies.taxonomy_service.service.TaxonomyQueryService;
import uk.ac.ebi.biostudies.taxonomy_service.service.TreeResponse;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.Branch;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation.NodeDetails;

/**
 * REST endpoints for browsing and searching taxonomies.
 *
 * <p>Every taxonomy endpoint exists in a versioned form, {@code
 * /taxonomy/{taxonomy}/{version}/...}, and an unversioned form that serves the latest version.
 */
@RestController
public class TaxonomyController {

  private static final String LATEST = "";

  private final TaxonomyQueryService queryService;

  public TaxonomyController(TaxonomyQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping(
      value = {"/taxonomy/", "/taxonomy"},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AvailableTaxonomies availableTaxonomies() {
    return queryService.availableTaxonomies();
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/{version}/tree",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public TreeResponse tree(@PathVariable String taxonomy, @PathVariable String version) {
    return queryService.getTree(taxonomy, version);
  }

  @GetMapping(value = "/taxonomy/{taxonomy}/tree", produces = MediaType.APPLICATION_JSON_VALUE)
  public TreeResponse latestTree(@PathVariable String taxonomy) {
    return queryService.getTree(taxonomy, LATEST);
  }

  @GetMapping(
      value = {"/taxonomy/{taxonomy}/{version}/branch/", "/taxonomy/{taxonomy}/{version}/branch"},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Branch rootBranch(@PathVariable String taxonomy, @PathVariable String version) {
    return queryService.getBranch(taxonomy, version, null);
  }

  @GetMapping(
      value = {"/taxonomy/{taxonomy}/branch/", "/taxonomy/{taxonomy}/branch"},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Branch latestRootBranch(@PathVariable String taxonomy) {
    return queryService.getBranch(taxonomy, LATEST, null);
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/{version}/branch/{nodeId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Branch branch(
      @PathVariable String taxonomy, @PathVariable String version, @PathVariable String nodeId) {
    return queryService.getBranch(taxonomy, version, nodeId);
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/branch/{nodeId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Branch latestBranch(@PathVariable String taxonomy, @PathVariable String nodeId) {
    return queryService.getBranch(taxonomy, LATEST, nodeId);
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/{version}/node/{nodeId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public NodeDetails node(
      @PathVariable String taxonomy, @PathVariable String version, @PathVariable String nodeId) {
    return queryService.getNode(taxonomy, version, nodeId);
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/node/{nodeId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public NodeDetails latestNode(@PathVariable String taxonomy, @PathVariable String nodeId) {
    return queryService.getNode(taxonomy, LATEST, nodeId);
  }

  @GetMapping(
      value = "/taxonomy/{taxonomy}/{version}/search",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public SearchResponse search(
      @PathVariable String taxonomy,
      @PathVariable String version,
      @RequestParam(defaultValue = "") String query,
      @RequestParam(name = "n", required = false) Integer maxResults) {
    return queryService.search(taxonomy, version, query, maxResults);
  }

  @GetMapping(value = "/taxonomy/{taxonomy}/search", produces = MediaType.APPLICATION_JSON_VALUE)
  public SearchResponse latestSearch(
      @PathVariable String taxonomy,
      @RequestParam(defaultValue = "") String query,
      @RequestParam(name = "n", required = false) Integer maxResults) {
    return queryService.search(taxonomy, LATEST, query, maxResults);
  }

  /** Reloads every data source; answers like {@code GET /taxonomy/} on success. */
  @PostMapping(
      value = {"/reload_data_sources/", "/reload_data_sources"},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AvailableTaxonomies reloadDataSources() {
    return queryService.reload();
  }
}
