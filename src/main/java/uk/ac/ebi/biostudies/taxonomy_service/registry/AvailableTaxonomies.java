package uk.ac.ebi.biostudies.taxonomy_service.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

/**
 * Registered taxonomy names with their sorted versions.
 *
 * @param lastLoadTime completion time of the last successful reload, {@code null} before the first
 * @param taxonomies versions per taxonomy name, ordered by name
 */
public record AvailableTaxonomies(
    @JsonProperty("last_load_time") Instant lastLoadTime,
    Map<String, TaxonomyVersions> taxonomies) {}
