package uk.ac.ebi.biostudies.taxonomy_service.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/** A search hit resolved to its taxonomy record, with a score rescaled to [0, 1]. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"score", "id", "name", "metadata"})
public record TaxonomyMatch(double score, String id, String name, JsonNode metadata) {}
