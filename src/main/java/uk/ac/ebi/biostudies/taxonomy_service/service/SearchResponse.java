package uk.ac.ebi.biostudies.taxonomy_service.service;

import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.search.TaxonomyMatch;

public record SearchResponse(List<TaxonomyMatch> matches) {}
