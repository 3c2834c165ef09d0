package uk.ac.ebi.biostudies.taxonomy_service.registry;

import java.util.List;

public record TaxonomyVersions(List<String> versions) {}
