package uk.ac.ebi.biostudies.taxonomy_service.service;

import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;

public record TreeResponse(List<TaxonomyNode> tree) {}
