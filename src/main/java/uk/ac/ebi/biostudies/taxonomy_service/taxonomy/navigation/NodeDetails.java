package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.navigation;

import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;

/**
 * A node in its surroundings: ancestors from the root down to the immediate parent, the node itself
 * and its immediate children, all stripped of their own children.
 */
public record NodeDetails(
    List<TaxonomyNode> parents, TaxonomyNode node, List<TaxonomyNode> children) {}
