package uk.ac.ebi.biostudies.taxonomy_service.search;

import java.util.List;

/**
 * Searchable projection of a taxonomy node.
 *
 * @param id node id
 * @param name normalized node name
 * @param tokens words of the normalized name, never empty
 * @param penalty depth penalty subtracted from the score of this document
 */
public record SearchDocument(String id, String name, List<String> tokens, double penalty) {}
