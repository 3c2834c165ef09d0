package uk.ac.ebi.biostudies.taxonomy_service.search;

/** A ranked hit with its raw, penalized score. */
public record ScoredDocument(String id, String name, double score) {}
