package uk.ac.ebi.biostudies.taxonomy_service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build.TaxonomyPayloadValidator;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build.TaxonomyTreeBuilder;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.NodeDescriptor;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyNode;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

/** Shared fixtures for taxonomy tests. */
public final class TaxonomyTestDataFactory {

  public static final ObjectMapper MAPPER = new ObjectMapper();

  private TaxonomyTestDataFactory() {}

  public static TaxonomyTreeBuilder newTreeBuilder() {
    return new TaxonomyTreeBuilder(
        new TaxonomyPayloadValidator(Validation.buildDefaultValidatorFactory().getValidator()));
  }

  /**
   * The reference tree.
   *
   * <pre>
   * 1 One
   * +-- 2 Two
   * |   +-- 3 Three
   * +-- 4 Four
   * 5 Five
   * </pre>
   */
  public static TaxonomyPayload referencePayload() {
    return payload(
        "reference",
        "1.0",
        new NodeDescriptor("1", "One", null, metadata("{\"code\": \"A\"}")),
        new NodeDescriptor("2", "Two", "1"),
        new NodeDescriptor("3", "Three", "2"),
        new NodeDescriptor("4", "Four", "1"),
        new NodeDescriptor("5", "Five"));
  }

  public static TaxonomyPayload payload(String name, String version, NodeDescriptor... nodes) {
    return new TaxonomyPayload(name, version, new ArrayList<>(Arrays.asList(nodes)));
  }

  /** Flat, childless records whose ids equal their names. */
  public static List<TaxonomyNode> namedNodes(String... names) {
    return Arrays.stream(names).map(name -> TaxonomyNode.leaf(name, name, null)).toList();
  }

  public static JsonNode metadata(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
