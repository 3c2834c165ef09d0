package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.NodeDescriptor;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyTree;

/**
 * Flattens a {@link TaxonomyTree} back into the persisted node-list format.
 *
 * <p>Nodes are emitted breadth-first, so every parent precedes its children and the result can be
 * fed straight back into {@link TaxonomyTreeBuilder}. Sibling order is kept.
 */
@Slf4j
@Component
public class TaxonomyTreeSerializer {

  private final ObjectMapper objectMapper;

  public TaxonomyTreeSerializer() {
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public TaxonomyPayload toPayload(String name, String version, TaxonomyTree tree) {
    List<NodeDescriptor> nodes = new ArrayList<>(tree.size());
    Deque<Integer> queue = new ArrayDeque<>();
    for (int root : tree.rootHandles()) {
      queue.add(root);
    }
    while (!queue.isEmpty()) {
      int handle = queue.poll();
      int parent = tree.parentHandle(handle);
      nodes.add(
          new NodeDescriptor(
              tree.id(handle),
              tree.name(handle),
              parent == TaxonomyTree.NO_PARENT ? null : tree.id(parent),
              tree.metadata(handle)));
      for (int child : tree.childHandles(handle)) {
        queue.add(child);
      }
    }
    return new TaxonomyPayload(name, version, nodes);
  }

  /**
   * Writes the payload as a taxonomy JSON file, replacing any existing file.
   *
   * @throws TaxonomyLoadException if the file cannot be written
   */
  public void writeTo(TaxonomyPayload payload, Path file) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writeValue(file.toFile(), payload);
      log.info(
          "Wrote taxonomy {} version {} ({} nodes) to {}",
          payload.getName(),
          payload.getVersion(),
          payload.getNodes().size(),
          file);
    } catch (IOException e) {
      throw new TaxonomyLoadException("Failed to write taxonomy file " + file, e);
    }
  }

  public String toJson(TaxonomyPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (IOException e) {
      throw new TaxonomyLoadException("Failed to serialize taxonomy " + payload.getName(), e);
    }
  }
}
