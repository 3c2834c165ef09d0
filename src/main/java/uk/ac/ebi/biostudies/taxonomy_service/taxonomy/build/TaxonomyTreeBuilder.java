package uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.DuplicateNodeIdException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.UnknownParentException;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.NodeDescriptor;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyTree;

/**
 * Assembles a {@link TaxonomyTree} from the flat node list of a {@link TaxonomyPayload}.
 *
 * <p>Nodes are processed in list order. A node whose {@code parent_id} is missing or empty becomes
 * a root; otherwise its parent must already have been declared earlier in the list. Sibling order
 * follows declaration order.
 *
 * <pre>{@code
 * TaxonomyTree tree = builder.buildTree(payload);
 * }</pre>
 */
@Slf4j
@Component
public class TaxonomyTreeBuilder {

  private final TaxonomyPayloadValidator payloadValidator;

  public TaxonomyTreeBuilder(TaxonomyPayloadValidator payloadValidator) {
    this.payloadValidator = payloadValidator;
  }

  /**
   * Validates the payload and builds its tree.
   *
   * @param payload raw taxonomy payload
   * @return the assembled tree
   * @throws uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomySchemaException if required
   *     fields are missing
   * @throws DuplicateNodeIdException if two nodes share an id
   * @throws UnknownParentException if a node references a parent not declared before it
   */
  public TaxonomyTree buildTree(TaxonomyPayload payload) {
    payloadValidator.validate(payload);

    TaxonomyTree.Builder builder = TaxonomyTree.builder();
    Map<String, Integer> handles = new HashMap<>();
    for (NodeDescriptor descriptor : payload.getNodes()) {
      String id = descriptor.getId();
      if (handles.containsKey(id)) {
        throw new DuplicateNodeIdException(id);
      }
      int parent = TaxonomyTree.NO_PARENT;
      String parentId = descriptor.getParentId();
      if (StringUtils.isNotEmpty(parentId)) {
        Integer parentHandle = handles.get(parentId);
        if (parentHandle == null) {
          throw new UnknownParentException(id, parentId);
        }
        parent = parentHandle;
      }
      handles.put(id, builder.add(id, descriptor.getName(), descriptor.getMetadata(), parent));
    }

    TaxonomyTree tree = builder.build();
    log.debug(
        "Built tree for taxonomy {} version {} with {} nodes",
        payload.getName(),
        payload.getVersion(),
        tree.size());
    return tree;
  }
}
