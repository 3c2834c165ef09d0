package uk.ac.ebi.biostudies.taxonomy_service.registry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.taxonomy_service.datasource.TaxonomyDataSource;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyNotFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.search.embedding.EmbeddingProvider;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.build.TaxonomyTreeBuilder;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyTree;

/**
 * Holds every loaded taxonomy, keyed by name and version.
 *
 * <p>The registry content is an immutable snapshot behind an {@link AtomicReference}. Readers never
 * lock. {@link #reload()} is serialized by a lock, rebuilds a complete new snapshot from the data
 * sources and publishes it with a single write. If any payload fails, the reload throws and the
 * previous snapshot stays in place.
 */
@Slf4j
@Service
public class TaxonomyRegistry {

  private final List<TaxonomyDataSource> dataSources;
  private final TaxonomyTreeBuilder treeBuilder;
  private final EmbeddingProvider embeddingProvider;

  private final ReentrantLock reloadLock = new ReentrantLock();
  private final AtomicReference<Snapshot> snapshot =
      new AtomicReference<>(new Snapshot(Collections.emptyMap(), null));

  public TaxonomyRegistry(
      List<TaxonomyDataSource> dataSources,
      TaxonomyTreeBuilder treeBuilder,
      Optional<EmbeddingProvider> embeddingProvider) {
    this.dataSources = dataSources;
    this.treeBuilder = treeBuilder;
    this.embeddingProvider = embeddingProvider.orElse(null);
  }

  /**
   * Returns a taxonomy version.
   *
   * @param name taxonomy name
   * @param version version, or {@code null}/empty for the lexicographically greatest version. The
   *     comparison is plain string order, so {@code "1.9"} is newer than {@code "1.10"}.
   * @throws TaxonomyNotFoundException if the name or the given version is not registered
   */
  public Taxonomy get(String name, String version) {
    Map<String, NavigableMap<String, Taxonomy>> taxonomies = snapshot.get().taxonomies();
    NavigableMap<String, Taxonomy> versions = taxonomies.get(name);
    if (versions == null || versions.isEmpty()) {
      throw new TaxonomyNotFoundException(
          "Taxonomy " + name + " does not exist. Available: " + taxonomies.keySet());
    }
    if (StringUtils.isEmpty(version)) {
      return versions.lastEntry().getValue();
    }
    Taxonomy taxonomy = versions.get(version);
    if (taxonomy == null) {
      throw new TaxonomyNotFoundException(
          "Version "
              + version
              + " does not exist for taxonomy "
              + name
              + ". Available: "
              + versions.keySet());
    }
    return taxonomy;
  }

  public Taxonomy get(String name) {
    return get(name, "");
  }

  /**
   * Rebuilds the registry from all data sources and swaps it in.
   *
   * @throws uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyException if any data source
   *     or payload fails; the previous content is kept
   */
  public void reload() {
    reloadLock.lock();
    try {
      log.info("Reloading taxonomies from {} data source(s)", dataSources.size());
      Map<String, NavigableMap<String, Taxonomy>> taxonomies = new TreeMap<>();
      for (TaxonomyDataSource dataSource : dataSources) {
        for (TaxonomyPayload payload : dataSource.loadTaxonomies()) {
          Taxonomy taxonomy = buildTaxonomy(payload);
          Taxonomy replaced =
              taxonomies
                  .computeIfAbsent(taxonomy.getName(), key -> new TreeMap<>())
                  .put(taxonomy.getVersion(), taxonomy);
          if (replaced != null) {
            log.warn(
                "Taxonomy {} version {} was loaded more than once, keeping the last one",
                taxonomy.getName(),
                taxonomy.getVersion());
          }
          log.info(
              "Registered: taxonomy={} version={} nodes={}",
              taxonomy.getName(),
              taxonomy.getVersion(),
              taxonomy.nodeCount());
        }
      }

      Map<String, NavigableMap<String, Taxonomy>> frozen = new TreeMap<>();
      taxonomies.forEach(
          (name, versions) -> frozen.put(name, Collections.unmodifiableNavigableMap(versions)));
      snapshot.set(new Snapshot(Collections.unmodifiableMap(frozen), Instant.now()));
      log.info("Taxonomy reload completed: {} taxonomies", frozen.size());
    } finally {
      reloadLock.unlock();
    }
  }

  public AvailableTaxonomies availableTaxonomies() {
    Snapshot current = snapshot.get();
    Map<String, TaxonomyVersions> taxonomies = new LinkedHashMap<>();
    current
        .taxonomies()
        .forEach(
            (name, versions) ->
                taxonomies.put(name, new TaxonomyVersions(List.copyOf(versions.keySet()))));
    return new AvailableTaxonomies(current.lastLoadTime(), taxonomies);
  }

  private Taxonomy buildTaxonomy(TaxonomyPayload payload) {
    TaxonomyTree tree = treeBuilder.buildTree(payload);
    Taxonomy taxonomy =
        new Taxonomy(payload.getName(), payload.getVersion(), tree, embeddingProvider);
    if (embeddingProvider != null
        && !tree.isEmpty()
        && !taxonomy.getSearcher().isSemanticEnabled()) {
      log.warn(
          "Semantic search disabled for taxonomy {} version {}",
          payload.getName(),
          payload.getVersion());
    }
    return taxonomy;
  }

  private record Snapshot(
      Map<String, NavigableMap<String, Taxonomy>> taxonomies, Instant lastLoadTime) {}
}
