package uk.ac.ebi.biostudies.taxonomy_service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import uk.ac.ebi.biostudies.taxonomy_service.registry.TaxonomyRegistry;

/**
 * Loads the taxonomy registry once the application has started.
 *
 * <p>Requests arriving before the first load completes see an empty registry.
 */
@Slf4j
@Service
public class InitializationService {

  private final TaxonomyRegistry taxonomyRegistry;

  public InitializationService(TaxonomyRegistry taxonomyRegistry) {
    this.taxonomyRegistry = taxonomyRegistry;
  }

  /**
   * Performs the first registry load when the application publishes an {@link
   * ApplicationReadyEvent}.
   *
   * @throws IllegalStateException if the taxonomies cannot be loaded
   */
  @EventListener(ApplicationReadyEvent.class)
  public void initialize() {
    log.info("Initializing taxonomy registry...");
    try {
      taxonomyRegistry.reload();
      log.info(
          "Taxonomy registry ready: {}",
          taxonomyRegistry.availableTaxonomies().taxonomies().keySet());
    } catch (Exception e) {
      log.error("Taxonomy registry initialization failed", e);
      throw new IllegalStateException("Failed to initialize taxonomy registry", e);
    }
  }
}
