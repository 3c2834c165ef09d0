package uk.ac.ebi.biostudies.taxonomy_service.datasource;

import java.util.List;
import uk.ac.ebi.biostudies.taxonomy_service.taxonomy.model.TaxonomyPayload;

/** Supplies raw taxonomy payloads to the registry on every reload. */
public interface TaxonomyDataSource {

  /**
   * Reads every taxonomy this source knows about.
   *
   * @return payloads in a stable order; later payloads win over earlier ones with the same name and
   *     version
   * @throws uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException if the source
   *     cannot be read or parsed
   */
  List<TaxonomyPayload> loadTaxonomies();
}
