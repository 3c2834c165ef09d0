package uk.ac.ebi.biostudies.taxonomy_service.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  private final TaxonomyConfig taxonomyConfig;

  public WebMvcConfig(TaxonomyConfig taxonomyConfig) {
    this.taxonomyConfig = taxonomyConfig;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    // Read endpoints are public
    registry
        .addMapping("/taxonomy/**")
        .allowedOrigins(taxonomyConfig.getCorsAllowedOriginList())
        .allowedMethods("GET", "OPTIONS")
        .allowedHeaders("*");

    registry
        .addMapping("/reload_data_sources/**")
        .allowedOrigins(taxonomyConfig.getCorsAllowedOriginList())
        .allowedMethods("POST", "OPTIONS")
        .allowedHeaders("*");
  }
}
