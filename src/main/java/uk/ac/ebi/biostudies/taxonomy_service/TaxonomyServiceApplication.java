package uk.ac.ebi.biostudies.taxonomy_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxonomyServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaxonomyServiceApplication.class, args);
  }
}
