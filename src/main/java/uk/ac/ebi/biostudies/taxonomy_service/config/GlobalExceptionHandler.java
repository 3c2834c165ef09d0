package uk.ac.ebi.biostudies.taxonomy_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.InvalidTaxonomyException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.NodeNotFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyDataIntegrityException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyLoadException;
import uk.ac.ebi.biostudies.taxonomy_service.exceptions.TaxonomyNotFoundException;
import uk.ac.ebi.biostudies.taxonomy_service.rest.ApiError;
import uk.ac.ebi.biostudies.taxonomy_service.rest.RestResponse;

@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(TaxonomyNotFoundException.class)
  public ResponseEntity<RestResponse<Void>> handleTaxonomyNotFound(TaxonomyNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, "TAXONOMY_NOT_FOUND", null, ex.getMessage());
  }

  @ExceptionHandler(NodeNotFoundException.class)
  public ResponseEntity<RestResponse<Void>> handleNodeNotFound(NodeNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, "NODE_NOT_FOUND", "nodeId", ex.getMessage());
  }

  @ExceptionHandler(InvalidTaxonomyException.class)
  public ResponseEntity<RestResponse<Void>> handleInvalidTaxonomy(InvalidTaxonomyException ex) {
    log.error("Taxonomy reload rejected: {}", ex.getMessage());
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_TAXONOMY", null, ex.getMessage());
  }

  @ExceptionHandler(TaxonomyLoadException.class)
  public ResponseEntity<RestResponse<Void>> handleLoadFailure(TaxonomyLoadException ex) {
    log.error("Taxonomy reload failed", ex);
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, "LOAD_FAILED", null, ex.getMessage());
  }

  @ExceptionHandler(TaxonomyDataIntegrityException.class)
  public ResponseEntity<RestResponse<Void>> handleDataIntegrity(TaxonomyDataIntegrityException ex) {
    log.error("Taxonomy data integrity violation", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DATA_INTEGRITY", null, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<RestResponse<Void>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    String message = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
    return respond(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", ex.getName(), message);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<RestResponse<Void>> handleNoResource(NoResourceFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", null, ex.getMessage());
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<RestResponse<Void>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex) {
    return respond(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", null, ex.getMessage());
  }

  // Catch-all for other exceptions
  @ExceptionHandler(Exception.class)
  public ResponseEntity<RestResponse<Void>> handleGeneric(Exception ex) {
    log.error("Unexpected error", ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", null, "Internal server error");
  }

  private static ResponseEntity<RestResponse<Void>> respond(
      HttpStatus status, String code, String field, String message) {
    ApiError error = new ApiError(code, field, message, status.value());
    return ResponseEntity.status(status).body(RestResponse.error(message, error));
  }
}
