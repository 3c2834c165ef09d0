package uk.ac.ebi.biostudies.taxonomy_service.rest;

import java.util.List;

/** Envelope for failed requests; successful responses return their payload directly. */
public record RestResponse<T>(boolean success, String message, T data, List<ApiError> errors) {

  public static RestResponse<Void> error(String msg, List<ApiError> errors) {
    return new RestResponse<>(false, msg, null, errors);
  }

  public static RestResponse<Void> error(String msg, ApiError error) {
    return error(msg, List.of(error));
  }
}
