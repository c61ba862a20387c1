package io.hookline.transport;

/**
 * Status and (possibly truncated) body of a receiver's answer.
 *
 * @param statusCode HTTP status code
 * @param body       response body text, empty when the receiver sent none
 */
public record TransportResponse(int statusCode, String body) {

  public TransportResponse {
    body = body == null ? "" : body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
