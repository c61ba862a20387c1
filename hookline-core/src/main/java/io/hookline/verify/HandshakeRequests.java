package io.hookline.verify;

import io.hookline.dispatch.WebhookHeaders;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shared plumbing for handshake POSTs. */
final class HandshakeRequests {

  private HandshakeRequests() {}

  static TransportResponse post(WebhookTransport transport, String url, String userAgent, String body)
      throws IOException {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(WebhookHeaders.CONTENT_TYPE, WebhookHeaders.JSON);
    headers.put(WebhookHeaders.USER_AGENT, userAgent);
    return transport.post(url, headers, body);
  }

  static String describe(IOException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
