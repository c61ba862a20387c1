package io.hookline.transport;

import java.io.IOException;
import java.util.Map;

/**
 * Outbound HTTP used for deliveries and verification handshakes.
 *
 * <p>Implementations must enforce a hard timeout on every call. A timeout, connection
 * failure or cancellation is reported as an {@link IOException}; any HTTP answer,
 * including 4xx and 5xx, is returned as a {@link TransportResponse}.
 *
 * @see OkHttpWebhookTransport
 */
public interface WebhookTransport extends AutoCloseable {

  /**
   * POSTs a JSON body to {@code url}.
   *
   * @param url     absolute target URL
   * @param headers request headers, sent in iteration order
   * @param body    JSON body
   * @return the receiver's answer
   * @throws IOException on timeout, network error or cancellation
   */
  TransportResponse post(String url, Map<String, String> headers, String body) throws IOException;

  /** Cancels in-flight calls and releases resources. */
  @Override
  default void close() {
  }
}
