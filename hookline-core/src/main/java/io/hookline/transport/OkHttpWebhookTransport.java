package io.hookline.transport;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebhookTransport} backed by OkHttp.
 *
 * <p>Redirects are not followed: a 3xx answer counts as a failed delivery. Response bodies
 * are read up to {@value #MAX_BODY_BYTES} bytes.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class OkHttpWebhookTransport implements WebhookTransport {
  private static final Logger logger = Logger.getLogger(OkHttpWebhookTransport.class.getName());

  static final long MAX_BODY_BYTES = 64 * 1024;
  private static final MediaType JSON = MediaType.get("application/json");

  private final OkHttpClient client;

  private OkHttpWebhookTransport(Builder builder) {
    OkHttpClient base = builder.client != null ? builder.client : new OkHttpClient();
    this.client = base.newBuilder()
        .connectTimeout(builder.connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(builder.readTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .callTimeout(builder.callTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public TransportResponse post(String url, Map<String, String> headers, String body) throws IOException {
    Request.Builder request = new Request.Builder();
    try {
      request.url(url);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid target URL: " + url, e);
    }
    request.post(RequestBody.create(body, JSON));
    headers.forEach(request::header);

    try (Response response = client.newCall(request.build()).execute()) {
      ResponseBody responseBody = response.peekBody(MAX_BODY_BYTES);
      return new TransportResponse(response.code(), responseBody.string());
    }
  }

  /** Cancels queued and running calls, then shuts the dispatcher and connection pool down. */
  @Override
  public void close() {
    client.dispatcher().cancelAll();
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
    logger.log(Level.FINE, "OkHttp transport closed");
  }

  /** Builder for {@link OkHttpWebhookTransport}. */
  public static final class Builder {
    private OkHttpClient client;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);
    private Duration callTimeout = Duration.ofSeconds(10);

    private Builder() {}

    /**
     * Sets a base client whose pools and interceptors are shared. Timeouts and redirect
     * settings are overridden.
     *
     * <p>Optional.
     */
    public Builder client(OkHttpClient client) {
      this.client = client;
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
      return this;
    }

    /** Optional. Defaults to 10 seconds. */
    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = requirePositive(readTimeout, "readTimeout");
      return this;
    }

    /**
     * Sets the hard bound on a whole call, from DNS lookup to the last body byte.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = requirePositive(callTimeout, "callTimeout");
      return this;
    }

    public OkHttpWebhookTransport build() {
      return new OkHttpWebhookTransport(this);
    }

    private static Duration requirePositive(Duration value, String name) {
      Objects.requireNonNull(value, name);
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(name + " must be > 0");
      }
      return value;
    }
  }
}
