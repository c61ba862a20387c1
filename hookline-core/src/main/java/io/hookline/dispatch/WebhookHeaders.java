package io.hookline.dispatch;

/** Header names sent with every delivery. */
public final class WebhookHeaders {
  public static final String SIGNATURE = "X-Webhook-Signature";
  public static final String TIMESTAMP = "X-Webhook-Timestamp";
  public static final String WEBHOOK_ID = "X-Webhook-Id";
  public static final String EVENT_ID = "X-Event-Id";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String USER_AGENT = "User-Agent";

  public static final String JSON = "application/json";
  public static final String DEFAULT_USER_AGENT = "Hookline-Webhook/1.0";

  private WebhookHeaders() {}
}
