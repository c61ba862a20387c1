package io.hookline.dispatch;

import io.hookline.HooklineException;

/**
 * A single delivery attempt failed. Carries the HTTP status when the receiver answered,
 * or {@code -1} for timeouts and network errors. Never reaches the triggering caller.
 */
public final class DeliveryFailureException extends HooklineException {
  private final int statusCode;

  public DeliveryFailureException(int statusCode) {
    super("HTTP " + statusCode);
    this.statusCode = statusCode;
  }

  public DeliveryFailureException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public int statusCode() {
    return statusCode;
  }
}
