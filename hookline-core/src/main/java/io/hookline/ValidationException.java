package io.hookline;

/**
 * Thrown when caller input is malformed. Never retried; surfaced to API callers as 4xx.
 */
public final class ValidationException extends HooklineException {

  public ValidationException(String message) {
    super(message);
  }
}
