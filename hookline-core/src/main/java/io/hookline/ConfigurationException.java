package io.hookline;

/**
 * Thrown at startup when a required capability (such as HMAC-SHA256 signing) is missing.
 * Fatal; never raised per request.
 */
public final class ConfigurationException extends HooklineException {

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
