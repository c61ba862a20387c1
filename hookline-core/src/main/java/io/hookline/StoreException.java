package io.hookline;

/**
 * Unchecked exception wrapping persistence failures raised by store implementations.
 */
public class StoreException extends HooklineException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
