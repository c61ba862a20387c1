package io.hookline;

/**
 * Base class for all unchecked exceptions raised by hookline.
 */
public class HooklineException extends RuntimeException {

  public HooklineException(String message) {
    super(message);
  }

  public HooklineException(String message, Throwable cause) {
    super(message, cause);
  }
}
