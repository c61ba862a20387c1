package io.hookline;

/**
 * Thrown when a referenced record does not exist.
 *
 * @see SubscriptionNotFoundException
 * @see EventNotFoundException
 */
public abstract class NotFoundException extends HooklineException {
  private final String id;

  protected NotFoundException(String message, String id) {
    super(message);
    this.id = id;
  }

  public String id() {
    return id;
  }
}
