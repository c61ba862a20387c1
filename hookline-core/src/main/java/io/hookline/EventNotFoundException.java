package io.hookline;

public final class EventNotFoundException extends NotFoundException {

  public EventNotFoundException(String eventId) {
    super("Event not found: " + eventId, eventId);
  }
}
