package io.hookline.server.web;

import io.hookline.intake.EventIntake;
import io.hookline.intake.TriggerReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Event intake endpoints. The trigger body is taken verbatim as the event payload.
 */
@RestController
@RequestMapping("/events")
public class EventController {

  private static final Logger log = LoggerFactory.getLogger(EventController.class);

  private final EventIntake intake;

  public EventController(EventIntake intake) {
    this.intake = intake;
  }

  @PostMapping("/trigger/{type}")
  public ResponseEntity<EventView> trigger(@PathVariable String type,
                                           @RequestBody(required = false) String payload) {
    TriggerReceipt receipt = intake.trigger(type, payload);
    log.debug("Event {} ({}) queued for {} of {} subscriptions", receipt.event().id(), type,
        receipt.queuedDeliveries(), receipt.matchedSubscriptions());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(EventView.of(receipt));
  }

  @GetMapping("/{id}")
  public EventView get(@PathVariable String id) {
    return EventView.of(intake.get(id));
  }
}
