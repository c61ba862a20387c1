package io.hookline.server.web;

import io.hookline.Hookline;
import io.hookline.RetryReceipt;
import io.hookline.ValidationException;
import io.hookline.model.DeliveryStats;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionFilter;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;
import io.hookline.verify.HandshakeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscription management endpoints.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

  private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

  private final Hookline hookline;

  public WebhookController(Hookline hookline) {
    this.hookline = hookline;
  }

  @PostMapping
  public ResponseEntity<WebhookView> create(@RequestBody(required = false) CreateWebhookRequest request) {
    if (request == null) {
      throw new ValidationException("Request body is required");
    }
    Subscription created = hookline.registry().create(
        request.url(),
        request.events(),
        VerificationMode.fromCode(request.verificationType()),
        request.metadata());
    log.info("Created webhook {} for {} ({})", created.id(), created.url(), created.verificationMode().code());
    return ResponseEntity.status(HttpStatus.CREATED).body(WebhookView.withSecret(created));
  }

  @GetMapping
  public Map<String, Object> list(@RequestParam(required = false) String status,
                                  @RequestParam(required = false) String event) {
    SubscriptionStatus statusFilter = status != null && !status.isBlank()
        ? SubscriptionStatus.fromCode(status) : null;
    String eventFilter = event != null && !event.isBlank() ? event : null;
    List<WebhookView> webhooks = hookline.registry()
        .list(new SubscriptionFilter(statusFilter, eventFilter))
        .stream()
        .map(WebhookView::of)
        .toList();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("webhooks", webhooks);
    body.put("count", webhooks.size());
    return body;
  }

  @GetMapping("/{id}")
  public WebhookView get(@PathVariable String id) {
    return WebhookView.of(hookline.registry().get(id));
  }

  @PatchMapping("/{id}")
  public WebhookView update(@PathVariable String id,
                            @RequestBody(required = false) UpdateWebhookRequest request) {
    if (request == null) {
      throw new ValidationException("Request body is required");
    }
    return WebhookView.of(hookline.registry().update(id, request.toPatch()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable String id) {
    hookline.registry().delete(id);
    log.info("Deleted webhook {}", id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/retry")
  public Map<String, Object> retry(@PathVariable String id) {
    RetryReceipt receipt = hookline.retry(id);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("id", id);
    body.put("status", receipt.subscription().status().code());
    body.put("requeued", receipt.requeued());
    if (receipt.requeued()) {
      body.put("requeuedEventId", receipt.requeuedEventId());
    }
    return body;
  }

  @PostMapping("/{id}/verify")
  public Map<String, Object> verify(@PathVariable String id) {
    HandshakeResult result = hookline.coordinator().verify(id);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("id", id);
    body.put("verified", result.verified());
    body.put("status", hookline.registry().get(id).status().code());
    if (result.error() != null) {
      body.put("error", result.error());
    }
    return body;
  }

  @GetMapping("/{id}/stats")
  public Map<String, Object> stats(@PathVariable String id) {
    DeliveryStats stats = hookline.dispatcher().stats(id);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("id", stats.subscriptionId());
    body.put("deliveryCount", stats.deliveryCount());
    body.put("consecutiveFailures", stats.consecutiveFailures());
    body.put("lastDeliveryAt", stats.lastDeliveryAt());
    body.put("lastDeliveryStatus", stats.lastDeliveryStatus() != null ? stats.lastDeliveryStatus().code() : null);
    body.put("lastDeliveryError", stats.lastDeliveryError());
    body.put("status", stats.status().code());
    return body;
  }
}
