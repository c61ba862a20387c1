package io.hookline.server.web;

import java.util.List;
import java.util.Map;

public record CreateWebhookRequest(
    String url,
    List<String> events,
    String verificationType,
    Map<String, Object> metadata
) {
}
