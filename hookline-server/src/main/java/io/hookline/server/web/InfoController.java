package io.hookline.server.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class InfoController {

  private final String version;

  public InfoController(@Value("${hookline.server.version:1.0.0}") String version) {
    this.version = version;
  }

  @GetMapping("/")
  public Map<String, Object> info() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("service", "hookline");
    body.put("version", version);
    body.put("verificationTypes", List.of("none", "stripe-style", "slack-style"));
    body.put("endpoints", Map.of(
        "webhooks", "/webhooks",
        "trigger", "/events/trigger/{type}",
        "events", "/events/{id}"));
    return body;
  }
}
