package io.hookline.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WebhookControllerTest {

  @Autowired
  private MockMvc mvc;

  @Autowired
  private ObjectMapper mapper;

  private MockWebServer receiver;

  @BeforeEach
  void setUp() throws Exception {
    receiver = new MockWebServer();
    receiver.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    receiver.shutdown();
  }

  @Test
  void createReturnsSecretOnlyOnce() throws Exception {
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"invoice.paid\"],"
        + "\"verificationType\":\"none\",\"metadata\":{\"team\":\"billing\"}}");

    mvc.perform(get("/webhooks/" + id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("active"))
        .andExpect(jsonPath("$.verificationType").value("none"))
        .andExpect(jsonPath("$.metadata.team").value("billing"))
        .andExpect(jsonPath("$.secret").doesNotExist());

    mvc.perform(get("/webhooks").param("event", "invoice.paid").param("status", "active"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.webhooks[0].id").value(id))
        .andExpect(jsonPath("$.webhooks[0].secret").doesNotExist());
  }

  @Test
  void createValidatesInput() throws Exception {
    mvc.perform(post("/webhooks").contentType(MediaType.APPLICATION_JSON)
            .content("{\"url\":\"not a url\",\"events\":[\"a\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").exists());

    mvc.perform(post("/webhooks").contentType(MediaType.APPLICATION_JSON)
            .content("{\"url\":\"https://example.com/hooks\",\"events\":[]}"))
        .andExpect(status().isBadRequest());

    mvc.perform(post("/webhooks").contentType(MediaType.APPLICATION_JSON)
            .content("{\"url\":\"https://example.com/hooks\",\"events\":[\"a\"],\"verificationType\":\"carrier-pigeon\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Unknown verification type: carrier-pigeon"));

    mvc.perform(post("/webhooks").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Malformed request body"));
  }

  @Test
  void unknownWebhookIsNotFound() throws Exception {
    mvc.perform(get("/webhooks/wh_missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Webhook not found: wh_missing"));
    mvc.perform(post("/webhooks/wh_missing/retry")).andExpect(status().isNotFound());
    mvc.perform(get("/webhooks/wh_missing/stats")).andExpect(status().isNotFound());
    mvc.perform(delete("/webhooks/wh_missing")).andExpect(status().isNotFound());
  }

  @Test
  void patchUpdatesFieldsAndMergesMetadata() throws Exception {
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"user.created\"],"
        + "\"verificationType\":\"none\",\"metadata\":{\"a\":1}}");

    mvc.perform(patch("/webhooks/" + id).contentType(MediaType.APPLICATION_JSON)
            .content("{\"events\":[\"user.created\",\"user.deleted\"],\"metadata\":{\"b\":2}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.events.length()").value(2))
        .andExpect(jsonPath("$.metadata.a").value(1))
        .andExpect(jsonPath("$.metadata.b").value(2));

    mvc.perform(patch("/webhooks/" + id).contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"disabled\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("disabled"));

    mvc.perform(patch("/webhooks/" + id).contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\":\"sleeping\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void deleteReturnsNoContent() throws Exception {
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"*\"],\"verificationType\":\"none\"}");

    mvc.perform(delete("/webhooks/" + id)).andExpect(status().isNoContent());
    mvc.perform(get("/webhooks/" + id)).andExpect(status().isNotFound());
  }

  @Test
  void statsOfFreshWebhook() throws Exception {
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"stats.only\"],\"verificationType\":\"none\"}");

    mvc.perform(get("/webhooks/" + id + "/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(id))
        .andExpect(jsonPath("$.deliveryCount").value(0))
        .andExpect(jsonPath("$.consecutiveFailures").value(0))
        .andExpect(jsonPath("$.lastDeliveryStatus").isEmpty())
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void verifyRejectedWhenNotPending() throws Exception {
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"a\"],\"verificationType\":\"none\"}");

    mvc.perform(post("/webhooks/" + id + "/verify"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", startsWith("Subscription " + id + " is not awaiting verification")));
  }

  @Test
  void stripeStyleVerificationCanBeRepeated() throws Exception {
    receiver.enqueue(new MockResponse().setResponseCode(404));
    String id = create("{\"url\":\"" + receiver.url("/hooks") + "\",\"events\":[\"a\"]}");

    RecordedRequest handshake = receiver.takeRequest(5, TimeUnit.SECONDS);
    assertNotNull(handshake);
    JsonNode body = mapper.readTree(handshake.getBody().readUtf8());
    assertEquals("webhook.verification", body.get("type").asText());
    assertEquals(64, body.get("verification_token").asText().length());

    Poll.until(() -> "HTTP 404".equals(view(id).path("lastHandshakeError").asText(null)));
    assertEquals("pending-verification", view(id).get("status").asText());

    receiver.enqueue(new MockResponse().setResponseCode(200));
    mvc.perform(post("/webhooks/" + id + "/verify"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verified").value(true))
        .andExpect(jsonPath("$.status").value("active"));
    assertFalse(view(id).get("verifiedAt").isNull());
  }

  private String create(String json) throws Exception {
    String response = mvc.perform(post("/webhooks").contentType(MediaType.APPLICATION_JSON).content(json))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.secret", startsWith("whsec_")))
        .andReturn().getResponse().getContentAsString();
    return mapper.readTree(response).get("id").asText();
  }

  private JsonNode view(String id) throws Exception {
    String response = mvc.perform(get("/webhooks/" + id))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    return mapper.readTree(response);
  }
}
