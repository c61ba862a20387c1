package io.hookline.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;
  private final ObjectReader payloadReader;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper")
        .copy()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    // payload numbers keep their exact digits and scale
    this.payloadReader = this.mapper.reader(JsonNodeFactory.withExactBigDecimals(true))
        .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .without(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES);
  }

  @Override
  public String normalize(String json) {
    if (json == null || json.isBlank()) {
      return "{}";
    }
    try {
      JsonNode node = payloadReader.readTree(json);
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not serializable as JSON", e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return new LinkedHashMap<>();
    }
    try {
      JsonNode node = mapper.readTree(json);
      if (!node.isObject()) {
        throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
      }
      return mapper.convertValue(node, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public List<String> parseStringList(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return mapper.readValue(json, STRING_LIST_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON string array: " + e.getOriginalMessage(), e);
    }
  }
}
