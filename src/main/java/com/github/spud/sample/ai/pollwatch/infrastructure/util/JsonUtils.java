package com.github.spud.sample.ai.pollwatch.infrastructure.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.util.concurrent.Callable;
import org.springframework.boot.json.JsonParseException;

/**
 * 共享 ObjectMapper；所有解析失败统一抛出 {@link JsonParseException}
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JsonUtils() {
  }

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return tryParse(() -> objectMapper.readTree(json));
  }

  public static JsonNode readTree(File file) {
    return tryParse(() -> objectMapper.readTree(file));
  }

  public static <T> T convert(JsonNode node, Class<T> clazz) {
    return tryParse(() -> objectMapper.treeToValue(node, clazz));
  }

  private static <T> T tryParse(Callable<T> parser) {
    try {
      return parser.call();
    } catch (Exception e) {
      throw new JsonParseException(e);
    }
  }
}
