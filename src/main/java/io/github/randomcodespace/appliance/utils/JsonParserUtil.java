package io.github.randomcodespace.appliance.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** JSON parsing of host tool output (machinectl, nix eval) using Jackson. */
public final class JsonParserUtil {
  private static final Logger logger = LoggerFactory.getLogger(JsonParserUtil.class);
  private static final ObjectMapper objectMapper = new ObjectMapper();

  static {
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private JsonParserUtil() {}

  /**
   * Parses a JSON string into an object of the specified generic type.
   *
   * @param jsonString The JSON string to parse.
   * @param typeReference The TypeReference for the generic type.
   * @param <T> The type of the object.
   * @return An Optional containing the parsed object, or Optional.empty() if the input is blank or
   *     does not match the requested type.
   */
  public static <T> Optional<T> fromJson(String jsonString, TypeReference<T> typeReference) {
    if (jsonString == null || jsonString.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(jsonString, typeReference));
    } catch (JsonProcessingException e) {
      logger.warn(
          "Failed to parse JSON string to {}: {}. JSON: {}",
          typeReference.getType().getTypeName(),
          e.getOriginalMessage(),
          overview(jsonString));
      return Optional.empty();
    }
  }

  private static String overview(String text) {
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
