package org.retention.churn.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JsonSmartJsonProvider;
import com.jayway.jsonpath.spi.mapper.JsonSmartMappingProvider;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * JSON helpers used outside the Spring context: by the domain's {@code fromJSON(String)} and by
 * the seed import.
 * <ul>
 *   <li>Object to JSON serialization (Java time as ISO-8601 strings)</li>
 *   <li>JSON to object deserialization, tolerant of unknown properties</li>
 *   <li>JSONPath-based value extraction</li>
 *   <li>Reading JSON files</li>
 * </ul>
 *
 * Thread-safe. Maximum JSON size is limited to 10MB.
 */
@Slf4j
@UtilityClass
public class JsonUtils {

  static final int MAX_JSON_LENGTH = 10_000_000; // 10MB
  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final Configuration jsonPathConfig;

  static {
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    // serialized views carry derived fields that stored records do not declare
    objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    // isolated JsonPath configuration so another provider on the classpath cannot change results
    jsonPathConfig =
        Configuration.builder()
            .jsonProvider(new JsonSmartJsonProvider())
            .mappingProvider(new JsonSmartMappingProvider())
            .options(EnumSet.noneOf(Option.class))
            .build();
  }

  /**
   * Serializes an object into its JSON string representation. Null is serialized as "null".
   *
   * @throws JsonProcessingException if the object cannot be serialized
   */
  public static String toJson(Object o) throws JsonProcessingException {
    return toJson(o, false);
  }

  /**
   * Serializes an object into JSON with optional pretty printing.
   *
   * @param o the object to serialize
   * @param pretty if true, formats JSON with indentation and line breaks
   * @throws JsonProcessingException if the object cannot be serialized
   */
  public static String toJson(Object o, boolean pretty) throws JsonProcessingException {
    if (o == null) {
      return "null";
    }
    return pretty
        ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(o)
        : objectMapper.writeValueAsString(o);
  }

  /**
   * Parses a JSON string into a specified Java type.
   *
   * @throws JsonProcessingException if JSON cannot be parsed or mapped to the class
   * @throws IllegalArgumentException if json is blank or oversized, or clazz is null
   */
  public static <T> T fromJson(String json, Class<T> clazz) throws JsonProcessingException {
    validateJsonSize(json);
    if (clazz == null) {
      throw new IllegalArgumentException("Target class cannot be null");
    }
    return objectMapper.readValue(json, clazz);
  }

  /**
   * Parses a JSON string into a generic type such as {@code List<CustomerRecord>}.
   *
   * @throws JsonProcessingException if JSON cannot be parsed or mapped to the type
   * @throws IllegalArgumentException if json is blank or oversized, or typeRef is null
   */
  public static <T> T fromJson(String json, TypeReference<T> typeRef)
      throws JsonProcessingException {
    validateJsonSize(json);
    if (typeRef == null) {
      throw new IllegalArgumentException("Type reference must not be null");
    }
    return objectMapper.readValue(json, typeRef);
  }

  /**
   * Converts an already parsed value (for example the result of {@link #extractValue}) into a
   * typed object.
   *
   * @throws IllegalArgumentException if the value cannot be mapped to the type
   */
  public static <T> T convertValue(Object value, TypeReference<T> typeRef) {
    if (typeRef == null) {
      throw new IllegalArgumentException("Type reference must not be null");
    }
    return objectMapper.convertValue(value, typeRef);
  }

  /**
   * Extracts an optional value from a JSON string using a JSONPath expression.
   *
   * @param json the JSON string
   * @param jsonPathExpression the JSONPath expression to evaluate
   * @param <T> the expected type of the result
   * @return an Optional containing the extracted value, or empty if the path does not exist
   * @throws JsonProcessingException if the document is not valid JSON
   */
  public static <T> Optional<T> extractValue(String json, String jsonPathExpression)
      throws JsonProcessingException {
    validateJsonSize(json);
    notBlank(jsonPathExpression, "JSONPath expression must not be null");

    try {
      T value = JsonPath
          .using(jsonPathConfig)
          .parse(json)
          .read(jsonPathExpression);
      return Optional.ofNullable(value);
    } catch (PathNotFoundException e) {
      return Optional.empty();
    } catch (InvalidJsonException e) {
      throw new JsonProcessingException("Invalid JSON document", e) {};
    }
  }

  /**
   * Reads a JSON file into a string after checking it exists and is readable.
   *
   * @throws FileNotFoundException if the file doesn't exist
   * @throws IOException if the path is not a readable file
   */
  public static String readJsonFromFile(String filePath) throws IOException {
    File file = validateAndGetFile(filePath);
    String content = Files.readString(file.toPath(), StandardCharsets.UTF_8);
    log.debug("Read {} characters of JSON from {}", content.length(), file.getAbsolutePath());
    return content;
  }

  /**
   * Validates that the character sequence is neither null, empty, nor whitespace only.
   *
   * @throws IllegalArgumentException if chars is blank, or if message is blank
   */
  public static <T extends CharSequence> T notBlank(T chars, String message) {

    if (StringUtils.isBlank(message)) {
      throw new IllegalArgumentException("Message must not be null or blank");
    }

    if (StringUtils.isBlank(chars)) {
      throw new IllegalArgumentException(message);
    }

    return chars;
  }

  private static void validateJsonSize(String json) {

    notBlank(json, "json must not be null or blank");

    if (json.length() > MAX_JSON_LENGTH) {
      throw new IllegalArgumentException(
          "JSON exceeds maximum allowed length of " + MAX_JSON_LENGTH + " characters");
    }
  }

  private static File validateAndGetFile(String filePath) throws IOException {
    notBlank(filePath, "File path must not be null");
    File file = new File(filePath).getAbsoluteFile();
    if (!file.exists()) {
      throw new FileNotFoundException("File not found: " + file.getAbsolutePath());
    }
    if (!file.isFile()) {
      throw new IOException("Path is not a file: " + file.getAbsolutePath());
    }
    if (!file.canRead()) {
      throw new IOException("Cannot read file: " + file.getAbsolutePath());
    }
    return file;
  }
}
