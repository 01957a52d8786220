package ca.nrc.ami3.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses documents into {@link Map}/{@link List} structures and reads typed fields
 * out of them.
 *
 * <p>Object fields keep document order. Numbers are returned as {@link Number}; callers convert through
 * {@link #doubleValue(Object, String)}.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory;

  public JsonSupport() {
    this(new JsonFactory());
  }

  public JsonSupport(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public JsonFactory factory() {
    return factory;
  }

  /**
   * Parses the supplied JSON string into an object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON file.
   *
   * @param file document to read; must not be {@code null}
   * @return parsed object graph
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the content is not valid JSON
   */
  public Object parse(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file);
         JsonParser parser = factory.createParser(in)) {
      return readDocument(parser);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON in " + file + ": " + ex.getOriginalMessage(), ex);
    }
  }

  /**
   * Casts a parsed value to a JSON object.
   *
   * @param value parsed value
   * @param what description used in error messages
   * @return read-only copy of the object fields in document order
   * @throws IllegalArgumentException if the value is not an object
   */
  public static Map<String, Object> asObject(Object value, String what) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> fields = new LinkedHashMap<>();
      map.forEach((key, field) -> fields.put(String.valueOf(key), field));
      return Collections.unmodifiableMap(fields);
    }
    throw new IllegalArgumentException(what + " must be a JSON object");
  }

  /**
   * Casts a parsed value to a JSON array.
   *
   * @param value parsed value
   * @param what description used in error messages
   * @return read-only copy of the array elements
   * @throws IllegalArgumentException if the value is not an array
   */
  public static List<Object> asArray(Object value, String what) {
    if (value instanceof List<?> list) {
      return Collections.unmodifiableList(new ArrayList<Object>(list));
    }
    throw new IllegalArgumentException(what + " must be a JSON array");
  }

  /**
   * Reads a required string field.
   *
   * @param object parent object
   * @param field field name
   * @return field value
   * @throws IllegalArgumentException if the field is missing or not a string
   */
  public static String requireString(Map<String, Object> object, String field) {
    Object value = object.get(field);
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException("field '" + field + "' must be a string");
  }

  /**
   * Reads an optional string field.
   *
   * @param object parent object
   * @param field field name
   * @param fallback value returned when the field is absent or {@code null}
   * @return field value or fallback
   * @throws IllegalArgumentException if the field is present but not a string
   */
  public static String optionalString(Map<String, Object> object, String field, String fallback) {
    Object value = object.get(field);
    if (value == null) {
      return fallback;
    }
    if (value instanceof String text) {
      return text;
    }
    throw new IllegalArgumentException("field '" + field + "' must be a string");
  }

  /**
   * Converts a parsed number.
   *
   * @param value parsed value
   * @param what description used in error messages
   * @return numeric value
   * @throws IllegalArgumentException if the value is not a number
   */
  public static double doubleValue(Object value, String what) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException(what + " must be a number");
  }

  /**
   * Reads an array of numbers.
   *
   * @param value parsed value; {@code null} yields an empty array
   * @param what description used in error messages
   * @return numbers in document order
   */
  public static double[] doubleArray(Object value, String what) {
    if (value == null) {
      return new double[0];
    }
    List<Object> items = asArray(value, what);
    double[] out = new double[items.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = doubleValue(items.get(i), what + "[" + i + "]");
    }
    return out;
  }

  /**
   * Renders a scalar attribute value as text.
   *
   * @param value parsed scalar
   * @return textual form; {@code null} for JSON null
   * @throws IllegalArgumentException if the value is an object or array
   */
  public static String scalarText(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new IllegalArgumentException("attribute values must be scalars");
    }
    return value.toString();
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return Map.of();
    }
    Object value = readValue(parser, token);
    JsonToken trailing = parser.nextToken();
    if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
