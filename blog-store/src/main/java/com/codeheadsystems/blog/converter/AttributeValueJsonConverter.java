package com.codeheadsystems.blog.converter;

import com.codeheadsystems.blog.exception.DecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts attribute maps to and from DynamoDB JSON, the typed format the AWS CLI reads and
 * writes ({"title": {"S": "Hello"}, "score": {"N": "4.5"}}).
 */
@Singleton
public class AttributeValueJsonConverter {

  private static final Logger log = LoggerFactory.getLogger(AttributeValueJsonConverter.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Attribute value json converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public AttributeValueJsonConverter(final ObjectMapper objectMapper) {
    log.info("AttributeValueJsonConverter({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * The Jackson type of a typed map, for reading one out of a larger document.
   *
   * @return the type reference
   */
  public TypeReference<Map<String, Object>> typedMapType() {
    return MAP_TYPE;
  }

  /**
   * Item as a DynamoDB JSON string.
   *
   * @param item the item
   * @return the string
   */
  public String toJson(final Map<String, AttributeValue> item) {
    log.trace("toJson({})", item);
    try {
      return objectMapper.writeValueAsString(toTypedMap(item));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to serialize item", e);
    }
  }

  /**
   * Item from a DynamoDB JSON string.
   *
   * @param json the json
   * @return the map
   */
  public Map<String, AttributeValue> fromJson(final String json) {
    log.trace("fromJson({})", json);
    try {
      return fromTypedMap(objectMapper.readValue(json, MAP_TYPE));
    } catch (JsonProcessingException e) {
      throw new DecodeException("Stored item is not valid JSON", e);
    }
  }

  /**
   * Item as nested maps and lists ready for Jackson, each value wrapped in its type descriptor.
   *
   * @param item the item
   * @return the map
   */
  public Map<String, Object> toTypedMap(final Map<String, AttributeValue> item) {
    final Map<String, Object> result = new LinkedHashMap<>();
    item.forEach((name, value) -> result.put(name, toTyped(value)));
    return result;
  }

  /**
   * Item from nested maps and lists as produced by {@link #toTypedMap(Map)}.
   *
   * @param typed the typed
   * @return the map
   */
  public Map<String, AttributeValue> fromTypedMap(final Map<String, Object> typed) {
    final Map<String, AttributeValue> result = new LinkedHashMap<>();
    typed.forEach((name, value) -> result.put(name, fromTyped(name, value)));
    return result;
  }

  private Object toTyped(final AttributeValue value) {
    return switch (value.type()) {
      case S -> Map.of("S", value.s());
      case N -> Map.of("N", value.n());
      case B -> Map.of("B", value.b().asByteArray());
      case BOOL -> Map.of("BOOL", value.bool());
      case NUL -> Map.of("NULL", Boolean.TRUE);
      case SS -> Map.of("SS", value.ss());
      case NS -> Map.of("NS", value.ns());
      case BS -> Map.of("BS", value.bs().stream().map(SdkBytes::asByteArray).toList());
      case L -> Map.of("L", value.l().stream().map(this::toTyped).toList());
      case M -> Map.of("M", toTypedMap(value.m()));
      default -> throw new IllegalArgumentException("Unsupported attribute value: " + value);
    };
  }

  @SuppressWarnings("unchecked")
  private AttributeValue fromTyped(final String name, final Object typed) {
    if (!(typed instanceof Map<?, ?> wrapper) || wrapper.size() != 1) {
      throw new DecodeException("Attribute '" + name + "' is not a single typed value: " + typed);
    }
    final Map.Entry<?, ?> entry = wrapper.entrySet().iterator().next();
    final Object value = entry.getValue();
    try {
      return switch (String.valueOf(entry.getKey())) {
        case "S" -> AttributeValue.fromS((String) value);
        case "N" -> AttributeValue.fromN(String.valueOf(value));
        case "B" -> AttributeValue.fromB(SdkBytes.fromByteArray(objectMapper.convertValue(value, byte[].class)));
        case "BOOL" -> AttributeValue.fromBool((Boolean) value);
        case "NULL" -> AttributeValue.fromNul((Boolean) value);
        case "SS" -> AttributeValue.fromSs((List<String>) value);
        case "NS" -> AttributeValue.fromNs(((List<?>) value).stream().map(String::valueOf).toList());
        case "BS" -> AttributeValue.fromBs(((List<?>) value).stream()
            .map(bytes -> SdkBytes.fromByteArray(objectMapper.convertValue(bytes, byte[].class)))
            .toList());
        case "L" -> AttributeValue.fromL(((List<?>) value).stream()
            .map(element -> fromTyped(name, element))
            .toList());
        case "M" -> AttributeValue.fromM(fromTypedMap((Map<String, Object>) value));
        default -> throw new DecodeException("Attribute '" + name + "' has unknown type " + entry.getKey());
      };
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new DecodeException("Attribute '" + name + "' has a malformed value: " + typed, e);
    }
  }

}
