package com.codeheadsystems.blog.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.blog.exception.DecodeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class AttributeValueJsonConverterTest {

  private AttributeValueJsonConverter converter;

  @BeforeEach
  void setup() {
    converter = new AttributeValueJsonConverter(new ObjectMapper());
  }

  @Test
  void toJson_usesTypeDescriptors() {
    final String json = converter.toJson(Map.of("title", AttributeValue.fromS("Hello")));

    assertThat(json).isEqualTo("{\"title\":{\"S\":\"Hello\"}}");
  }

  @Test
  void fromJson_readsCliFormat() {
    final Map<String, AttributeValue> item = converter.fromJson(
        "{\"PK\":{\"S\":\"USER#1\"},\"score\":{\"N\":\"4.5\"},\"tags\":{\"SS\":[\"a\",\"b\"]}}");

    assertThat(item)
        .containsEntry("PK", AttributeValue.fromS("USER#1"))
        .containsEntry("score", AttributeValue.fromN("4.5"))
        .containsEntry("tags", AttributeValue.fromSs(List.of("a", "b")));
  }

  @Test
  void nestedValuesSurvive() {
    final Map<String, AttributeValue> item = Map.of(
        "flag", AttributeValue.fromBool(true),
        "nothing", AttributeValue.fromNul(true),
        "bytes", AttributeValue.fromB(SdkBytes.fromUtf8String("abc")),
        "list", AttributeValue.fromL(List.of(AttributeValue.fromN("1"), AttributeValue.fromS("x"))),
        "map", AttributeValue.fromM(Map.of("inner", AttributeValue.fromS("y"))));

    assertThat(converter.fromJson(converter.toJson(item))).isEqualTo(item);
  }

  @Test
  void fromJson_notJson() {
    assertThatThrownBy(() -> converter.fromJson("{not json"))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void fromJson_untypedValue() {
    assertThatThrownBy(() -> converter.fromJson("{\"title\":\"Hello\"}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("title");
  }

  @Test
  void fromJson_unknownType() {
    assertThatThrownBy(() -> converter.fromJson("{\"title\":{\"X\":\"Hello\"}}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("unknown type");
  }

}
