package com.codeheadsystems.api.blog.v1;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BlogJsonTest {

  private static final Instant CREATED = Instant.parse("2024-03-01T12:00:00Z");

  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper()
        .registerModule(new Jdk8Module())
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Test
  void blog_usesSnakeCaseNames() throws JsonProcessingException {
    final Blog blog = ImmutableBlog.builder()
        .blogId("b1")
        .title("title")
        .score(4.5)
        .createdDate(CREATED)
        .userId("u1")
        .build();

    final JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(blog));

    assertThat(node.get("blog_id").asText()).isEqualTo("b1");
    assertThat(node.get("user_id").asText()).isEqualTo("u1");
    assertThat(node.get("created_date").asText()).isEqualTo("2024-03-01T12:00:00Z");
    assertThat(node.get("score").asDouble()).isEqualTo(4.5);
  }

  @Test
  void createBlogRequest_defaultsScore() throws JsonProcessingException {
    final CreateBlogRequest request = objectMapper.readValue(
        "{\"title\":\"Hello\",\"user_id\":\"u1\"}", CreateBlogRequest.class);

    assertThat(request)
        .hasFieldOrPropertyWithValue("title", "Hello")
        .hasFieldOrPropertyWithValue("userId", "u1")
        .hasFieldOrPropertyWithValue("score", 0.0);
  }

  @Test
  void updateUserRequest_absentFieldsAreEmpty() throws JsonProcessingException {
    final UpdateUserRequest request = objectMapper.readValue("{\"name\":\"Ada\"}", UpdateUserRequest.class);

    assertThat(request.name()).contains("Ada");
    assertThat(request.email()).isEmpty();
    assertThat(request.password()).isEmpty();
  }

  @Test
  void user_toStringHidesPassword() {
    final User user = ImmutableUser.builder()
        .userId("u1")
        .name("Ada")
        .email("ada@example.com")
        .password("secret-hash")
        .build();

    assertThat(user.toString()).doesNotContain("secret-hash");
  }

}
