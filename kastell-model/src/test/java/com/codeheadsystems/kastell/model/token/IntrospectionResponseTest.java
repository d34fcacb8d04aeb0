package com.codeheadsystems.kastell.model.token;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntrospectionResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void inactive_carriesOnlyTheFlag() throws Exception {
    String json = mapper.writeValueAsString(IntrospectionResponse.inactive());

    assertThat(json).isEqualTo("{\"active\":false}");
  }

  @Test
  void active_usesWireNames() throws Exception {
    IntrospectionResponse response = new IntrospectionResponse(true, "openid email", "client_1",
        TokenResponse.BEARER, 1700003600L, 1700000000L, "sub-1", List.of("client_1"),
        "https://op.example.org");

    JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

    assertThat(json.get("active").asBoolean()).isTrue();
    assertThat(json.get("client_id").asText()).isEqualTo("client_1");
    assertThat(json.get("token_type").asText()).isEqualTo("Bearer");
    assertThat(json.get("aud").get(0).asText()).isEqualTo("client_1");
    assertThat(json.get("exp").asLong()).isEqualTo(1700003600L);
  }
}
