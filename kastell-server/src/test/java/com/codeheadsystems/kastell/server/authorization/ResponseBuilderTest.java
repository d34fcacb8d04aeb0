package com.codeheadsystems.kastell.server.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResponseBuilderTest {

  private final ResponseBuilder builder = new ResponseBuilder();

  @Test
  void resolveMode_defaults() {
    assertThat(builder.resolveMode(Set.of("code"), null)).isEqualTo(ResponseMode.QUERY);
    assertThat(builder.resolveMode(Set.of("none"), null)).isEqualTo(ResponseMode.QUERY);
    assertThat(builder.resolveMode(Set.of("code", "id_token"), null))
        .isEqualTo(ResponseMode.FRAGMENT);
    assertThat(builder.resolveMode(Set.of("id_token", "token"), ""))
        .isEqualTo(ResponseMode.FRAGMENT);
  }

  @Test
  void resolveMode_formPost_allowedForAnyType() {
    assertThat(builder.resolveMode(Set.of("code"), "form_post")).isEqualTo(ResponseMode.FORM_POST);
    assertThat(builder.resolveMode(Set.of("id_token"), "form_post"))
        .isEqualTo(ResponseMode.FORM_POST);
  }

  @Test
  void resolveMode_conflicts_throw() {
    assertThatThrownBy(() -> builder.resolveMode(Set.of("code"), "fragment"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> builder.resolveMode(Set.of("id_token"), "query"))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> builder.resolveMode(Set.of("code"), "smoke_signal"))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void build_query_appendsToExistingQuery() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("code", "abc");
    params.put("state", "s t");

    assertThat(builder.build("sid", "https://cb", ResponseMode.QUERY, params).location())
        .isEqualTo("https://cb?code=abc&state=s+t");
    assertThat(builder.build("sid", "https://cb?foo=1", ResponseMode.QUERY, params).location())
        .isEqualTo("https://cb?foo=1&code=abc&state=s+t");
    assertThat(builder.build("sid", "https://cb?", ResponseMode.QUERY, params).location())
        .isEqualTo("https://cb?code=abc&state=s+t");
  }

  @Test
  void build_fragment() {
    AuthorizationResponse response = builder.build(null, "https://cb", ResponseMode.FRAGMENT,
        Map.of("id_token", "x.y.z"));

    assertThat(response.location()).isEqualTo("https://cb#id_token=x.y.z");
    assertThat(response.isRedirect()).isTrue();
  }

  @Test
  void build_formPost_rendersEscapedHiddenInputs() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("code", "abc");
    params.put("state", "\"><script>");

    AuthorizationResponse response = builder.build("sid", "https://cb?a=1&b=2",
        ResponseMode.FORM_POST, params);

    assertThat(response.isRedirect()).isFalse();
    assertThat(response.body())
        .contains("<form method=\"post\" action=\"https://cb?a=1&amp;b=2\">")
        .contains("<input type=\"hidden\" name=\"code\" value=\"abc\"/>")
        .contains("value=\"&quot;&gt;&lt;script&gt;\"")
        .contains("document.forms[0].submit()")
        .doesNotContain("<script>");
  }

  @Test
  void build_dropsNullValues() {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("code", "abc");
    params.put("state", null);

    assertThat(builder.build("sid", "https://cb", ResponseMode.QUERY, params).parameters())
        .containsOnlyKeys("code");
  }
}
