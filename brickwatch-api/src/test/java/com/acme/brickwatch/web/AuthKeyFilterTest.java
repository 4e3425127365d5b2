package com.acme.brickwatch.web;

import static org.assertj.core.api.Assertions.*;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AuthKeyFilterTest {

  private final AuthKeyFilter filter = new AuthKeyFilter("s3cret");

  @Test
  @DisplayName("requests without a configured key should pass")
  void testNoKeyConfigured() {
    assertThat(new AuthKeyFilter("").checkAuthKey(HttpRequest.GET("/api/bricks"))).isNull();
  }

  @Test
  @DisplayName("the key should be accepted from header or query parameter")
  void testKeyAccepted() {
    MutableHttpRequest<?> byParameter = HttpRequest.GET("/api/bricks");
    byParameter.getParameters().add("auth_key", "s3cret");

    assertThat(filter.checkAuthKey(HttpRequest.GET("/api/bricks").header("X-Auth-Key", "s3cret"))).isNull();
    assertThat(filter.checkAuthKey(byParameter)).isNull();
  }

  @Test
  @DisplayName("a missing or wrong key should be rejected with 401")
  void testKeyRejected() {
    HttpResponse<ErrorResponse> missing = filter.checkAuthKey(HttpRequest.GET("/api/bricks"));
    HttpResponse<ErrorResponse> wrong =
        filter.checkAuthKey(HttpRequest.DELETE("/api/bricks/abcdefgh").header("X-Auth-Key", "guess"));

    assertThat((Object) missing.status()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat((Object) wrong.status()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(wrong.body().statusCode()).isEqualTo(401);
  }

  @Test
  @DisplayName("trigger should never require the key")
  void testTriggerExempt() {
    assertThat(filter.checkAuthKey(HttpRequest.POST("/api/bricks/abcdefgh/trigger", ""))).isNull();
  }
}
