package com.acme.brickwatch.web;

import io.micronaut.context.annotation.Value;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.RequestFilter;
import io.micronaut.http.annotation.ServerFilter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared-secret check for the management API. When {@code brickwatch.api.auth-key} is set, every
 * {@code /api/**} request except trigger must carry it in the {@code X-Auth-Key} header or the
 * {@code auth_key} query parameter.
 */
@ServerFilter("/api/**")
public class AuthKeyFilter {
  private static final Logger LOG = LoggerFactory.getLogger(AuthKeyFilter.class);

  static final String HEADER = "X-Auth-Key";
  static final String PARAMETER = "auth_key";

  private final byte[] authKey;

  public AuthKeyFilter(@Value("${brickwatch.api.auth-key:}") String authKey) {
    this.authKey = authKey.getBytes(StandardCharsets.UTF_8);
  }

  @RequestFilter
  @Nullable
  public HttpResponse<ErrorResponse> checkAuthKey(HttpRequest<?> request) {
    if (authKey.length == 0 || request.getPath().endsWith("/trigger")) {
      return null;
    }
    String given = request.getHeaders().get(HEADER);
    if (given == null) {
      given = request.getParameters().get(PARAMETER);
    }
    if (given != null && MessageDigest.isEqual(authKey, given.getBytes(StandardCharsets.UTF_8))) {
      return null;
    }
    LOG.warn("Rejected {} {}: missing or invalid auth key", request.getMethod(), request.getPath());
    return HttpResponse.<ErrorResponse>status(HttpStatus.UNAUTHORIZED)
        .body(new ErrorResponse("Missing or invalid auth key", HttpStatus.UNAUTHORIZED.getCode()));
  }
}
