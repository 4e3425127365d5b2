package com.acme.brickwatch.web;

import com.acme.brickwatch.core.TransientException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Store outages and exhausted concurrent-update retries -> 503 SERVICE UNAVAILABLE. */
@Produces
@Singleton
@Requires(classes = {TransientException.class, ExceptionHandler.class})
public class TransientExceptionHandler
    implements ExceptionHandler<TransientException, HttpResponse<ErrorResponse>> {
  private static final Logger LOG = LoggerFactory.getLogger(TransientExceptionHandler.class);

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, TransientException exception) {
    LOG.warn("Transient failure on {} {}: {}", request.getMethod(), request.getPath(), exception.getMessage());
    return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ErrorResponse(
                "Temporarily unavailable, retry later: " + exception.getMessage(),
                HttpStatus.SERVICE_UNAVAILABLE.getCode()));
  }
}
