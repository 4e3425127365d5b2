package com.acme.brickwatch.web;

import com.acme.brickwatch.core.PermanentException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Produces
@Singleton
@Requires(classes = {PermanentException.class, ExceptionHandler.class})
public class PermanentExceptionHandler
    implements ExceptionHandler<PermanentException, HttpResponse<ErrorResponse>> {
  private static final Logger LOG = LoggerFactory.getLogger(PermanentExceptionHandler.class);

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, PermanentException exception) {
    LOG.error("Permanent failure on {} {}", request.getMethod(), request.getPath(), exception);
    return HttpResponse.serverError(
        new ErrorResponse("Internal error", HttpStatus.INTERNAL_SERVER_ERROR.getCode()));
  }
}
