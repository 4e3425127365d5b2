package com.acme.brickwatch.web;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Invalid input -> 400 BAD REQUEST. Covers malformed or overlapping periodicities, empty names,
 * bad email addresses, invalid search expressions and updates that change nothing.
 */
@Produces
@Singleton
@Requires(classes = {IllegalArgumentException.class, ExceptionHandler.class})
public class IllegalArgumentExceptionHandler
    implements ExceptionHandler<IllegalArgumentException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, IllegalArgumentException exception) {
    return HttpResponse.badRequest(
        new ErrorResponse(
            exception.getMessage() != null ? exception.getMessage() : "Invalid request",
            HttpStatus.BAD_REQUEST.getCode()));
  }
}
