package com.acme.brickwatch.web;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Pausing a paused brick or unpausing an active one -> 400 BAD REQUEST. */
@Produces
@Singleton
@Requires(classes = {IllegalStateException.class, ExceptionHandler.class})
public class IllegalStateExceptionHandler
    implements ExceptionHandler<IllegalStateException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, IllegalStateException exception) {
    return HttpResponse.badRequest(
        new ErrorResponse(
            exception.getMessage() != null ? exception.getMessage() : "Invalid state",
            HttpStatus.BAD_REQUEST.getCode()));
  }
}
