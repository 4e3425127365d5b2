package com.acme.brickwatch.web;

import com.acme.brickwatch.service.DuplicateSlugException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** A name whose slug is taken by another brick -> 409 CONFLICT. */
@Produces
@Singleton
@Requires(classes = {DuplicateSlugException.class, ExceptionHandler.class})
public class DuplicateSlugExceptionHandler
    implements ExceptionHandler<DuplicateSlugException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, DuplicateSlugException exception) {
    return HttpResponse.status(HttpStatus.CONFLICT)
        .body(new ErrorResponse(exception.getMessage(), HttpStatus.CONFLICT.getCode()));
  }
}
