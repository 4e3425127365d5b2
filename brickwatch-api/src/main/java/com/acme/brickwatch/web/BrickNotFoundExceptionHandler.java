package com.acme.brickwatch.web;

import com.acme.brickwatch.service.BrickNotFoundException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

@Produces
@Singleton
@Requires(classes = {BrickNotFoundException.class, ExceptionHandler.class})
public class BrickNotFoundExceptionHandler
    implements ExceptionHandler<BrickNotFoundException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, BrickNotFoundException exception) {
    return HttpResponse.notFound(
        new ErrorResponse(exception.getMessage(), HttpStatus.NOT_FOUND.getCode()));
  }
}
