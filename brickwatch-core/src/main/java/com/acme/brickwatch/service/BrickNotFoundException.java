package com.acme.brickwatch.service;

public class BrickNotFoundException extends RuntimeException {
  public BrickNotFoundException(String message) {
    super(message);
  }

  public static BrickNotFoundException byId(String id) {
    return new BrickNotFoundException("No brick with id " + id);
  }

  public static BrickNotFoundException bySlug(String slug) {
    return new BrickNotFoundException("No brick with slug " + slug);
  }
}
