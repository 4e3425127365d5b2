package com.acme.brickwatch.service;

/** A brick name whose slug is already taken by another brick. */
public class DuplicateSlugException extends RuntimeException {

  private final String slug;

  public DuplicateSlugException(String slug) {
    super("A brick with slug '" + slug + "' already exists");
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }
}
