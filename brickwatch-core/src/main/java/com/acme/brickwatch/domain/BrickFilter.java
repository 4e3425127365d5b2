package com.acme.brickwatch.domain;

/**
 * Listing criteria. Null fields do not filter; {@code search} is a regular expression matched
 * against name, slug, identifier and recipient addresses.
 */
public record BrickFilter(Boolean paused, Boolean late, String search) {

  public static BrickFilter all() {
    return new BrickFilter(null, null, null);
  }
}
