package com.acme.brickwatch.web.dto;

import com.acme.brickwatch.service.BrickUpdate;
import java.util.List;

/** Partial update; absent fields stay unchanged and {@code emails: ["-"]} clears recipients. */
public record UpdateBrickRequest(
    String name, String periodicity, String description, List<String> emails) {

  public BrickUpdate toUpdate() {
    return new BrickUpdate(name, periodicity, description, emails);
  }
}
