package com.acme.brickwatch.web.dto;

import com.acme.brickwatch.service.NewBrick;
import java.util.List;

public record CreateBrickRequest(
    String name, String periodicity, String description, List<String> emails, Boolean paused) {

  public NewBrick toNewBrick() {
    return new NewBrick(name, periodicity, description, emails, Boolean.TRUE.equals(paused));
  }
}
