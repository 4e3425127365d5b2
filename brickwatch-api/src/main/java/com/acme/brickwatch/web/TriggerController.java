package com.acme.brickwatch.web;

import com.acme.brickwatch.domain.BrickIdentity;
import com.acme.brickwatch.service.BrickNotFoundException;
import com.acme.brickwatch.service.BrickService;
import com.acme.brickwatch.web.dto.TriggerResponse;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;

/**
 * Short trigger URL for jobs that can only issue a bare HTTP request, such as
 * {@code curl https://host/abcdefgh?m=done}. Never requires the auth key.
 */
@Controller
public class TriggerController {

  private final BrickService service;

  public TriggerController(BrickService service) {
    this.service = service;
  }

  @Get("/{id}{?comment,m}")
  public TriggerResponse triggerGet(
      @PathVariable String id, @Nullable @QueryValue String comment, @Nullable @QueryValue String m) {
    return trigger(id, comment, m);
  }

  @Post("/{id}{?comment,m}")
  public TriggerResponse triggerPost(
      @PathVariable String id, @Nullable @QueryValue String comment, @Nullable @QueryValue String m) {
    return trigger(id, comment, m);
  }

  private TriggerResponse trigger(String id, String comment, String m) {
    if (!BrickIdentity.isId(id)) {
      throw BrickNotFoundException.byId(id);
    }
    return TriggerResponse.from(service.trigger(id, comment != null ? comment : m));
  }
}
