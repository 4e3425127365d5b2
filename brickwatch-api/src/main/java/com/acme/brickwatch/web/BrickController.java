package com.acme.brickwatch.web;

import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.BrickFilter;
import com.acme.brickwatch.domain.BrickIdentity;
import com.acme.brickwatch.service.BrickNotFoundException;
import com.acme.brickwatch.service.BrickService;
import com.acme.brickwatch.web.dto.BrickView;
import com.acme.brickwatch.web.dto.CommentRequest;
import com.acme.brickwatch.web.dto.CreateBrickRequest;
import com.acme.brickwatch.web.dto.TriggerResponse;
import com.acme.brickwatch.web.dto.UpdateBrickRequest;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Patch;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brick management API. A {@code {ref}} path segment is either a brick identifier or a slug.
 */
@Controller("/api/bricks")
public class BrickController {
  private static final Logger LOG = LoggerFactory.getLogger(BrickController.class);

  private final BrickService service;
  private final Clock clock;

  public BrickController(BrickService service, Clock clock) {
    this.service = service;
    this.clock = clock;
  }

  @Post
  public HttpResponse<BrickView> create(@Body CreateBrickRequest request) {
    Brick brick = service.create(request.toNewBrick());
    return HttpResponse.created(BrickView.detailed(brick, clock.instant()));
  }

  @Get("{?paused,late,search,verbose}")
  public List<BrickView> list(
      @Nullable @QueryValue Boolean paused,
      @Nullable @QueryValue Boolean late,
      @Nullable @QueryValue String search,
      @QueryValue(defaultValue = "false") boolean verbose) {
    if (search != null) {
      // Reject invalid expressions before they reach the database
      Pattern.compile(search);
    }
    List<Brick> bricks = service.list(new BrickFilter(paused, late, search), verbose);
    LOG.debug("Listed {} bricks (paused={}, late={}, search={})", bricks.size(), paused, late, search);
    return bricks.stream()
        .map(b -> verbose ? BrickView.detailed(b, null) : BrickView.summary(b))
        .collect(Collectors.toList());
  }

  @Get("/lookup{?id,slug,name}")
  public BrickView lookup(
      @Nullable @QueryValue String id,
      @Nullable @QueryValue String slug,
      @Nullable @QueryValue String name) {
    return BrickView.detailed(service.find(id, slug, name), clock.instant());
  }

  @Get("/{ref}")
  public BrickView get(@PathVariable String ref) {
    return BrickView.detailed(resolve(ref), clock.instant());
  }

  @Patch("/{ref}")
  public BrickView update(@PathVariable String ref, @Body UpdateBrickRequest request) {
    Brick brick = service.update(resolve(ref).getId(), request.toUpdate());
    return BrickView.detailed(brick, clock.instant());
  }

  @Delete("/{ref}")
  public HttpResponse<Void> delete(@PathVariable String ref) {
    service.delete(resolve(ref).getId());
    return HttpResponse.noContent();
  }

  @Post("/{ref}/trigger")
  public TriggerResponse trigger(@PathVariable String ref, @Nullable @Body CommentRequest body) {
    return TriggerResponse.from(service.trigger(resolve(ref).getId(), comment(body)));
  }

  @Post("/{ref}/pause")
  public BrickView pause(@PathVariable String ref, @Nullable @Body CommentRequest body) {
    return BrickView.detailed(service.pause(resolve(ref).getId(), comment(body)), clock.instant());
  }

  @Post("/{ref}/unpause")
  public BrickView unpause(@PathVariable String ref, @Nullable @Body CommentRequest body) {
    return BrickView.detailed(service.unpause(resolve(ref).getId(), comment(body)), clock.instant());
  }

  private Brick resolve(String ref) {
    if (BrickIdentity.isId(ref)) {
      try {
        return service.get(ref);
      } catch (BrickNotFoundException e) {
        LOG.debug("No brick with id {}, trying it as a slug", ref);
      }
    }
    return service.find(null, ref, null);
  }

  private static String comment(CommentRequest body) {
    return body != null ? body.comment() : null;
  }
}
