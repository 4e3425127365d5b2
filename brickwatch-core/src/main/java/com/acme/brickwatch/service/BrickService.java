package com.acme.brickwatch.service;

import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.BrickFilter;
import java.util.List;

/**
 * Brick lifecycle operations. Each returns the post-mutation brick and keeps the deadline
 * scheduler informed about deadline changes.
 */
public interface BrickService {

  /**
   * @throws DuplicateSlugException if the name's slug is taken
   * @throws com.acme.brickwatch.schedule.PeriodicityParseException if the periodicity is invalid
   */
  Brick create(NewBrick request);

  /** @throws BrickNotFoundException if no brick has this identifier */
  Brick get(String id);

  /**
   * Looks a brick up by exactly one of identifier, slug or name (names resolve through their slug).
   */
  Brick find(String id, String slug, String name);

  List<Brick> list(BrickFilter filter, boolean verbose);

  /** @throws IllegalArgumentException if the update changes nothing */
  Brick update(String id, BrickUpdate update);

  TriggerResult trigger(String id, String comment);

  /** @throws IllegalStateException if the brick is already paused */
  Brick pause(String id, String comment);

  /** @throws IllegalStateException if the brick is not paused */
  Brick unpause(String id, String comment);

  void delete(String id);
}
