package com.acme.brickwatch.repository;

import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.BrickFilter;
import com.acme.brickwatch.domain.WakeTarget;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for bricks and their history. Every write touches a single brick and is atomic; the
 * store is the source of truth shared by all server processes.
 */
public interface BrickRepository {

  // Insert operations

  /**
   * Insert a new brick together with its initial history and assign its store key
   */
  void insert(Brick brick);

  // Query operations

  /**
   * Load a brick with its full history by public identifier
   */
  Optional<Brick> findById(String id);

  /**
   * Resolve a slug to the public identifier of its brick
   */
  Optional<String> findIdBySlug(String slug);

  /**
   * List bricks matching the filter, ordered by name. History is loaded only when requested.
   */
  List<Brick> list(BrickFilter filter, boolean withHistory);

  /**
   * Bricks whose wake target is at or before the given instant: unpaused, not late bricks with a
   * passed deadline, and unpaused bricks whose schedule gap has ended.
   */
  List<Brick> findWithDeadlineBefore(Instant time, int limit);

  /**
   * Wake targets of all unpaused, not late bricks that have a deadline or a gap end
   */
  List<WakeTarget> listActive();

  // Update operations

  /**
   * Compare-and-set write of the brick's fields plus its unsaved history events. Increments the
   * version and prunes stored history on success.
   *
   * @return false if the stored version no longer matches {@code expectedVersion}
   */
  boolean update(Brick brick, long expectedVersion);

  /**
   * Delete a brick and its history
   *
   * @return false if no such brick exists
   */
  boolean delete(String id);

  // Notification claim operations

  /**
   * Atomically take ownership of a pending notification. Succeeds only while {@code notify_pending}
   * is true and {@code late} still equals {@code expectedLate}.
   */
  boolean claimNotification(String id, boolean expectedLate, String claimToken, Instant claimedAt);

  /**
   * Mark a claimed notification as delivered
   */
  void completeNotification(String id, String claimToken);

  /**
   * Give a claimed notification back so that it is retried. The notice is owed again only if the
   * brick is unpaused and still in the late state it was claimed for.
   *
   * @return false if the claim no longer belongs to {@code claimToken}
   */
  boolean releaseNotification(String id, String claimToken);

  /**
   * Bricks with an unclaimed pending notification
   */
  List<Brick> findPendingNotifications(int limit);

  /**
   * Drop claims older than the given instant (crashed senders), owing the notice again under the
   * same condition as {@link #releaseNotification}
   */
  int recoverStaleClaims(Instant claimedBefore);
}
