package com.acme.brickwatch.scheduler;

import java.time.Instant;

/** Observer of wake-target changes made by this process. */
public interface DeadlineChangeListener {

  /**
   * @param brickId public identifier of the brick
   * @param wakeAt new wake target, or null if the brick no longer needs one
   */
  void onDeadlineChanged(String brickId, Instant wakeAt);
}
