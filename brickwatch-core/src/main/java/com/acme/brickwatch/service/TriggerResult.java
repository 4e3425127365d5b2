package com.acme.brickwatch.service;

import com.acme.brickwatch.domain.Brick;

/**
 * Post-trigger projection of a brick.
 *
 * @param recovered the brick was late before the trigger
 * @param unpaused the brick was paused before the trigger
 */
public record TriggerResult(Brick brick, boolean recovered, boolean unpaused) {}
