package com.acme.brickwatch.domain;

import java.time.Instant;

/** Instant at which the scheduler must look at a brick again. */
public record WakeTarget(String brickId, Instant wakeAt) {}
