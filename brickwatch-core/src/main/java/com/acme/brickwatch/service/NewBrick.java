package com.acme.brickwatch.service;

import java.util.List;

/** Creation request; {@code description} and {@code emails} may be null. */
public record NewBrick(
    String name, String periodicity, String description, List<String> emails, boolean paused) {}
