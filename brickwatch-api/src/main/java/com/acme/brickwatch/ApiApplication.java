package com.acme.brickwatch;

import io.micronaut.runtime.Micronaut;

/**
 * Brick Watch server - HTTP endpoint for managing and triggering bricks.
 * Also runs the deadline scheduler and notification sweeper unless scheduler.enabled=false.
 */
public class ApiApplication {
    public static void main(String[] args) {
        Micronaut.run(ApiApplication.class, args);
    }
}
