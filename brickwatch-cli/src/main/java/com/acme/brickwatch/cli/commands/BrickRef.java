package com.acme.brickwatch.cli.commands;

import com.acme.brickwatch.cli.service.ApiService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Option;

import java.io.IOException;

/** Identifies one brick by exactly one of identifier, slug or name. */
public class BrickRef {

    @Option(names = {"-i", "--id"}, description = "Brick identifier")
    String id;

    @Option(names = {"-s", "--slug"}, description = "Brick slug")
    String slug;

    @Option(names = {"-n", "--name"}, description = "Brick name")
    String name;

    /**
     * Returns the path reference to use with the API. A name is resolved to the identifier first.
     *
     * @throws BrickLookupException if the name does not resolve
     */
    String resolve(ApiService api) throws IOException {
        if (id != null) {
            return id;
        }
        if (slug != null) {
            return slug;
        }
        ApiService.ApiResponse response = api.findByName(name);
        if (!response.isSuccessful()) {
            throw new BrickLookupException(response);
        }
        JsonNode brick = new ObjectMapper().readTree(response.getBody());
        return brick.path("id").asText();
    }

    static class BrickLookupException extends RuntimeException {
        private final transient ApiService.ApiResponse response;

        BrickLookupException(ApiService.ApiResponse response) {
            super("Brick lookup failed with status " + response.getStatusCode());
            this.response = response;
        }

        ApiService.ApiResponse getResponse() {
            return response;
        }
    }
}
