package com.acme.brickwatch.cli.commands;

import com.acme.brickwatch.cli.service.ApiService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/** Brick management subcommands. Each prints the server's JSON response and exits non-zero on failure. */
public final class BrickCommands {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private BrickCommands() {
    }

    abstract static class ApiCommand implements Callable<Integer> {
        @Mixin
        ConnectionOptions connection;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            try {
                return print(execute(connection.apiService()));
            } catch (BrickRef.BrickLookupException e) {
                return print(e.getResponse());
            } catch (IOException e) {
                spec.commandLine().getErr().println("Error contacting server: " + e.getMessage());
                return 2;
            }
        }

        abstract ApiService.ApiResponse execute(ApiService api) throws IOException;

        private int print(ApiService.ApiResponse response) {
            PrintWriter out = response.isSuccessful() ? spec.commandLine().getOut() : spec.commandLine().getErr();
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                out.println(response.isSuccessful() ? "OK" : "Request failed with status " + response.getStatusCode());
            } else {
                out.println(pretty(body));
            }
            out.flush();
            return response.isSuccessful() ? 0 : 1;
        }
    }

    static String pretty(String body) {
        try {
            JsonNode json = MAPPER.readTree(body);
            return MAPPER.writeValueAsString(json);
        } catch (IOException e) {
            // Not JSON, print as-is
            return body;
        }
    }

    @Command(name = "create", description = "Create a brick")
    public static class Create extends ApiCommand {
        @Option(names = {"-n", "--name"}, required = true, description = "Brick name")
        String name;

        @Option(names = {"-P", "--periodicity"}, required = true,
                description = "Seconds between triggers, or schedule rules like '* * * * mon-fri 600; * * * * sat,sun 7200'")
        String periodicity;

        @Option(names = {"-d", "--description"}, description = "Description")
        String description;

        @Option(names = {"-e", "--email"}, description = "Notification address, may be repeated")
        List<String> emails;

        @Option(names = "--paused", description = "Create the brick paused")
        boolean paused;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.create(name, periodicity, description, emails, paused);
        }
    }

    @Command(name = "get", description = "Show a brick with its history")
    public static class Get extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        BrickRef ref;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            if (ref.name != null) {
                return api.findByName(ref.name);
            }
            return api.get(ref.resolve(api));
        }
    }

    @Command(name = "list", description = "List bricks")
    public static class ListBricks extends ApiCommand {
        @Option(names = "--paused", negatable = true, description = "Only paused (or with --no-paused, unpaused) bricks")
        Boolean paused;

        @Option(names = "--late", negatable = true, description = "Only late (or with --no-late, timely) bricks")
        Boolean late;

        @Option(names = "--search", description = "Regular expression matched against name, slug, identifier and emails")
        String search;

        @Option(names = {"-v", "--verbose"}, description = "Include history")
        boolean verbose;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.list(paused, late, search, verbose);
        }
    }

    @Command(name = "update", description = "Change a brick's name, periodicity, description or emails")
    public static class Update extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        Target target;

        @Option(names = {"-n", "--name"}, description = "New name")
        String name;

        @Option(names = {"-P", "--periodicity"}, description = "New periodicity")
        String periodicity;

        @Option(names = {"-d", "--description"}, description = "New description")
        String description;

        @Option(names = {"-e", "--email"}, description = "Replacement address list, may be repeated; '-' clears all")
        List<String> emails;

        static class Target {
            @Option(names = {"-i", "--id"}, description = "Brick identifier")
            String id;

            @Option(names = {"-s", "--slug"}, description = "Brick slug")
            String slug;
        }

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            String ref = target.id != null ? target.id : target.slug;
            return api.update(ref, name, periodicity, description, emails);
        }
    }

    @Command(name = "trigger", description = "Record that the job ran")
    public static class Trigger extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        BrickRef ref;

        @Option(names = {"-c", "--comment"}, description = "Comment stored in the history")
        String comment;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.trigger(ref.resolve(api), comment);
        }
    }

    @Command(name = "pause", description = "Stop watching a brick")
    public static class Pause extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        BrickRef ref;

        @Option(names = {"-c", "--comment"}, description = "Comment stored in the history")
        String comment;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.pause(ref.resolve(api), comment);
        }
    }

    @Command(name = "unpause", description = "Resume watching a brick")
    public static class Unpause extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        BrickRef ref;

        @Option(names = {"-c", "--comment"}, description = "Comment stored in the history")
        String comment;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.unpause(ref.resolve(api), comment);
        }
    }

    @Command(name = "delete", description = "Delete a brick and its history")
    public static class Delete extends ApiCommand {
        @ArgGroup(multiplicity = "1")
        BrickRef ref;

        @Override
        ApiService.ApiResponse execute(ApiService api) throws IOException {
            return api.delete(ref.resolve(api));
        }
    }
}
