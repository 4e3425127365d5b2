package com.acme.brickwatch.cli.commands;

import com.acme.brickwatch.cli.CliApplication;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BrickCommandsTest {

    private MockWebServer server;
    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new CliApplication());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private int run(String... args) {
        String[] all = new String[args.length + 4];
        System.arraycopy(args, 0, all, 0, args.length);
        all[args.length] = "--host";
        all[args.length + 1] = server.getHostName();
        all[args.length + 2] = "--port";
        all[args.length + 3] = String.valueOf(server.getPort());
        return cmd.execute(all);
    }

    @Test
    void testApplication_registersAllSubcommands() {
        assertThat(cmd.getSubcommands()).containsKeys(
                "configure", "create", "get", "list", "update", "trigger", "pause", "unpause", "delete");
    }

    @Test
    void testCreate_printsBrick() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\":\"abcdefgh\",\"name\":\"Nightly\"}"));

        int exitCode = run("create", "--name", "Nightly", "--periodicity", "3600", "-e", "a@example.com", "-e", "b@example.com");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"id\" : \"abcdefgh\"");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("a@example.com", "b@example.com");
    }

    @Test
    void testTriggerByName_resolvesIdentifierFirst() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\":\"abcdefgh\"}"));
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\",\"recovered\":false,\"unpaused\":false}"));

        int exitCode = run("trigger", "--name", "Nightly", "--comment", "manual run");

        assertThat(exitCode).isZero();
        assertThat(server.takeRequest().getRequestUrl().encodedPath()).isEqualTo("/api/bricks/lookup");
        RecordedRequest trigger = server.takeRequest();
        assertThat(trigger.getPath()).isEqualTo("/api/bricks/abcdefgh/trigger");
    }

    @Test
    void testUnknownBrick_exitsWithFailure() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"No brick with slug nope\",\"statusCode\":404}"));

        int exitCode = run("pause", "--slug", "nope");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No brick with slug nope");
    }

    @Test
    void testRefOptions_areMutuallyExclusive() {
        int exitCode = run("delete", "--id", "abcdefgh", "--slug", "nightly");

        assertThat(exitCode).isEqualTo(2);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void testList_passesNegatedFilter() throws Exception {
        server.enqueue(new MockResponse().setBody("[]"));

        int exitCode = run("list", "--no-paused");

        assertThat(exitCode).isZero();
        assertThat(server.takeRequest().getRequestUrl().queryParameter("paused")).isEqualTo("false");
    }

    @Test
    void testConfigure_writesSettingsFile(@TempDir Path tempDir) throws Exception {
        int exitCode = cmd.execute("configure", "--host", "watch.example.com", "--port", "9000", "--directory", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve(".brickwatch.env")))
                .contains("BRICKWATCH_HOST=watch.example.com")
                .contains("BRICKWATCH_PORT=9000");
    }
}
