package com.acme.brickwatch.cli.commands;

import com.acme.brickwatch.cli.config.CliConfiguration;
import com.acme.brickwatch.cli.service.ApiService;
import picocli.CommandLine.Option;

import java.time.Duration;

/** Server connection options shared by every command that talks to the API. */
public class ConnectionOptions {

    @Option(names = {"-H", "--host"}, description = "Server host (default: from ~/.brickwatch.env or localhost)")
    String host;

    @Option(names = {"-p", "--port"}, description = "Server port (default: from ~/.brickwatch.env or 8080)")
    Integer port;

    @Option(names = {"-k", "--auth-key"}, description = "Authentication key, if the server requires one")
    String authKey;

    ApiService apiService() {
        CliConfiguration config = CliConfiguration.getInstance();
        return ApiService.forServer(
                host != null ? host : config.getHost(),
                port != null ? port : config.getPort(),
                authKey != null ? authKey : config.getAuthKey(),
                Duration.ofSeconds(config.getTimeoutSeconds()));
    }
}
