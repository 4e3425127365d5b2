package com.acme.brickwatch.cli.commands;

import com.acme.brickwatch.cli.config.CliConfiguration;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "configure", description = "Save server connection settings to ~/.brickwatch.env")
public class ConfigureCommand implements Callable<Integer> {

    @Option(names = {"-H", "--host"}, required = true, description = "Server host")
    String host;

    @Option(names = {"-p", "--port"}, defaultValue = "8080", description = "Server port (default: ${DEFAULT-VALUE})")
    int port;

    @Option(names = {"-k", "--auth-key"}, description = "Authentication key")
    String authKey;

    @Option(names = "--directory", hidden = true, description = "Directory holding the settings file")
    Path directory;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        CliConfiguration config = directory != null ? new CliConfiguration(directory) : CliConfiguration.getInstance();
        try {
            Path file = config.save(host, port, authKey);
            spec.commandLine().getOut().println("Saved settings to " + file);
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Could not write settings: " + e.getMessage());
            return 1;
        }
    }
}
