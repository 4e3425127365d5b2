package com.acme.brickwatch.cli.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings of the CLI, read from {@code ~/.brickwatch.env} with environment variables
 * taking the same names as fallback.
 */
public class CliConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CliConfiguration.class);

    public static final String FILE_NAME = ".brickwatch.env";
    static final String HOST = "BRICKWATCH_HOST";
    static final String PORT = "BRICKWATCH_PORT";
    static final String AUTH_KEY = "BRICKWATCH_AUTH_KEY";
    static final String TIMEOUT_SECONDS = "BRICKWATCH_TIMEOUT_SECONDS";

    private static CliConfiguration instance;
    private final Path directory;
    private final Dotenv dotenv;

    public CliConfiguration(Path directory) {
        this.directory = directory;
        try {
            this.dotenv = Dotenv.configure()
                    .directory(directory.toString())
                    .filename(FILE_NAME)
                    .ignoreIfMissing()
                    .load();
            logger.debug("Configuration loaded from {}", directory.resolve(FILE_NAME));
        } catch (Exception e) {
            logger.warn("Failed to load {}, using system environment variables only", FILE_NAME, e);
            throw new RuntimeException("Failed to initialize configuration", e);
        }
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            instance = new CliConfiguration(Paths.get(System.getProperty("user.home")));
        }
        return instance;
    }

    private String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public String getHost() {
        return get(HOST, "localhost");
    }

    public int getPort() {
        return getInt(PORT, 8080);
    }

    /** Null when no key is configured. */
    public String getAuthKey() {
        return get(AUTH_KEY, null);
    }

    public int getTimeoutSeconds() {
        return getInt(TIMEOUT_SECONDS, 30);
    }

    public Path getFile() {
        return directory.resolve(FILE_NAME);
    }

    /**
     * Writes the connection settings to the configuration file, replacing it. A null auth key
     * leaves the key out.
     */
    public Path save(String host, int port, String authKey) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(HOST, host);
        values.put(PORT, String.valueOf(port));
        if (authKey != null && !authKey.isBlank()) {
            values.put(AUTH_KEY, authKey);
        }
        StringBuilder content = new StringBuilder();
        values.forEach((key, value) -> content.append(key).append('=').append(value).append('\n'));
        Path file = getFile();
        Files.writeString(file, content.toString(), StandardCharsets.UTF_8);
        logger.info("Saved configuration to {}", file);
        return file;
    }
}
