package io.github.yok.masklink.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves connection secrets from a literal value or from a named environment variable.
 *
 * <p>
 * Variables are looked up in the process environment first and then in an optional dotenv-style
 * file ({@code KEY=VALUE} per line, {@code #} comments and blank lines ignored). A value present in
 * the process environment is never overridden by the file.
 * </p>
 */
@Slf4j
public class SecretResolver {

    private final Map<String, String> environment;
    private final Path envFile;

    // Parsed lazily; the file is optional and read at most once
    private Map<String, String> fileEntries;

    /**
     * Creates a resolver over the real process environment.
     *
     * @param envFile dotenv-style file, or {@code null} to disable file lookup
     */
    public SecretResolver(Path envFile) {
        this(System.getenv(), envFile);
    }

    /**
     * Creates a resolver over the given environment map.
     *
     * @param environment environment variables
     * @param envFile dotenv-style file, or {@code null} to disable file lookup
     */
    public SecretResolver(Map<String, String> environment, Path envFile) {
        this.environment = environment;
        this.envFile = envFile;
    }

    /**
     * Resolves a secret.
     *
     * @param literal literal secret; used as-is when not blank
     * @param envName name of the variable holding the secret
     * @param owner label of the connection the secret belongs to (for messages only)
     * @return the resolved secret
     * @throws IllegalStateException if neither a literal nor a resolvable variable is configured
     */
    public String resolve(String literal, String envName, String owner) {
        if (StringUtils.isNotEmpty(literal)) {
            return literal;
        }
        if (StringUtils.isBlank(envName)) {
            throw new IllegalStateException(
                    "Neither 'password' nor 'password-env' is configured for connection: " + owner);
        }
        String value = lookup(envName.trim());
        if (StringUtils.isEmpty(value)) {
            throw new IllegalStateException("Environment variable not found: " + envName
                    + " (connection=" + owner + ")");
        }
        return value;
    }

    /**
     * Looks up a variable in the process environment, then in the dotenv file.
     *
     * @param name variable name
     * @return value, or {@code null} when undefined
     */
    public String lookup(String name) {
        String value = environment.get(name);
        if (value != null) {
            return value;
        }
        return fileEntries().get(name);
    }

    private synchronized Map<String, String> fileEntries() {
        if (fileEntries == null) {
            fileEntries = readEnvFile();
        }
        return fileEntries;
    }

    private Map<String, String> readEnvFile() {
        if (envFile == null || !Files.isRegularFile(envFile)) {
            return Collections.emptyMap();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read env file: " + envFile, e);
        }
        Map<String, String> entries = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || !line.contains("=")) {
                continue;
            }
            String key = StringUtils.substringBefore(line, "=").trim();
            String value = StringUtils.substringAfter(line, "=").trim();
            entries.putIfAbsent(key, value);
        }
        log.debug("Loaded {} entries from env file {}", entries.size(), envFile);
        return entries;
    }
}
