package org.realityforge.sqldeploy.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.realityforge.sqldeploy.config.ConfigException;

final class PasswordResolver {
    private final Map<String, String> environment;
    private final InputStream stdin;

    PasswordResolver(final Map<String, String> environment, final InputStream stdin) {
        this.environment = Map.copyOf(environment);
        this.stdin = stdin;
    }

    String fromDirectValue(final String value) {
        return value;
    }

    String fromEnvironment(final String variableName) {
        final var value = environment.get(variableName);
        if (null == value) {
            throw new ConfigException("No value found in environment variable '" + variableName + "'.");
        }
        return value;
    }

    // Consumes exactly one line so a request piped after the password is left on stdin.
    String fromStdin() {
        final var line = new ByteArrayOutputStream();
        try {
            int next = stdin.read();
            if (-1 == next) {
                throw new ConfigException("No password available on stdin.");
            }
            while (-1 != next && '\n' != next) {
                line.write(next);
                next = stdin.read();
            }
        } catch (final IOException ioe) {
            throw new UncheckedIOException("Failed to read password from stdin", ioe);
        }
        final var value = line.toString(StandardCharsets.UTF_8);
        return value.endsWith("\r") ? value.substring(0, value.length() - 1) : value;
    }
}
