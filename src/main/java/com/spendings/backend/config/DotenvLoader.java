package com.spendings.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a local ".env" file before the Spring context starts, so that DATABASE_URL,
 * DATABASE_NAME and PORT can be kept out of the shell during development.
 *
 * Values become System properties and are only applied when neither an environment variable nor
 * a System property of the same name is already set.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final List<Path> CANDIDATES = List.of(Path.of(".env"), Path.of("backend", ".env"));

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Optional<Path> envFile = CANDIDATES.stream().filter(Files::isRegularFile).findFirst();
        if (envFile.isEmpty()) {
            return;
        }

        try {
            int applied = apply(Files.readAllLines(envFile.get(), StandardCharsets.UTF_8));
            if (applied > 0) {
                log.info("[DotenvLoader] applied {} keys from {} (values hidden)", applied,
                        envFile.get().toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] could not read {}: {}", envFile.get(), e.getMessage());
        }
    }

    static int apply(List<String> lines) {
        int applied = 0;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int eq = line.indexOf('=');
            if (eq <= 0) continue;

            String key = line.substring(0, eq).trim();
            String value = unquote(line.substring(eq + 1).trim());
            if (key.isEmpty() || value.isEmpty() || isDefined(key)) continue;

            System.setProperty(key, value);
            applied++;
        }
        return applied;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean isDefined(String key) {
        String env = System.getenv(key);
        String prop = System.getProperty(key);
        return (env != null && !env.isBlank()) || (prop != null && !prop.isBlank());
    }
}
