package com.bucketvault.infrastructure.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code .env} files written for shells: {@code KEY=value} lines, an optional {@code export}
 * prefix, optional single or double quotes around the value, {@code #} comments.
 * Malformed lines are skipped; later lines win.
 */
public final class DotEnv {

    private static final String EXPORT = "export ";

    private DotEnv() {}

    public static Map<String, String> loadIfExists(Path envFile) throws IOException {
        if (envFile == null || !Files.isRegularFile(envFile)) return new LinkedHashMap<>();
        return parse(Files.readAllLines(envFile, StandardCharsets.UTF_8));
    }

    static Map<String, String> parse(List<String> lines) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.charAt(0) == '#') continue;
            if (line.startsWith(EXPORT)) line = line.substring(EXPORT.length()).strip();

            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            out.put(line.substring(0, eq).strip(), unquote(line.substring(eq + 1).strip()));
        }
        return out;
    }

    private static String unquote(String v) {
        if (v.length() < 2) return v;
        char first = v.charAt(0);
        if ((first == '"' || first == '\'') && v.charAt(v.length() - 1) == first) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
