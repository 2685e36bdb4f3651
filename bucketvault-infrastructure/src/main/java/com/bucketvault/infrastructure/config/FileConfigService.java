package com.bucketvault.infrastructure.config;

import com.bucketvault.application.config.ConfigKey;
import com.bucketvault.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * File + env configuration of a vault instance.
 *
 * Load order (low -> high priority):
 *  1) classpath bucketvault.properties (shipped defaults)
 *  2) config/config.properties (working directory)
 *  3) config/.env (optional)
 *  4) OS environment, BUCKETVAULT_* mapping of every known key
 *
 * Key to env mapping: vault.fee.ownerBps -> BUCKETVAULT_VAULT_FEE_OWNER_BPS
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    static final String CLASSPATH_DEFAULTS = "bucketvault.properties";

    private final Properties props = new Properties();
    private final Path configDir;

    private FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadClasspathDefaults();
        loadFiles();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return fromDirectory(Path.of(System.getProperty("user.dir")).resolve("config"));
    }

    public static FileConfigService fromDirectory(Path configDir) throws IOException {
        return new FileConfigService(configDir, System.getenv());
    }

    /** Directory + explicit environment; lets tests control overrides. */
    static FileConfigService fromDirectory(Path configDir, Map<String, String> env) throws IOException {
        return new FileConfigService(configDir, env);
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadClasspathDefaults() throws IOException {
        try (InputStream in = FileConfigService.class.getClassLoader().getResourceAsStream(CLASSPATH_DEFAULTS)) {
            if (in != null) props.load(in);
        }
    }

    private void loadFiles() throws IOException {
        if (configDir == null) return;

        Path file = configDir.resolve("config.properties");
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            }
        }
        DotEnv.loadIfExists(configDir.resolve(".env")).forEach(props::setProperty);
    }

    private void applyEnvOverrides(Map<String, String> env) {
        for (String key : props.stringPropertyNames()) {
            String val = env.get(toEnvKey(key));
            if (val != null) props.setProperty(key, val);
        }
        for (ConfigKey ck : ConfigKey.values()) {
            String val = env.get(toEnvKey(ck.key()));
            if (val != null) props.setProperty(ck.key(), val);
        }
    }

    /**
     * Maps a properties key into an env-var key.
     *
     * Examples:
     * - vault.id                -> BUCKETVAULT_VAULT_ID
     * - vault.fee.callerBps     -> BUCKETVAULT_VAULT_FEE_CALLER_BPS
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "BUCKETVAULT_" + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] key={} value='{}' is not an integer, using default {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null) return defaultValue;
        if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) return Boolean.parseBoolean(v);
        log.warn("[CONFIG] key={} value='{}' is not a boolean, using default {}", key, v, defaultValue);
        return defaultValue;
    }
}
