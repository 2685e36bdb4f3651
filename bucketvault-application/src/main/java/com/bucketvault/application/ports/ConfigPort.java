package com.bucketvault.application.ports;

/**
 * Flat key/value settings of one vault process, keyed by {@link com.bucketvault.application.config.ConfigKey}.
 * Blank values read as absent; typed getters fall back to the default on unparseable input.
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    boolean getBoolean(String key, boolean defaultValue);
}
