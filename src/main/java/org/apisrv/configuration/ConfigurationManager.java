package org.apisrv.configuration;

import lombok.extern.slf4j.Slf4j;
import org.apisrv.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "apisrv.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    ConfigurationManager(Properties properties) {
        this.properties = properties;
    }

    private ConfigurationManager() {
        this(loadDefaults());
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager();
        }

        return INSTANCE;
    }

    /**
     * Layers the properties of {@code path} over the bundled defaults.
     */
    public static synchronized void overrideProperties(String path) {
        Properties merged = loadDefaults();
        try (FileInputStream input = new FileInputStream(path)) {
            merged.load(input);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", path, e);
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", path, e);
            throw new ConfigurationException("Error loading configuration file: " + path, e);
        }
        INSTANCE = new ConfigurationManager(merged);
    }

    private static Properties loadDefaults() {
        Properties defaults = new Properties();
        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                log.warn("Bundled configuration {} not found, using built-in defaults", DEFAULT_RESOURCE);
                return defaults;
            }
            defaults.load(input);
        } catch (IOException e) {
            log.error("Error loading bundled configuration {}", DEFAULT_RESOURCE, e);
            throw new ConfigurationException("Error loading configuration file.", e);
        }
        return defaults;
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            log.debug("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    public int getIntProperty(String key, int defaultValue) {
        long value = getLongProperty(key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            log.warn("Integer property {} out of range: {}", key, value);
            throw new ConfigurationException("Integer property out of range: " + key);
        }
        return (int) value;
    }

    public long getLongProperty(String key, long defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer format for property: {}", key, e);
            throw new ConfigurationException("Invalid integer format for property: " + key, e);
        }
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

}
