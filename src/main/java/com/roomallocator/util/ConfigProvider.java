package com.roomallocator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class ConfigProvider {
    private static final String CONFIG_FILE = "config.properties";
    // System property naming a config file on disk that replaces the classpath one
    public static final String CONFIG_FILE_PROPERTY = "config.file";
    private static final Logger logger = LoggerFactory.getLogger(ConfigProvider.class);

    // Available configuration parameters
    public static final String ALLOCATOR_ENDPOINT = "ALLOCATOR_ENDPOINT";
    public static final String DATASET_RESOURCE = "DATASET_RESOURCE";
    public static final String ACTIVITY_LOG_CAPACITY = "ACTIVITY_LOG_CAPACITY";

    // Default values
    private static final String DEFAULT_ALLOCATOR_ENDPOINT = "tcp://*:5570";
    private static final String DEFAULT_DATASET_RESOURCE = "dataset/default-rooms.json";
    private static final String DEFAULT_ACTIVITY_LOG_CAPACITY = "100";

    // Global configuration settings
    private static Properties properties;

    /**
     * Loads the configuration without command line overrides.
     */
    public static Properties loadConfiguration() {
        return loadConfiguration(new String[0]);
    }

    /**
     * Loads the configuration from the properties file and then overrides with command line arguments.
     *
     * @param args Command line arguments in the format of key=value
     * @return The loaded properties with command line overrides
     */
    public static synchronized Properties loadConfiguration(String[] args) {
        properties = loadPropertiesFromFile();

        setDefaultIfMissing(ALLOCATOR_ENDPOINT, DEFAULT_ALLOCATOR_ENDPOINT);
        setDefaultIfMissing(DATASET_RESOURCE, DEFAULT_DATASET_RESOURCE);
        setDefaultIfMissing(ACTIVITY_LOG_CAPACITY, DEFAULT_ACTIVITY_LOG_CAPACITY);

        if (args != null) {
            for (String arg : args) {
                if (arg.contains("=")) {
                    String[] parts = arg.split("=", 2);
                    String key = parts[0].trim().toUpperCase();
                    String value = parts[1].trim();
                    properties.setProperty(key, value);
                    logger.info("Override configuration: {}={}", key, value);
                }
            }
        }

        return properties;
    }

    /**
     * Get the current configuration properties, loading them on first use.
     */
    public static synchronized Properties getConfiguration() {
        if (properties == null) {
            loadConfiguration();
        }
        return properties;
    }

    /**
     * Reads a positive integer setting, falling back to {@code defaultValue}
     * when it is missing or not a positive number.
     */
    public static int getPositiveInt(Properties config, String key, int defaultValue) {
        String value = config.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warn("Value for {} must be positive: '{}', using default {}", key, value, defaultValue);
            } catch (NumberFormatException nfe) {
                logger.warn("Invalid value for {}: '{}', using default {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static void setDefaultIfMissing(String key, String defaultValue) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, defaultValue);
        }
    }

    /**
     * Loads properties from the file named by {@value #CONFIG_FILE_PROPERTY},
     * or from {@value #CONFIG_FILE} on the classpath.
     */
    private static Properties loadPropertiesFromFile() {
        Properties props = new Properties();
        String external = System.getProperty(CONFIG_FILE_PROPERTY);
        if (external != null && !external.isBlank()) {
            try (InputStream input = new FileInputStream(external)) {
                props.load(input);
                logger.info("Loaded configuration from {}", external);
                return props;
            } catch (IOException e) {
                logger.error("Error loading configuration from {}: {}", external, e.getMessage(), e);
            }
        }
        try (InputStream input = ConfigProvider.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                logger.warn("Unable to find {}. Using default values.", CONFIG_FILE);
                return props;
            }

            props.load(input);
            logger.info("Loaded configuration from {}", CONFIG_FILE);
        } catch (IOException e) {
            logger.error("Error loading configuration: {}", e.getMessage(), e);
        }
        return props;
    }
}
