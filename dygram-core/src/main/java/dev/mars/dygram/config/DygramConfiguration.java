/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.dygram.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the semantic passes.
 * Defaults are overridden by a {@code dygram.properties} resource on the classpath,
 * then by system properties starting with {@code dygram.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class DygramConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(DygramConfiguration.class);

    public static final String STRICT_DEFAULT = "dygram.strict.default";
    public static final String MAX_ERRORS = "dygram.validation.maxErrors";
    public static final String FAIL_FAST = "dygram.validation.failFast";
    public static final String REPORT_CYCLES = "dygram.graph.reportCycles";
    public static final String RESERVED_IDENTIFIERS = "dygram.dependency.reservedIdentifiers";
    public static final String ROOT_IDENTIFIERS_ONLY = "dygram.dependency.condition.rootIdentifiersOnly";

    // Default configuration values
    private static final boolean DEFAULT_STRICT = false;
    private static final int DEFAULT_MAX_ERRORS = 0; // unlimited
    private static final boolean DEFAULT_FAIL_FAST = false;
    private static final boolean DEFAULT_REPORT_CYCLES = true;
    private static final String DEFAULT_RESERVED_IDENTIFIERS = "true,false,null,errorCount,errors,activeState";
    private static final boolean DEFAULT_ROOT_IDENTIFIERS_ONLY = false;

    private static final String RESOURCE_NAME = "dygram.properties";

    private final Properties properties;

    public DygramConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromSystemProperties();
    }

    public DygramConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public static DygramConfiguration defaults() {
        return new DygramConfiguration(null);
    }

    /**
     * Whether machines without {@code @StrictMode} are still analyzed strictly.
     */
    public boolean isStrictByDefault() {
        return getBooleanProperty(STRICT_DEFAULT, DEFAULT_STRICT);
    }

    public int getMaxErrors() {
        int value = getIntProperty(MAX_ERRORS, DEFAULT_MAX_ERRORS);
        if (value < 0) {
            logger.warn("Negative value for property {}: {}. Using default: {}", MAX_ERRORS, value, DEFAULT_MAX_ERRORS);
            return DEFAULT_MAX_ERRORS;
        }
        return value;
    }

    /**
     * Whether diagnostic collection stops at the first error.
     */
    public boolean isFailFast() {
        return getBooleanProperty(FAIL_FAST, DEFAULT_FAIL_FAST);
    }

    public boolean isReportCycles() {
        return getBooleanProperty(REPORT_CYCLES, DEFAULT_REPORT_CYCLES);
    }

    /**
     * Identifiers in edge conditions that never denote a node.
     */
    public Set<String> getReservedIdentifiers() {
        String value = getStringProperty(RESERVED_IDENTIFIERS, DEFAULT_RESERVED_IDENTIFIERS);
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * When true, a dotted path in a condition ({@code config.retry.max}) contributes only its
     * root identifier; when false every segment is treated as an identifier.
     */
    public boolean isRootIdentifiersOnly() {
        return getBooleanProperty(ROOT_IDENTIFIERS_ONLY, DEFAULT_ROOT_IDENTIFIERS_ONLY);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
            logger.warn("Invalid boolean value for property {}: {}. Using default: {}", key, value, defaultValue);
            return defaultValue;
        }
        return Boolean.parseBoolean(trimmed);
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(STRICT_DEFAULT, String.valueOf(DEFAULT_STRICT));
        properties.setProperty(MAX_ERRORS, String.valueOf(DEFAULT_MAX_ERRORS));
        properties.setProperty(FAIL_FAST, String.valueOf(DEFAULT_FAIL_FAST));
        properties.setProperty(REPORT_CYCLES, String.valueOf(DEFAULT_REPORT_CYCLES));
        properties.setProperty(RESERVED_IDENTIFIERS, DEFAULT_RESERVED_IDENTIFIERS);
        properties.setProperty(ROOT_IDENTIFIERS_ONLY, String.valueOf(DEFAULT_ROOT_IDENTIFIERS_ONLY));
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath resource {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("dygram."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "DygramConfiguration{" +
                "strictByDefault=" + isStrictByDefault() +
                ", maxErrors=" + getMaxErrors() +
                ", failFast=" + isFailFast() +
                ", reportCycles=" + isReportCycles() +
                ", rootIdentifiersOnly=" + isRootIdentifiersOnly() +
                '}';
    }
}
