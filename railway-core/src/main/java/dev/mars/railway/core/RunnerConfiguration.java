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

package dev.mars.railway.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the DAG runners.
 * Defaults are overridden by the first {@code railway.properties} found on disk or on the
 * classpath, then by {@code railway.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class RunnerConfiguration {
    private static final Logger logger = Logger.getLogger(RunnerConfiguration.class.getName());

    public static final String MAX_ITERATIONS_KEY = "railway.runner.max.iterations";
    public static final String STRICT_KEY = "railway.runner.strict";
    public static final String METRICS_ENABLED_KEY = "railway.runner.metrics.enabled";
    public static final String PATH_TAIL_SIZE_KEY = "railway.runner.path.tail.size";

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final boolean DEFAULT_STRICT = true;
    public static final boolean DEFAULT_METRICS_ENABLED = true;
    public static final int DEFAULT_PATH_TAIL_SIZE = 10;

    private static final String CONFIG_FILE_NAME = "railway.properties";

    private final Properties properties;

    public RunnerConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public RunnerConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    public int getMaxIterations() {
        return getPositiveIntProperty(MAX_ITERATIONS_KEY, DEFAULT_MAX_ITERATIONS);
    }

    public boolean isStrict() {
        return getBooleanProperty(STRICT_KEY, DEFAULT_STRICT);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED_KEY, DEFAULT_METRICS_ENABLED);
    }

    public int getPathTailSize() {
        return getPositiveIntProperty(PATH_TAIL_SIZE_KEY, DEFAULT_PATH_TAIL_SIZE);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getPositiveIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
                logger.warning("Non-positive value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_ITERATIONS_KEY, String.valueOf(DEFAULT_MAX_ITERATIONS));
        properties.setProperty(STRICT_KEY, String.valueOf(DEFAULT_STRICT));
        properties.setProperty(METRICS_ENABLED_KEY, String.valueOf(DEFAULT_METRICS_ENABLED));
        properties.setProperty(PATH_TAIL_SIZE_KEY, String.valueOf(DEFAULT_PATH_TAIL_SIZE));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.railway/" + CONFIG_FILE_NAME
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("railway."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "RunnerConfiguration{" +
                "maxIterations=" + getMaxIterations() +
                ", strict=" + isStrict() +
                ", metricsEnabled=" + isMetricsEnabled() +
                ", pathTailSize=" + getPathTailSize() +
                '}';
    }
}
