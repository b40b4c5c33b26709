/*
 Licensed to Diennea S.r.l. under one
 or more contributor license agreements. See the NOTICE file
 distributed with this work for additional information
 regarding copyright ownership. Diennea S.r.l. licenses this file
 to you under the Apache License, Version 2.0 (the
 "License"); you may not use this file except in compliance
 with the License.  You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing,
 software distributed under the License is distributed on an
 "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 KIND, either express or implied.  See the License for the
 specific language governing permissions and limitations
 under the License.

 */
package org.certkeeper.configstore;

import java.util.Arrays;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;

/**
 * Read-only source of configuration properties.
 */
public interface ConfigurationStore {

    String PROPERTY_VALUES_SEPARATOR = ",";

    /**
     * A view over the process environment, as seen at the time of the call.
     *
     * @return a store whose keys are the environment variable names
     */
    static ConfigurationStore fromEnvironment() {
        Properties env = new Properties();
        env.putAll(System.getenv());
        return new PropertiesConfigurationStore(env);
    }

    default String toStringConfiguration() {
        Set<String> props = new TreeSet<>();
        forEach((k, v) -> props.add(k + "=" + v));
        StringBuilder builder = new StringBuilder();
        props.forEach(p -> builder.append(p).append("\n"));
        return builder.toString();
    }

    String getProperty(String key, String defaultValue);

    default int getInt(String key, int defaultValue) throws ConfigurationNotValidException {
        String property = getProperty(key, defaultValue + "").trim();
        if (property.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(property);
        } catch (NumberFormatException err) {
            throw new ConfigurationNotValidException("Invalid integer value '" + property + "' for parameter '" + key + "'");
        }
    }

    /**
     * Like {@link #getInt(String, int)}, but malformed values are reported as the default.
     */
    default int getIntOrDefault(String key, int defaultValue) {
        try {
            return getInt(key, defaultValue);
        } catch (ConfigurationNotValidException err) {
            return defaultValue;
        }
    }

    default long getLong(String key, long defaultValue) throws ConfigurationNotValidException {
        String property = getProperty(key, defaultValue + "").trim();
        if (property.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(property);
        } catch (NumberFormatException err) {
            throw new ConfigurationNotValidException("Invalid integer value '" + property + "' for parameter '" + key + "'");
        }
    }

    default String getString(String key, String defaultValue) {
        String property = getProperty(key, defaultValue);
        if (property == null || property.isBlank()) {
            return defaultValue;
        }
        return property.trim();
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        String property = getProperty(key, defaultValue + "").trim();
        if (property.isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(property);
    }

    default Set<String> getValues(String key) {
        return getValues(key, Set.of());
    }

    default Set<String> getValues(String key, Set<String> defaultValue) {
        final var values = getString(key, "");
        if (values.isBlank()) {
            return defaultValue;
        }
        return Set.copyOf(Arrays.asList(values.replaceAll(" ", "").split(PROPERTY_VALUES_SEPARATOR)));
    }

    void forEach(BiConsumer<String, String> consumer);

    void forEach(String prefix, BiConsumer<String, String> consumer);

    /**
     *
     * @param prefix prefix for properties to fetch. Whether null, all properties will be fetched.
     * @return properties with key starting with prefix.
     */
    default Properties asProperties(String prefix) {
        Properties copy = new Properties();
        this.forEach((k, v) -> {
            if (prefix == null) {
                copy.put(k, v);
            } else if (k.startsWith(prefix + ".")) {
                copy.put(k.substring(prefix.length() + 1), v);
            }
        });
        return copy;
    }
}
