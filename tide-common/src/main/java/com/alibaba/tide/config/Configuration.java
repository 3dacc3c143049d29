/*
 * Copyright (c) 2024 Alibaba Group Holding Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.tide.config;

import com.alibaba.tide.annotation.PublicEvolving;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values are stored as given and
 * converted to the type of the {@link ConfigOption} they are read with, so string-valued maps
 * coming from property files can be used directly.
 *
 * @since 0.1
 */
@PublicEvolving
public class Configuration {

    @GuardedBy("confData")
    private final Map<String, Object> confData;

    public Configuration() {
        this.confData = new HashMap<>();
    }

    /** Creates a new configuration with the copy of the given configuration. */
    public Configuration(Configuration other) {
        synchronized (other.confData) {
            this.confData = new HashMap<>(other.confData);
        }
    }

    /** Creates a new configuration that is initialized with the options of the given map. */
    public static Configuration fromMap(Map<String, String> map) {
        final Configuration configuration = new Configuration();
        map.forEach(configuration::setString);
        return configuration;
    }

    /**
     * Returns the value associated with the given config option, or the option's default value if
     * the key is not present.
     *
     * @throws IllegalArgumentException if the stored value cannot be converted to the option type
     */
    @Nullable
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value associated with the given config option if it was set explicitly. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        Object rawValue = getRawValue(option.key());
        if (rawValue == null) {
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        T value = (T) convertValue(option.key(), rawValue, option.getClazz());
        return Optional.of(value);
    }

    public <T> Configuration set(ConfigOption<T> option, T value) {
        setValueInternal(option.key(), checkNotNull(value));
        return this;
    }

    public void setString(String key, String value) {
        setValueInternal(key, checkNotNull(value));
    }

    public boolean contains(ConfigOption<?> option) {
        synchronized (confData) {
            return confData.containsKey(option.key());
        }
    }

    /** Returns a copy of the configuration with all values rendered as strings. */
    public Map<String, String> toMap() {
        synchronized (confData) {
            Map<String, String> result = new HashMap<>(confData.size());
            confData.forEach((key, value) -> result.put(key, String.valueOf(value)));
            return result;
        }
    }

    // --------------------------------------------------------------------------------------------

    private void setValueInternal(String key, Object value) {
        checkNotNull(key, "key must not be null.");
        synchronized (confData) {
            confData.put(key, value);
        }
    }

    @Nullable
    private Object getRawValue(String key) {
        synchronized (confData) {
            return confData.get(key);
        }
    }

    private static Object convertValue(String key, Object rawValue, Class<?> clazz) {
        if (clazz.isInstance(rawValue)) {
            return rawValue;
        }
        String value = rawValue.toString().trim();
        try {
            if (clazz == Integer.class) {
                return Integer.parseInt(value);
            } else if (clazz == Long.class) {
                return Long.parseLong(value);
            } else if (clazz == Boolean.class) {
                if ("true".equalsIgnoreCase(value)) {
                    return Boolean.TRUE;
                } else if ("false".equalsIgnoreCase(value)) {
                    return Boolean.FALSE;
                }
            } else if (clazz == String.class) {
                return value;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s' as %s.",
                            rawValue, key, clazz.getSimpleName()),
                    e);
        }
        throw new IllegalArgumentException(
                String.format(
                        "Could not parse value '%s' for key '%s' as %s.",
                        rawValue, key, clazz.getSimpleName()));
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
