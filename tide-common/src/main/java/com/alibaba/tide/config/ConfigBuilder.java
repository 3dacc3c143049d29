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

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * {@code ConfigBuilder} is used to build a {@link ConfigOption}. The typical usage looks like:
 *
 * <pre>{@code
 * ConfigOption<Integer> batchSize = ConfigBuilder
 *     .key("avro.decode.batch-size")
 *     .intType()
 *     .defaultValue(1024)
 *     .withDescription("...");
 * }</pre>
 *
 * @since 0.1
 */
@PublicEvolving
public class ConfigBuilder {

    private final String key;

    /**
     * Starts building a new {@link ConfigOption}.
     *
     * @param key The key for the config option.
     * @return The builder for the config option with the given key.
     */
    public static ConfigBuilder key(String key) {
        checkNotNull(key);
        return new ConfigBuilder(key);
    }

    private ConfigBuilder(String key) {
        this.key = key;
    }

    /** Defines that the value of the option should be of {@link Boolean} type. */
    public TypedConfigOptionBuilder<Boolean> booleanType() {
        return new TypedConfigOptionBuilder<>(key, Boolean.class);
    }

    /** Defines that the value of the option should be of {@link Integer} type. */
    public TypedConfigOptionBuilder<Integer> intType() {
        return new TypedConfigOptionBuilder<>(key, Integer.class);
    }

    /** Defines that the value of the option should be of {@link Long} type. */
    public TypedConfigOptionBuilder<Long> longType() {
        return new TypedConfigOptionBuilder<>(key, Long.class);
    }

    /** Defines that the value of the option should be of {@link String} type. */
    public TypedConfigOptionBuilder<String> stringType() {
        return new TypedConfigOptionBuilder<>(key, String.class);
    }

    /**
     * Builder for {@link ConfigOption} with a defined atomic type.
     *
     * @param <T> atomic type of the option
     */
    public static class TypedConfigOptionBuilder<T> {
        private final String key;
        private final Class<T> clazz;

        TypedConfigOptionBuilder(String key, Class<T> clazz) {
            this.key = key;
            this.clazz = clazz;
        }

        /**
         * Creates a ConfigOption with the given default value.
         *
         * @param value The default value for the config option
         * @return The config option with the default value.
         */
        public ConfigOption<T> defaultValue(T value) {
            return new ConfigOption<>(key, clazz, ConfigOption.EMPTY_DESCRIPTION, value);
        }

        /**
         * Creates a ConfigOption without a default value.
         *
         * @return The config option without a default value.
         */
        public ConfigOption<T> noDefaultValue() {
            return new ConfigOption<>(key, clazz, ConfigOption.EMPTY_DESCRIPTION, null);
        }
    }
}
