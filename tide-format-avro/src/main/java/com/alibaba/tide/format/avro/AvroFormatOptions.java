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

package com.alibaba.tide.format.avro;

import com.alibaba.tide.annotation.PublicEvolving;
import com.alibaba.tide.config.ConfigOption;

import static com.alibaba.tide.config.ConfigBuilder.key;

/**
 * Config options of the Avro format.
 *
 * @since 0.1
 */
@PublicEvolving
public class AvroFormatOptions {

    public static final ConfigOption<Integer> DECODE_BATCH_SIZE =
            key("avro.decode.batch-size")
                    .intType()
                    .defaultValue(1024)
                    .withDescription(
                            "The maximum number of buffered rows decoded into one batch when no "
                                    + "explicit row limit is given.");

    public static final ConfigOption<Integer> DECODE_SCHEMA_INDEX_CACHE_SIZE =
            key("avro.decode.schema-index.cache-size")
                    .intType()
                    .defaultValue(64)
                    .withDescription(
                            "The maximum number of writer schema indexes a decoder keeps. "
                                    + "Indexes that are rarely used are evicted first when "
                                    + "the limit is exceeded.");

    private AvroFormatOptions() {}
}
