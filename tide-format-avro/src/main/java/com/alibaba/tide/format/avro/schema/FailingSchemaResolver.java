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

package com.alibaba.tide.format.avro.schema;

import com.alibaba.tide.annotation.PublicEvolving;

import org.apache.avro.Schema;

/**
 * A {@link SchemaResolver} for setups without a schema registry. Every lookup fails, so only
 * schemas registered up front in a {@link WriterSchemaCache} can be decoded.
 *
 * @since 0.1
 */
@PublicEvolving
public class FailingSchemaResolver implements SchemaResolver {

    public static final FailingSchemaResolver INSTANCE = new FailingSchemaResolver();

    @Override
    public Schema resolveSchema(int schemaId) {
        throw new UnsupportedOperationException(
                String.format(
                        "Schema id %d is not registered and no schema registry is configured.",
                        schemaId));
    }
}
