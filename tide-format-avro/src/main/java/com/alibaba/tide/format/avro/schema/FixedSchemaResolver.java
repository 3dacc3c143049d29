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

import static com.alibaba.tide.utils.Preconditions.checkArgument;
import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * A {@link SchemaResolver} for sources whose records are all written with one known schema.
 *
 * @since 0.1
 */
@PublicEvolving
public class FixedSchemaResolver implements SchemaResolver {

    private final int schemaId;
    private final Schema schema;

    public FixedSchemaResolver(int schemaId, Schema schema) {
        this.schemaId = schemaId;
        this.schema = checkNotNull(schema);
    }

    @Override
    public Schema resolveSchema(int schemaId) {
        checkArgument(
                schemaId == this.schemaId,
                "Unexpected schema id %s, expected %s.",
                schemaId,
                this.schemaId);
        return schema;
    }
}
