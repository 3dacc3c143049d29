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

import javax.annotation.Nullable;

/**
 * Resolves writer schemas by their identifier, typically by asking a schema registry.
 *
 * <p>Implementations may block and may fail; a failure is surfaced to the caller of the decode
 * pass and is not retried.
 *
 * @since 0.1
 */
@PublicEvolving
@FunctionalInterface
public interface SchemaResolver {

    /**
     * Returns the writer schema registered under the given id, or null if the id is unknown.
     *
     * @throws Exception if the schema could not be fetched
     */
    @Nullable
    Schema resolveSchema(int schemaId) throws Exception;
}
