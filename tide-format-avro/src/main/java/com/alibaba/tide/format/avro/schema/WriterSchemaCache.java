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
import com.alibaba.tide.exception.SchemaResolutionException;

import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;
import static com.alibaba.tide.utils.Preconditions.checkState;
import static com.alibaba.tide.utils.concurrent.LockUtils.inLock;

/**
 * Cache of writer schemas by schema id, shared by all decoders reading from the same registry.
 *
 * <p>A miss resolves the schema through the {@link SchemaResolver} while holding the cache lock,
 * so concurrent readers of the same missing id wait for one fetch instead of issuing their own.
 * Resolved schemas are kept for the lifetime of the cache. Failures are not cached and not
 * retried.
 *
 * @since 0.1
 */
@ThreadSafe
@PublicEvolving
public class WriterSchemaCache {

    private static final Logger LOG = LoggerFactory.getLogger(WriterSchemaCache.class);

    private final SchemaResolver resolver;

    private final ReentrantLock lock = new ReentrantLock();

    @GuardedBy("lock")
    private final Map<Integer, Schema> schemas = new HashMap<>();

    public WriterSchemaCache(SchemaResolver resolver) {
        this.resolver = checkNotNull(resolver);
    }

    /** Creates a cache that only knows the given schema. */
    public static WriterSchemaCache ofFixed(int schemaId, Schema schema) {
        return new WriterSchemaCache(new FixedSchemaResolver(schemaId, schema));
    }

    /**
     * Returns the writer schema for the given id, resolving and caching it on a miss.
     *
     * @throws SchemaResolutionException if the resolver fails or does not know the id
     */
    public Schema getOrResolve(int schemaId) {
        return inLock(
                lock,
                () -> {
                    Schema schema = schemas.get(schemaId);
                    if (schema == null) {
                        schema = resolve(schemaId);
                        schemas.put(schemaId, schema);
                        LOG.info("Resolved writer schema {} ({}).", schemaId, schema.getFullName());
                    }
                    return schema;
                });
    }

    /**
     * Registers a writer schema up front. Schema ids are immutable, so registering the schema an
     * id already maps to is a no-op and registering a different one fails.
     *
     * @throws IllegalStateException if a different schema is cached under the id
     */
    public void register(int schemaId, Schema schema) {
        checkNotNull(schema);
        inLock(
                lock,
                () -> {
                    Schema existing = schemas.putIfAbsent(schemaId, schema);
                    checkState(
                            existing == null || existing.equals(schema),
                            "Writer schema id %s is already bound to schema %s.",
                            schemaId,
                            existing);
                });
    }

    public int size() {
        return inLock(
                lock,
                () -> {
                    return schemas.size();
                });
    }

    @GuardedBy("lock")
    private Schema resolve(int schemaId) {
        Schema schema;
        try {
            schema = resolver.resolveSchema(schemaId);
        } catch (Exception e) {
            throw new SchemaResolutionException(schemaId, e);
        }
        if (schema == null) {
            throw new SchemaResolutionException(
                    schemaId, String.format("Writer schema with id %d not found.", schemaId));
        }
        return schema;
    }
}
