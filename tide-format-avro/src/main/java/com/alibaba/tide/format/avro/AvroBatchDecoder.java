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
import com.alibaba.tide.annotation.VisibleForTesting;
import com.alibaba.tide.config.Configuration;
import com.alibaba.tide.exception.DecodeException;
import com.alibaba.tide.exception.NotARecordException;
import com.alibaba.tide.exception.SchemaResolutionException;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.data.GenericDatumConverter;
import com.alibaba.tide.format.avro.decode.ColumnBuilder;
import com.alibaba.tide.format.avro.decode.SourceRecord;
import com.alibaba.tide.format.avro.schema.SchemaIndex;
import com.alibaba.tide.format.avro.schema.WriterSchemaCache;
import com.alibaba.tide.utils.ArrowUtils;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.avro.generic.GenericRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.List;

import static com.alibaba.tide.utils.Preconditions.checkArgument;
import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * Decodes buffered Avro records into {@link ColumnarBatch}es laid out by a fixed Arrow target
 * schema.
 *
 * <p>Records are appended together with the id of their writer schema and stay buffered until a
 * call to {@link #nextBatch(int)} consumes them. The layout of every batch is determined by the
 * target schema alone: columns come in target schema order, fields of the source records are
 * matched by name, and fields missing from a record become nulls.
 *
 * <p>A decode pass either produces a complete batch or fails with a {@link DecodeException}, in
 * which case the rows of the pass remain buffered. Callers that want to skip them call {@link
 * #clear()}.
 *
 * @since 0.1
 */
@NotThreadSafe
@PublicEvolving
public class AvroBatchDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(AvroBatchDecoder.class);

    private final Schema targetSchema;
    private final WriterSchemaCache schemaCache;
    private final BufferAllocator allocator;
    private final int defaultBatchSize;

    /** Indexes of recently used writer schemas. */
    private final Cache<Integer, SchemaIndex> schemaIndexes;

    private final List<BufferedRow> buffer = new ArrayList<>();

    private boolean appended;

    public AvroBatchDecoder(
            Schema targetSchema,
            WriterSchemaCache schemaCache,
            BufferAllocator allocator,
            Configuration conf) {
        checkNotNull(targetSchema, "targetSchema must not be null.");
        ArrowUtils.validateDictionaryIds(targetSchema);
        this.targetSchema = ArrowUtils.toMemoryFormat(targetSchema);
        this.schemaCache = checkNotNull(schemaCache);
        this.allocator = checkNotNull(allocator);
        this.defaultBatchSize = conf.get(AvroFormatOptions.DECODE_BATCH_SIZE);
        checkArgument(
                defaultBatchSize > 0,
                "'%s' must be positive, but is %s.",
                AvroFormatOptions.DECODE_BATCH_SIZE.key(),
                defaultBatchSize);
        int cacheSize = conf.get(AvroFormatOptions.DECODE_SCHEMA_INDEX_CACHE_SIZE);
        checkArgument(
                cacheSize > 0,
                "'%s' must be positive, but is %s.",
                AvroFormatOptions.DECODE_SCHEMA_INDEX_CACHE_SIZE.key(),
                cacheSize);
        // eviction runs on the decoding thread
        this.schemaIndexes =
                Caffeine.newBuilder().maximumSize(cacheSize).executor(Runnable::run).build();
    }

    public AvroBatchDecoder(
            Schema targetSchema, WriterSchemaCache schemaCache, BufferAllocator allocator) {
        this(targetSchema, schemaCache, allocator, new Configuration());
    }

    /** Buffers a record written with the writer schema of the given id. */
    public void append(int schemaId, AvroValue value) {
        checkNotNull(value, "value must not be null.");
        buffer.add(new BufferedRow(schemaId, value));
        appended = true;
    }

    /** Buffers a generic record written with the writer schema of the given id. */
    public void append(int schemaId, GenericRecord record) {
        checkNotNull(record, "record must not be null.");
        append(schemaId, GenericDatumConverter.convert(record, record.getSchema()));
    }

    /** Decodes up to the configured batch size of buffered rows, see {@link #nextBatch(int)}. */
    @Nullable
    public ColumnarBatch nextBatch() {
        return nextBatch(defaultBatchSize);
    }

    /**
     * Decodes up to {@code maxRows} buffered rows, in the order they were appended, into one
     * batch and removes them from the buffer.
     *
     * @return the batch, which is empty if all appended rows were consumed before, or null if no
     *     row was ever appended
     * @throws NotARecordException if a buffered value or its writer schema is not a record
     * @throws SchemaResolutionException if a writer schema cannot be resolved
     * @throws DecodeException if a value cannot be converted to its target column
     */
    @Nullable
    public ColumnarBatch nextBatch(int maxRows) {
        checkArgument(maxRows > 0, "maxRows must be positive, but is %s.", maxRows);
        if (!appended) {
            return null;
        }
        List<BufferedRow> rows = buffer.subList(0, Math.min(maxRows, buffer.size()));
        ColumnarBatch batch = decode(rows);
        rows.clear();
        return batch;
    }

    /** Returns the number of rows waiting to be decoded. */
    public int bufferedRows() {
        return buffer.size();
    }

    /** Drops all buffered rows. */
    public void clear() {
        if (!buffer.isEmpty()) {
            LOG.info("Dropping {} buffered rows.", buffer.size());
        }
        buffer.clear();
    }

    public Schema getTargetSchema() {
        return targetSchema;
    }

    @VisibleForTesting
    int cachedSchemaIndexes() {
        schemaIndexes.cleanUp();
        return (int) schemaIndexes.estimatedSize();
    }

    private ColumnarBatch decode(List<BufferedRow> rows) {
        List<SourceRecord> records = new ArrayList<>(rows.size());
        for (BufferedRow row : rows) {
            if (row.value.getKind() != AvroValue.Kind.RECORD) {
                throw new NotARecordException(
                        String.format(
                                "Expected a record written with schema %s, but got %s.",
                                row.schemaId,
                                row.value.getKind()));
            }
            records.add(new SourceRecord(getSchemaIndex(row.schemaId), row.value.getRecord()));
        }

        VectorSchemaRoot root = VectorSchemaRoot.create(targetSchema, allocator);
        DictionaryProvider.MapDictionaryProvider dictionaries =
                new DictionaryProvider.MapDictionaryProvider();
        try {
            root.allocateNew();
            ColumnBuilder builder = new ColumnBuilder(dictionaries);
            for (FieldVector vector : root.getFieldVectors()) {
                builder.build(records, "", vector);
            }
            root.setRowCount(records.size());
            LOG.debug(
                    "Decoded {} rows into a batch of {} columns.",
                    records.size(),
                    root.getFieldVectors().size());
            return new ColumnarBatch(root, dictionaries);
        } catch (RuntimeException e) {
            LOG.warn(
                    "Failed to decode {} buffered rows, keeping them buffered.", records.size(), e);
            try {
                new ColumnarBatch(root, dictionaries).close();
            } catch (RuntimeException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    private SchemaIndex getSchemaIndex(int schemaId) {
        return schemaIndexes.get(
                schemaId,
                id -> {
                    SchemaIndex index = SchemaIndex.build(schemaCache.getOrResolve(id));
                    LOG.debug("Indexed writer schema {} with {} paths.", id, index.size());
                    return index;
                });
    }

    private static final class BufferedRow {
        private final int schemaId;
        private final AvroValue value;

        private BufferedRow(int schemaId, AvroValue value) {
            this.schemaId = schemaId;
            this.value = value;
        }
    }
}
