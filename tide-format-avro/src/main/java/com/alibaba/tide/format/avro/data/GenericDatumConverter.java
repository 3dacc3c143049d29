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

package com.alibaba.tide.format.avro.data;

import com.alibaba.tide.annotation.PublicEvolving;
import com.alibaba.tide.exception.ShapeMismatchException;
import com.alibaba.tide.exception.UnsupportedTypeException;

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.IndexedRecord;

import javax.annotation.Nullable;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Converts data produced by Avro's generic datum reader ({@link IndexedRecord}, {@link
 * GenericFixed}, {@link org.apache.avro.util.Utf8}, {@link ByteBuffer}, collections and boxed
 * primitives) into {@link AvroValue}s, guided by the writer schema.
 *
 * <p>Union branches are resolved with {@link GenericData#resolveUnion(Schema, Object)} and kept
 * on the resulting value. Logical types on {@code int} and {@code long} are reflected in the value
 * kind. Maps are not supported.
 *
 * @since 0.1
 */
@PublicEvolving
public final class GenericDatumConverter {

    private static final String DURATION_LOGICAL_TYPE = "duration";

    private GenericDatumConverter() {
        // no instantiation
    }

    /** Converts a datum written with the given schema. */
    public static AvroValue convert(@Nullable Object datum, Schema schema) {
        return convert(datum, schema, "");
    }

    private static AvroValue convert(@Nullable Object datum, Schema schema, String path) {
        if (datum == null && schema.getType() != Schema.Type.UNION) {
            return AvroValue.NULL;
        }
        switch (schema.getType()) {
            case NULL:
                return AvroValue.NULL;
            case BOOLEAN:
                return AvroValue.ofBoolean(cast(datum, Boolean.class, schema, path));
            case INT:
                return convertInt(cast(datum, Number.class, schema, path).intValue(), schema);
            case LONG:
                return convertLong(cast(datum, Number.class, schema, path).longValue(), schema);
            case FLOAT:
                return AvroValue.ofFloat(cast(datum, Number.class, schema, path).floatValue());
            case DOUBLE:
                return AvroValue.ofDouble(cast(datum, Number.class, schema, path).doubleValue());
            case STRING:
                return AvroValue.ofString(cast(datum, CharSequence.class, schema, path).toString());
            case BYTES:
                return AvroValue.ofBytes(toBytes(datum, schema, path));
            case FIXED:
                byte[] fixed = cast(datum, GenericFixed.class, schema, path).bytes();
                if (DURATION_LOGICAL_TYPE.equals(schema.getProp(LogicalType.LOGICAL_TYPE_PROP))) {
                    return AvroValue.ofDuration(fixed);
                }
                return AvroValue.ofFixed(schema.getFixedSize(), fixed);
            case ENUM:
                String symbol = datum.toString();
                return AvroValue.ofEnum(schema.getEnumOrdinal(symbol), symbol);
            case ARRAY:
                Collection<?> items = cast(datum, Collection.class, schema, path);
                List<AvroValue> elements = new ArrayList<>(items.size());
                String elementPath = childPath(path, "element");
                for (Object item : items) {
                    elements.add(convert(item, schema.getElementType(), elementPath));
                }
                return AvroValue.ofArray(elements);
            case RECORD:
                IndexedRecord record = cast(datum, IndexedRecord.class, schema, path);
                AvroRecord.Builder builder = AvroRecord.builder();
                for (Schema.Field field : schema.getFields()) {
                    builder.field(
                            field.name(),
                            convert(
                                    record.get(field.pos()),
                                    field.schema(),
                                    childPath(path, field.name())));
                }
                return AvroValue.ofRecord(builder.build());
            case UNION:
                int branch = GenericData.get().resolveUnion(schema, datum);
                return AvroValue.ofUnion(
                        branch, convert(datum, schema.getTypes().get(branch), path));
            default:
                throw new UnsupportedTypeException(
                        schema.getType().getName(),
                        String.format(
                                "Avro type %s at '%s' is not supported.",
                                schema.getType().getName(), path));
        }
    }

    private static AvroValue convertInt(int value, Schema schema) {
        LogicalType logicalType = schema.getLogicalType();
        if (logicalType instanceof LogicalTypes.Date) {
            return AvroValue.ofDate(value);
        } else if (logicalType instanceof LogicalTypes.TimeMillis) {
            return AvroValue.ofTimeMillis(value);
        }
        return AvroValue.ofInt(value);
    }

    private static AvroValue convertLong(long value, Schema schema) {
        LogicalType logicalType = schema.getLogicalType();
        if (logicalType instanceof LogicalTypes.TimeMicros) {
            return AvroValue.ofTimeMicros(value);
        } else if (logicalType instanceof LogicalTypes.TimestampMillis) {
            return AvroValue.ofTimestampMillis(value);
        } else if (logicalType instanceof LogicalTypes.TimestampMicros) {
            return AvroValue.ofTimestampMicros(value);
        } else if (logicalType instanceof LogicalTypes.LocalTimestampMillis) {
            return AvroValue.ofLocalTimestampMillis(value);
        } else if (logicalType instanceof LogicalTypes.LocalTimestampMicros) {
            return AvroValue.ofLocalTimestampMicros(value);
        }
        return AvroValue.ofLong(value);
    }

    private static byte[] toBytes(Object datum, Schema schema, String path) {
        if (datum instanceof byte[]) {
            return ((byte[]) datum).clone();
        }
        ByteBuffer buffer = cast(datum, ByteBuffer.class, schema, path).duplicate();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private static String childPath(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    private static <T> T cast(Object datum, Class<T> clazz, Schema schema, String path) {
        if (!clazz.isInstance(datum)) {
            throw new ShapeMismatchException(
                    schema.getType().getName(), datum.getClass().getSimpleName(), path);
        }
        return clazz.cast(datum);
    }
}
