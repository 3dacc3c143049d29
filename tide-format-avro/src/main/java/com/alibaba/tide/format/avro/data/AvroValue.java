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

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.alibaba.tide.utils.Preconditions.checkArgument;
import static com.alibaba.tide.utils.Preconditions.checkNotNull;
import static com.alibaba.tide.utils.Preconditions.checkState;

/**
 * A single semi-structured value as produced by deserializing an Avro datum. Every value is tagged
 * with its {@link Kind}; unions keep the index of the branch that was resolved while reading, and
 * temporal logical types keep their encoding so that consumers can tell a millisecond counter
 * from a plain {@code long}.
 *
 * <p>Instances are immutable. Arrays and records are not copied on construction, callers must not
 * modify them afterwards.
 *
 * @since 0.1
 */
@PublicEvolving
public final class AvroValue {

    /** The kind of an {@link AvroValue}. */
    public enum Kind {
        NULL,
        BOOLEAN,
        INT,
        LONG,
        FLOAT,
        DOUBLE,
        STRING,
        BYTES,
        FIXED,
        ENUM,
        ARRAY,
        RECORD,
        UNION,
        DATE,
        TIME_MILLIS,
        TIME_MICROS,
        TIMESTAMP_MILLIS,
        TIMESTAMP_MICROS,
        LOCAL_TIMESTAMP_MILLIS,
        LOCAL_TIMESTAMP_MICROS,
        DURATION
    }

    public static final AvroValue NULL = new AvroValue(Kind.NULL, null, 0);

    private static final int DURATION_SIZE = 12;

    private final Kind kind;

    /**
     * Boxed primitive, {@link String}, {@code byte[]}, {@code List<AvroValue>}, {@link AvroRecord}
     * or, for unions, the {@link AvroValue} of the resolved branch.
     */
    @Nullable private final Object value;

    /** Union branch, enum ordinal or fixed size, depending on the kind. */
    private final int index;

    private AvroValue(Kind kind, @Nullable Object value, int index) {
        this.kind = kind;
        this.value = value;
        this.index = index;
    }

    // ------------------------------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------------------------------

    public static AvroValue ofBoolean(boolean value) {
        return new AvroValue(Kind.BOOLEAN, value, 0);
    }

    public static AvroValue ofInt(int value) {
        return new AvroValue(Kind.INT, value, 0);
    }

    public static AvroValue ofLong(long value) {
        return new AvroValue(Kind.LONG, value, 0);
    }

    public static AvroValue ofFloat(float value) {
        return new AvroValue(Kind.FLOAT, value, 0);
    }

    public static AvroValue ofDouble(double value) {
        return new AvroValue(Kind.DOUBLE, value, 0);
    }

    public static AvroValue ofString(String value) {
        return new AvroValue(Kind.STRING, checkNotNull(value), 0);
    }

    public static AvroValue ofBytes(byte[] value) {
        return new AvroValue(Kind.BYTES, checkNotNull(value), 0);
    }

    public static AvroValue ofFixed(byte[] value) {
        return ofFixed(value.length, value);
    }

    public static AvroValue ofFixed(int size, byte[] value) {
        checkArgument(
                size == value.length,
                "Fixed value of declared size %s has %s bytes.",
                size,
                value.length);
        return new AvroValue(Kind.FIXED, value, size);
    }

    public static AvroValue ofEnum(int ordinal, String symbol) {
        return new AvroValue(Kind.ENUM, checkNotNull(symbol), ordinal);
    }

    public static AvroValue ofArray(List<AvroValue> elements) {
        return new AvroValue(Kind.ARRAY, Collections.unmodifiableList(elements), 0);
    }

    public static AvroValue ofArray(AvroValue... elements) {
        return ofArray(Arrays.asList(elements));
    }

    public static AvroValue ofRecord(AvroRecord record) {
        return new AvroValue(Kind.RECORD, checkNotNull(record), 0);
    }

    public static AvroValue ofUnion(int branch, AvroValue value) {
        return new AvroValue(Kind.UNION, checkNotNull(value), branch);
    }

    public static AvroValue ofDate(int daysSinceEpoch) {
        return new AvroValue(Kind.DATE, daysSinceEpoch, 0);
    }

    public static AvroValue ofTimeMillis(int millisOfDay) {
        return new AvroValue(Kind.TIME_MILLIS, millisOfDay, 0);
    }

    public static AvroValue ofTimeMicros(long microsOfDay) {
        return new AvroValue(Kind.TIME_MICROS, microsOfDay, 0);
    }

    public static AvroValue ofTimestampMillis(long epochMillis) {
        return new AvroValue(Kind.TIMESTAMP_MILLIS, epochMillis, 0);
    }

    public static AvroValue ofTimestampMicros(long epochMicros) {
        return new AvroValue(Kind.TIMESTAMP_MICROS, epochMicros, 0);
    }

    public static AvroValue ofLocalTimestampMillis(long millis) {
        return new AvroValue(Kind.LOCAL_TIMESTAMP_MILLIS, millis, 0);
    }

    public static AvroValue ofLocalTimestampMicros(long micros) {
        return new AvroValue(Kind.LOCAL_TIMESTAMP_MICROS, micros, 0);
    }

    /** Avro durations are 12 bytes: months, days and milliseconds as little-endian ints. */
    public static AvroValue ofDuration(byte[] value) {
        checkArgument(
                value.length == DURATION_SIZE,
                "Duration must have %s bytes, but has %s.",
                DURATION_SIZE,
                value.length);
        return new AvroValue(Kind.DURATION, value, 0);
    }

    // ------------------------------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------------------------------

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /** Returns the value of the resolved branch if this is a union, otherwise this value. */
    public AvroValue unwrapUnion() {
        return kind == Kind.UNION ? (AvroValue) value : this;
    }

    public boolean getBoolean() {
        checkKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    /** Returns the value of an {@code INT}, {@code DATE} or {@code TIME_MILLIS}. */
    public int getInt() {
        checkState(value instanceof Integer, "Value of kind %s is not an int.", kind);
        return (Integer) value;
    }

    /** Returns the value of a {@code LONG} or any 64-bit temporal kind. */
    public long getLong() {
        checkState(value instanceof Long, "Value of kind %s is not a long.", kind);
        return (Long) value;
    }

    public float getFloat() {
        checkKind(Kind.FLOAT);
        return (Float) value;
    }

    public double getDouble() {
        checkKind(Kind.DOUBLE);
        return (Double) value;
    }

    public String getString() {
        checkKind(Kind.STRING);
        return (String) value;
    }

    /** Returns the raw bytes of a {@code BYTES}, {@code FIXED} or {@code DURATION}. */
    public byte[] getBytes() {
        checkState(value instanceof byte[], "Value of kind %s has no bytes.", kind);
        return (byte[]) value;
    }

    public int getFixedSize() {
        checkKind(Kind.FIXED);
        return index;
    }

    public int getEnumOrdinal() {
        checkKind(Kind.ENUM);
        return index;
    }

    public String getEnumSymbol() {
        checkKind(Kind.ENUM);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<AvroValue> getArray() {
        checkKind(Kind.ARRAY);
        return (List<AvroValue>) value;
    }

    public AvroRecord getRecord() {
        checkKind(Kind.RECORD);
        return (AvroRecord) value;
    }

    public int getUnionBranch() {
        checkKind(Kind.UNION);
        return index;
    }

    private void checkKind(Kind expected) {
        checkState(kind == expected, "Expected a value of kind %s, but was %s.", expected, kind);
    }

    // ------------------------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AvroValue that = (AvroValue) o;
        if (kind != that.kind || index != that.index) {
            return false;
        }
        if (value instanceof byte[]) {
            return that.value instanceof byte[]
                    && Arrays.equals((byte[]) value, (byte[]) that.value);
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int valueHash =
                value instanceof byte[]
                        ? Arrays.hashCode((byte[]) value)
                        : Objects.hashCode(value);
        return 31 * (31 * kind.hashCode() + index) + valueHash;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULL:
                return "null";
            case UNION:
                return "Union(" + index + ", " + value + ")";
            case ENUM:
                return "Enum(" + index + ", " + value + ")";
            case BYTES:
            case FIXED:
            case DURATION:
                return kind + Arrays.toString((byte[]) value);
            default:
                return kind + "(" + value + ")";
        }
    }
}
