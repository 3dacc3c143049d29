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

package com.alibaba.tide.format.avro.resolver;

import com.alibaba.tide.annotation.Internal;
import com.alibaba.tide.exception.StringConversionException;
import com.alibaba.tide.exception.UnsupportedTypeException;
import com.alibaba.tide.format.avro.data.AvroValue;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Coerces a single {@link AvroValue} into a target scalar representation. Every resolver first
 * looks through one level of union tagging.
 *
 * <p>A {@code null} result means absent, which callers store as a null slot. Only the string
 * resolver and the numeric resolver, for durations, fail with an exception.
 */
@Internal
public final class ValueResolvers {

    private static final double TWO_POW_63 = 0x1.0p63;
    private static final double TWO_POW_64 = 0x1.0p64;

    private ValueResolvers() {
        // no instantiation
    }

    @Nullable
    public static Boolean resolveBoolean(AvroValue value) {
        AvroValue v = value.unwrapUnion();
        return v.getKind() == AvroValue.Kind.BOOLEAN ? v.getBoolean() : null;
    }

    /**
     * Converts ints, longs, floats, doubles and the integer-encoded temporal kinds to the given
     * numeric kind. Integral targets return a {@link Long}, {@link NumericKind#FLOAT32} a {@link
     * Float} and {@link NumericKind#FLOAT64} a {@link Double}.
     *
     * <p>Values that do not fit the target, and values of any other kind, are absent.
     *
     * @throws UnsupportedTypeException for duration values, which have no numeric representation
     */
    @Nullable
    public static Number resolveNumber(AvroValue value, NumericKind kind) {
        AvroValue v = value.unwrapUnion();
        switch (v.getKind()) {
            case INT:
            case DATE:
            case TIME_MILLIS:
                return castLong(v.getInt(), kind);
            case LONG:
            case TIME_MICROS:
            case TIMESTAMP_MILLIS:
            case TIMESTAMP_MICROS:
            case LOCAL_TIMESTAMP_MILLIS:
            case LOCAL_TIMESTAMP_MICROS:
                return castLong(v.getLong(), kind);
            case FLOAT:
                return castDouble(v.getFloat(), kind);
            case DOUBLE:
                return castDouble(v.getDouble(), kind);
            case DURATION:
                throw new UnsupportedTypeException(
                        "duration",
                        String.format("Duration values cannot be converted to %s.", kind));
            default:
                return null;
        }
    }

    /**
     * Reads strings, UTF-8 encoded bytes and enum symbols as a string.
     *
     * @throws StringConversionException if the value is of any other non-null kind or its bytes
     *     are not valid UTF-8
     */
    @Nullable
    public static String resolveString(AvroValue value) {
        AvroValue v = value.unwrapUnion();
        switch (v.getKind()) {
            case STRING:
                return v.getString();
            case ENUM:
                return v.getEnumSymbol();
            case BYTES:
                try {
                    return StandardCharsets.UTF_8
                            .newDecoder()
                            .onMalformedInput(CodingErrorAction.REPORT)
                            .onUnmappableCharacter(CodingErrorAction.REPORT)
                            .decode(ByteBuffer.wrap(v.getBytes()))
                            .toString();
                } catch (CharacterCodingException e) {
                    throw new StringConversionException(
                            "Expected resolvable string, but bytes are not valid UTF-8.", e);
                }
            case NULL:
                return null;
            default:
                throw new StringConversionException(
                        String.format(
                                "Expected resolvable string, but got a value of kind %s.",
                                v.getKind()));
        }
    }

    /**
     * Reads bytes, strings (as UTF-8) and arrays of ints in {@code [0, 255]} as a byte sequence.
     * Arrays with any element outside that range, and values of any other kind, are absent.
     */
    @Nullable
    public static byte[] resolveBytes(AvroValue value) {
        AvroValue v = value.unwrapUnion();
        switch (v.getKind()) {
            case BYTES:
                return v.getBytes();
            case STRING:
                return v.getString().getBytes(StandardCharsets.UTF_8);
            case ARRAY:
                List<AvroValue> items = v.getArray();
                byte[] bytes = new byte[items.size()];
                for (int i = 0; i < bytes.length; i++) {
                    Long unsigned = resolveUnsignedByte(items.get(i));
                    if (unsigned == null) {
                        return null;
                    }
                    bytes[i] = (byte) unsigned.longValue();
                }
                return bytes;
            default:
                return null;
        }
    }

    /** Reads a fixed value of exactly the given size. Any other value is absent. */
    @Nullable
    public static byte[] resolveFixed(AvroValue value, int size) {
        AvroValue v = value.unwrapUnion();
        if (v.getKind() == AvroValue.Kind.FIXED && v.getFixedSize() == size) {
            return v.getBytes();
        }
        return null;
    }

    // ------------------------------------------------------------------------------------------

    @Nullable
    private static Long resolveUnsignedByte(AvroValue value) {
        long n;
        if (value.getKind() == AvroValue.Kind.INT) {
            n = value.getInt();
        } else if (value.getKind() == AvroValue.Kind.LONG) {
            n = value.getLong();
        } else {
            return null;
        }
        return n >= 0 && n <= 0xFF ? n : null;
    }

    @Nullable
    private static Number castLong(long value, NumericKind kind) {
        if (!kind.isFloatingPoint()) {
            return value >= kind.minValue() && value <= kind.maxValue() ? value : null;
        }
        if (kind == NumericKind.FLOAT32) {
            return (float) value;
        }
        return (double) value;
    }

    @Nullable
    private static Number castDouble(double value, NumericKind kind) {
        switch (kind) {
            case FLOAT32:
                if (Double.isFinite(value) && Math.abs(value) > Float.MAX_VALUE) {
                    return null;
                }
                return (float) value;
            case FLOAT64:
                return value;
            case UINT64:
                if (!Double.isFinite(value) || value <= -1.0 || value >= TWO_POW_64) {
                    return null;
                }
                double truncated = value < 0 ? 0 : Math.floor(value);
                if (truncated < TWO_POW_63) {
                    return (long) truncated;
                }
                return new BigDecimal(truncated).toBigInteger().longValue();
            case INT64:
                if (!Double.isFinite(value) || value <= -TWO_POW_63 - 1 || value >= TWO_POW_63) {
                    return null;
                }
                return (long) value;
            default:
                if (!Double.isFinite(value)
                        || value <= kind.minValue() - 1.0
                        || value >= kind.maxValue() + 1.0) {
                    return null;
                }
                return (long) value;
        }
    }
}
