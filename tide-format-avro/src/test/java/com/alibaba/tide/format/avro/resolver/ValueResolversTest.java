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

import com.alibaba.tide.exception.StringConversionException;
import com.alibaba.tide.exception.UnsupportedTypeException;
import com.alibaba.tide.format.avro.data.AvroValue;

import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.alibaba.tide.format.avro.AvroTestUtils.nullUnion;
import static com.alibaba.tide.format.avro.AvroTestUtils.nullable;
import static com.alibaba.tide.format.avro.AvroTestUtils.record;
import static com.alibaba.tide.format.avro.resolver.ValueResolvers.resolveBoolean;
import static com.alibaba.tide.format.avro.resolver.ValueResolvers.resolveBytes;
import static com.alibaba.tide.format.avro.resolver.ValueResolvers.resolveFixed;
import static com.alibaba.tide.format.avro.resolver.ValueResolvers.resolveNumber;
import static com.alibaba.tide.format.avro.resolver.ValueResolvers.resolveString;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ValueResolvers}. */
class ValueResolversTest {

    @Test
    void testResolveBoolean() {
        assertThat(resolveBoolean(AvroValue.ofBoolean(true))).isTrue();
        assertThat(resolveBoolean(nullable(AvroValue.ofBoolean(false)))).isFalse();
        assertThat(resolveBoolean(AvroValue.NULL)).isNull();
        assertThat(resolveBoolean(nullUnion())).isNull();
        assertThat(resolveBoolean(AvroValue.ofInt(1))).isNull();
        assertThat(resolveBoolean(AvroValue.ofString("true"))).isNull();
    }

    @Test
    void testResolveIntegers() {
        assertThat(resolveNumber(AvroValue.ofInt(5), NumericKind.INT8)).isEqualTo(5L);
        assertThat(resolveNumber(nullable(AvroValue.ofInt(-7)), NumericKind.INT16))
                .isEqualTo(-7L);
        assertThat(resolveNumber(AvroValue.ofInt(300), NumericKind.INT8)).isNull();
        assertThat(resolveNumber(AvroValue.ofInt(-1), NumericKind.UINT8)).isNull();
        assertThat(resolveNumber(AvroValue.ofInt(255), NumericKind.UINT8)).isEqualTo(255L);
        assertThat(resolveNumber(AvroValue.ofLong(65536L), NumericKind.UINT16)).isNull();
        assertThat(resolveNumber(AvroValue.ofLong(4294967295L), NumericKind.UINT32))
                .isEqualTo(4294967295L);
        assertThat(resolveNumber(AvroValue.ofLong(Long.MAX_VALUE), NumericKind.INT32)).isNull();
        assertThat(resolveNumber(AvroValue.ofLong(Long.MIN_VALUE), NumericKind.INT64))
                .isEqualTo(Long.MIN_VALUE);
        assertThat(resolveNumber(AvroValue.ofLong(-1L), NumericKind.UINT64)).isNull();
    }

    @Test
    void testResolveFloatingPointToIntegers() {
        assertThat(resolveNumber(AvroValue.ofDouble(3.9), NumericKind.INT32)).isEqualTo(3L);
        assertThat(resolveNumber(AvroValue.ofDouble(-3.9), NumericKind.INT32)).isEqualTo(-3L);
        assertThat(resolveNumber(AvroValue.ofFloat(-0.5f), NumericKind.UINT8)).isEqualTo(0L);
        assertThat(resolveNumber(AvroValue.ofDouble(127.99), NumericKind.INT8)).isEqualTo(127L);
        assertThat(resolveNumber(AvroValue.ofDouble(128.0), NumericKind.INT8)).isNull();
        assertThat(resolveNumber(AvroValue.ofDouble(Double.NaN), NumericKind.INT64)).isNull();
        assertThat(resolveNumber(AvroValue.ofDouble(Double.NEGATIVE_INFINITY), NumericKind.INT16))
                .isNull();
        assertThat(resolveNumber(AvroValue.ofDouble(1e19), NumericKind.INT64)).isNull();
        assertThat(resolveNumber(AvroValue.ofDouble(1.8e19), NumericKind.UINT64))
                .isEqualTo(-446744073709551616L);
        assertThat(resolveNumber(AvroValue.ofDouble(2e19), NumericKind.UINT64)).isNull();
    }

    @Test
    void testResolveFloatingPoint() {
        assertThat(resolveNumber(AvroValue.ofFloat(1.5f), NumericKind.FLOAT64)).isEqualTo(1.5d);
        assertThat(resolveNumber(AvroValue.ofLong(3L), NumericKind.FLOAT32)).isEqualTo(3.0f);
        assertThat(resolveNumber(AvroValue.ofInt(-7), NumericKind.FLOAT64)).isEqualTo(-7.0d);
        assertThat(resolveNumber(AvroValue.ofDouble(0.25), NumericKind.FLOAT32)).isEqualTo(0.25f);
        assertThat(resolveNumber(AvroValue.ofDouble(1e300), NumericKind.FLOAT32)).isNull();
        assertThat(resolveNumber(AvroValue.ofDouble(Double.POSITIVE_INFINITY), NumericKind.FLOAT32))
                .isEqualTo(Float.POSITIVE_INFINITY);
    }

    @Test
    void testResolveTemporalCounters() {
        assertThat(resolveNumber(AvroValue.ofDate(10), NumericKind.INT32)).isEqualTo(10L);
        assertThat(resolveNumber(AvroValue.ofTimeMillis(1000), NumericKind.INT32))
                .isEqualTo(1000L);
        assertThat(resolveNumber(AvroValue.ofTimeMicros(1000L), NumericKind.INT64))
                .isEqualTo(1000L);
        assertThat(resolveNumber(AvroValue.ofTimestampMillis(1700000000000L), NumericKind.INT64))
                .isEqualTo(1700000000000L);
        assertThat(resolveNumber(AvroValue.ofTimestampMicros(-1L), NumericKind.INT64))
                .isEqualTo(-1L);
        assertThat(resolveNumber(AvroValue.ofLocalTimestampMillis(5L), NumericKind.INT64))
                .isEqualTo(5L);
        assertThat(resolveNumber(AvroValue.ofLocalTimestampMicros(6L), NumericKind.INT64))
                .isEqualTo(6L);
    }

    @Test
    void testResolveNumberOfOtherKinds() {
        assertThat(resolveNumber(AvroValue.NULL, NumericKind.INT32)).isNull();
        assertThat(resolveNumber(nullUnion(), NumericKind.INT32)).isNull();
        assertThat(resolveNumber(AvroValue.ofString("1"), NumericKind.INT32)).isNull();
        assertThat(resolveNumber(AvroValue.ofBoolean(true), NumericKind.INT32)).isNull();
        assertThat(resolveNumber(record(), NumericKind.INT32)).isNull();
        assertThatThrownBy(
                        () -> resolveNumber(AvroValue.ofDuration(new byte[12]), NumericKind.INT64))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("Duration");
    }

    @Test
    void testResolveString() {
        assertThat(resolveString(AvroValue.ofString("a"))).isEqualTo("a");
        assertThat(resolveString(nullable(AvroValue.ofString("x")))).isEqualTo("x");
        assertThat(resolveString(AvroValue.ofBytes("héllo".getBytes(StandardCharsets.UTF_8))))
                .isEqualTo("héllo");
        assertThat(resolveString(AvroValue.ofEnum(1, "B"))).isEqualTo("B");
        assertThat(resolveString(AvroValue.NULL)).isNull();
        assertThat(resolveString(nullUnion())).isNull();

        assertThatThrownBy(() -> resolveString(AvroValue.ofBytes(new byte[] {(byte) 0xff})))
                .isInstanceOf(StringConversionException.class)
                .hasMessageContaining("UTF-8");
        assertThatThrownBy(() -> resolveString(AvroValue.ofInt(1)))
                .isInstanceOf(StringConversionException.class)
                .hasMessageContaining("INT");
    }

    @Test
    void testResolveBytes() {
        assertThat(resolveBytes(AvroValue.ofBytes(new byte[] {1, 2}))).containsExactly(1, 2);
        assertThat(resolveBytes(AvroValue.ofString("ab"))).containsExactly(97, 98);
        assertThat(resolveBytes(AvroValue.ofArray(AvroValue.ofInt(1), AvroValue.ofLong(255L))))
                .containsExactly(1, (byte) 255);
        assertThat(resolveBytes(AvroValue.ofArray())).isEmpty();
        assertThat(resolveBytes(AvroValue.ofArray(AvroValue.ofInt(256)))).isNull();
        assertThat(resolveBytes(AvroValue.ofArray(AvroValue.ofString("1")))).isNull();
        assertThat(resolveBytes(AvroValue.ofInt(1))).isNull();
        assertThat(resolveBytes(AvroValue.ofFixed(new byte[] {1}))).isNull();
        assertThat(resolveBytes(AvroValue.NULL)).isNull();
    }

    @Test
    void testResolveFixed() {
        assertThat(resolveFixed(AvroValue.ofFixed(new byte[] {1, 2, 3}), 3))
                .containsExactly(1, 2, 3);
        assertThat(resolveFixed(nullable(AvroValue.ofFixed(new byte[] {1, 2})), 2))
                .containsExactly(1, 2);
        assertThat(resolveFixed(AvroValue.ofFixed(new byte[] {1, 2, 3}), 4)).isNull();
        assertThat(resolveFixed(AvroValue.ofBytes(new byte[] {1, 2, 3}), 3)).isNull();
        assertThat(resolveFixed(AvroValue.NULL, 3)).isNull();
    }

    @Test
    void testNumericKindOfArrowType() {
        assertThat(NumericKind.of(new ArrowType.Int(8, true))).isEqualTo(NumericKind.INT8);
        assertThat(NumericKind.of(new ArrowType.Int(16, false))).isEqualTo(NumericKind.UINT16);
        assertThat(NumericKind.of(new ArrowType.Int(64, false))).isEqualTo(NumericKind.UINT64);
        assertThat(NumericKind.FLOAT32.isFloatingPoint()).isTrue();
        assertThat(NumericKind.INT32.isFloatingPoint()).isFalse();
    }
}
