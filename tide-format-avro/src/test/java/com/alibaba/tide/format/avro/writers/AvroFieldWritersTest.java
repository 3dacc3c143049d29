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

package com.alibaba.tide.format.avro.writers;

import com.alibaba.tide.exception.DictionaryKeyOverflowException;
import com.alibaba.tide.exception.StringConversionException;
import com.alibaba.tide.exception.UnsupportedTypeException;
import com.alibaba.tide.format.avro.data.AvroValue;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FixedSizeBinaryVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeStampMilliTZVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.alibaba.tide.format.avro.AvroTestUtils.nullUnion;
import static com.alibaba.tide.format.avro.AvroTestUtils.nullable;
import static com.alibaba.tide.format.avro.AvroTestUtils.values;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link AvroFieldWriter}s created by {@link AvroFieldWriters}. */
class AvroFieldWritersTest {

    private BufferAllocator allocator;

    @BeforeEach
    void setup() {
        allocator = new RootAllocator(Long.MAX_VALUE);
    }

    @AfterEach
    void tearDown() {
        allocator.close();
    }

    @Test
    void testBooleanWriter() {
        try (BitVector vector = new BitVector("b", allocator)) {
            vector.allocateNew();
            AvroFieldWriter writer = AvroFieldWriters.createFieldWriter(vector, "b", false);
            assertThat(writer).isInstanceOf(AvroBooleanWriter.class);
            writer.write(AvroValue.ofBoolean(true));
            writer.write(nullable(AvroValue.ofBoolean(false)));
            writer.write(null);
            writer.write(AvroValue.ofInt(1));
            writer.finish();

            assertThat(writer.getCount()).isEqualTo(4);
            assertThat(values(vector)).containsExactly(true, false, null, null);
        }
    }

    @Test
    void testIntegerWriters() {
        try (TinyIntVector tinyInt = new TinyIntVector("t", allocator);
                UInt8Vector uint64 = new UInt8Vector("u", allocator)) {
            tinyInt.allocateNew();
            uint64.allocateNew();
            AvroFieldWriter tinyIntWriter = AvroFieldWriters.createFieldWriter(tinyInt, "t", false);
            tinyIntWriter.write(AvroValue.ofInt(127));
            tinyIntWriter.write(AvroValue.ofInt(128));
            tinyIntWriter.write(AvroValue.ofDouble(-3.7));
            tinyIntWriter.write(nullUnion());
            tinyIntWriter.finish();
            assertThat(values(tinyInt)).containsExactly((byte) 127, null, (byte) -3, null);

            AvroFieldWriter uint64Writer = AvroFieldWriters.createFieldWriter(uint64, "u", false);
            uint64Writer.write(AvroValue.ofLong(42L));
            uint64Writer.write(AvroValue.ofLong(-1L));
            uint64Writer.finish();
            assertThat(uint64.getValueCount()).isEqualTo(2);
            assertThat(uint64.get(0)).isEqualTo(42L);
            assertThat(uint64.isNull(1)).isTrue();
        }
    }

    @Test
    void testFloatAndTemporalWriters() {
        try (Float4Vector floats = new Float4Vector("f", allocator);
                TimeStampMilliTZVector timestamps =
                        new TimeStampMilliTZVector("ts", allocator, "UTC");
                DateMilliVector dates = new DateMilliVector("d", allocator);
                TimeMicroVector times = new TimeMicroVector("t", allocator)) {
            floats.allocateNew();
            timestamps.allocateNew();
            dates.allocateNew();
            times.allocateNew();
            AvroFieldWriter floatWriter = AvroFieldWriters.createFieldWriter(floats, "f", false);
            floatWriter.write(AvroValue.ofInt(2));
            floatWriter.write(AvroValue.ofString("2"));
            floatWriter.finish();
            assertThat(values(floats)).containsExactly(2.0f, null);

            AvroFieldWriter timestampWriter =
                    AvroFieldWriters.createFieldWriter(timestamps, "ts", false);
            assertThat(timestampWriter).isInstanceOf(AvroTimestampWriter.class);
            timestampWriter.write(AvroValue.ofTimestampMillis(1700000000000L));
            timestampWriter.write(null);
            timestampWriter.finish();
            assertThat(timestamps.get(0)).isEqualTo(1700000000000L);
            assertThat(timestamps.isNull(1)).isTrue();

            AvroFieldWriter dateWriter = AvroFieldWriters.createFieldWriter(dates, "d", false);
            assertThat(dateWriter).isInstanceOf(AvroDateWriter.class);
            dateWriter.write(AvroValue.ofLong(86400000L));
            dateWriter.finish();
            assertThat(dates.get(0)).isEqualTo(86400000L);

            AvroFieldWriter timeWriter = AvroFieldWriters.createFieldWriter(times, "t", false);
            assertThat(timeWriter).isInstanceOf(AvroTimeWriter.class);
            timeWriter.write(AvroValue.ofTimeMicros(1234L));
            timeWriter.finish();
            assertThat(times.get(0)).isEqualTo(1234L);
        }
    }

    @Test
    void testStringWriters() {
        try (VarCharVector strict = new VarCharVector("s", allocator);
                LargeVarCharVector lenient = new LargeVarCharVector("l", allocator)) {
            strict.allocateNew();
            lenient.allocateNew();
            AvroFieldWriter strictWriter = AvroFieldWriters.createFieldWriter(strict, "s", false);
            strictWriter.write(AvroValue.ofString("a"));
            strictWriter.write(AvroValue.ofEnum(0, "RED"));
            strictWriter.write(AvroValue.NULL);
            strictWriter.finish();
            assertThat(values(strict)).containsExactly("a", "RED", null);
            assertThatThrownBy(() -> strictWriter.write(AvroValue.ofInt(1)))
                    .isInstanceOf(StringConversionException.class);

            AvroFieldWriter lenientWriter =
                    AvroFieldWriters.createFieldWriter(lenient, "l", true);
            lenientWriter.write(AvroValue.ofInt(1));
            lenientWriter.write(AvroValue.ofBytes("b".getBytes(StandardCharsets.UTF_8)));
            lenientWriter.finish();
            assertThat(values(lenient)).containsExactly(null, "b");
        }
    }

    @Test
    void testBinaryWriters() {
        try (VarBinaryVector binary = new VarBinaryVector("b", allocator);
                FixedSizeBinaryVector fixed = new FixedSizeBinaryVector("f", allocator, 2)) {
            binary.allocateNew();
            fixed.allocateNew();
            AvroFieldWriter binaryWriter = AvroFieldWriters.createFieldWriter(binary, "b", false);
            binaryWriter.write(AvroValue.ofString("hi"));
            binaryWriter.write(AvroValue.ofArray(AvroValue.ofInt(1), AvroValue.ofInt(2)));
            binaryWriter.write(AvroValue.ofBoolean(true));
            binaryWriter.finish();
            assertThat(binary.get(0)).isEqualTo("hi".getBytes(StandardCharsets.UTF_8));
            assertThat(binary.get(1)).containsExactly(1, 2);
            assertThat(binary.isNull(2)).isTrue();

            AvroFieldWriter fixedWriter = AvroFieldWriters.createFieldWriter(fixed, "f", false);
            assertThat(fixedWriter).isInstanceOf(AvroFixedSizeBinaryWriter.class);
            fixedWriter.write(AvroValue.ofFixed(new byte[] {3, 4}));
            fixedWriter.write(AvroValue.ofFixed(new byte[] {3, 4, 5}));
            fixedWriter.finish();
            assertThat(fixed.get(0)).containsExactly(3, 4);
            assertThat(fixed.isNull(1)).isTrue();
        }
    }

    @Test
    void testDictionaryWriter() {
        ArrowType.Int indexType = new ArrowType.Int(8, false);
        Field field =
                new Field(
                        "d",
                        new FieldType(true, indexType, new DictionaryEncoding(3, false, indexType)),
                        null);
        try (UInt1Vector vector = new UInt1Vector(field, allocator)) {
            vector.allocateNew();
            AvroFieldWriter writer = AvroFieldWriters.createFieldWriter(vector, "d", false);
            assertThat(writer).isInstanceOf(AvroDictionaryWriter.class);
            writer.write(AvroValue.ofString("b"));
            writer.write(AvroValue.ofString("a"));
            writer.write(AvroValue.ofString("b"));
            writer.write(AvroValue.NULL);
            writer.finish();

            assertThat(values(vector)).containsExactly((byte) 0, (byte) 1, (byte) 0, null);
            AvroDictionaryWriter dictionaryWriter = (AvroDictionaryWriter) writer;
            assertThat(dictionaryWriter.getDictionarySize()).isEqualTo(2);
            Dictionary dictionary = dictionaryWriter.finishDictionary();
            try (VarCharVector dictionaryVector = (VarCharVector) dictionary.getVector()) {
                assertThat(dictionary.getEncoding().getId()).isEqualTo(3);
                assertThat(values(dictionaryVector)).containsExactly("b", "a");
            }
        }
    }

    @Test
    void testDictionaryOverflow() {
        ArrowType.Int indexType = new ArrowType.Int(8, true);
        Field field =
                new Field(
                        "d",
                        new FieldType(true, indexType, new DictionaryEncoding(1, false, indexType)),
                        null);
        try (TinyIntVector vector = new TinyIntVector(field, allocator)) {
            vector.allocateNew();
            AvroFieldWriter writer = AvroFieldWriters.createFieldWriter(vector, "a.d", false);
            for (int i = 0; i < 128; i++) {
                writer.write(AvroValue.ofString("v" + i));
            }
            writer.write(AvroValue.ofString("v0"));
            assertThatThrownBy(() -> writer.write(AvroValue.ofString("v128")))
                    .isInstanceOf(DictionaryKeyOverflowException.class)
                    .hasMessageContaining("a.d")
                    .hasMessageContaining("128");
        }
    }

    @Test
    void testUnsupportedVector() {
        try (DecimalVector vector = new DecimalVector("dec", allocator, 10, 2)) {
            assertThatThrownBy(() -> AvroFieldWriters.createFieldWriter(vector, "x.dec", false))
                    .isInstanceOf(UnsupportedTypeException.class)
                    .hasMessageContaining("x.dec")
                    .hasMessageContaining("Decimal");
        }
    }
}
