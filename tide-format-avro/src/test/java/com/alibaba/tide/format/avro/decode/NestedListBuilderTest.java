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

package com.alibaba.tide.format.avro.decode;

import com.alibaba.tide.exception.NestedTypeUnsupportedException;
import com.alibaba.tide.exception.ShapeMismatchException;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.schema.SchemaIndex;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.LargeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.alibaba.tide.format.avro.AvroTestUtils.decodeDictionary;
import static com.alibaba.tide.format.avro.AvroTestUtils.nullUnion;
import static com.alibaba.tide.format.avro.AvroTestUtils.nullable;
import static com.alibaba.tide.format.avro.AvroTestUtils.record;
import static com.alibaba.tide.format.avro.AvroTestUtils.stringList;
import static com.alibaba.tide.format.avro.AvroTestUtils.strings;
import static com.alibaba.tide.format.avro.AvroTestUtils.values;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/** Tests for {@link NestedListBuilder}. */
class NestedListBuilderTest {

    private static final String WRITER_SCHEMA =
            "{\"type\":\"record\",\"name\":\"Row\",\"fields\":["
                    + "{\"name\":\"tags\",\"type\":[\"null\","
                    + "{\"type\":\"array\",\"items\":\"string\"}]},"
                    + "{\"name\":\"points\",\"type\":{\"type\":\"array\",\"items\":"
                    + "[\"null\",{\"type\":\"record\",\"name\":\"Point\",\"fields\":["
                    + "{\"name\":\"x\",\"type\":\"int\"},"
                    + "{\"name\":\"label\",\"type\":[\"null\",\"string\"]}]}]}},"
                    + "{\"name\":\"matrix\",\"type\":{\"type\":\"array\",\"items\":"
                    + "{\"type\":\"array\",\"items\":\"int\"}}},"
                    + "{\"name\":\"ts\",\"type\":{\"type\":\"array\",\"items\":"
                    + "{\"type\":\"long\",\"logicalType\":\"timestamp-millis\"}}}"
                    + "]}";

    private final SchemaIndex index = SchemaIndex.parse(WRITER_SCHEMA);

    private BufferAllocator allocator;
    private DictionaryProvider.MapDictionaryProvider dictionaries;
    private ColumnBuilder columnBuilder;
    private NestedListBuilder listBuilder;
    private final List<FieldVector> vectors = new ArrayList<>();

    @BeforeEach
    void setup() {
        allocator = new RootAllocator(Long.MAX_VALUE);
        dictionaries = new DictionaryProvider.MapDictionaryProvider();
        columnBuilder = new ColumnBuilder(dictionaries);
        listBuilder = new NestedListBuilder(columnBuilder);
    }

    @AfterEach
    void tearDown() {
        vectors.forEach(FieldVector::close);
        for (long id : dictionaries.getDictionaryIds()) {
            dictionaries.lookup(id).getVector().close();
        }
        allocator.close();
    }

    @Test
    void testScalarIsTakenAsListOfOne() {
        ListVector vector =
                (ListVector)
                        buildList(
                                listOf("tags", Field.nullable("item", ArrowType.Utf8.INSTANCE)),
                                nullable(strings("x", "y")),
                                AvroValue.ofString("z"));

        assertThat(vector.getValueCount()).isEqualTo(2);
        assertThat(stringList(vector, 0)).containsExactly("x", "y");
        assertThat(stringList(vector, 1)).containsExactly("z");
    }

    @Test
    void testNullMissingAndEmptyLists() {
        ListVector vector =
                (ListVector)
                        buildList(
                                listOf("tags", Field.nullable("item", ArrowType.Utf8.INSTANCE)),
                                nullUnion(),
                                null,
                                strings(),
                                AvroValue.NULL);

        assertThat(vector.getValueCount()).isEqualTo(4);
        assertThat(vector.isNull(0)).isTrue();
        assertThat(vector.isNull(1)).isTrue();
        assertThat(vector.isNull(2)).isFalse();
        assertThat(stringList(vector, 2)).isEmpty();
        assertThat(vector.isNull(3)).isTrue();
    }

    @Test
    void testUnresolvableStringElementsBecomeNull() {
        ListVector vector =
                (ListVector)
                        buildList(
                                listOf("tags", Field.nullable("item", ArrowType.Utf8.INSTANCE)),
                                AvroValue.ofArray(
                                        AvroValue.ofString("a"),
                                        AvroValue.ofInt(1),
                                        AvroValue.NULL));

        assertThat(stringList(vector, 0)).containsExactly("a", null, null);
    }

    @Test
    void testListOfStructs() {
        Field point =
                new Field(
                        "item",
                        FieldType.nullable(ArrowType.Struct.INSTANCE),
                        Arrays.asList(
                                Field.nullable("x", new ArrowType.Int(32, true)),
                                Field.nullable("label", ArrowType.Utf8.INSTANCE)));
        ListVector vector =
                (ListVector)
                        buildList(
                                listOf("points", point),
                                AvroValue.ofArray(
                                        nullable(
                                                record(
                                                        "x",
                                                        AvroValue.ofInt(1),
                                                        "label",
                                                        nullable(AvroValue.ofString("a")))),
                                        nullUnion(),
                                        nullable(record("x", AvroValue.ofInt(2)))),
                                null);

        assertThat(vector.isNull(1)).isTrue();
        assertThat(vector.getObject(0)).hasSize(3);
        StructVector elements = (StructVector) vector.getDataVector();
        assertThat(elements.getValueCount()).isEqualTo(3);
        assertThat(elements.isNull(0)).isFalse();
        assertThat(elements.isNull(1)).isTrue();
        assertThat(elements.isNull(2)).isFalse();
        assertThat(values(elements.getChild("x"))).containsExactly(1, null, 2);
        assertThat(values(elements.getChild("label"))).containsExactly("a", null, null);
    }

    @Test
    void testScalarInListOfStructsIsRejected() {
        Field point =
                new Field(
                        "item",
                        FieldType.nullable(ArrowType.Struct.INSTANCE),
                        Collections.singletonList(
                                Field.nullable("x", new ArrowType.Int(32, true))));

        ShapeMismatchException e =
                catchThrowableOfType(
                        () ->
                                buildList(
                                        listOf("points", point),
                                        AvroValue.ofArray(record("x", AvroValue.ofInt(1))),
                                        AvroValue.ofInt(5)),
                        ShapeMismatchException.class);
        assertThat(e.getPath()).isEqualTo("points.element");
        assertThat(e.getExpectedKind()).isEqualTo("RECORD");
        assertThat(e.getActualKind()).isEqualTo("INT");
    }

    @Test
    void testListOfLists() {
        Field inner = listOf("item", Field.nullable("item", new ArrowType.Int(32, true)));
        ListVector vector =
                (ListVector)
                        buildList(
                                listOf("matrix", inner),
                                AvroValue.ofArray(
                                        AvroValue.ofArray(AvroValue.ofInt(1), AvroValue.ofInt(2)),
                                        AvroValue.ofArray(AvroValue.ofInt(3))),
                                AvroValue.ofInt(4));

        assertThat(vector.getObject(0))
                .isEqualTo(Arrays.asList(Arrays.asList(1, 2), Collections.singletonList(3)));
        assertThat(vector.getObject(1))
                .isEqualTo(Collections.singletonList(Collections.singletonList(4)));
    }

    @Test
    void testNestedListOfDictionaryStrings() {
        ArrowType.Int indexType = new ArrowType.Int(16, true);
        Field codes =
                new Field(
                        "item",
                        new FieldType(
                                true, indexType, new DictionaryEncoding(3L, false, indexType)),
                        null);
        Field matrix = listOf("matrix", listOf("item", codes));
        ListVector vector = (ListVector) matrix.createVector(allocator);
        vectors.add(vector);
        vector.allocateNew();

        List<SourceRecord> rows =
                Collections.singletonList(
                        new SourceRecord(
                                index,
                                record(
                                                "matrix",
                                                AvroValue.ofArray(
                                                        strings("a", "b"),
                                                        AvroValue.ofArray(
                                                                AvroValue.ofString("a"),
                                                                AvroValue.ofLong(1L))))
                                        .getRecord()));
        columnBuilder.build(rows, "", vector);

        ListVector inner = (ListVector) vector.getDataVector();
        assertThat(decodeDictionary(inner.getDataVector(), dictionaries.lookup(3L)))
                .containsExactly("a", "b", "a", null);
    }

    @Test
    void testLargeList() {
        Field field =
                new Field(
                        "tags",
                        FieldType.nullable(ArrowType.LargeList.INSTANCE),
                        Collections.singletonList(
                                Field.nullable("item", ArrowType.Utf8.INSTANCE)));
        LargeListVector vector =
                (LargeListVector)
                        buildList(field, strings("a", "b"), nullUnion(), AvroValue.ofString("c"));

        assertThat(vector.getValueCount()).isEqualTo(3);
        assertThat(vector.getObject(0)).hasSize(2);
        assertThat(vector.isNull(1)).isTrue();
        assertThat(vector.getObject(2).get(0).toString()).isEqualTo("c");
    }

    @Test
    void testTemporalElementsAreUnsupported() {
        Field field =
                listOf(
                        "ts",
                        Field.nullable(
                                "item", new ArrowType.Timestamp(TimeUnit.MILLISECOND, null)));
        NestedTypeUnsupportedException e =
                catchThrowableOfType(
                        () -> buildList(field, AvroValue.ofArray(AvroValue.ofTimestampMillis(1L))),
                        NestedTypeUnsupportedException.class);
        assertThat(e).hasMessageContaining("'ts.element'");
        assertThat(e.getPath()).isEqualTo("ts.element");
    }

    private FieldVector buildList(Field field, AvroValue... rows) {
        FieldVector vector = field.createVector(allocator);
        vectors.add(vector);
        vector.allocateNew();
        List<SourceValue> values = new ArrayList<>(rows.length);
        for (AvroValue row : rows) {
            values.add(new SourceValue(index, row));
        }
        listBuilder.build(values, field.getName(), vector);
        return vector;
    }

    private static Field listOf(String name, Field element) {
        return new Field(
                name,
                FieldType.nullable(ArrowType.List.INSTANCE),
                Collections.singletonList(element));
    }
}
