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

package com.alibaba.tide.utils;

import com.alibaba.tide.exception.UnsupportedTypeException;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ArrowUtils}. */
class ArrowUtilsTest {

    private static final ArrowType.Int INT8 = new ArrowType.Int(8, true);
    private static final ArrowType.Int UINT8 = new ArrowType.Int(8, false);

    @Test
    void testDictionaryKeyCapacity() {
        assertThat(ArrowUtils.dictionaryKeyCapacity(INT8)).isEqualTo(128);
        assertThat(ArrowUtils.dictionaryKeyCapacity(UINT8)).isEqualTo(256);
        assertThat(ArrowUtils.dictionaryKeyCapacity(new ArrowType.Int(16, true)))
                .isEqualTo(32768);
        assertThat(ArrowUtils.dictionaryKeyCapacity(new ArrowType.Int(32, false)))
                .isEqualTo(4294967296L);
        assertThat(ArrowUtils.dictionaryKeyCapacity(new ArrowType.Int(64, true)))
                .isEqualTo(Long.MAX_VALUE);
        assertThat(ArrowUtils.dictionaryKeyCapacity(new ArrowType.Int(64, false)))
                .isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void testValidateDictionaryIds() {
        Field top = dictionaryField("a", 1, ArrowType.Utf8.INSTANCE);
        Field nested =
                new Field(
                        "s",
                        FieldType.nullable(ArrowType.Struct.INSTANCE),
                        Collections.singletonList(dictionaryField("b", 2, INT8)));
        ArrowUtils.validateDictionaryIds(new Schema(Arrays.asList(top, nested)));

        Field clashing =
                new Field(
                        "s",
                        FieldType.nullable(ArrowType.Struct.INSTANCE),
                        Collections.singletonList(dictionaryField("b", 1, INT8)));
        assertThatThrownBy(
                        () ->
                                ArrowUtils.validateDictionaryIds(
                                        new Schema(Arrays.asList(top, clashing))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Dictionary id 1")
                .hasMessageContaining("'a'")
                .hasMessageContaining("'b'");
    }

    @Test
    void testToMemoryFormat() {
        Field declaredAsString = dictionaryField("a", 1, ArrowType.Utf8.INSTANCE);
        Field declaredAsIndex = dictionaryField("b", 2, INT8);
        Field list =
                new Field(
                        "c",
                        FieldType.nullable(ArrowType.List.INSTANCE),
                        Collections.singletonList(
                                dictionaryField("element", 3, ArrowType.Utf8.INSTANCE)));
        Field plain = Field.nullable("d", new ArrowType.Int(32, true));

        Schema converted =
                ArrowUtils.toMemoryFormat(
                        new Schema(Arrays.asList(declaredAsString, declaredAsIndex, list, plain)));

        assertThat(converted.getFields().get(0).getType()).isEqualTo(INT8);
        assertThat(converted.getFields().get(0).getDictionary().getId()).isEqualTo(1);
        assertThat(converted.getFields().get(1).getType()).isEqualTo(INT8);
        assertThat(converted.getFields().get(1).getDictionary())
                .isEqualTo(declaredAsIndex.getDictionary());
        assertThat(converted.getFields().get(2).getChildren().get(0).getType()).isEqualTo(INT8);
        assertThat(converted.getFields().get(3)).isEqualTo(plain);
    }

    @Test
    void testToMemoryFormatRejectsNonStringDictionaries() {
        Field field =
                dictionaryField(
                        "a", 1, new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE));
        assertThatThrownBy(() -> ArrowUtils.toMemoryFormat(new Schema(Arrays.asList(field))))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("Only dictionaries of strings are supported");
    }

    @Test
    void testDescribe() {
        assertThat(ArrowUtils.describe(Field.nullable("a", ArrowType.Utf8.INSTANCE)))
                .isEqualTo("Utf8");
        assertThat(ArrowUtils.describe(dictionaryField("a", 1, INT8)))
                .isEqualTo("Dictionary<Int(8, true), Utf8>");
        assertThat(ArrowUtils.isDictionaryEncoded(dictionaryField("a", 1, INT8))).isTrue();
        assertThat(ArrowUtils.isDictionaryEncoded(Field.nullable("a", INT8))).isFalse();
    }

    private static Field dictionaryField(String name, long id, ArrowType type) {
        DictionaryEncoding encoding = new DictionaryEncoding(id, false, INT8);
        return new Field(name, new FieldType(true, type, encoding), null);
    }
}
