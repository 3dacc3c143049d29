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

import com.alibaba.tide.annotation.Internal;
import com.alibaba.tide.exception.UnsupportedTypeException;

import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.alibaba.tide.utils.Preconditions.checkArgument;

/** Utilities for Arrow. */
@Internal
public class ArrowUtils {

    /**
     * Returns the number of distinct dictionary entries that can be addressed with keys of the
     * given integer type. Keys are never negative, so a signed key type addresses half of its
     * range.
     */
    public static long dictionaryKeyCapacity(ArrowType.Int indexType) {
        int bits = indexType.getIsSigned() ? indexType.getBitWidth() - 1 : indexType.getBitWidth();
        return bits >= Long.SIZE - 1 ? Long.MAX_VALUE : 1L << bits;
    }

    /** Returns true if the values of the field are stored as keys into a dictionary. */
    public static boolean isDictionaryEncoded(Field field) {
        return field.getDictionary() != null;
    }

    /**
     * Checks that every dictionary-encoded field of the schema, including fields nested in lists
     * and structs, uses its own dictionary id.
     */
    public static void validateDictionaryIds(Schema schema) {
        Map<Long, String> ids = new HashMap<>();
        for (Field field : flattenFields(schema.getFields())) {
            DictionaryEncoding encoding = field.getDictionary();
            if (encoding != null) {
                String previous = ids.put(encoding.getId(), field.getName());
                checkArgument(
                        previous == null,
                        "Dictionary id %s is used by both field '%s' and field '%s'.",
                        encoding.getId(),
                        previous,
                        field.getName());
            }
        }
    }

    /**
     * Converts the dictionary-encoded fields of a schema to the in-memory layout, where the type
     * of the field is the index type of its dictionary. A dictionary-encoded field may be declared
     * either with its index type or with {@code Utf8} as the type of the dictionary values.
     *
     * @throws UnsupportedTypeException if a dictionary holds values of any other type
     */
    public static Schema toMemoryFormat(Schema schema) {
        List<Field> fields = new ArrayList<>(schema.getFields().size());
        for (Field field : schema.getFields()) {
            fields.add(toMemoryFormat(field));
        }
        return new Schema(fields, schema.getCustomMetadata());
    }

    private static Field toMemoryFormat(Field field) {
        List<Field> children = new ArrayList<>(field.getChildren().size());
        for (Field child : field.getChildren()) {
            children.add(toMemoryFormat(child));
        }
        DictionaryEncoding encoding = field.getDictionary();
        if (encoding == null) {
            return new Field(field.getName(), field.getFieldType(), children);
        }
        ArrowType declared = field.getType();
        if (!declared.equals(encoding.getIndexType())
                && declared.getTypeID() != ArrowType.ArrowTypeID.Utf8) {
            throw new UnsupportedTypeException(
                    describe(field),
                    String.format(
                            "Only dictionaries of strings are supported, but field '%s' declares "
                                    + "dictionary values of type %s.",
                            field.getName(),
                            declared));
        }
        FieldType fieldType =
                new FieldType(
                        field.isNullable(),
                        encoding.getIndexType(),
                        encoding,
                        field.getMetadata());
        return new Field(field.getName(), fieldType, children);
    }

    /** Returns a short, human readable description of a field's declared type. */
    public static String describe(Field field) {
        DictionaryEncoding encoding = field.getDictionary();
        if (encoding != null) {
            ArrowType valueType =
                    field.getType().equals(encoding.getIndexType())
                            ? ArrowType.Utf8.INSTANCE
                            : field.getType();
            return String.format("Dictionary<%s, %s>", encoding.getIndexType(), valueType);
        }
        return field.getType().toString();
    }

    // ------------------------------------------------------------------------------------------

    private static List<Field> flattenFields(List<Field> fields) {
        List<Field> allFields = new ArrayList<>();
        for (Field f : fields) {
            allFields.add(f);
            allFields.addAll(flattenFields(f.getChildren()));
        }
        return allFields;
    }
}
