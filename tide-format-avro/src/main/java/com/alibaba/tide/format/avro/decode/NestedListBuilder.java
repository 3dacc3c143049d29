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

import com.alibaba.tide.annotation.Internal;
import com.alibaba.tide.exception.NestedTypeUnsupportedException;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.schema.SchemaIndex;
import com.alibaba.tide.utils.ArrowUtils;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.LargeListVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.pojo.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills list columns, one nesting level at a time.
 *
 * <p>An array contributes its elements to the row, a null or missing value makes the row a null
 * list, and any other value is taken as a list of one element. The elements of all rows are then
 * flattened into a single stream and written into the element vector, recursing for lists of
 * lists. Strings that cannot be converted are written as null elements. Temporal elements are not
 * supported.
 */
@Internal
public class NestedListBuilder {

    private final ColumnBuilder columnBuilder;

    NestedListBuilder(ColumnBuilder columnBuilder) {
        this.columnBuilder = columnBuilder;
    }

    /** Writes one list per value into a {@link ListVector} or {@link LargeListVector}. */
    public void build(List<SourceValue> rows, String path, FieldVector listVector) {
        List<SourceValue> elements = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            SourceValue row = rows.get(i);
            if (row.isNullOrMissing()) {
                setNull(listVector, i);
                continue;
            }
            AvroValue value = row.getValue().unwrapUnion();
            if (value.getKind() == AvroValue.Kind.ARRAY) {
                List<AvroValue> items = value.getArray();
                startValue(listVector, i);
                for (AvroValue item : items) {
                    elements.add(row.with(item));
                }
                endValue(listVector, i, items.size());
            } else {
                startValue(listVector, i);
                elements.add(row.with(value));
                endValue(listVector, i, 1);
            }
        }
        String elementPath = path + "." + SchemaIndex.ELEMENT_SEGMENT;
        buildElements(elements, elementPath, getDataVector(listVector));
        listVector.setValueCount(rows.size());
    }

    private void buildElements(List<SourceValue> elements, String path, FieldVector vector) {
        Field field = vector.getField();
        if (ArrowUtils.isDictionaryEncoded(field)) {
            columnBuilder.writeScalars(elements, path, vector, true);
            return;
        }
        switch (field.getType().getTypeID()) {
            case Null:
                vector.setValueCount(elements.size());
                break;
            case Bool:
            case Int:
            case FloatingPoint:
            case Utf8:
            case LargeUtf8:
            case Binary:
            case LargeBinary:
            case FixedSizeBinary:
                columnBuilder.writeScalars(elements, path, vector, true);
                break;
            case Struct:
                columnBuilder.buildStruct(elements, path, (StructVector) vector);
                break;
            case List:
            case LargeList:
                build(elements, path, vector);
                break;
            default:
                throw new NestedTypeUnsupportedException(ArrowUtils.describe(field), path);
        }
    }

    // ------------------------------------------------------------------------------------------
    //  ListVector and LargeListVector share no interface for writing offsets
    // ------------------------------------------------------------------------------------------

    static FieldVector getDataVector(FieldVector listVector) {
        if (listVector instanceof LargeListVector) {
            return ((LargeListVector) listVector).getDataVector();
        }
        return ((ListVector) listVector).getDataVector();
    }

    static void startValue(FieldVector listVector, int index) {
        if (listVector instanceof LargeListVector) {
            ((LargeListVector) listVector).startNewValue(index);
        } else {
            ((ListVector) listVector).startNewValue(index);
        }
    }

    static void endValue(FieldVector listVector, int index, int size) {
        if (listVector instanceof LargeListVector) {
            ((LargeListVector) listVector).endValue(index, size);
        } else {
            ((ListVector) listVector).endValue(index, size);
        }
    }

    static void setNull(FieldVector listVector, int index) {
        if (listVector instanceof LargeListVector) {
            ((LargeListVector) listVector).setNull(index);
        } else {
            ((ListVector) listVector).setNull(index);
        }
    }
}
