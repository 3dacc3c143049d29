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
import com.alibaba.tide.exception.DecodeException;
import com.alibaba.tide.exception.ShapeMismatchException;
import com.alibaba.tide.exception.UnsupportedTypeException;
import com.alibaba.tide.format.avro.data.AvroRecord;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.schema.SchemaIndex;
import com.alibaba.tide.format.avro.writers.AvroDictionaryWriter;
import com.alibaba.tide.format.avro.writers.AvroFieldWriter;
import com.alibaba.tide.format.avro.writers.AvroFieldWriters;
import com.alibaba.tide.utils.ArrowUtils;

import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Field;

import java.util.ArrayList;
import java.util.List;

import static com.alibaba.tide.format.avro.decode.NestedListBuilder.endValue;
import static com.alibaba.tide.format.avro.decode.NestedListBuilder.getDataVector;
import static com.alibaba.tide.format.avro.decode.NestedListBuilder.setNull;
import static com.alibaba.tide.format.avro.decode.NestedListBuilder.startValue;
import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * Fills one column of a batch from the source records, dispatching on the declared type of the
 * column and recursing into the children of struct columns.
 *
 * <p>Each source record is looked up at the dotted path of the column through the index of its
 * writer schema. A path that does not resolve yields a null slot, so every column receives exactly
 * one slot per source record. Dictionaries of dictionary-encoded columns are collected into the
 * given provider.
 */
@Internal
public class ColumnBuilder {

    private final DictionaryProvider.MapDictionaryProvider dictionaries;
    private final NestedListBuilder listBuilder;

    public ColumnBuilder(DictionaryProvider.MapDictionaryProvider dictionaries) {
        this.dictionaries = checkNotNull(dictionaries);
        this.listBuilder = new NestedListBuilder(this);
    }

    /**
     * Writes one slot per record into the given vector.
     *
     * @param rows the source records, one per row of the column
     * @param parentPath the dotted path of the enclosing struct, or an empty string for a
     *     top-level column
     * @param vector the allocated vector of the column
     * @throws DecodeException if a value cannot be converted to the declared type of the column
     */
    public void build(List<SourceRecord> rows, String parentPath, FieldVector vector) {
        Field field = vector.getField();
        String path = childPath(parentPath, field.getName());
        if (ArrowUtils.isDictionaryEncoded(field)) {
            writeScalars(lookup(rows, path), path, vector, false);
            return;
        }
        switch (field.getType().getTypeID()) {
            case Null:
                vector.setValueCount(rows.size());
                break;
            case Struct:
                buildStruct(lookup(rows, path), path, (StructVector) vector);
                break;
            case List:
            case LargeList:
                if (ArrowUtils.isDictionaryEncoded(getDataVector(vector).getField())) {
                    buildDictionaryList(lookup(rows, path), path, vector);
                } else {
                    listBuilder.build(lookup(rows, path), path, vector);
                }
                break;
            case Bool:
            case Int:
            case FloatingPoint:
            case Timestamp:
            case Date:
            case Time:
            case Utf8:
            case LargeUtf8:
            case Binary:
            case LargeBinary:
            case FixedSizeBinary:
                writeScalars(lookup(rows, path), path, vector, false);
                break;
            default:
                throw new UnsupportedTypeException(
                        ArrowUtils.describe(field),
                        String.format(
                                "Unsupported type %s of column '%s'.",
                                ArrowUtils.describe(field),
                                path));
        }
    }

    /** Writes scalar values, or dictionary keys, into a vector with one slot per value. */
    void writeScalars(
            List<SourceValue> values, String path, FieldVector vector, boolean lenientStrings) {
        AvroFieldWriter writer = AvroFieldWriters.createFieldWriter(vector, path, lenientStrings);
        for (SourceValue value : values) {
            writer.write(value.getValue());
        }
        writer.finish();
        if (writer instanceof AvroDictionaryWriter) {
            dictionaries.put(((AvroDictionaryWriter) writer).finishDictionary());
        }
    }

    /**
     * Fills a struct vector with one slot per value. Missing and null values leave the slot
     * undefined and give every child a null, any other value that is not a record is rejected.
     */
    void buildStruct(List<SourceValue> values, String path, StructVector vector) {
        List<SourceRecord> records = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            SourceValue source = values.get(i);
            if (source.isNullOrMissing()) {
                vector.setNull(i);
                records.add(new SourceRecord(source.getSchemaIndex(), AvroRecord.EMPTY));
                continue;
            }
            AvroValue value = source.getValue().unwrapUnion();
            if (value.getKind() == AvroValue.Kind.RECORD) {
                vector.setIndexDefined(i);
                records.add(new SourceRecord(source.getSchemaIndex(), value.getRecord()));
            } else {
                throw new ShapeMismatchException(
                        AvroValue.Kind.RECORD.name(), value.getKind().name(), path);
            }
        }
        for (FieldVector child : vector.getChildrenFromFields()) {
            build(records, path, child);
        }
        vector.setValueCount(values.size());
    }

    /**
     * Fills a list of dictionary-encoded strings. A single value is taken as a list of one
     * element and an explicit null as a list holding one null element. Only a missing value
     * yields a null list.
     */
    private void buildDictionaryList(List<SourceValue> values, String path, FieldVector vector) {
        String elementPath = path + "." + SchemaIndex.ELEMENT_SEGMENT;
        AvroDictionaryWriter writer =
                AvroDictionaryWriter.forField(
                        (BaseIntVector) getDataVector(vector), elementPath, false);
        for (int i = 0; i < values.size(); i++) {
            AvroValue value = values.get(i).getValue();
            if (value == null) {
                setNull(vector, i);
                continue;
            }
            value = value.unwrapUnion();
            if (value.getKind() == AvroValue.Kind.ARRAY) {
                startValue(vector, i);
                for (AvroValue item : value.getArray()) {
                    writer.write(item);
                }
                endValue(vector, i, value.getArray().size());
            } else if (value.getKind() == AvroValue.Kind.RECORD) {
                throw new ShapeMismatchException(
                        AvroValue.Kind.ARRAY.name(), value.getKind().name(), path);
            } else {
                startValue(vector, i);
                writer.write(value);
                endValue(vector, i, 1);
            }
        }
        writer.finish();
        vector.setValueCount(values.size());
        dictionaries.put(writer.finishDictionary());
    }

    private static List<SourceValue> lookup(List<SourceRecord> rows, String path) {
        List<SourceValue> values = new ArrayList<>(rows.size());
        for (SourceRecord row : rows) {
            values.add(row.lookup(path));
        }
        return values;
    }

    static String childPath(String parentPath, String name) {
        return parentPath.isEmpty() ? name : parentPath + "." + name;
    }
}
