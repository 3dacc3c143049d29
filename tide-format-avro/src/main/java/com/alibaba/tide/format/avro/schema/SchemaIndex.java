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

package com.alibaba.tide.format.avro.schema;

import com.alibaba.tide.annotation.Internal;
import com.alibaba.tide.annotation.VisibleForTesting;
import com.alibaba.tide.exception.NotARecordException;
import com.alibaba.tide.exception.SchemaParseFailedException;
import com.alibaba.tide.format.avro.data.AvroRecord;
import com.alibaba.tide.format.avro.data.AvroValue;

import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattened view of a writer schema that maps dotted field paths to the position of the field in
 * the field list of the record that owns it.
 *
 * <p>Top-level fields are keyed by their name, fields of nested records by {@code
 * parent.child}, and the element type of an array extends the path by {@code .element}. A union
 * of exactly two branches where one branch is {@code null} is looked through with the same path.
 * Any other union is not descended, so paths below it have no entry and never resolve.
 *
 * <p>When two fields map to the same path the one indexed last wins.
 */
@Internal
public final class SchemaIndex {

    public static final String ELEMENT_SEGMENT = "element";

    private final Map<String, Integer> positions;

    private SchemaIndex(Map<String, Integer> positions) {
        this.positions = positions;
    }

    /** Parses the JSON definition of a writer schema and indexes it. */
    public static SchemaIndex parse(String writerSchemaJson) {
        Schema schema;
        try {
            schema = new Schema.Parser().parse(writerSchemaJson);
        } catch (SchemaParseException e) {
            throw new SchemaParseFailedException("Failed to parse Avro writer schema.", e);
        }
        return build(schema);
    }

    /** Indexes a record-shaped writer schema. */
    public static SchemaIndex build(Schema writerSchema) {
        if (writerSchema.getType() != Schema.Type.RECORD) {
            throw new NotARecordException(
                    String.format(
                            "Expected Avro schema to be a record, but got %s.",
                            writerSchema.getType().getName()));
        }
        Map<String, Integer> positions = new HashMap<>();
        Set<String> visiting = new HashSet<>();
        visiting.add(writerSchema.getFullName());
        for (Schema.Field field : writerSchema.getFields()) {
            positions.put(field.name(), field.pos());
        }
        for (Schema.Field field : writerSchema.getFields()) {
            indexChild(field.name(), field.schema(), positions, visiting);
        }
        return new SchemaIndex(positions);
    }

    private static void indexChild(
            String parentPath,
            Schema schema,
            Map<String, Integer> positions,
            Set<String> visiting) {
        switch (schema.getType()) {
            case UNION:
                List<Schema> branches = schema.getTypes();
                if (branches.size() == 2 && schema.isNullable()) {
                    Schema nonNull =
                            branches.get(0).getType() == Schema.Type.NULL
                                    ? branches.get(1)
                                    : branches.get(0);
                    indexChild(parentPath, nonNull, positions, visiting);
                }
                break;
            case RECORD:
                // recursive record definitions are indexed down to their first repetition
                if (!visiting.add(schema.getFullName())) {
                    break;
                }
                for (Schema.Field field : schema.getFields()) {
                    positions.put(parentPath + "." + field.name(), field.pos());
                }
                for (Schema.Field field : schema.getFields()) {
                    indexChild(
                            parentPath + "." + field.name(), field.schema(), positions, visiting);
                }
                visiting.remove(schema.getFullName());
                break;
            case ARRAY:
                indexChild(
                        parentPath + "." + ELEMENT_SEGMENT,
                        schema.getElementType(),
                        positions,
                        visiting);
                break;
            default:
                break;
        }
    }

    /**
     * Returns the value at the given path of a record written with this schema, or null if the
     * path is not indexed or the record does not carry the field.
     *
     * <p>The indexed position is tried first. If the record is not laid out in writer order the
     * field is looked up by name instead.
     */
    @Nullable
    public AvroValue lookup(AvroRecord record, String path) {
        Integer pos = positions.get(path);
        if (pos == null) {
            return null;
        }
        String name = path.substring(path.lastIndexOf('.') + 1);
        if (pos < record.size() && record.getName(pos).equals(name)) {
            return record.get(pos);
        }
        return record.get(name);
    }

    /** Returns the indexed position of a path, or null if the path is not indexed. */
    @Nullable
    public Integer getPosition(String path) {
        return positions.get(path);
    }

    public int size() {
        return positions.size();
    }

    @VisibleForTesting
    Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(positions);
    }

    @Override
    public String toString() {
        return "SchemaIndex" + positions;
    }
}
