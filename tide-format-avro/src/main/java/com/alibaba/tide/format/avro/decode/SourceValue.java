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
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.schema.SchemaIndex;

import javax.annotation.Nullable;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * A value found at some path of a source record, or a missing value, together with the index of
 * the writer schema of the record it was found in.
 */
@Internal
public final class SourceValue {

    private final SchemaIndex schemaIndex;
    @Nullable private final AvroValue value;

    public SourceValue(SchemaIndex schemaIndex, @Nullable AvroValue value) {
        this.schemaIndex = checkNotNull(schemaIndex);
        this.value = value;
    }

    public SchemaIndex getSchemaIndex() {
        return schemaIndex;
    }

    /** Returns the value, or null if the field is missing from the record. */
    @Nullable
    public AvroValue getValue() {
        return value;
    }

    /** Returns true if the field is missing or holds null, looking through one union. */
    public boolean isNullOrMissing() {
        return value == null || value.unwrapUnion().isNull();
    }

    /** Returns a value of the same writer schema. */
    public SourceValue with(@Nullable AvroValue newValue) {
        return new SourceValue(schemaIndex, newValue);
    }

    @Override
    public String toString() {
        return value == null ? "<missing>" : value.toString();
    }
}
