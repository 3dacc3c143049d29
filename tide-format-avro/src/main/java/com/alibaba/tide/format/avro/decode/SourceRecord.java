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
import com.alibaba.tide.format.avro.data.AvroRecord;
import com.alibaba.tide.format.avro.schema.SchemaIndex;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/** A record together with the index of the writer schema it was written with. */
@Internal
public final class SourceRecord {

    private final SchemaIndex schemaIndex;
    private final AvroRecord record;

    public SourceRecord(SchemaIndex schemaIndex, AvroRecord record) {
        this.schemaIndex = checkNotNull(schemaIndex);
        this.record = checkNotNull(record);
    }

    public SchemaIndex getSchemaIndex() {
        return schemaIndex;
    }

    public AvroRecord getRecord() {
        return record;
    }

    /** Looks up the value at the given path, or returns null if the path does not resolve. */
    public SourceValue lookup(String path) {
        return new SourceValue(schemaIndex, schemaIndex.lookup(record, path));
    }

    @Override
    public String toString() {
        return String.valueOf(record);
    }
}
