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

package com.alibaba.tide.format.avro.data;

import com.alibaba.tide.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.alibaba.tide.utils.Preconditions.checkArgument;
import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * An ordered sequence of named {@link AvroValue}s. When produced from a datum the fields are in
 * the order of the writer schema, but a record may also carry fields in any order, omit fields or
 * contain fields unknown to the target schema.
 *
 * @since 0.1
 */
@PublicEvolving
public final class AvroRecord {

    /** A record without fields, every lookup into it misses. */
    public static final AvroRecord EMPTY =
            new AvroRecord(Collections.emptyList(), Collections.emptyList());

    private final List<String> names;
    private final List<AvroValue> values;

    private AvroRecord(List<String> names, List<AvroValue> values) {
        this.names = names;
        this.values = values;
    }

    public static AvroRecord of(List<String> names, List<AvroValue> values) {
        checkArgument(
                names.size() == values.size(),
                "Got %s field names for %s values.",
                names.size(),
                values.size());
        return new AvroRecord(
                Collections.unmodifiableList(new ArrayList<>(names)),
                Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return names.size();
    }

    public String getName(int pos) {
        return names.get(pos);
    }

    public AvroValue get(int pos) {
        return values.get(pos);
    }

    /** Returns the position of the first field with the given name, or -1. */
    public int indexOf(String name) {
        return names.indexOf(name);
    }

    /** Returns the value of the first field with the given name, or null if there is none. */
    @Nullable
    public AvroValue get(String name) {
        int pos = indexOf(name);
        return pos < 0 ? null : values.get(pos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AvroRecord that = (AvroRecord) o;
        return names.equals(that.names) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(names.get(i)).append('=').append(values.get(i));
        }
        return sb.append('}').toString();
    }

    /** Builder for {@link AvroRecord}. */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<AvroValue> values = new ArrayList<>();

        private Builder() {}

        public Builder field(String name, AvroValue value) {
            names.add(checkNotNull(name));
            values.add(checkNotNull(value));
            return this;
        }

        public AvroRecord build() {
            return AvroRecord.of(names, values);
        }
    }
}
