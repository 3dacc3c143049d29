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

import com.alibaba.tide.annotation.Internal;
import com.alibaba.tide.exception.DictionaryKeyOverflowException;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.utils.ArrowUtils;

import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * {@link AvroFieldWriter} for dictionary-encoded strings. Each distinct string gets the next free
 * key, in order of first appearance, and the key is written to the index vector.
 *
 * <p>The dictionary itself is materialized by {@link #finishDictionary()} once all values are
 * written.
 */
@Internal
public class AvroDictionaryWriter extends AvroFieldWriter {

    private final String path;
    private final boolean lenient;
    private final DictionaryEncoding encoding;
    private final long capacity;

    private final Map<String, Long> keys = new LinkedHashMap<>();

    public static AvroDictionaryWriter forField(
            BaseIntVector indexVector, String path, boolean lenient) {
        return new AvroDictionaryWriter(indexVector, path, lenient);
    }

    private AvroDictionaryWriter(BaseIntVector indexVector, String path, boolean lenient) {
        super(indexVector);
        this.path = path;
        this.lenient = lenient;
        this.encoding =
                checkNotNull(
                        indexVector.getField().getDictionary(),
                        "Field '%s' is not dictionary-encoded.",
                        path);
        this.capacity = ArrowUtils.dictionaryKeyCapacity(encoding.getIndexType());
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        String resolved = value == null ? null : AvroVarCharWriter.resolve(value, lenient);
        if (resolved == null) {
            ((BaseFixedWidthVector) getValueVector()).setNull(getCount());
            return;
        }
        Long key = keys.get(resolved);
        if (key == null) {
            if (keys.size() >= capacity) {
                throw new DictionaryKeyOverflowException(path, capacity);
            }
            key = (long) keys.size();
            keys.put(resolved, key);
        }
        ((BaseIntVector) getValueVector()).setWithPossibleTruncate(getCount(), key);
    }

    /** Returns the number of distinct strings written so far. */
    public int getDictionarySize() {
        return keys.size();
    }

    /**
     * Builds the dictionary of all distinct strings written, allocated from the allocator of the
     * index vector. The caller owns the returned dictionary vector.
     */
    public Dictionary finishDictionary() {
        Field valueField =
                Field.nullable(getValueVector().getField().getName(), ArrowType.Utf8.INSTANCE);
        VarCharVector values = new VarCharVector(valueField, getValueVector().getAllocator());
        values.allocateNew();
        int index = 0;
        for (String value : keys.keySet()) {
            values.setSafe(index++, value.getBytes(StandardCharsets.UTF_8));
        }
        values.setValueCount(index);
        return new Dictionary(values, encoding);
    }
}
