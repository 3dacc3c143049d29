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
import com.alibaba.tide.format.avro.data.AvroValue;

import org.apache.arrow.vector.ValueVector;

import javax.annotation.Nullable;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * Base class for writers that append resolved {@link AvroValue}s to an Arrow vector, one slot per
 * call. An absent value, passed as {@code null}, is written as a null slot.
 */
@Internal
public abstract class AvroFieldWriter {

    /** Container which is used to store the written sequence of values of a column. */
    private final ValueVector valueVector;

    private int count;

    protected AvroFieldWriter(ValueVector valueVector) {
        this.valueVector = checkNotNull(valueVector);
    }

    /** Returns the underlying container which stores the sequence of values of a column. */
    public ValueVector getValueVector() {
        return valueVector;
    }

    /** Returns the current count of elements written. */
    public int getCount() {
        return count;
    }

    /** Writes the value into the slot at {@link #getCount()}. */
    protected abstract void doWrite(@Nullable AvroValue value);

    /** Writes the value, or a null slot if the value is absent. */
    public void write(@Nullable AvroValue value) {
        doWrite(value);
        count++;
    }

    /** Sets the value count of the vector to the number of values written. */
    public void finish() {
        valueVector.setValueCount(count);
    }
}
