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
import com.alibaba.tide.format.avro.resolver.NumericKind;
import com.alibaba.tide.format.avro.resolver.ValueResolvers;

import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.ValueVector;

import javax.annotation.Nullable;

/**
 * {@link AvroFieldWriter} for Time. Seconds and milliseconds are stored in 32 bits, microseconds
 * and nanoseconds in 64 bits.
 */
@Internal
public class AvroTimeWriter extends AvroFieldWriter {

    private final NumericKind kind;

    public static AvroTimeWriter forField(ValueVector valueVector) {
        if (valueVector instanceof TimeSecVector || valueVector instanceof TimeMilliVector) {
            return new AvroTimeWriter((BaseFixedWidthVector) valueVector, NumericKind.INT32);
        } else if (valueVector instanceof TimeMicroVector
                || valueVector instanceof TimeNanoVector) {
            return new AvroTimeWriter((BaseFixedWidthVector) valueVector, NumericKind.INT64);
        } else {
            throw new IllegalArgumentException(
                    "Unsupported vector for Time type: " + valueVector.getClass().getName());
        }
    }

    private AvroTimeWriter(BaseFixedWidthVector timeVector, NumericKind kind) {
        super(timeVector);
        this.kind = kind;
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        Number resolved = value == null ? null : ValueResolvers.resolveNumber(value, kind);
        int pos = getCount();
        if (resolved == null) {
            ((BaseFixedWidthVector) getValueVector()).setNull(pos);
        } else if (getValueVector() instanceof TimeSecVector) {
            ((TimeSecVector) getValueVector()).setSafe(pos, resolved.intValue());
        } else if (getValueVector() instanceof TimeMilliVector) {
            ((TimeMilliVector) getValueVector()).setSafe(pos, resolved.intValue());
        } else if (getValueVector() instanceof TimeMicroVector) {
            ((TimeMicroVector) getValueVector()).setSafe(pos, resolved.longValue());
        } else {
            ((TimeNanoVector) getValueVector()).setSafe(pos, resolved.longValue());
        }
    }
}
