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
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;

import javax.annotation.Nullable;

/** {@link AvroFieldWriter} for Date, stored either as days or as milliseconds. */
@Internal
public class AvroDateWriter extends AvroFieldWriter {

    public static AvroDateWriter forField(DateDayVector dateDayVector) {
        return new AvroDateWriter(dateDayVector);
    }

    public static AvroDateWriter forField(DateMilliVector dateMilliVector) {
        return new AvroDateWriter(dateMilliVector);
    }

    private AvroDateWriter(BaseFixedWidthVector dateVector) {
        super(dateVector);
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        if (getValueVector() instanceof DateDayVector) {
            DateDayVector vector = (DateDayVector) getValueVector();
            Number resolved =
                    value == null ? null : ValueResolvers.resolveNumber(value, NumericKind.INT32);
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved.intValue());
            }
        } else {
            DateMilliVector vector = (DateMilliVector) getValueVector();
            Number resolved =
                    value == null ? null : ValueResolvers.resolveNumber(value, NumericKind.INT64);
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved.longValue());
            }
        }
    }
}
