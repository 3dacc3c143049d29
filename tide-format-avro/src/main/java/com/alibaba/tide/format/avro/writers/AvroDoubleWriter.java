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

import org.apache.arrow.vector.Float8Vector;

import javax.annotation.Nullable;

/** {@link AvroFieldWriter} for Double. */
@Internal
public class AvroDoubleWriter extends AvroFieldWriter {

    public static AvroDoubleWriter forField(Float8Vector doubleVector) {
        return new AvroDoubleWriter(doubleVector);
    }

    private AvroDoubleWriter(Float8Vector doubleVector) {
        super(doubleVector);
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        Float8Vector vector = (Float8Vector) getValueVector();
        Number resolved =
                value == null ? null : ValueResolvers.resolveNumber(value, NumericKind.FLOAT64);
        if (resolved == null) {
            vector.setNull(getCount());
        } else {
            vector.setSafe(getCount(), resolved.doubleValue());
        }
    }
}
