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
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.types.pojo.ArrowType;

import javax.annotation.Nullable;

/**
 * {@link AvroFieldWriter} for signed and unsigned integers of every width. Values that do not fit
 * the width of the vector are written as null.
 */
@Internal
public class AvroIntegerWriter extends AvroFieldWriter {

    private final NumericKind kind;

    public static AvroIntegerWriter forField(BaseIntVector intVector) {
        return new AvroIntegerWriter(intVector);
    }

    private AvroIntegerWriter(BaseIntVector intVector) {
        super(intVector);
        this.kind = NumericKind.of((ArrowType.Int) intVector.getField().getType());
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        Number resolved = value == null ? null : ValueResolvers.resolveNumber(value, kind);
        if (resolved == null) {
            ((BaseFixedWidthVector) getValueVector()).setNull(getCount());
        } else {
            ((BaseIntVector) getValueVector())
                    .setWithPossibleTruncate(getCount(), resolved.longValue());
        }
    }
}
