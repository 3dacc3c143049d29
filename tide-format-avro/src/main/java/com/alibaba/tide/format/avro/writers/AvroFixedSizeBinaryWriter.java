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
import com.alibaba.tide.format.avro.resolver.ValueResolvers;

import org.apache.arrow.vector.FixedSizeBinaryVector;

import javax.annotation.Nullable;

/**
 * {@link AvroFieldWriter} for FixedSizeBinary. Only fixed values of exactly the byte width of the
 * vector are written, anything else becomes null.
 */
@Internal
public class AvroFixedSizeBinaryWriter extends AvroFieldWriter {

    private final int byteWidth;

    public static AvroFixedSizeBinaryWriter forField(FixedSizeBinaryVector fixedSizeBinaryVector) {
        return new AvroFixedSizeBinaryWriter(fixedSizeBinaryVector);
    }

    private AvroFixedSizeBinaryWriter(FixedSizeBinaryVector fixedSizeBinaryVector) {
        super(fixedSizeBinaryVector);
        this.byteWidth = fixedSizeBinaryVector.getByteWidth();
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        FixedSizeBinaryVector vector = (FixedSizeBinaryVector) getValueVector();
        byte[] resolved = value == null ? null : ValueResolvers.resolveFixed(value, byteWidth);
        if (resolved == null) {
            vector.setNull(getCount());
        } else {
            vector.setSafe(getCount(), resolved);
        }
    }
}
