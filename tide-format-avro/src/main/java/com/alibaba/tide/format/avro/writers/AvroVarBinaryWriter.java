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

import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.VarBinaryVector;

import javax.annotation.Nullable;

/** {@link AvroFieldWriter} for VarBinary and LargeVarBinary. */
@Internal
public class AvroVarBinaryWriter extends AvroFieldWriter {

    public static AvroVarBinaryWriter forField(VarBinaryVector varBinaryVector) {
        return new AvroVarBinaryWriter(varBinaryVector);
    }

    public static AvroVarBinaryWriter forField(LargeVarBinaryVector largeVarBinaryVector) {
        return new AvroVarBinaryWriter(largeVarBinaryVector);
    }

    private AvroVarBinaryWriter(VarBinaryVector varBinaryVector) {
        super(varBinaryVector);
    }

    private AvroVarBinaryWriter(LargeVarBinaryVector largeVarBinaryVector) {
        super(largeVarBinaryVector);
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        byte[] resolved = value == null ? null : ValueResolvers.resolveBytes(value);
        if (getValueVector() instanceof VarBinaryVector) {
            VarBinaryVector vector = (VarBinaryVector) getValueVector();
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved);
            }
        } else {
            LargeVarBinaryVector vector = (LargeVarBinaryVector) getValueVector();
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved);
            }
        }
    }
}
