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
import com.alibaba.tide.exception.StringConversionException;
import com.alibaba.tide.format.avro.data.AvroValue;
import com.alibaba.tide.format.avro.resolver.ValueResolvers;

import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.VarCharVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * {@link AvroFieldWriter} for VarChar and LargeVarChar.
 *
 * <p>A strict writer fails with a {@link StringConversionException} on values that cannot be read
 * as a string. A lenient writer, used for list elements, writes them as null.
 */
@Internal
public class AvroVarCharWriter extends AvroFieldWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AvroVarCharWriter.class);

    private final boolean lenient;

    public static AvroVarCharWriter forField(VarCharVector varCharVector, boolean lenient) {
        return new AvroVarCharWriter(varCharVector, lenient);
    }

    public static AvroVarCharWriter forField(
            LargeVarCharVector largeVarCharVector, boolean lenient) {
        return new AvroVarCharWriter(largeVarCharVector, lenient);
    }

    private AvroVarCharWriter(VarCharVector varCharVector, boolean lenient) {
        super(varCharVector);
        this.lenient = lenient;
    }

    private AvroVarCharWriter(LargeVarCharVector largeVarCharVector, boolean lenient) {
        super(largeVarCharVector);
        this.lenient = lenient;
    }

    @Override
    protected void doWrite(@Nullable AvroValue value) {
        String resolved = value == null ? null : resolve(value, lenient);
        if (getValueVector() instanceof VarCharVector) {
            VarCharVector vector = (VarCharVector) getValueVector();
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved.getBytes(StandardCharsets.UTF_8));
            }
        } else {
            LargeVarCharVector vector = (LargeVarCharVector) getValueVector();
            if (resolved == null) {
                vector.setNull(getCount());
            } else {
                vector.setSafe(getCount(), resolved.getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    /** Resolves a string, turning conversion failures into null if lenient. */
    @Nullable
    static String resolve(AvroValue value, boolean lenient) {
        if (!lenient) {
            return ValueResolvers.resolveString(value);
        }
        try {
            return ValueResolvers.resolveString(value);
        } catch (StringConversionException e) {
            LOG.debug("Writing list element as null: {}", e.getMessage());
            return null;
        }
    }
}
