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
import com.alibaba.tide.exception.UnsupportedTypeException;
import com.alibaba.tide.utils.ArrowUtils;

import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.FixedSizeBinaryVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.LargeVarBinaryVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeMicroVector;
import org.apache.arrow.vector.TimeMilliVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.TimeSecVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

/** Creates the {@link AvroFieldWriter} of a scalar Arrow vector. */
@Internal
public final class AvroFieldWriters {

    private AvroFieldWriters() {
        // no instantiation
    }

    /**
     * Creates a writer for the given vector.
     *
     * @param vector the vector to write into
     * @param path the dotted path of the column, for error reporting
     * @param lenientStrings whether string values that cannot be converted are written as null
     *     instead of failing
     * @throws UnsupportedTypeException if the vector is not of a scalar type that can be written
     */
    public static AvroFieldWriter createFieldWriter(
            ValueVector vector, String path, boolean lenientStrings) {
        if (ArrowUtils.isDictionaryEncoded(vector.getField())) {
            if (vector instanceof BaseIntVector) {
                return AvroDictionaryWriter.forField(
                        (BaseIntVector) vector, path, lenientStrings);
            }
        } else if (vector instanceof BitVector) {
            return AvroBooleanWriter.forField((BitVector) vector);
        } else if (vector instanceof TinyIntVector
                || vector instanceof SmallIntVector
                || vector instanceof IntVector
                || vector instanceof BigIntVector
                || vector instanceof UInt1Vector
                || vector instanceof UInt2Vector
                || vector instanceof UInt4Vector
                || vector instanceof UInt8Vector) {
            return AvroIntegerWriter.forField((BaseIntVector) vector);
        } else if (vector instanceof Float4Vector) {
            return AvroFloatWriter.forField((Float4Vector) vector);
        } else if (vector instanceof Float8Vector) {
            return AvroDoubleWriter.forField((Float8Vector) vector);
        } else if (vector instanceof TimeStampVector) {
            return AvroTimestampWriter.forField((TimeStampVector) vector);
        } else if (vector instanceof DateDayVector) {
            return AvroDateWriter.forField((DateDayVector) vector);
        } else if (vector instanceof DateMilliVector) {
            return AvroDateWriter.forField((DateMilliVector) vector);
        } else if (vector instanceof TimeSecVector
                || vector instanceof TimeMilliVector
                || vector instanceof TimeMicroVector
                || vector instanceof TimeNanoVector) {
            return AvroTimeWriter.forField(vector);
        } else if (vector instanceof VarCharVector) {
            return AvroVarCharWriter.forField((VarCharVector) vector, lenientStrings);
        } else if (vector instanceof LargeVarCharVector) {
            return AvroVarCharWriter.forField((LargeVarCharVector) vector, lenientStrings);
        } else if (vector instanceof VarBinaryVector) {
            return AvroVarBinaryWriter.forField((VarBinaryVector) vector);
        } else if (vector instanceof LargeVarBinaryVector) {
            return AvroVarBinaryWriter.forField((LargeVarBinaryVector) vector);
        } else if (vector instanceof FixedSizeBinaryVector) {
            return AvroFixedSizeBinaryWriter.forField((FixedSizeBinaryVector) vector);
        }
        throw new UnsupportedTypeException(
                ArrowUtils.describe(vector.getField()),
                String.format(
                        "Unsupported type %s of column '%s'.",
                        ArrowUtils.describe(vector.getField()),
                        path));
    }
}
