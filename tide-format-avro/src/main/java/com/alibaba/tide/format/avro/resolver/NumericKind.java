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

package com.alibaba.tide.format.avro.resolver;

import com.alibaba.tide.annotation.Internal;

import org.apache.arrow.vector.types.pojo.ArrowType;

/** The native numeric representations that source values can be converted into. */
@Internal
public enum NumericKind {
    INT8(Byte.MIN_VALUE, Byte.MAX_VALUE),
    INT16(Short.MIN_VALUE, Short.MAX_VALUE),
    INT32(Integer.MIN_VALUE, Integer.MAX_VALUE),
    INT64(Long.MIN_VALUE, Long.MAX_VALUE),
    UINT8(0, 0xFFL),
    UINT16(0, 0xFFFFL),
    UINT32(0, 0xFFFF_FFFFL),
    // values above Long.MAX_VALUE are carried in the sign bit
    UINT64(0, Long.MAX_VALUE),
    FLOAT32(0, 0),
    FLOAT64(0, 0);

    private final long minValue;
    private final long maxValue;

    NumericKind(long minValue, long maxValue) {
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    /** Smallest integral value of the kind. Only defined for integral kinds. */
    long minValue() {
        return minValue;
    }

    /** Largest integral value of the kind that fits a signed long. */
    long maxValue() {
        return maxValue;
    }

    /** Returns the kind that stores values of the given Arrow integer type. */
    public static NumericKind of(ArrowType.Int type) {
        switch (type.getBitWidth()) {
            case 8:
                return type.getIsSigned() ? INT8 : UINT8;
            case 16:
                return type.getIsSigned() ? INT16 : UINT16;
            case 32:
                return type.getIsSigned() ? INT32 : UINT32;
            case 64:
                return type.getIsSigned() ? INT64 : UINT64;
            default:
                throw new IllegalArgumentException("Unsupported integer bit width: " + type);
        }
    }
}
