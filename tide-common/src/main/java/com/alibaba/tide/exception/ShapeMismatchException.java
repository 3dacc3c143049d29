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

package com.alibaba.tide.exception;

import com.alibaba.tide.annotation.PublicEvolving;

/**
 * Thrown when a source value has a different shape than the one declared at a path, for example
 * a string found where a nested record was expected.
 *
 * @since 0.1
 */
@PublicEvolving
public class ShapeMismatchException extends DecodeException {

    private static final long serialVersionUID = 1L;

    private final String expectedKind;
    private final String actualKind;
    private final String path;

    public ShapeMismatchException(String expectedKind, String actualKind, String path) {
        super(
                String.format(
                        "Expected a value of kind %s at '%s', but got %s.",
                        expectedKind, path, actualKind));
        this.expectedKind = expectedKind;
        this.actualKind = actualKind;
        this.path = path;
    }

    public String getExpectedKind() {
        return expectedKind;
    }

    public String getActualKind() {
        return actualKind;
    }

    public String getPath() {
        return path;
    }
}
