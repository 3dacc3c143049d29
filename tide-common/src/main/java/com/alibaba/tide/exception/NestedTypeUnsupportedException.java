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
 * Thrown when a list column declares an element type that cannot be built inside a list.
 *
 * @since 0.1
 */
@PublicEvolving
public class NestedTypeUnsupportedException extends DecodeException {

    private static final long serialVersionUID = 1L;

    private final String typeDescription;
    private final String path;

    public NestedTypeUnsupportedException(String typeDescription, String path) {
        super(
                String.format(
                        "Nested list of %s is not supported at '%s'.", typeDescription, path));
        this.typeDescription = typeDescription;
        this.path = path;
    }

    public String getTypeDescription() {
        return typeDescription;
    }

    public String getPath() {
        return path;
    }
}
