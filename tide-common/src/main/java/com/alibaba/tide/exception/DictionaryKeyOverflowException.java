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
 * Thrown when a dictionary-encoded column sees more distinct values than its key type can
 * address.
 *
 * @since 0.1
 */
@PublicEvolving
public class DictionaryKeyOverflowException extends DecodeException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final long capacity;

    public DictionaryKeyOverflowException(String path, long capacity) {
        super(
                String.format(
                        "Dictionary of column '%s' exceeds the %d distinct values "
                                + "addressable by its key type.",
                        path, capacity));
        this.path = path;
        this.capacity = capacity;
    }

    public String getPath() {
        return path;
    }

    public long getCapacity() {
        return capacity;
    }
}
