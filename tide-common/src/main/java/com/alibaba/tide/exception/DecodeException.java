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
 * Base class for failures of a decode pass that turns buffered records into a columnar batch. A
 * decode pass is all-or-nothing: when one of these is thrown no batch has been produced and the
 * caller decides whether to drop, quarantine or fail on the offending records.
 *
 * @since 0.1
 */
@PublicEvolving
public class DecodeException extends TideRuntimeException {

    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
