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
 * Base class of all Tide-specific unchecked exceptions.
 *
 * @since 0.1
 */
@PublicEvolving
public class TideRuntimeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TideRuntimeException(String message) {
        super(message);
    }

    public TideRuntimeException(Throwable cause) {
        super(cause);
    }

    public TideRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
