/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.toolshape.core.errors;

import lombok.Getter;

/**
 * Raised when a source description cannot be represented in the schema dialect. Fatal for the request, never
 * retried.
 */
@Getter
public class SchemaBuildException extends RuntimeException {
    private final SchemaErrorType errorType;

    public SchemaBuildException(SchemaErrorType errorType, Object... args) {
        super(errorType.getMessage().formatted(args));
        this.errorType = errorType;
    }

    public SchemaBuildException(SchemaErrorType errorType, Throwable cause, Object... args) {
        super(errorType.getMessage().formatted(args), cause);
        this.errorType = errorType;
    }
}
