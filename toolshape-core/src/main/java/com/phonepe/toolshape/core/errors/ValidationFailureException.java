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

import com.phonepe.toolshape.core.model.ValidationErrorRecord;
import lombok.Getter;

import java.util.List;

/**
 * Input did not satisfy a model. Expected and recoverable: callers turn it into a feedback envelope.
 */
@Getter
public class ValidationFailureException extends RuntimeException {
    private final String modelName;
    private final transient List<ValidationErrorRecord> errors;

    public ValidationFailureException(String modelName, List<ValidationErrorRecord> errors) {
        super("%d validation error(s) for %s".formatted(errors.size(), modelName));
        this.modelName = modelName;
        this.errors = List.copyOf(errors);
    }
}
