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

package com.phonepe.toolshape.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.toolshape.core.errors.ValidationFailureException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of validating an input against a model. Holds the validated value, defaults filled in, or the ordered
 * errors.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {
    String modelName;
    JsonNode value;
    List<ValidationErrorRecord> errors;

    public static ValidationResult success(String modelName, JsonNode value) {
        return new ValidationResult(modelName, value, List.of());
    }

    public static ValidationResult failure(String modelName, List<ValidationErrorRecord> errors) {
        return new ValidationResult(modelName, null, List.copyOf(errors));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public JsonNode orElseThrow() {
        if (!isSuccess()) {
            throw new ValidationFailureException(modelName, errors);
        }
        return value;
    }
}
