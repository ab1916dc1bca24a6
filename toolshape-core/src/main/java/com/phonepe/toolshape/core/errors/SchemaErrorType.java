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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Reasons a type description cannot be turned into a schema tree
 */
@Getter
@AllArgsConstructor
public enum SchemaErrorType {
    UNSUPPORTED_CONSTRUCT("Unsupported construct at %s: %s"),
    UNRESOLVED_REFERENCE("Reference %s could not be resolved"),
    CYCLIC_REFERENCE("Reference %s forms a cycle and cannot be inlined"),
    MISSING_ANNOTATION("Parameter %s of %s has no usable name or type: %s"),
    AMBIGUOUS_SAMPLE("Sample field %s is an empty sequence and no item type can be inferred"),
    EMPTY_SCHEMA("Schema document has no shape to build from: %s"),
    INVALID_DOCUMENT("Schema document could not be read: %s"),
    DUPLICATE_TOOL("Tool %s is already registered"),
    ;

    private final String message;
}
