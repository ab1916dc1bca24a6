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
import com.phonepe.toolshape.core.schema.CanonicalSchema;
import com.phonepe.toolshape.core.schema.SchemaNormalizer;

/**
 * A live model that checks inputs against a shape
 */
public interface ValidatingModel {
    String name();

    ValidationResult validate(final JsonNode input);

    /**
     * The schema document in the engine's own form
     */
    JsonNode jsonSchema();

    default CanonicalSchema schema() {
        return SchemaNormalizer.normalize(jsonSchema());
    }
}
