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

package com.phonepe.toolshape.core.schema;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Json schema keywords understood by the dialect
 */
@UtilityClass
public class SchemaKeywords {
    public static final String TYPE = "type";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String DEFAULT = "default";
    public static final String PROPERTIES = "properties";
    public static final String REQUIRED = "required";
    public static final String ITEMS = "items";
    public static final String ANY_OF = "anyOf";
    public static final String ONE_OF = "oneOf";
    public static final String ALL_OF = "allOf";
    public static final String ENUM = "enum";
    public static final String CONST = "const";
    public static final String REF = "$ref";
    public static final String DEFS = "$defs";
    public static final String DEFINITIONS = "definitions";
    public static final String SCHEMA = "$schema";
    public static final String ADDITIONAL_PROPERTIES = "additionalProperties";

    public static final String OBJECT_TYPE = "object";
    public static final String ARRAY_TYPE = "array";

    /**
     * Constraint keywords copied through unchanged. Emission follows this order.
     */
    public static final List<String> CONSTRAINTS = List.of(
            "format",
            ENUM,
            CONST,
            "pattern",
            "minLength",
            "maxLength",
            "minimum",
            "exclusiveMinimum",
            "maximum",
            "exclusiveMaximum",
            "multipleOf",
            "minItems",
            "maxItems",
            "uniqueItems");
}
