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
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One validation failure, independent of the engine that found it
 */
@Value
public class ValidationErrorRecord {
    /**
     * Machine readable error kind, for example {@code missing} or {@code int_parsing}
     */
    String kind;

    /**
     * Path to the failing value: field names ({@link String}) and list indices ({@link Integer})
     */
    List<Object> location;

    String message;

    /**
     * The offending input, null when there is none
     */
    JsonNode input;

    /**
     * Bound or expectation the input violated, ordered
     */
    Map<String, Object> context;

    /**
     * Anything else the engine reported. Passed through untouched.
     */
    Map<String, Object> extras;

    @Builder
    public ValidationErrorRecord(
            @NonNull String kind,
            List<Object> location,
            @NonNull String message,
            JsonNode input,
            Map<String, Object> context,
            Map<String, Object> extras) {
        this.kind = kind;
        this.location = null == location
                        ? List.of()
                        : Collections.unmodifiableList(new ArrayList<>(location));
        this.message = message;
        this.input = input;
        this.context = ordered(context);
        this.extras = ordered(extras);
    }

    private static Map<String, Object> ordered(Map<String, Object> values) {
        return null == values || values.isEmpty()
               ? Map.of()
               : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
