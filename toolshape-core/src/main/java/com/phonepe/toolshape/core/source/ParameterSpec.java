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

package com.phonepe.toolshape.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.lang.reflect.Type;

/**
 * One parameter of a callable
 */
@Value
@Builder
@With
public class ParameterSpec {
    @NonNull
    String name;

    /**
     * Declared java type. May be a parameterized type like {@code List<String>}.
     */
    @NonNull
    Type type;

    String description;

    JsonNode defaultValue;

    /**
     * Parameter may be left out even without a default. A parameter with a default, null included, is never
     * required.
     */
    boolean optional;

    public static ParameterSpec of(final String name, final Type type) {
        return builder().name(name).type(type).build();
    }

    public boolean isRequired() {
        return !optional && null == defaultValue;
    }
}
