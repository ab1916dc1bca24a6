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

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * An annotated java class or record. Field names, descriptions and defaults come from jackson annotations.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ClassDefSource extends TypeSource {
    Class<?> type;

    /**
     * Overrides the class simple name as model name, may be null
     */
    String modelName;

    private ClassDefSource(@NonNull Class<?> type, String modelName) {
        super(SourceType.CLASS_DEF);
        this.type = type;
        this.modelName = modelName;
    }

    public static ClassDefSource of(final Class<?> type) {
        return new ClassDefSource(type, null);
    }

    public static ClassDefSource of(final Class<?> type, final String modelName) {
        return new ClassDefSource(type, modelName);
    }

    @Override
    public <T> T accept(TypeSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
