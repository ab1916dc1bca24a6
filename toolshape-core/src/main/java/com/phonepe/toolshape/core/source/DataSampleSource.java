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

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A representative data sample. Values are either sample values or type tokens such as {@code String.class}.
 * Field order follows the iteration order of the sample.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DataSampleSource extends TypeSource {
    String name;
    Map<String, Object> sample;

    /**
     * Model description, may be null
     */
    @With
    String description;

    @With
    SampleOptions options;

    private DataSampleSource(
            @NonNull String name,
            @NonNull Map<String, Object> sample,
            String description,
            @NonNull SampleOptions options) {
        super(SourceType.DATA_SAMPLE);
        this.name = name;
        this.sample = Collections.unmodifiableMap(new LinkedHashMap<>(sample));
        this.description = description;
        this.options = options;
    }

    public static DataSampleSource of(final String name, final Map<String, ?> sample) {
        return new DataSampleSource(name, new LinkedHashMap<>(sample), null, SampleOptions.defaults());
    }

    /**
     * Json values of the node are used as sample values
     */
    public static DataSampleSource of(final String name, final ObjectNode sample) {
        final var values = new LinkedHashMap<String, Object>();
        sample.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue().deepCopy()));
        return new DataSampleSource(name, values, null, SampleOptions.defaults());
    }

    @Override
    public <T> T accept(TypeSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
