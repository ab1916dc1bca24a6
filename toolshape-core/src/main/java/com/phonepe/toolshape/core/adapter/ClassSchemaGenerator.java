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

package com.phonepe.toolshape.core.adapter;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;

/**
 * Generates json schema documents for java types. Types used more than once, and self references, come out as
 * definitions and references and are removed later by the inliner.
 */
@Slf4j
public class ClassSchemaGenerator {
    private final SchemaGenerator generator;

    public ClassSchemaGenerator() {
        final var config = new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .without(Option.EXTRA_OPEN_API_FORMAT_VALUES)
                .without(Option.FLATTENED_ENUMS_FROM_TOSTRING)
                .without(Option.SCHEMA_VERSION_INDICATOR)
                .without(Option.FLATTENED_OPTIONALS)
                .with(new ShapeJacksonModule())
                .build();
        this.generator = new SchemaGenerator(config);
    }

    public ObjectNode generate(final Type type) {
        final var schema = generator.generateSchema(type);
        log.debug("Generated schema for {}: {}", type.getTypeName(), schema);
        return schema;
    }
}
