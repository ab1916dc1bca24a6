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

package com.phonepe.toolshape.core.engine.networknt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.phonepe.toolshape.core.model.ModelDefinition;
import com.phonepe.toolshape.core.model.ValidatingModel;
import com.phonepe.toolshape.core.model.ValidationResult;
import com.phonepe.toolshape.core.schema.NodeKind;
import com.phonepe.toolshape.core.schema.SchemaField;
import com.phonepe.toolshape.core.schema.SchemaNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * A model backed by a compiled networknt schema. Valid inputs come back as copies with absent defaults filled in.
 */
@Slf4j
class NetworkntValidatingModel implements ValidatingModel {
    private final ModelDefinition definition;
    private final ObjectNode document;
    private final JsonSchema schema;
    private final SchemaNode shape;
    private final ValidationMessageMapper messageMapper;

    NetworkntValidatingModel(ModelDefinition definition, ObjectNode document, JsonSchema schema) {
        this.definition = definition;
        this.document = document;
        this.schema = schema;
        this.shape = shapeOf(definition);
        this.messageMapper = new ValidationMessageMapper(shape);
    }

    @Override
    public String name() {
        return definition.getName();
    }

    @Override
    public ValidationResult validate(JsonNode input) {
        final var actual = Objects.requireNonNullElse(input, NullNode.getInstance());
        final var messages = schema.validate(actual);
        if (messages.isEmpty()) {
            final var value = actual.deepCopy();
            fill(value, shape);
            return ValidationResult.success(name(), value);
        }
        log.debug("Input for {} failed validation with {} messages", name(), messages.size());
        return ValidationResult.failure(name(), messageMapper.map(messages, actual));
    }

    @Override
    public JsonNode jsonSchema() {
        return document.deepCopy();
    }

    private static void fill(JsonNode value, SchemaNode node) {
        if (node.getKind() == NodeKind.OBJECT && value instanceof ObjectNode object) {
            for (final var field : node.getFields()) {
                final var present = object.get(field.getName());
                if (null == present) {
                    if (field.getNode().hasDefault()) {
                        object.set(field.getName(), field.getNode().getDefaultValue().deepCopy());
                    }
                }
                else {
                    fill(present, field.getNode());
                }
            }
        }
        else if (node.getKind() == NodeKind.ARRAY && value.isArray() && null != node.getItems()) {
            value.forEach(element -> fill(element, node.getItems()));
        }
    }

    /**
     * The model as a tree again, descriptions and defaults back on the field types
     */
    private static SchemaNode shapeOf(ModelDefinition definition) {
        return SchemaNode.object(definition.getName(),
                                 definition.getDescription(),
                                 definition.getFields()
                                         .stream()
                                         .map(field -> new SchemaField(field.getName(),
                                                                       field.getType()
                                                                               .withDescription(field.getDescription())
                                                                               .withDefaultValue(field.getDefaultValue()),
                                                                       field.isRequired()))
                                         .toList());
    }
}
