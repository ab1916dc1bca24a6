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

package com.phonepe.toolshape.toolbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.phonepe.toolshape.core.schema.CanonicalSchema;
import com.phonepe.toolshape.core.schema.SchemaKeywords;

/**
 * Tool definition layouts expected by the different LLM providers. The parameters are always the canonical schema
 * without its title and description, which become the tool name and description.
 */
public enum ToolSchemaFormat {
    /**
     * {@code {name, description, parameters}}
     */
    GENERIC {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            return definition(name, description, "parameters", parameters(schema));
        }
    },
    /**
     * {@code {type: function, function: {name, description, parameters}}}
     */
    OPENAI {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            return function(definition(name, description, "parameters", parameters(schema)));
        }
    },
    /**
     * OpenAI function in strict mode: every property required, no additional properties anywhere
     */
    OPENAI_STRICT {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            final var function = NODES.objectNode();
            function.put("name", name);
            function.put("description", Strings.nullToEmpty(description));
            function.put("strict", true);
            function.set("parameters", strict(parameters(schema)));
            return function(function);
        }
    },
    /**
     * Structured output definition for the OpenAI response format
     */
    OPENAI_RESPONSE_FORMAT {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            final var jsonSchema = NODES.objectNode();
            jsonSchema.put("name", name);
            jsonSchema.put("description", Strings.nullToEmpty(description));
            jsonSchema.put("strict", true);
            jsonSchema.set("schema", strict(parameters(schema)));
            final var format = NODES.objectNode();
            format.put(SchemaKeywords.TYPE, "json_schema");
            format.set("json_schema", jsonSchema);
            return format;
        }
    },
    /**
     * {@code {name, description, input_schema}}
     */
    ANTHROPIC {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            return definition(name, description, "input_schema", parameters(schema));
        }
    },
    /**
     * Generic layout without any defaults, which Gemini rejects
     */
    GOOGLE {
        @Override
        public ObjectNode render(String name, String description, CanonicalSchema schema) {
            final var parameters = parameters(schema);
            removeDefaults(parameters);
            return definition(name, description, "parameters", parameters);
        }
    },
    ;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public abstract ObjectNode render(final String name, final String description, final CanonicalSchema schema);

    private static ObjectNode parameters(CanonicalSchema schema) {
        final var parameters = schema.asJsonNode();
        parameters.remove(SchemaKeywords.TITLE);
        parameters.remove(SchemaKeywords.DESCRIPTION);
        return parameters;
    }

    private static ObjectNode definition(String name, String description, String schemaField, ObjectNode schema) {
        final var definition = NODES.objectNode();
        definition.put("name", name);
        definition.put("description", Strings.nullToEmpty(description));
        definition.set(schemaField, schema);
        return definition;
    }

    private static ObjectNode function(ObjectNode definition) {
        final var function = NODES.objectNode();
        function.put(SchemaKeywords.TYPE, "function");
        function.set("function", definition);
        return function;
    }

    /**
     * Rewrites a schema for strict mode. Objects list all their properties as required and forbid anything else.
     */
    private static ObjectNode strict(JsonNode schema) {
        final var out = NODES.objectNode();
        final var isObject = SchemaKeywords.OBJECT_TYPE.equals(schema.path(SchemaKeywords.TYPE).asText());
        schema.fields().forEachRemaining(entry -> {
            final var key = entry.getKey();
            final var value = entry.getValue();
            switch (key) {
                case SchemaKeywords.REQUIRED, SchemaKeywords.ADDITIONAL_PROPERTIES -> {
                    //Rewritten with the properties
                }
                case SchemaKeywords.PROPERTIES -> {
                    final var properties = out.putObject(SchemaKeywords.PROPERTIES);
                    final var required = NODES.arrayNode();
                    value.fields().forEachRemaining(property -> {
                        properties.set(property.getKey(), strict(property.getValue()));
                        required.add(property.getKey());
                    });
                    out.set(SchemaKeywords.REQUIRED, required);
                }
                case SchemaKeywords.ITEMS -> out.set(key, strict(value));
                case SchemaKeywords.ANY_OF -> {
                    final var variants = out.putArray(key);
                    value.forEach(variant -> variants.add(strict(variant)));
                }
                default -> out.set(key, value.deepCopy());
            }
        });
        if (isObject) {
            if (!out.has(SchemaKeywords.PROPERTIES)) {
                out.putObject(SchemaKeywords.PROPERTIES);
                out.putArray(SchemaKeywords.REQUIRED);
            }
            out.put(SchemaKeywords.ADDITIONAL_PROPERTIES, false);
        }
        return out;
    }

    private static void removeDefaults(JsonNode schema) {
        if (!(schema instanceof ObjectNode object)) {
            return;
        }
        object.remove(SchemaKeywords.DEFAULT);
        object.path(SchemaKeywords.PROPERTIES).forEach(ToolSchemaFormat::removeDefaults);
        removeDefaults(object.get(SchemaKeywords.ITEMS));
        object.path(SchemaKeywords.ANY_OF).forEach(ToolSchemaFormat::removeDefaults);
    }
}
