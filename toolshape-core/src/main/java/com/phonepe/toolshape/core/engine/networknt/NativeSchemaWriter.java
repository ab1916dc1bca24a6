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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.model.FieldSpec;
import com.phonepe.toolshape.core.model.ModelDefinition;
import com.phonepe.toolshape.core.schema.NodeKind;
import com.phonepe.toolshape.core.schema.SchemaKeywords;
import com.phonepe.toolshape.core.schema.SchemaNode;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * Renders a model definition as a draft 2020-12 document the way validation engines usually publish models:
 * titled properties, nested objects moved to {@code $defs} and pulled in through {@code $ref}.
 */
class NativeSchemaWriter {
    static final String DRAFT_2020_12 = "https://json-schema.org/draft/2020-12/schema";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectNode defs = NODES.objectNode();
    private final Set<String> usedNames = new HashSet<>();

    static ObjectNode write(final ModelDefinition definition) {
        return new NativeSchemaWriter().document(definition);
    }

    private ObjectNode document(ModelDefinition definition) {
        usedNames.add(definition.getName());
        final var document = NODES.objectNode();
        document.put(SchemaKeywords.SCHEMA, DRAFT_2020_12);
        document.put(SchemaKeywords.TITLE, definition.getName());
        if (!Strings.isNullOrEmpty(definition.getDescription())) {
            document.put(SchemaKeywords.DESCRIPTION, definition.getDescription());
        }
        document.put(SchemaKeywords.TYPE, SchemaKeywords.OBJECT_TYPE);
        final var properties = document.putObject(SchemaKeywords.PROPERTIES);
        final var required = document.putArray(SchemaKeywords.REQUIRED);
        for (final var field : definition.getFields()) {
            properties.set(field.getName(), property(definition.getName(), field));
            if (field.isRequired()) {
                required.add(field.getName());
            }
        }
        if (required.isEmpty()) {
            document.remove(SchemaKeywords.REQUIRED);
        }
        if (!defs.isEmpty()) {
            document.set(SchemaKeywords.DEFS, defs);
        }
        return document;
    }

    private ObjectNode property(String ownerName, FieldSpec field) {
        final var schema = node(field.getType(), ownerName + StringUtils.capitalize(field.getName()));
        schema.put(SchemaKeywords.TITLE, titleOf(field.getName()));
        if (!Strings.isNullOrEmpty(field.getDescription())) {
            schema.put(SchemaKeywords.DESCRIPTION, field.getDescription());
        }
        if (null != field.getDefaultValue() && !field.getDefaultValue().isNull()) {
            schema.set(SchemaKeywords.DEFAULT, field.getDefaultValue().deepCopy());
        }
        return schema;
    }

    private ObjectNode node(SchemaNode node, String suggestedName) {
        final var out = switch (node.getKind()) {
            case OBJECT -> hoist(node, suggestedName);
            case ARRAY -> {
                final var array = typed(SchemaKeywords.ARRAY_TYPE, node);
                array.set(SchemaKeywords.ITEMS, node(null == node.getItems() ? SchemaNode.any() : node.getItems(),
                                                     suggestedName + "Item"));
                yield array;
            }
            case PRIMITIVE, ENUM -> typed(null == node.getPrimitiveType() ? null : node.getPrimitiveType().getKeyword(),
                                          node);
            case UNION -> {
                final var union = NODES.objectNode();
                final var variants = union.putArray(SchemaKeywords.ANY_OF);
                node.getVariants().forEach(variant -> variants.add(node(variant, suggestedName)));
                yield union;
            }
            case REFERENCE -> throw new SchemaBuildException(SchemaErrorType.UNRESOLVED_REFERENCE,
                                                             node.getReference());
        };
        if (node.getKind() != NodeKind.OBJECT) {
            if (!Strings.isNullOrEmpty(node.getDescription())) {
                out.put(SchemaKeywords.DESCRIPTION, node.getDescription());
            }
            if (node.hasDefault()) {
                out.set(SchemaKeywords.DEFAULT, node.getDefaultValue().deepCopy());
            }
        }
        return out;
    }

    /**
     * Moves an object into the definitions and returns a reference to it. Description and default stay next to the
     * reference.
     */
    private ObjectNode hoist(SchemaNode node, String suggestedName) {
        final var name = uniqueName(Strings.isNullOrEmpty(node.getName()) ? suggestedName : node.getName());
        final var definition = NODES.objectNode();
        definition.put(SchemaKeywords.TITLE, name);
        definition.put(SchemaKeywords.TYPE, SchemaKeywords.OBJECT_TYPE);
        defs.set(name, definition);
        final var properties = definition.putObject(SchemaKeywords.PROPERTIES);
        final var required = NODES.arrayNode();
        for (final var field : node.getFields()) {
            final var child = field.getNode();
            final var schema = node(child, name + StringUtils.capitalize(field.getName()));
            schema.put(SchemaKeywords.TITLE, titleOf(field.getName()));
            properties.set(field.getName(), schema);
            if (field.isRequired()) {
                required.add(field.getName());
            }
        }
        if (!required.isEmpty()) {
            definition.set(SchemaKeywords.REQUIRED, required);
        }
        final var reference = NODES.objectNode();
        reference.put(SchemaKeywords.REF, "#/" + SchemaKeywords.DEFS + "/" + name);
        if (!Strings.isNullOrEmpty(node.getDescription())) {
            reference.put(SchemaKeywords.DESCRIPTION, node.getDescription());
        }
        if (node.hasDefault()) {
            reference.set(SchemaKeywords.DEFAULT, node.getDefaultValue().deepCopy());
        }
        return reference;
    }

    private static ObjectNode typed(String type, SchemaNode node) {
        final var out = NODES.objectNode();
        if (null != type) {
            out.put(SchemaKeywords.TYPE, type);
        }
        node.getConstraints().forEach((keyword, value) -> out.set(keyword, value.deepCopy()));
        return out;
    }

    private String uniqueName(String base) {
        var name = base;
        var counter = 1;
        while (!usedNames.add(name)) {
            name = base + "_" + counter++;
        }
        return name;
    }

    private static String titleOf(String fieldName) {
        return StringUtils.capitalize(fieldName.replace('_', ' '));
    }
}
