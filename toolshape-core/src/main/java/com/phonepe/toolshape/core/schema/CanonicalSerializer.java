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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;

/**
 * Writes an inlined tree as the canonical document. Key order inside every node is fixed: type, description,
 * constraints, properties, required, items, anyOf, default and finally title, which only the root carries.
 */
public class CanonicalSerializer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public CanonicalSchema serialize(final SchemaNode root) {
        final var document = write(root, true);
        if (!Strings.isNullOrEmpty(root.getName())) {
            document.put(SchemaKeywords.TITLE, root.getName());
        }
        return new CanonicalSchema(document);
    }

    private ObjectNode write(SchemaNode node, boolean root) {
        if (node.getKind() == NodeKind.REFERENCE) {
            throw new SchemaBuildException(SchemaErrorType.UNRESOLVED_REFERENCE, node.getReference());
        }
        final var out = NODES.objectNode();
        writeType(node, out);
        if (!Strings.isNullOrEmpty(node.getDescription())) {
            out.put(SchemaKeywords.DESCRIPTION, node.getDescription());
        }
        for (final var keyword : SchemaKeywords.CONSTRAINTS) {
            final var value = node.getConstraints().get(keyword);
            if (value != null) {
                out.set(keyword, value.deepCopy());
            }
        }
        switch (node.getKind()) {
            case OBJECT -> writeObject(node, root, out);
            case ARRAY -> out.set(SchemaKeywords.ITEMS,
                                  write(null == node.getItems() ? SchemaNode.any() : node.getItems(), false));
            case UNION -> {
                final var variants = out.putArray(SchemaKeywords.ANY_OF);
                node.getVariants().forEach(variant -> variants.add(write(variant, false)));
            }
            default -> {
                //Nothing else to write for primitives and enums
            }
        }
        if (node.hasDefault()) {
            out.set(SchemaKeywords.DEFAULT, node.getDefaultValue().deepCopy());
        }
        return out;
    }

    private static void writeType(SchemaNode node, ObjectNode out) {
        switch (node.getKind()) {
            case OBJECT -> out.put(SchemaKeywords.TYPE, SchemaKeywords.OBJECT_TYPE);
            case ARRAY -> out.put(SchemaKeywords.TYPE, SchemaKeywords.ARRAY_TYPE);
            case PRIMITIVE, ENUM -> {
                if (null != node.getPrimitiveType() && null != node.getPrimitiveType().getKeyword()) {
                    out.put(SchemaKeywords.TYPE, node.getPrimitiveType().getKeyword());
                }
            }
            default -> {
                //Unions are typed by their variants
            }
        }
    }

    private void writeObject(SchemaNode node, boolean root, ObjectNode out) {
        if (root || !node.getFields().isEmpty()) {
            final var properties = out.putObject(SchemaKeywords.PROPERTIES);
            node.getFields().forEach(field -> properties.set(field.getName(), write(field.getNode(), false)));
        }
        final var required = node.getFields()
                .stream()
                .filter(SchemaField::isRequired)
                .map(SchemaField::getName)
                .toList();
        if (!required.isEmpty()) {
            final var array = out.putArray(SchemaKeywords.REQUIRED);
            required.forEach(array::add);
        }
    }
}
