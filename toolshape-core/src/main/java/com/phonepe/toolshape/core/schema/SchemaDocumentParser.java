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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a json schema document, bare or wrapped in one of the common tool envelopes, into a schema tree.
 * References are kept as reference nodes and the root carries the parsed definitions.
 */
@Slf4j
public class SchemaDocumentParser {
    private static final String ROOT_PATH = "#";
    private static final Set<String> NON_SHAPE_KEYWORDS = Set.of(SchemaKeywords.TITLE,
                                                                  SchemaKeywords.DESCRIPTION,
                                                                  SchemaKeywords.SCHEMA,
                                                                  SchemaKeywords.DEFS,
                                                                  SchemaKeywords.DEFINITIONS,
                                                                  "$id",
                                                                  "$comment");
    private static final Set<String> ANNOTATION_KEYWORDS = Set.of(SchemaKeywords.TITLE,
                                                                   SchemaKeywords.DESCRIPTION,
                                                                   SchemaKeywords.DEFAULT,
                                                                   "examples",
                                                                   "$comment");
    private static final Map<String, List<String>> TYPE_KEYWORDS = Map.of(
            "string", List.of("format", "pattern", "minLength", "maxLength"),
            "number", List.of("minimum", "exclusiveMinimum", "maximum", "exclusiveMaximum", "multipleOf"),
            SchemaKeywords.ARRAY_TYPE, List.of(SchemaKeywords.ITEMS, "minItems", "maxItems", "uniqueItems"),
            SchemaKeywords.OBJECT_TYPE, List.of(SchemaKeywords.PROPERTIES,
                                                SchemaKeywords.REQUIRED,
                                                SchemaKeywords.ADDITIONAL_PROPERTIES));

    public SchemaNode parse(final JsonNode document) {
        if (null == document || !document.isObject()) {
            throw new SchemaBuildException(SchemaErrorType.INVALID_DOCUMENT,
                                           "expected a json object, got " + describe(document));
        }
        final var envelope = Envelope.unwrap((ObjectNode) document);
        final var schema = envelope.schema();
        if (!hasShape(schema)) {
            throw new SchemaBuildException(SchemaErrorType.EMPTY_SCHEMA, schema.toString());
        }
        final var definitions = new LinkedHashMap<String, SchemaNode>();
        readDefinitions(schema, SchemaKeywords.DEFS, definitions);
        readDefinitions(schema, SchemaKeywords.DEFINITIONS, definitions);
        var root = parseNode(schema, ROOT_PATH);
        final var name = Strings.isNullOrEmpty(envelope.name()) ? root.getName() : envelope.name();
        final var description = Strings.isNullOrEmpty(envelope.description())
                                ? root.getDescription()
                                : envelope.description();
        root = root.toBuilder()
                .name(name)
                .description(description)
                .definitions(definitions)
                .build();
        log.debug("Parsed schema document {} with {} definitions", name, definitions.size());
        return root;
    }

    private void readDefinitions(ObjectNode schema, String keyword, Map<String, SchemaNode> definitions) {
        final var defs = schema.get(keyword);
        if (null == defs || !defs.isObject()) {
            return;
        }
        defs.fields().forEachRemaining(entry -> {
            final var node = parseNode(entry.getValue(), "#/" + keyword + "/" + entry.getKey());
            definitions.put(entry.getKey(),
                            Strings.isNullOrEmpty(node.getName()) ? node.withName(entry.getKey()) : node);
        });
    }

    private SchemaNode parseNode(JsonNode raw, String path) {
        if (raw.isBoolean() && raw.asBoolean()) {
            return SchemaNode.any();
        }
        if (!raw.isObject()) {
            throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path, raw.toString());
        }
        final var node = (ObjectNode) raw;
        final var allOf = node.get(SchemaKeywords.ALL_OF);
        if (null != allOf) {
            return parseNode(mergeAllOf(node, allOf, path), path);
        }
        final var builder = SchemaNode.builder()
                .name(JsonUtils.text(node, SchemaKeywords.TITLE))
                .description(JsonUtils.text(node, SchemaKeywords.DESCRIPTION))
                .defaultValue(JsonUtils.unwrapPojo(node.get(SchemaKeywords.DEFAULT)));
        if (node.has(SchemaKeywords.REF)) {
            return builder.kind(NodeKind.REFERENCE)
                    .reference(node.get(SchemaKeywords.REF).asText())
                    .build();
        }
        final var alternatives = node.has(SchemaKeywords.ANY_OF)
                                 ? node.get(SchemaKeywords.ANY_OF)
                                 : node.get(SchemaKeywords.ONE_OF);
        if (null != alternatives) {
            if (!alternatives.isArray()) {
                throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path, alternatives.toString());
            }
            final var variants = new ArrayList<SchemaNode>();
            for (int i = 0; i < alternatives.size(); i++) {
                variants.add(parseNode(alternatives.get(i), path + "/anyOf/" + i));
            }
            return builder.kind(NodeKind.UNION).variants(variants).build();
        }
        final var type = node.get(SchemaKeywords.TYPE);
        if (null != type && type.isArray()) {
            if (type.size() == 1) {
                final var single = node.deepCopy();
                single.set(SchemaKeywords.TYPE, type.get(0));
                return parseNode(single, path);
            }
            return builder.kind(NodeKind.UNION).variants(splitTypes(node, type, path)).build();
        }
        builder.constraints(constraints(node));
        final var typeName = null == type ? null : type.asText();
        if (node.has(SchemaKeywords.ENUM)) {
            return builder.kind(NodeKind.ENUM)
                    .primitiveType(null == typeName
                                   ? inferEnumType(node.get(SchemaKeywords.ENUM))
                                   : primitiveType(typeName, path))
                    .build();
        }
        if (SchemaKeywords.OBJECT_TYPE.equals(typeName) || (null == typeName && node.has(SchemaKeywords.PROPERTIES))) {
            return builder.kind(NodeKind.OBJECT).fields(parseFields(node, path)).build();
        }
        if (SchemaKeywords.ARRAY_TYPE.equals(typeName)) {
            final var items = node.get(SchemaKeywords.ITEMS);
            if (null != items && items.isArray()) {
                throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path + "/items",
                                               "positional item lists are not supported");
            }
            return builder.kind(NodeKind.ARRAY)
                    .items(null == items ? SchemaNode.any() : parseNode(items, path + "/items"))
                    .build();
        }
        return builder.kind(NodeKind.PRIMITIVE)
                .primitiveType(null == typeName ? PrimitiveType.ANY : primitiveType(typeName, path))
                .build();
    }

    private List<SchemaField> parseFields(ObjectNode node, String path) {
        final var required = new HashSet<String>();
        node.path(SchemaKeywords.REQUIRED).forEach(name -> required.add(name.asText()));
        final var fields = new ArrayList<SchemaField>();
        final var properties = node.path(SchemaKeywords.PROPERTIES);
        properties.fields().forEachRemaining(
                entry -> fields.add(new SchemaField(entry.getKey(),
                                                    parseNode(entry.getValue(),
                                                              path + "/properties/" + entry.getKey()),
                                                    required.contains(entry.getKey()))));
        return fields;
    }

    private List<SchemaNode> splitTypes(ObjectNode node, JsonNode types, String path) {
        final var variants = new ArrayList<SchemaNode>();
        for (final var type : types) {
            final var variant = node.deepCopy();
            variant.set(SchemaKeywords.TYPE, type);
            variant.remove(List.of(SchemaKeywords.TITLE, SchemaKeywords.DESCRIPTION, SchemaKeywords.DEFAULT));
            restrictTo(variant, type.asText());
            variants.add(parseNode(variant, path));
        }
        return variants;
    }

    /**
     * Drops the keywords that belong to other types, along with enum and const values the type cannot hold
     */
    private static void restrictTo(ObjectNode variant, String type) {
        TYPE_KEYWORDS.forEach((owner, keywords) -> {
            if (!owner.equals(type) && !(isNumericType(owner) && isNumericType(type))) {
                variant.remove(keywords);
            }
        });
        final var values = variant.get(SchemaKeywords.ENUM);
        if (null != values && values.isArray()) {
            final var kept = variant.arrayNode();
            values.forEach(value -> {
                if (holds(type, value)) {
                    kept.add(value);
                }
            });
            if (kept.isEmpty()) {
                variant.remove(SchemaKeywords.ENUM);
            }
            else {
                variant.set(SchemaKeywords.ENUM, kept);
            }
        }
        final var constant = variant.get(SchemaKeywords.CONST);
        if (null != constant && !holds(type, constant)) {
            variant.remove(SchemaKeywords.CONST);
        }
    }

    private static boolean holds(String type, JsonNode value) {
        return switch (type) {
            case "string" -> value.isTextual();
            case "integer" -> value.isIntegralNumber();
            case "number" -> value.isNumber();
            case "boolean" -> value.isBoolean();
            case "null" -> value.isNull();
            case SchemaKeywords.OBJECT_TYPE -> value.isObject();
            case SchemaKeywords.ARRAY_TYPE -> value.isArray();
            default -> true;
        };
    }

    private static boolean isNumericType(String type) {
        return "integer".equals(type) || "number".equals(type);
    }

    /**
     * Merges an allOf into its parent. At most one entry may carry a shape, the others may only annotate it, which
     * is how generators attach a property description to a described type. Later annotations win over earlier ones
     * and siblings on the parent win over all of them.
     */
    private static ObjectNode mergeAllOf(ObjectNode node, JsonNode allOf, String path) {
        if (!allOf.isArray() || allOf.isEmpty()) {
            throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path + "/allOf",
                                           "expected a non empty list of schemas");
        }
        ObjectNode shape = null;
        final var annotations = new ArrayList<ObjectNode>();
        for (final var entry : allOf) {
            if (!entry.isObject()) {
                throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path + "/allOf",
                                               entry.toString());
            }
            if (isAnnotationOnly((ObjectNode) entry)) {
                annotations.add((ObjectNode) entry);
            }
            else if (null == shape) {
                shape = (ObjectNode) entry;
            }
            else {
                throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path + "/allOf",
                                               "only a single schema can be combined");
            }
        }
        final ObjectNode merged = null == shape ? node.objectNode() : shape.deepCopy();
        annotations.forEach(annotation -> merged.setAll(annotation.deepCopy()));
        node.fields().forEachRemaining(entry -> {
            if (!entry.getKey().equals(SchemaKeywords.ALL_OF)) {
                merged.set(entry.getKey(), entry.getValue().deepCopy());
            }
        });
        return merged;
    }

    private static boolean isAnnotationOnly(ObjectNode entry) {
        final var names = entry.fieldNames();
        while (names.hasNext()) {
            if (!ANNOTATION_KEYWORDS.contains(names.next())) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, JsonNode> constraints(ObjectNode node) {
        final var constraints = new LinkedHashMap<String, JsonNode>();
        SchemaKeywords.CONSTRAINTS.forEach(keyword -> {
            final var value = node.get(keyword);
            if (null != value) {
                constraints.put(keyword, value);
            }
        });
        return constraints;
    }

    private static PrimitiveType primitiveType(String typeName, String path) {
        return PrimitiveType.fromKeyword(typeName)
                .orElseThrow(() -> new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT, path,
                                                            "unknown type " + typeName));
    }

    private static PrimitiveType inferEnumType(JsonNode values) {
        if (null == values || !values.isArray() || values.isEmpty()) {
            return PrimitiveType.ANY;
        }
        PrimitiveType inferred = null;
        for (final var value : values) {
            final PrimitiveType current;
            if (value.isTextual()) {
                current = PrimitiveType.STRING;
            }
            else if (value.isBoolean()) {
                current = PrimitiveType.BOOLEAN;
            }
            else if (value.isIntegralNumber()) {
                current = PrimitiveType.INTEGER;
            }
            else if (value.isNumber()) {
                current = PrimitiveType.NUMBER;
            }
            else {
                return PrimitiveType.ANY;
            }
            if (null == inferred) {
                inferred = current;
            }
            else if (inferred != current) {
                if (isNumeric(inferred) && isNumeric(current)) {
                    inferred = PrimitiveType.NUMBER;
                }
                else {
                    return PrimitiveType.ANY;
                }
            }
        }
        return inferred;
    }

    private static boolean isNumeric(PrimitiveType type) {
        return type == PrimitiveType.INTEGER || type == PrimitiveType.NUMBER;
    }

    private static boolean hasShape(ObjectNode schema) {
        final var names = schema.fieldNames();
        while (names.hasNext()) {
            if (!NON_SHAPE_KEYWORDS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    private static String describe(JsonNode node) {
        return null == node ? "nothing" : node.getNodeType().name().toLowerCase();
    }

    /**
     * The schema itself plus name and description found on a surrounding tool envelope
     */
    private record Envelope(String name, String description, ObjectNode schema) {

        static Envelope unwrap(ObjectNode document) {
            final var function = document.get("function");
            if (null != function && function.isObject()) {
                return unwrap((ObjectNode) function);
            }
            final var jsonSchema = document.get("json_schema");
            if (null != jsonSchema && jsonSchema.isObject()) {
                return new Envelope(JsonUtils.text(jsonSchema, "name"),
                                    JsonUtils.text(jsonSchema, SchemaKeywords.DESCRIPTION),
                                    objectAt(jsonSchema, "schema"));
            }
            for (final var field : List.of("input_schema", "parameters")) {
                final var schema = document.get(field);
                if (null != schema && schema.isObject() && !document.has(SchemaKeywords.PROPERTIES)) {
                    return new Envelope(JsonUtils.text(document, "name"),
                                        JsonUtils.text(document, SchemaKeywords.DESCRIPTION),
                                        (ObjectNode) schema);
                }
            }
            return new Envelope(null, null, document);
        }

        private static ObjectNode objectAt(JsonNode node, String field) {
            final var value = node.get(field);
            if (null == value || !value.isObject()) {
                throw new SchemaBuildException(SchemaErrorType.INVALID_DOCUMENT, "missing " + field + " object");
            }
            return (ObjectNode) value;
        }
    }
}
