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
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import org.junit.jupiter.api.Test;

import static com.phonepe.toolshape.core.utils.TestUtils.json;
import static org.junit.jupiter.api.Assertions.*;

class SchemaDocumentParserTest {
    private static final String WEATHER_CANONICAL = "{\"type\":\"object\",\"description\":\"Weather for a city\","
            + "\"properties\":{\"city\":{\"type\":\"string\"}},\"required\":[\"city\"],\"title\":\"get_weather\"}";

    private final SchemaDocumentParser parser = new SchemaDocumentParser();

    @Test
    void testBareSchema() {
        final var root = parser.parse(json("""
                {"title": "Point", "type": "object",
                 "properties": {"x": {"type": "number"}, "y": {"type": "number"}},
                 "required": ["x"]}
                """));
        assertEquals(NodeKind.OBJECT, root.getKind());
        assertEquals("Point", root.getName());
        assertEquals(2, root.getFields().size());
        assertTrue(root.field("x").orElseThrow().isRequired());
        assertFalse(root.field("y").orElseThrow().isRequired());
        assertEquals(PrimitiveType.NUMBER, root.field("y").orElseThrow().getNode().getPrimitiveType());
    }

    @Test
    void testOpenAiFunctionEnvelope() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"type": "function",
                 "function": {"name": "get_weather", "description": "Weather for a city",
                              "parameters": {"type": "object",
                                             "properties": {"city": {"type": "string"}},
                                             "required": ["city"]}}}
                """));
        assertEquals(WEATHER_CANONICAL, schema.toJson());
    }

    @Test
    void testAnthropicEnvelope() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"name": "get_weather", "description": "Weather for a city",
                 "input_schema": {"type": "object",
                                  "properties": {"city": {"type": "string"}},
                                  "required": ["city"]}}
                """));
        assertEquals(WEATHER_CANONICAL, schema.toJson());
    }

    @Test
    void testResponseFormatEnvelope() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"type": "json_schema",
                 "json_schema": {"name": "get_weather", "description": "Weather for a city", "strict": true,
                                 "schema": {"type": "object",
                                            "properties": {"city": {"type": "string"}},
                                            "required": ["city"],
                                            "additionalProperties": false}}}
                """));
        assertEquals(WEATHER_CANONICAL, schema.toJson());
    }

    @Test
    void testPropertyNamedParametersIsNotAnEnvelope() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {"parameters": {"type": "object", "properties": {"a": {"type": "string"}}}}}
                """));
        assertEquals("parameters", root.getFields().get(0).getName());
    }

    @Test
    void testSingleAllOfIsMerged() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {"unit": {"allOf": [{"$ref": "#/$defs/Unit"}], "description": "Unit to use"}},
                 "$defs": {"Unit": {"type": "string", "enum": ["C", "F"]}}}
                """));
        final var unit = root.field("unit").orElseThrow().getNode();
        assertEquals(NodeKind.REFERENCE, unit.getKind());
        assertEquals("#/$defs/Unit", unit.getReference());
        assertEquals("Unit to use", unit.getDescription());
        assertEquals("Unit", root.getDefinitions().get("Unit").getName());
        assertEquals(PrimitiveType.STRING, root.getDefinitions().get("Unit").getPrimitiveType());
    }

    @Test
    void testMultiEntryAllOfIsUnsupported() {
        final var document = json("""
                {"type": "object",
                 "properties": {"x": {"allOf": [{"type": "string"}, {"minLength": 2}]}}}
                """);
        final var error = assertThrows(SchemaBuildException.class, () -> parser.parse(document));
        assertEquals(SchemaErrorType.UNSUPPORTED_CONSTRUCT, error.getErrorType());
        assertTrue(error.getMessage().contains("#/properties/x/allOf"));
    }

    @Test
    void testUnions() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {
                    "limit": {"type": ["integer", "null"], "description": "Max rows"},
                    "id": {"oneOf": [{"type": "string"}, {"type": "integer"}]},
                    "tag": {"type": ["string"]}}}
                """));
        final var limit = root.field("limit").orElseThrow().getNode();
        assertEquals(NodeKind.UNION, limit.getKind());
        assertEquals("Max rows", limit.getDescription());
        assertEquals(2, limit.getVariants().size());
        assertNull(limit.getVariants().get(0).getDescription());
        assertEquals(PrimitiveType.NULL, limit.getVariants().get(1).getPrimitiveType());
        assertEquals(NodeKind.UNION, root.field("id").orElseThrow().getNode().getKind());
        final var tag = root.field("tag").orElseThrow().getNode();
        assertEquals(NodeKind.PRIMITIVE, tag.getKind());
        assertEquals(PrimitiveType.STRING, tag.getPrimitiveType());
    }

    @Test
    void testEnumTypeInference() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {
                    "unit": {"enum": ["C", "F"]},
                    "level": {"enum": [1, 2.5]},
                    "mixed": {"enum": ["a", 1]}}}
                """));
        assertEquals(PrimitiveType.STRING, root.field("unit").orElseThrow().getNode().getPrimitiveType());
        assertEquals(PrimitiveType.NUMBER, root.field("level").orElseThrow().getNode().getPrimitiveType());
        assertEquals(PrimitiveType.ANY, root.field("mixed").orElseThrow().getNode().getPrimitiveType());
        assertEquals(NodeKind.ENUM, root.field("unit").orElseThrow().getNode().getKind());
    }

    @Test
    void testConstraintsAreCopied() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {"code": {"type": "string", "pattern": "^[A-Z]+$", "maxLength": 4,
                                         "x-internal": true}}}
                """));
        final var constraints = root.field("code").orElseThrow().getNode().getConstraints();
        assertEquals(2, constraints.size());
        assertEquals("^[A-Z]+$", constraints.get("pattern").asText());
        assertEquals(4, constraints.get("maxLength").asInt());
    }

    @Test
    void testArrays() {
        final var root = parser.parse(json("""
                {"type": "object",
                 "properties": {"tags": {"type": "array"}, "ids": {"type": "array", "items": {"type": "integer"}}}}
                """));
        final var tags = root.field("tags").orElseThrow().getNode();
        assertEquals(NodeKind.ARRAY, tags.getKind());
        assertEquals(PrimitiveType.ANY, tags.getItems().getPrimitiveType());
        assertEquals(PrimitiveType.INTEGER, root.field("ids").orElseThrow().getNode().getItems().getPrimitiveType());
    }

    @Test
    void testPositionalItemsAreUnsupported() {
        final var document = json("""
                {"type": "object",
                 "properties": {"pair": {"type": "array", "items": [{"type": "string"}, {"type": "integer"}]}}}
                """);
        final var error = assertThrows(SchemaBuildException.class, () -> parser.parse(document));
        assertEquals(SchemaErrorType.UNSUPPORTED_CONSTRUCT, error.getErrorType());
    }

    @Test
    void testUnknownTypeIsUnsupported() {
        final var document = json("""
                {"type": "object", "properties": {"when": {"type": "date"}}}
                """);
        final var error = assertThrows(SchemaBuildException.class, () -> parser.parse(document));
        assertEquals(SchemaErrorType.UNSUPPORTED_CONSTRUCT, error.getErrorType());
        assertTrue(error.getMessage().contains("#/properties/when"));
    }

    @Test
    void testTrueSchemaIsAny() {
        final var root = parser.parse(json("""
                {"type": "object", "properties": {"anything": true}}
                """));
        assertEquals(PrimitiveType.ANY, root.field("anything").orElseThrow().getNode().getPrimitiveType());
    }

    @Test
    void testEmptySchema() {
        final var document = json("""
                {"title": "Nothing", "description": "No shape at all", "$defs": {}}
                """);
        final var error = assertThrows(SchemaBuildException.class, () -> parser.parse(document));
        assertEquals(SchemaErrorType.EMPTY_SCHEMA, error.getErrorType());
    }

    @Test
    void testInvalidDocument() {
        final var nodes = JsonNodeFactory.instance;
        final var array = nodes.arrayNode();
        var error = assertThrows(SchemaBuildException.class, () -> parser.parse(array));
        assertEquals(SchemaErrorType.INVALID_DOCUMENT, error.getErrorType());
        error = assertThrows(SchemaBuildException.class, () -> parser.parse(null));
        assertEquals(SchemaErrorType.INVALID_DOCUMENT, error.getErrorType());
        final var envelope = json("""
                {"json_schema": {"name": "broken"}}
                """);
        error = assertThrows(SchemaBuildException.class, () -> parser.parse(envelope));
        assertEquals(SchemaErrorType.INVALID_DOCUMENT, error.getErrorType());
    }

    @Test
    void testAnnotationEntriesOfAllOfAreMerged() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"title": "Customer", "type": "object",
                 "properties": {"home": {"allOf": [{"type": "object", "description": "A postal address",
                                                    "properties": {"city": {"type": "string"}},
                                                    "required": ["city"]},
                                                   {"description": "Where the customer lives"}]}},
                 "required": ["home"]}
                """));
        final var home = schema.properties().get("home");
        assertEquals("object", home.get("type").asText());
        assertEquals("Where the customer lives", home.get("description").asText());
        assertEquals("string", home.get("properties").get("city").get("type").asText());
        assertEquals("[\"city\"]", home.get("required").toString());
    }

    @Test
    void testTypeArrayKeepsConstraintsOfEachType() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"title": "Filter", "type": "object",
                 "properties": {"limit": {"type": ["integer", "null"], "minimum": 1},
                                "code": {"type": ["string", "integer"], "pattern": "^[A-Z]+$", "maximum": 99,
                                         "enum": ["AB", 12, null]}}}
                """));
        assertEquals("{\"anyOf\":[{\"type\":\"integer\",\"minimum\":1},{\"type\":\"null\"}]}",
                     schema.properties().get("limit").toString());
        assertEquals("{\"anyOf\":[{\"type\":\"string\",\"enum\":[\"AB\"],\"pattern\":\"^[A-Z]+$\"},"
                             + "{\"type\":\"integer\",\"enum\":[12],\"maximum\":99}]}",
                     schema.properties().get("code").toString());
    }
}
