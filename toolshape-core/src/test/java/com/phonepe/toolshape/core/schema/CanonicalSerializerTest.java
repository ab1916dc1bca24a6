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

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.phonepe.toolshape.core.utils.TestUtils.json;
import static org.junit.jupiter.api.Assertions.*;

class CanonicalSerializerTest {
    private final CanonicalSerializer serializer = new CanonicalSerializer();

    @Test
    void testKeyOrder() {
        final var code = SchemaNode.builder()
                .kind(NodeKind.PRIMITIVE)
                .primitiveType(PrimitiveType.STRING)
                .defaultValue(TextNode.valueOf("AB"))
                .constraints(Map.of("maxLength", IntNode.valueOf(4), "minLength", IntNode.valueOf(1)))
                .description("Short code")
                .build();
        final var root = SchemaNode.object("Codes", "Code list", List.of(SchemaField.optional("code", code)));
        assertEquals("{\"type\":\"object\",\"description\":\"Code list\",\"properties\":{"
                             + "\"code\":{\"type\":\"string\",\"description\":\"Short code\",\"minLength\":1,"
                             + "\"maxLength\":4,\"default\":\"AB\"}},\"title\":\"Codes\"}",
                     serializer.serialize(root).toJson());
    }

    @Test
    void testFieldOrderIsKept() {
        final var root = SchemaNode.object("Ordered", null,
                                           List.of(SchemaField.required("b", SchemaNode.primitive(PrimitiveType.STRING)),
                                                   SchemaField.optional("a", SchemaNode.primitive(PrimitiveType.INTEGER)),
                                                   SchemaField.required("c", SchemaNode.primitive(PrimitiveType.NUMBER))));
        final var schema = serializer.serialize(root);
        assertEquals(List.of("b", "a", "c"), names(schema.properties().fieldNames()));
        assertEquals(List.of("b", "c"), schema.required());
    }

    @Test
    void testEmptyObjects() {
        final var nested = SchemaNode.object(null, null, List.of());
        final var root = SchemaNode.object("Holder", null, List.of(SchemaField.required("meta", nested)));
        assertEquals("{\"type\":\"object\",\"properties\":{\"meta\":{\"type\":\"object\"}},"
                             + "\"required\":[\"meta\"],\"title\":\"Holder\"}",
                     serializer.serialize(root).toJson());
        assertEquals("{\"type\":\"object\",\"properties\":{}}",
                     serializer.serialize(SchemaNode.object(null, null, List.of())).toJson());
    }

    @Test
    void testAnyUnionAndArray() {
        final var union = SchemaNode.builder()
                .kind(NodeKind.UNION)
                .variants(List.of(SchemaNode.primitive(PrimitiveType.INTEGER), SchemaNode.primitive(PrimitiveType.NULL)))
                .defaultValue(NullNode.getInstance())
                .build();
        final var root = SchemaNode.object("Mixed", null,
                                           List.of(SchemaField.required("anything", SchemaNode.any()),
                                                   SchemaField.optional("limit", union),
                                                   SchemaField.required("rows", SchemaNode.array(SchemaNode.any()))));
        assertEquals("{\"type\":\"object\",\"properties\":{\"anything\":{},"
                             + "\"limit\":{\"anyOf\":[{\"type\":\"integer\"},{\"type\":\"null\"}]},"
                             + "\"rows\":{\"type\":\"array\",\"items\":{}}},"
                             + "\"required\":[\"anything\",\"rows\"],\"title\":\"Mixed\"}",
                     serializer.serialize(root).toJson());
    }

    @Test
    void testReferenceIsRefused() {
        final var root = SchemaNode.object("Dangling", null,
                                           List.of(SchemaField.required("x", SchemaNode.reference("#/$defs/X"))));
        final var error = assertThrows(SchemaBuildException.class, () -> serializer.serialize(root));
        assertEquals(SchemaErrorType.UNRESOLVED_REFERENCE, error.getErrorType());
    }

    @Test
    void testIdempotence() {
        final var first = SchemaNormalizer.normalize(json("""
                {"title": "Search", "description": "Searches the catalog", "type": "object",
                 "required": ["query"],
                 "properties": {"query": {"type": "string", "minLength": 1, "title": "Query"},
                                "filters": {"type": "object", "title": "Filters",
                                            "properties": {"brand": {"type": "string"}}},
                                "page": {"type": "integer", "default": 1}}}
                """));
        final var second = SchemaNormalizer.normalize(first.asJsonNode());
        assertEquals(first, second);
        assertEquals(first.toJson(), second.toJson());
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void testCanonicalSchemaAccessors() {
        final var schema = SchemaNormalizer.normalize(json("""
                {"title": "Search", "description": "Searches the catalog", "type": "object",
                 "required": ["query"], "properties": {"query": {"type": "string"}}}
                """));
        assertEquals("Search", schema.title());
        assertEquals("Searches the catalog", schema.description());
        assertEquals("object", schema.type());
        assertEquals(List.of("query"), schema.required());
        assertEquals(schema.toJson(), schema.toString());
        final var copy = schema.asJsonNode();
        copy.put("title", "Changed");
        assertEquals("Search", schema.title());
    }

    private static List<String> names(Iterator<String> iterator) {
        final var names = new ArrayList<String>();
        iterator.forEachRemaining(names::add);
        return names;
    }
}
