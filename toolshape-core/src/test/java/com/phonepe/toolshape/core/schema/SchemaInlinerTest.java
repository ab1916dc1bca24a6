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
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phonepe.toolshape.core.utils.TestUtils.readJsonResource;
import static org.junit.jupiter.api.Assertions.*;

class SchemaInlinerTest {
    private final SchemaInliner inliner = new SchemaInliner();

    @Test
    void testReferencesReplacedAtEveryUse() {
        final var address = SchemaNode.object("Address", "Postal address",
                                              List.of(SchemaField.required("street",
                                                                           SchemaNode.primitive(PrimitiveType.STRING))));
        final var root = SchemaNode.object("Customer", null,
                                           List.of(SchemaField.required("home", SchemaNode.reference("#/$defs/Address")),
                                                   SchemaField.optional("work",
                                                                        SchemaNode.reference("#/$defs/Address")
                                                                                .withDescription("Office"))))
                .withDefinitions(Map.of("Address", address));
        final var inlined = inliner.inline(root);
        assertEquals("Customer", inlined.getName());
        assertTrue(inlined.getDefinitions().isEmpty());
        final var home = inlined.field("home").orElseThrow().getNode();
        final var work = inlined.field("work").orElseThrow().getNode();
        assertEquals(NodeKind.OBJECT, home.getKind());
        assertNull(home.getName());
        assertEquals("Postal address", home.getDescription());
        assertEquals("Office", work.getDescription());
        assertEquals(home.getFields(), work.getFields());
    }

    @Test
    void testReferenceDefaultWins() {
        final var root = SchemaNode.object("Paging", null,
                                           List.of(SchemaField.optional("size",
                                                                        SchemaNode.reference("#/$defs/Size")
                                                                                .withDefaultValue(IntNode.valueOf(10)))))
                .withDefinitions(Map.of("Size",
                                        SchemaNode.primitive(PrimitiveType.INTEGER)
                                                .withDefaultValue(IntNode.valueOf(50))));
        final var size = inliner.inline(root).field("size").orElseThrow().getNode();
        assertEquals(10, size.getDefaultValue().asInt());
        assertEquals(PrimitiveType.INTEGER, size.getPrimitiveType());
    }

    @Test
    void testNoIndirectionLeft() {
        final var schema = SchemaNormalizer.normalize(readJsonResource("/schemas/order_with_defs.json"));
        assertFalse(schema.toJson().contains("$ref"));
        assertFalse(schema.toJson().contains("$defs"));
        assertFalse(schema.toJson().contains("definitions"));
        assertEquals("{\"type\":\"object\",\"properties\":{"
                             + "\"id\":{\"type\":\"string\",\"description\":\"Order id\"},"
                             + "\"billing\":{\"type\":\"object\",\"description\":\"Where the invoice goes\","
                             + "\"properties\":{\"street\":{\"type\":\"string\"},"
                             + "\"zip\":{\"type\":\"string\",\"pattern\":\"^[0-9]{6}$\"}},\"required\":[\"street\"]},"
                             + "\"shipping\":{\"type\":\"object\",\"description\":\"Postal address\","
                             + "\"properties\":{\"street\":{\"type\":\"string\"},"
                             + "\"zip\":{\"type\":\"string\",\"pattern\":\"^[0-9]{6}$\"}},\"required\":[\"street\"]},"
                             + "\"lines\":{\"type\":\"array\",\"minItems\":1,\"items\":{\"type\":\"object\","
                             + "\"properties\":{\"sku\":{\"type\":\"string\"},"
                             + "\"quantity\":{\"type\":\"integer\",\"minimum\":1,\"default\":1}},"
                             + "\"required\":[\"sku\"]}}},"
                             + "\"required\":[\"id\",\"billing\",\"lines\"],\"title\":\"Order\"}",
                     schema.toJson());
    }

    @Test
    void testSelfReferenceIsCyclic() {
        final var root = SchemaNode.object("Category", null,
                                           List.of(SchemaField.required("name",
                                                                        SchemaNode.primitive(PrimitiveType.STRING)),
                                                   SchemaField.optional("children",
                                                                        SchemaNode.array(SchemaNode.reference("#")))));
        final var error = assertThrows(SchemaBuildException.class, () -> inliner.inline(root));
        assertEquals(SchemaErrorType.CYCLIC_REFERENCE, error.getErrorType());
    }

    @Test
    void testCycleThroughDefinitions() {
        final var node = SchemaNode.object("Node", null,
                                           List.of(SchemaField.optional("next", SchemaNode.reference("#/$defs/Node"))));
        final var root = SchemaNode.object("List", null,
                                           List.of(SchemaField.required("head", SchemaNode.reference("#/$defs/Node"))))
                .withDefinitions(Map.of("Node", node));
        final var error = assertThrows(SchemaBuildException.class, () -> inliner.inline(root));
        assertEquals(SchemaErrorType.CYCLIC_REFERENCE, error.getErrorType());
        assertTrue(error.getMessage().contains("#/$defs/Node"));
    }

    @Test
    void testSharedDefinitionIsNotACycle() {
        final var leaf = SchemaNode.object("Leaf", null,
                                           List.of(SchemaField.required("value",
                                                                        SchemaNode.primitive(PrimitiveType.INTEGER))));
        final var pair = SchemaNode.object("Pair", null,
                                           List.of(SchemaField.required("left", SchemaNode.reference("#/$defs/Leaf")),
                                                   SchemaField.required("right", SchemaNode.reference("#/$defs/Leaf"))));
        final var root = SchemaNode.object("Tree", null,
                                           List.of(SchemaField.required("first", SchemaNode.reference("#/$defs/Pair")),
                                                   SchemaField.required("second", SchemaNode.reference("#/$defs/Pair"))))
                .withDefinitions(Map.of("Leaf", leaf, "Pair", pair));
        final var inlined = inliner.inline(root);
        final var second = inlined.field("second").orElseThrow().getNode();
        assertEquals(NodeKind.OBJECT, second.field("right").orElseThrow().getNode().getKind());
    }

    @Test
    void testUnresolvedReferences() {
        for (final var reference : List.of("#/$defs/Missing", "https://example.com/schema.json", "#/properties/x",
                                           "#/$defs/A/properties/b")) {
            final var root = SchemaNode.object("Broken", null,
                                               List.of(SchemaField.required("x", SchemaNode.reference(reference))))
                    .withDefinitions(Map.of("A", SchemaNode.any()));
            final var error = assertThrows(SchemaBuildException.class, () -> inliner.inline(root));
            assertEquals(SchemaErrorType.UNRESOLVED_REFERENCE, error.getErrorType(), reference);
        }
    }

    @Test
    void testEscapedReference() {
        final var root = SchemaNode.object("Escaped", null,
                                           List.of(SchemaField.required("x", SchemaNode.reference("#/$defs/a~1b~0c"))))
                .withDefinitions(Map.of("a/b~c", SchemaNode.primitive(PrimitiveType.BOOLEAN)));
        assertEquals(PrimitiveType.BOOLEAN,
                     inliner.inline(root).field("x").orElseThrow().getNode().getPrimitiveType());
    }

    @Test
    void testRootReferenceTakesTargetName() {
        final var pet = SchemaNode.object("Pet", "A pet",
                                          List.of(SchemaField.required("name",
                                                                       SchemaNode.primitive(PrimitiveType.STRING))));
        final var root = SchemaNode.reference("#/$defs/Pet").withDefinitions(Map.of("Pet", pet));
        final var inlined = inliner.inline(root);
        assertEquals("Pet", inlined.getName());
        assertEquals(NodeKind.OBJECT, inlined.getKind());
    }
}
