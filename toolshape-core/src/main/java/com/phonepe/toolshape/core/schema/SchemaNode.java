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
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of the intermediate schema tree shared by all type sources. Instances are immutable; collections are
 * copied on construction and keep their insertion order.
 */
@Value
@With
public class SchemaNode {
    @NonNull
    NodeKind kind;

    /**
     * Type name. Only the root name survives inlining, where it becomes the schema title.
     */
    String name;

    String description;

    /**
     * Default value, null when the node has none
     */
    JsonNode defaultValue;

    /**
     * Json type for {@link NodeKind#PRIMITIVE} and {@link NodeKind#ENUM} nodes
     */
    PrimitiveType primitiveType;

    /**
     * Constraint keyword to value, see {@link SchemaKeywords#CONSTRAINTS}
     */
    Map<String, JsonNode> constraints;

    /**
     * Children of an object, in declaration order
     */
    List<SchemaField> fields;

    /**
     * Item type of an array
     */
    SchemaNode items;

    /**
     * Alternatives of a union
     */
    List<SchemaNode> variants;

    /**
     * Target of a reference node: {@code #}, {@code #/$defs/Name} or {@code #/definitions/Name}
     */
    String reference;

    /**
     * Named definitions references point into. Only populated on the root.
     */
    Map<String, SchemaNode> definitions;

    @Builder(toBuilder = true)
    @SuppressWarnings("java:S107")
    public SchemaNode(
            @NonNull NodeKind kind,
            String name,
            String description,
            JsonNode defaultValue,
            PrimitiveType primitiveType,
            Map<String, JsonNode> constraints,
            List<SchemaField> fields,
            SchemaNode items,
            List<SchemaNode> variants,
            String reference,
            Map<String, SchemaNode> definitions) {
        this.kind = kind;
        this.name = name;
        this.description = description;
        this.defaultValue = JsonUtils.copyOrNull(defaultValue);
        this.primitiveType = primitiveType;
        this.constraints = copyConstraints(constraints);
        this.fields = null == fields ? List.of() : List.copyOf(fields);
        this.items = items;
        this.variants = null == variants ? List.of() : List.copyOf(variants);
        this.reference = reference;
        this.definitions = null == definitions
                           ? Map.of()
                           : Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static SchemaNode primitive(PrimitiveType type) {
        return builder().kind(NodeKind.PRIMITIVE).primitiveType(type).build();
    }

    public static SchemaNode any() {
        return primitive(PrimitiveType.ANY);
    }

    public static SchemaNode array(SchemaNode items) {
        return builder().kind(NodeKind.ARRAY).items(items).build();
    }

    public static SchemaNode object(String name, String description, List<SchemaField> fields) {
        return builder()
                .kind(NodeKind.OBJECT)
                .name(name)
                .description(description)
                .fields(fields)
                .build();
    }

    public static SchemaNode reference(String target) {
        return builder().kind(NodeKind.REFERENCE).reference(target).build();
    }

    public Optional<SchemaField> field(String fieldName) {
        return fields.stream()
                .filter(field -> field.getName().equals(fieldName))
                .findFirst();
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isNull();
    }

    private static Map<String, JsonNode> copyConstraints(Map<String, JsonNode> constraints) {
        if (null == constraints || constraints.isEmpty()) {
            return Map.of();
        }
        final var copy = new LinkedHashMap<String, JsonNode>();
        constraints.forEach((keyword, value) -> copy.put(keyword, Objects.requireNonNull(value).deepCopy()));
        return Collections.unmodifiableMap(copy);
    }
}
