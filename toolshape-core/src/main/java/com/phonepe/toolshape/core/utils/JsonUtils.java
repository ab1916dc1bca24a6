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

package com.phonepe.toolshape.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.POJONode;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Mapper setup and small helpers for tree handling
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static boolean empty(final JsonNode node) {
        return node == null
                || node.isNull()
                || node.isMissingNode()
                || (node.isContainerNode() && node.isEmpty());
    }

    /**
     * Text value of a field, or null when it is absent or not textual
     */
    public static String text(final JsonNode node, final String field) {
        final var value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /**
     * Some generators put raw java values into trees. Converts such wrapped values into proper json nodes.
     */
    public static JsonNode unwrapPojo(final JsonNode node) {
        if (node instanceof POJONode pojoNode) {
            return createMapper().valueToTree(pojoNode.getPojo());
        }
        return node;
    }

    public static JsonNode copyOrNull(final JsonNode node) {
        return Objects.isNull(node) ? null : node.deepCopy();
    }
}
