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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * The inlined, order preserving schema document handed to the LLM. Two schemas are equal only when their json
 * text is identical, key order included.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class CanonicalSchema {
    private final ObjectNode document;

    @Getter
    @EqualsAndHashCode.Include
    private final String json;

    public CanonicalSchema(@NonNull ObjectNode document) {
        this.document = document.deepCopy();
        this.json = write(this.document);
    }

    public String title() {
        return JsonUtils.text(document, SchemaKeywords.TITLE);
    }

    public String description() {
        return JsonUtils.text(document, SchemaKeywords.DESCRIPTION);
    }

    public String type() {
        return JsonUtils.text(document, SchemaKeywords.TYPE);
    }

    public ObjectNode properties() {
        final var properties = document.get(SchemaKeywords.PROPERTIES);
        return properties instanceof ObjectNode objectNode
               ? objectNode.deepCopy()
               : document.objectNode();
    }

    public List<String> required() {
        final var names = new ArrayList<String>();
        document.path(SchemaKeywords.REQUIRED).forEach(name -> names.add(name.asText()));
        return List.copyOf(names);
    }

    /**
     * A copy of the document, safe to modify
     */
    public ObjectNode asJsonNode() {
        return document.deepCopy();
    }

    public String toJson() {
        return json;
    }

    @Override
    public String toString() {
        return json;
    }

    private static String write(JsonNode document) {
        try {
            return JsonUtils.createMapper().writeValueAsString(document);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize schema document", e);
        }
    }
}
