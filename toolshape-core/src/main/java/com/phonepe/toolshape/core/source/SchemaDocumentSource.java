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

package com.phonepe.toolshape.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * A deserialized json schema document, bare or inside a tool envelope. May contain definitions and references.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SchemaDocumentSource extends TypeSource {
    JsonNode document;

    private SchemaDocumentSource(@NonNull JsonNode document) {
        super(SourceType.SCHEMA_DOCUMENT);
        this.document = document.deepCopy();
    }

    public static SchemaDocumentSource of(final JsonNode document) {
        return new SchemaDocumentSource(document);
    }

    public static SchemaDocumentSource parse(final String json) {
        try {
            return new SchemaDocumentSource(JsonUtils.createMapper().readTree(json));
        }
        catch (JsonProcessingException e) {
            throw new SchemaBuildException(SchemaErrorType.INVALID_DOCUMENT, e, e.getOriginalMessage());
        }
    }

    @Override
    public <T> T accept(TypeSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
