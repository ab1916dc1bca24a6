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
import lombok.experimental.UtilityClass;

/**
 * Brings any schema document, including engine native ones, into canonical form
 */
@UtilityClass
public class SchemaNormalizer {
    private static final SchemaDocumentParser PARSER = new SchemaDocumentParser();
    private static final SchemaInliner INLINER = new SchemaInliner();
    private static final CanonicalSerializer SERIALIZER = new CanonicalSerializer();

    public static CanonicalSchema normalize(final JsonNode document) {
        return SERIALIZER.serialize(INLINER.inline(PARSER.parse(document)));
    }

    public static CanonicalSchema normalize(final SchemaNode tree) {
        return SERIALIZER.serialize(INLINER.inline(tree));
    }
}
