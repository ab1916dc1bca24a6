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

package com.phonepe.toolshape.core.adapter;

import com.phonepe.toolshape.core.schema.SchemaDocumentParser;
import com.phonepe.toolshape.core.schema.SchemaInliner;
import com.phonepe.toolshape.core.schema.SchemaNode;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.RequiredArgsConstructor;

import java.lang.reflect.Type;

/**
 * Turns a java type used as a parameter type or type token into an anonymous, reference free tree
 */
@RequiredArgsConstructor
public class JavaTypeResolver {
    private final ClassSchemaGenerator generator;
    private final SchemaDocumentParser parser;
    private final SchemaInliner inliner;

    public JavaTypeResolver() {
        this(new ClassSchemaGenerator(), new SchemaDocumentParser(), new SchemaInliner());
    }

    public SchemaNode resolve(final Type type) {
        final var document = generator.generate(type);
        if (JsonUtils.empty(document)) {
            return SchemaNode.any();
        }
        return inliner.inline(parser.parse(document)).withName(null);
    }
}
