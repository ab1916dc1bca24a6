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

import com.google.common.base.Strings;
import com.phonepe.toolshape.core.schema.SchemaDocumentParser;
import com.phonepe.toolshape.core.schema.SchemaNode;
import com.phonepe.toolshape.core.source.ClassDefSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the tree of an annotated class. References produced by the generator are left to the inliner.
 */
@Slf4j
@RequiredArgsConstructor
public class ClassDefAdapter {
    private final ClassSchemaGenerator generator;
    private final SchemaDocumentParser parser;

    public SchemaNode adapt(final ClassDefSource source) {
        final var type = source.getType();
        final var name = Strings.isNullOrEmpty(source.getModelName()) ? type.getSimpleName() : source.getModelName();
        log.debug("Building schema tree {} from class {}", name, type.getName());
        return parser.parse(generator.generate(type)).withName(name);
    }
}
