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

package com.phonepe.toolshape.core.model;

import com.google.common.base.Strings;
import com.phonepe.toolshape.core.errors.SchemaBuildException;
import com.phonepe.toolshape.core.errors.SchemaErrorType;
import com.phonepe.toolshape.core.naming.IdentifierAllocator;
import com.phonepe.toolshape.core.schema.NodeKind;
import com.phonepe.toolshape.core.schema.SchemaField;
import com.phonepe.toolshape.core.schema.SchemaInliner;
import com.phonepe.toolshape.core.schema.SchemaNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a live validating model from a schema tree. The model's own schema normalizes to the same canonical
 * schema as the tree it was built from.
 */
@Slf4j
public class ModelSynthesizer {
    private final ValidationEngine engine;
    private final IdentifierAllocator allocator;
    private final SchemaInliner inliner;

    public ModelSynthesizer(ValidationEngine engine) {
        this(engine, IdentifierAllocator.defaultAllocator());
    }

    public ModelSynthesizer(ValidationEngine engine, IdentifierAllocator allocator) {
        this.engine = engine;
        this.allocator = allocator;
        this.inliner = new SchemaInliner();
    }

    public ValidatingModel synthesize(final SchemaNode tree) {
        final var root = inliner.inline(tree);
        if (root.getKind() != NodeKind.OBJECT) {
            throw new SchemaBuildException(SchemaErrorType.UNSUPPORTED_CONSTRUCT,
                                           "#", "a model needs an object at the root, found " + root.getKind());
        }
        final var name = Strings.isNullOrEmpty(root.getName()) ? allocator.next() : root.getName();
        final var definition = ModelDefinition.builder()
                .name(name)
                .description(root.getDescription())
                .fields(root.getFields().stream().map(ModelSynthesizer::fieldSpec).toList())
                .build();
        log.debug("Defining model {} with {} fields", name, definition.getFields().size());
        return engine.defineModel(definition);
    }

    private static FieldSpec fieldSpec(SchemaField field) {
        final var node = field.getNode();
        return FieldSpec.builder()
                .name(field.getName())
                .type(node.toBuilder().description(null).defaultValue(null).build())
                .required(field.isRequired())
                .defaultValue(node.hasDefault() ? node.getDefaultValue() : null)
                .description(node.getDescription())
                .build();
    }
}
