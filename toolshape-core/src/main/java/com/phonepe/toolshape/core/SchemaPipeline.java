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

package com.phonepe.toolshape.core;

import com.phonepe.toolshape.core.adapter.TypeDescriptorAdapter;
import com.phonepe.toolshape.core.engine.networknt.NetworkntValidationEngine;
import com.phonepe.toolshape.core.model.ModelSynthesizer;
import com.phonepe.toolshape.core.model.ValidatingModel;
import com.phonepe.toolshape.core.model.ValidationEngine;
import com.phonepe.toolshape.core.naming.IdentifierAllocator;
import com.phonepe.toolshape.core.schema.CanonicalSchema;
import com.phonepe.toolshape.core.schema.SchemaNormalizer;
import com.phonepe.toolshape.core.source.TypeSource;

/**
 * Entry point tying adapters, inliner, serializer and synthesizer together
 */
public class SchemaPipeline {
    private final TypeDescriptorAdapter adapter;
    private final ModelSynthesizer synthesizer;

    public SchemaPipeline() {
        this(new NetworkntValidationEngine(), IdentifierAllocator.defaultAllocator());
    }

    public SchemaPipeline(ValidationEngine engine, IdentifierAllocator allocator) {
        this.adapter = new TypeDescriptorAdapter();
        this.synthesizer = new ModelSynthesizer(engine, allocator);
    }

    /**
     * Canonical schema of the source
     */
    public CanonicalSchema schema(final TypeSource source) {
        return SchemaNormalizer.normalize(adapter.adapt(source));
    }

    /**
     * Live model validating inputs of the source's shape
     */
    public ValidatingModel model(final TypeSource source) {
        return synthesizer.synthesize(adapter.adapt(source));
    }
}
