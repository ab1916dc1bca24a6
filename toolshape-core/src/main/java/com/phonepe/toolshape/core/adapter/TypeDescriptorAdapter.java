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
import com.phonepe.toolshape.core.source.ClassDefSource;
import com.phonepe.toolshape.core.source.DataSampleSource;
import com.phonepe.toolshape.core.source.FunctionSignatureSource;
import com.phonepe.toolshape.core.source.SchemaDocumentSource;
import com.phonepe.toolshape.core.source.TypeSource;
import com.phonepe.toolshape.core.source.TypeSourceVisitor;

/**
 * Turns any {@link TypeSource} into a schema tree. The tree may still hold references.
 */
public class TypeDescriptorAdapter implements TypeSourceVisitor<SchemaNode> {
    private final SchemaDocumentParser parser;
    private final ClassDefAdapter classDefAdapter;
    private final FunctionSignatureAdapter functionSignatureAdapter;
    private final DataSampleAdapter dataSampleAdapter;

    public TypeDescriptorAdapter() {
        final var generator = new ClassSchemaGenerator();
        this.parser = new SchemaDocumentParser();
        final var typeResolver = new JavaTypeResolver(generator, parser, new SchemaInliner());
        this.classDefAdapter = new ClassDefAdapter(generator, parser);
        this.functionSignatureAdapter = new FunctionSignatureAdapter(typeResolver);
        this.dataSampleAdapter = new DataSampleAdapter(typeResolver);
    }

    public SchemaNode adapt(final TypeSource source) {
        return source.accept(this);
    }

    @Override
    public SchemaNode visit(ClassDefSource classDef) {
        return classDefAdapter.adapt(classDef);
    }

    @Override
    public SchemaNode visit(FunctionSignatureSource functionSignature) {
        return functionSignatureAdapter.adapt(functionSignature.getDescriptor());
    }

    @Override
    public SchemaNode visit(DataSampleSource dataSample) {
        return dataSampleAdapter.adapt(dataSample);
    }

    @Override
    public SchemaNode visit(SchemaDocumentSource schemaDocument) {
        return parser.parse(schemaDocument.getDocument());
    }
}
