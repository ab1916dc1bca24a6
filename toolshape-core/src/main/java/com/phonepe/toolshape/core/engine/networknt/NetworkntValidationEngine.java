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

package com.phonepe.toolshape.core.engine.networknt;

import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.phonepe.toolshape.core.model.ModelDefinition;
import com.phonepe.toolshape.core.model.ValidatingModel;
import com.phonepe.toolshape.core.model.ValidationEngine;
import lombok.extern.slf4j.Slf4j;

/**
 * Validation engine on top of the networknt json schema validator
 */
@Slf4j
public class NetworkntValidationEngine implements ValidationEngine {
    private final JsonSchemaFactory factory;

    public NetworkntValidationEngine() {
        this(JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012));
    }

    public NetworkntValidationEngine(JsonSchemaFactory factory) {
        this.factory = factory;
    }

    @Override
    public ValidatingModel defineModel(ModelDefinition definition) {
        final var document = NativeSchemaWriter.write(definition);
        log.debug("Compiling model {}: {}", definition.getName(), document);
        return new NetworkntValidatingModel(definition, document, factory.getSchema(document));
    }
}
