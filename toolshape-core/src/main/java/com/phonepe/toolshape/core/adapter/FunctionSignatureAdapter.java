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
import com.google.common.reflect.TypeToken;
import com.phonepe.toolshape.core.schema.SchemaField;
import com.phonepe.toolshape.core.schema.SchemaNode;
import com.phonepe.toolshape.core.source.CallableDescriptor;
import com.phonepe.toolshape.core.source.ParameterSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One field per parameter, in declaration order
 */
@Slf4j
@RequiredArgsConstructor
public class FunctionSignatureAdapter {
    private final JavaTypeResolver typeResolver;

    public SchemaNode adapt(final CallableDescriptor descriptor) {
        log.debug("Building schema tree for callable {} with {} parameters",
                  descriptor.getName(), descriptor.getParameters().size());
        final var fields = descriptor.getParameters()
                .stream()
                .map(this::field)
                .toList();
        return SchemaNode.object(descriptor.getName(), descriptor.getDescription(), fields);
    }

    private SchemaField field(ParameterSpec parameter) {
        var node = typeResolver.resolve(parameter.getType());
        if (!Strings.isNullOrEmpty(parameter.getDescription())) {
            final var rawType = TypeToken.of(parameter.getType()).getRawType();
            node = node.withDescription(DocumentedEnums.isDocumented(rawType)
                                        ? DocumentedEnums.describe(rawType, parameter.getDescription())
                                        : parameter.getDescription());
        }
        if (null != parameter.getDefaultValue() && !parameter.getDefaultValue().isNull()) {
            node = node.withDefaultValue(parameter.getDefaultValue());
        }
        return new SchemaField(parameter.getName(), node, parameter.isRequired());
    }
}
