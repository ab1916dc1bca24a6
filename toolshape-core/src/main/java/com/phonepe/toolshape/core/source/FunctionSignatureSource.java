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

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.lang.reflect.Method;

/**
 * The parameter list of a callable. Only already resolved descriptors are consumed.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FunctionSignatureSource extends TypeSource {
    CallableDescriptor descriptor;

    private FunctionSignatureSource(@NonNull CallableDescriptor descriptor) {
        super(SourceType.FUNCTION_SIGNATURE);
        this.descriptor = descriptor;
    }

    public static FunctionSignatureSource of(final CallableDescriptor descriptor) {
        return new FunctionSignatureSource(descriptor);
    }

    public static FunctionSignatureSource of(final Method method) {
        return new FunctionSignatureSource(CallableDescriptor.fromMethod(method));
    }

    @Override
    public <T> T accept(TypeSourceVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
