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

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Settings for inferring a schema from a data sample
 */
@Value
@Builder
@With
public class SampleOptions {
    /**
     * Use sample values as defaults. Fields with a default are not required.
     */
    @Builder.Default
    boolean defaultsFromValues = false;

    /**
     * Treat string sample values as field descriptions instead of examples
     */
    @Builder.Default
    boolean descriptionsFromStringValues = false;

    @Builder.Default
    EmptySequencePolicy emptySequencePolicy = EmptySequencePolicy.ANY_ITEMS;

    public static SampleOptions defaults() {
        return builder().build();
    }
}
