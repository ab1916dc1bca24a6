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

package com.phonepe.toolshape.toolbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.toolshape.core.engine.networknt.NetworkntValidationEngine;
import com.phonepe.toolshape.core.feedback.FeedbackSettings;
import com.phonepe.toolshape.core.model.ValidationEngine;
import com.phonepe.toolshape.core.naming.IdentifierAllocator;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Collaborators shared by tools
 */
@Value
@Builder
@With
public class ToolSettings {
    @Builder.Default
    ObjectMapper mapper = JsonUtils.createMapper();

    @Builder.Default
    ValidationEngine engine = new NetworkntValidationEngine();

    @Builder.Default
    IdentifierAllocator allocator = IdentifierAllocator.defaultAllocator();

    @Builder.Default
    FeedbackSettings feedback = FeedbackSettings.defaults();

    public static ToolSettings defaults() {
        return builder().build();
    }
}
