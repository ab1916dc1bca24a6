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

package com.phonepe.toolshape.core.feedback;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuration of the feedback sent back to the model
 */
@Value
@Builder
@With
public class FeedbackSettings {
    public static final String DEFAULT_MESSAGE_TO_ASSISTANT =
            "Please pay close attention to the following errors and use them to correct your tool inputs.";

    @Builder.Default
    String messageToAssistant = DEFAULT_MESSAGE_TO_ASSISTANT;

    public static FeedbackSettings defaults() {
        return builder().build();
    }
}
