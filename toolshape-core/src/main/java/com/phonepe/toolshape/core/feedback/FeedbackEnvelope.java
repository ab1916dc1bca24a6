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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * What the agent loop hands back to the model when a tool input is invalid
 */
@Value
@JsonPropertyOrder({"success", "message_to_assistant", "errors"})
public class FeedbackEnvelope {
    @JsonProperty("success")
    boolean success;

    @JsonProperty("message_to_assistant")
    String messageToAssistant;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonProperty("errors")
    List<FeedbackError> errors;

    public static FeedbackEnvelope failure(String messageToAssistant, List<FeedbackError> errors) {
        return new FeedbackEnvelope(false, messageToAssistant, List.copyOf(errors));
    }
}
