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

import lombok.NonNull;
import lombok.Value;

/**
 * Result of a tool call, ready to be sent back to the model
 */
@Value
public class ToolCallResult {
    @NonNull
    String toolName;
    @NonNull
    ToolCallStatus status;
    String content;

    public static ToolCallResult success(String toolName, String content) {
        return new ToolCallResult(toolName, ToolCallStatus.SUCCESS, content);
    }

    public static ToolCallResult failure(String toolName, ToolCallStatus status, String content) {
        return new ToolCallResult(toolName, status, content);
    }

    public boolean isSuccess() {
        return status == ToolCallStatus.SUCCESS;
    }
}
