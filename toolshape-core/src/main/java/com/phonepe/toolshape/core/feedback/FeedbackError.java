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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonepe.toolshape.core.utils.JsonUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * One entry of the feedback envelope. Serialized as type, loc, msg, input and ctx, in that order, followed by any
 * extra fields of the record.
 */
@Value
@Builder
public class FeedbackError {
    private static final JsonMapper MAPPER = JsonUtils.createMapper();

    @NonNull
    String type;

    /**
     * Location rendered as a tuple, for example {@code ('age',)}
     */
    @NonNull
    String loc;

    @NonNull
    String msg;

    JsonNode input;

    Map<String, Object> ctx;

    Map<String, Object> extras;

    @JsonValue
    public ObjectNode toJsonNode() {
        final var node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("loc", loc);
        node.put("msg", msg);
        node.set("input", null == input ? NullNode.getInstance() : input.deepCopy());
        if (null != ctx && !ctx.isEmpty()) {
            node.set("ctx", MAPPER.valueToTree(ctx));
        }
        if (null != extras) {
            extras.forEach((key, value) -> {
                if (!node.has(key)) {
                    node.set(key, MAPPER.valueToTree(value));
                }
            });
        }
        return node;
    }
}
