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

package com.phonepe.contextkeeper.core.llm.results;

import com.fasterxml.jackson.databind.JsonNode;

import com.phonepe.contextkeeper.core.llm.ToolResultContent;
import com.phonepe.contextkeeper.core.llm.ToolResultContentType;
import com.phonepe.contextkeeper.core.llm.ToolResultContentVisitor;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structured output from a tool
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class JsonToolResult extends ToolResultContent {
    JsonNode value;

    @Builder
    @Jacksonized
    public JsonToolResult(@NonNull JsonNode value) {
        super(ToolResultContentType.JSON);
        this.value = value;
    }

    @Override
    public <T> T accept(ToolResultContentVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
