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

package com.phonepe.contextkeeper.core.llm.blocks;

import com.fasterxml.jackson.databind.JsonNode;

import com.phonepe.contextkeeper.core.llm.ContentBlock;
import com.phonepe.contextkeeper.core.llm.ContentBlockType;
import com.phonepe.contextkeeper.core.llm.ContentBlockVisitor;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request from the assistant to invoke a tool
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolUseBlock extends ContentBlock {
    /**
     * Invocation id as generated by the model. Tool results refer back to this
     */
    String id;

    /**
     * Name of the tool to be called
     */
    String name;

    /**
     * Arguments for the call
     */
    JsonNode input;

    @Builder
    @Jacksonized
    public ToolUseBlock(@NonNull String id, @NonNull String name, JsonNode input) {
        super(ContentBlockType.TOOL_USE);
        this.id = id;
        this.name = name;
        this.input = input;
    }

    @Override
    public <T> T accept(ContentBlockVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
