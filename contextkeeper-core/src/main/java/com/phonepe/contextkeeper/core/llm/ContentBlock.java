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

package com.phonepe.contextkeeper.core.llm;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import com.phonepe.contextkeeper.core.llm.blocks.ImageBlock;
import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ThinkingBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolResultBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolUseBlock;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single piece of content inside a message. The set of block types is closed; every consumer handles all of
 * them through a {@link ContentBlockVisitor}.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes(
        {
                @JsonSubTypes.Type(name = "TEXT", value = TextBlock.class),
                @JsonSubTypes.Type(name = "THINKING", value = ThinkingBlock.class),
                @JsonSubTypes.Type(name = "IMAGE", value = ImageBlock.class),

                //Assistant->Tool
                @JsonSubTypes.Type(name = "TOOL_USE", value = ToolUseBlock.class),
                //Tool->Assistant
                @JsonSubTypes.Type(name = "TOOL_RESULT", value = ToolResultBlock.class),
        }
)
public abstract class ContentBlock {
    private final ContentBlockType type;

    public abstract <T> T accept(ContentBlockVisitor<T> visitor);
}
