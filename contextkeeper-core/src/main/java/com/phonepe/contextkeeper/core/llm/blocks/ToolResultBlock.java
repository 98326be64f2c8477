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

import com.phonepe.contextkeeper.core.llm.ContentBlock;
import com.phonepe.contextkeeper.core.llm.ContentBlockType;
import com.phonepe.contextkeeper.core.llm.ContentBlockVisitor;
import com.phonepe.contextkeeper.core.llm.ToolResultContent;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of a tool run, sent back to the model
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolResultBlock extends ContentBlock {
    /**
     * Id of the {@link ToolUseBlock} this result answers
     */
    String toolUseId;

    ToolResultContent content;

    /**
     * Set if the tool run failed
     */
    boolean error;

    @Builder
    @Jacksonized
    public ToolResultBlock(@NonNull String toolUseId, @NonNull ToolResultContent content, boolean error) {
        super(ContentBlockType.TOOL_RESULT);
        this.toolUseId = toolUseId;
        this.content = content;
        this.error = error;
    }

    @Override
    public <T> T accept(ContentBlockVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
