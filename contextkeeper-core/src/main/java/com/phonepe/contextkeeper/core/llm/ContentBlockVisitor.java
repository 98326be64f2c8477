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

import com.phonepe.contextkeeper.core.llm.blocks.ImageBlock;
import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ThinkingBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolResultBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolUseBlock;

/**
 * Visitor to handle all content block types
 */
public interface ContentBlockVisitor<T> {
    T visit(TextBlock text);

    T visit(ThinkingBlock thinking);

    T visit(ImageBlock image);

    T visit(ToolUseBlock toolUse);

    T visit(ToolResultBlock toolResult);
}
