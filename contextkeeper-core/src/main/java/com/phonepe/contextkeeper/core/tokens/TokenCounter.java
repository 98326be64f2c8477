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

package com.phonepe.contextkeeper.core.tokens;

import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.llm.ToolDefinition;

import java.util.List;

/**
 * Estimates token counts for a model.
 * Implementations must be total: unknown models degrade to a heuristic and nothing here throws.
 * The default implementation is {@link DefaultTokenCounter}. Providers with a counting endpoint can plug in a
 * precise implementation.
 */
public interface TokenCounter {
    /**
     * Count tokens in raw text
     *
     * @param model Model identifier
     * @param text  Text to count. Null is treated as empty
     * @return Number of tokens
     */
    int countText(final String model, final String text);

    /**
     * Count tokens in a batch of messages, including per message and per batch overheads
     *
     * @param model    Model identifier
     * @param messages Messages to count tokens in
     * @return Number of tokens in the messages
     */
    int countMessages(final String model, final List<Message> messages);

    /**
     * Count tokens needed to declare the given tools to the model
     */
    int countTools(final String model, final List<ToolDefinition> tools);
}
