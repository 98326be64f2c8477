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

import com.google.common.base.Strings;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;

import com.phonepe.contextkeeper.core.llm.ContentBlock;
import com.phonepe.contextkeeper.core.llm.ContentBlockVisitor;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.llm.ToolDefinition;
import com.phonepe.contextkeeper.core.llm.ToolResultContentVisitor;
import com.phonepe.contextkeeper.core.llm.blocks.ImageBlock;
import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ThinkingBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolResultBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolUseBlock;
import com.phonepe.contextkeeper.core.llm.results.ImageToolResult;
import com.phonepe.contextkeeper.core.llm.results.JsonToolResult;
import com.phonepe.contextkeeper.core.llm.results.TextToolResult;
import com.phonepe.contextkeeper.core.model.ModelCatalog;
import com.phonepe.contextkeeper.core.model.TokenizerKind;

import lombok.NonNull;

import java.util.List;
import java.util.Objects;

/**
 * Token counter that picks the tokenizer for a model from the {@link ModelCatalog}.
 * <p>
 * Counting heuristic for messages:
 * - For each message, add a fixed overhead for role and formatting
 * - Text and thinking blocks count the text
 * - Tool use blocks count the name and the serialized input, plus a structural overhead
 * - Tool result blocks count the text or serialized json (flat image estimate for images), plus a structural overhead
 * - Image blocks count as a flat estimate
 * - Finally, add a fixed boundary overhead once for the whole batch
 */
public class DefaultTokenCounter implements TokenCounter {

    private final EncodingRegistry encodingRegistry = Encodings.newDefaultEncodingRegistry();
    private final ModelCatalog catalog;
    private final TokenCountingConfig config;

    public DefaultTokenCounter(@NonNull ModelCatalog catalog) {
        this(catalog, TokenCountingConfig.DEFAULT);
    }

    public DefaultTokenCounter(@NonNull ModelCatalog catalog, @NonNull TokenCountingConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    @Override
    public int countText(final String model, final String text) {
        return count(catalog.infoFor(model).getTokenizer(), text);
    }

    @Override
    public int countMessages(final String model, final List<Message> messages) {
        final var tokenizer = catalog.infoFor(model).getTokenizer();
        var totalTokens = 0;
        for (final var message : Objects.requireNonNullElseGet(messages, List::<Message>of)) {
            totalTokens += config.getMessageOverhead();
            for (final var block : message.getContent()) {
                totalTokens += countBlock(tokenizer, block);
            }
        }
        // Once per call, not per message
        totalTokens += config.getBatchBoundaryOverhead();
        return totalTokens;
    }

    @Override
    public int countTools(final String model, final List<ToolDefinition> tools) {
        final var tokenizer = catalog.infoFor(model).getTokenizer();
        var totalTokens = 0;
        for (final var tool : Objects.requireNonNullElseGet(tools, List::<ToolDefinition>of)) {
            totalTokens += count(tokenizer, tool.getName());
            totalTokens += count(tokenizer, tool.getDescription());
            totalTokens += count(tokenizer, tool.getInputSchema().toString());
            totalTokens += config.getPerToolOverhead();
        }
        return totalTokens;
    }

    private int countBlock(final TokenizerKind tokenizer, final ContentBlock block) {
        return block.accept(new ContentBlockVisitor<Integer>() {
            @Override
            public Integer visit(TextBlock text) {
                return count(tokenizer, text.getText());
            }

            @Override
            public Integer visit(ThinkingBlock thinking) {
                return count(tokenizer, thinking.getText());
            }

            @Override
            public Integer visit(ImageBlock image) {
                return config.getImageTokens();
            }

            @Override
            public Integer visit(ToolUseBlock toolUse) {
                final var input = toolUse.getInput() == null ? "" : toolUse.getInput().toString();
                return count(tokenizer, toolUse.getName())
                        + count(tokenizer, input)
                        + config.getToolUseOverhead();
            }

            @Override
            public Integer visit(ToolResultBlock toolResult) {
                return countToolResult(tokenizer, toolResult) + config.getToolResultOverhead();
            }
        });
    }

    private int countToolResult(final TokenizerKind tokenizer, final ToolResultBlock toolResult) {
        return toolResult.getContent().accept(new ToolResultContentVisitor<Integer>() {
            @Override
            public Integer visit(TextToolResult text) {
                return count(tokenizer, text.getText());
            }

            @Override
            public Integer visit(JsonToolResult json) {
                return count(tokenizer, json.getValue().toString());
            }

            @Override
            public Integer visit(ImageToolResult image) {
                return config.getImageTokens();
            }
        });
    }

    private int count(final TokenizerKind tokenizer, final String content) {
        if (Strings.isNullOrEmpty(content)) {
            return 0;
        }
        if (tokenizer.isHeuristic()) {
            return (content.codePointCount(0, content.length()) + 3) / 4;
        }
        return encodingRegistry.getEncoding(tokenizer.getEncodingType())
                .encodeOrdinary(content)
                .size();
    }
}
