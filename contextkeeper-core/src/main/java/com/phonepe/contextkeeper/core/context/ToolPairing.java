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

package com.phonepe.contextkeeper.core.context;

import com.phonepe.contextkeeper.core.llm.ContentBlock;
import com.phonepe.contextkeeper.core.llm.ContentBlockVisitor;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.llm.Role;
import com.phonepe.contextkeeper.core.llm.blocks.ImageBlock;
import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ThinkingBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolResultBlock;
import com.phonepe.contextkeeper.core.llm.blocks.ToolUseBlock;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Extracts tool use and tool result ids from messages. Tool uses only count when emitted by the assistant, tool
 * results only when sent by the user.
 */
@UtilityClass
public class ToolPairing {

    public static Optional<String> toolUseId(final Message message, final ContentBlock block) {
        if (message.getRole() != Role.ASSISTANT) {
            return Optional.empty();
        }
        return Optional.ofNullable(block.accept(new IdExtractor() {
            @Override
            public String visit(ToolUseBlock toolUse) {
                return toolUse.getId();
            }
        }));
    }

    public static Optional<String> toolResultId(final Message message, final ContentBlock block) {
        if (message.getRole() != Role.USER) {
            return Optional.empty();
        }
        return Optional.ofNullable(block.accept(new IdExtractor() {
            @Override
            public String visit(ToolResultBlock toolResult) {
                return toolResult.getToolUseId();
            }
        }));
    }

    public static Set<String> toolUseIds(final Collection<ContextSegment> segments) {
        final var ids = new HashSet<String>();
        for (final var segment : segments) {
            for (final var message : segment.getMessages()) {
                message.getContent().forEach(block -> toolUseId(message, block).ifPresent(ids::add));
            }
        }
        return ids;
    }

    public static Set<String> toolResultIds(final Collection<ContextSegment> segments) {
        final var ids = new HashSet<String>();
        for (final var segment : segments) {
            for (final var message : segment.getMessages()) {
                message.getContent().forEach(block -> toolResultId(message, block).ifPresent(ids::add));
            }
        }
        return ids;
    }

    private abstract static class IdExtractor implements ContentBlockVisitor<String> {
        @Override
        public String visit(TextBlock text) {
            return null;
        }

        @Override
        public String visit(ThinkingBlock thinking) {
            return null;
        }

        @Override
        public String visit(ImageBlock image) {
            return null;
        }

        @Override
        public String visit(ToolUseBlock toolUse) {
            return null;
        }

        @Override
        public String visit(ToolResultBlock toolResult) {
            return null;
        }
    }
}
