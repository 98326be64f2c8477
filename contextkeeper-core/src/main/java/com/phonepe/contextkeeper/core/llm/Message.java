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

import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * A message in the conversation
 */
@Value
public class Message {
    @NonNull
    Role role;

    /**
     * Ordered content blocks. Never null, may be empty
     */
    List<ContentBlock> content;

    @Builder
    @Jacksonized
    public Message(@NonNull Role role, List<ContentBlock> content) {
        this.role = role;
        this.content = List.copyOf(Objects.requireNonNullElseGet(content, List::of));
    }

    public static Message user(String text) {
        return new Message(Role.USER, List.of(new TextBlock(text)));
    }

    public static Message assistant(String text) {
        return new Message(Role.ASSISTANT, List.of(new TextBlock(text)));
    }

    public static Message of(Role role, ContentBlock... blocks) {
        return new Message(role, List.of(blocks));
    }
}
