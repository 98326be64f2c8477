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

import com.fasterxml.jackson.annotation.JsonIgnore;

import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.tokens.TokenCounter;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.NonFinal;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A typed, ordered group of messages with a position in the thread.
 * <p>
 * Segments are immutable. The only mutable state is the memoized token count, which is a pure cache fill.
 */
@Value
public class ContextSegment {
    @NonNull
    SegmentKind kind;

    List<Message> messages;

    /**
     * Position in the owning thread. Assigned by the thread on append
     */
    long sequence;

    @NonFinal
    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    transient volatile CachedTokenCount cachedTokenCount;

    @Builder
    @Jacksonized
    public ContextSegment(@NonNull SegmentKind kind, List<Message> messages, long sequence) {
        this.kind = kind;
        this.messages = List.copyOf(Objects.requireNonNullElseGet(messages, List::of));
        this.sequence = sequence;
    }

    public static ContextSegment of(SegmentKind kind, List<Message> messages) {
        return new ContextSegment(kind, messages, 0);
    }

    /**
     * System text as a segment. The request builder places the system prompt separately; this is meant for
     * threads that persist prompts alongside the conversation.
     */
    public static ContextSegment system(String text) {
        return of(SegmentKind.SYSTEM, List.of(Message.user(text)));
    }

    public static ContextSegment chat(List<Message> messages) {
        return of(SegmentKind.CHAT_HISTORY, messages);
    }

    public static ContextSegment toolExchange(List<Message> messages) {
        return of(SegmentKind.TOOL_EXCHANGE, messages);
    }

    public ContextSegment withSequence(long sequence) {
        if (this.sequence == sequence) {
            return this;
        }
        final var copy = new ContextSegment(kind, messages, sequence);
        copy.cachedTokenCount = cachedTokenCount;
        return copy;
    }

    /**
     * Token cost of this segment for the given model. Computed once per model and counter, then memoized.
     */
    public int tokenCount(final String model, final TokenCounter counter) {
        final var cached = cachedTokenCount;
        if (cached != null && cached.counter() == counter && Objects.equals(cached.model(), model)) {
            return cached.tokens();
        }
        final var tokens = counter.countMessages(model, messages);
        cachedTokenCount = new CachedTokenCount(model, counter, tokens);
        return tokens;
    }

    /**
     * Last memoized token count, if any
     */
    public OptionalInt cachedTokenCount() {
        final var cached = cachedTokenCount;
        return cached == null ? OptionalInt.empty() : OptionalInt.of(cached.tokens());
    }

    private record CachedTokenCount(String model, TokenCounter counter, int tokens) {
    }
}
