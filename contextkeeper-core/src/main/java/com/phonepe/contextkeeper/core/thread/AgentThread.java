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

package com.phonepe.contextkeeper.core.thread;

import com.phonepe.contextkeeper.core.context.ContextSegment;
import com.phonepe.contextkeeper.core.utils.ContextUtils;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A conversation with an agent, stored as an ordered log of typed segments. Every appended segment gets the next
 * sequence number of the thread.
 */
@Getter
@ToString
public class AgentThread {
    public static final String DEFAULT_TITLE = "New conversation";

    private String id;
    private String title;
    private String model;
    @ToString.Exclude
    private final List<ContextSegment> segments;
    private final long createdAt;
    private long updatedAt;
    private long nextSequence;
    private final Map<String, String> metadata;

    public AgentThread(@NonNull String model) {
        this(null, null, model, null, 0, 0, 0, null);
    }

    @Builder
    @Jacksonized
    private AgentThread(String id,
                        String title,
                        @NonNull String model,
                        List<ContextSegment> segments,
                        long createdAt,
                        long updatedAt,
                        long nextSequence,
                        Map<String, String> metadata) {
        final var now = ContextUtils.epochMicro();
        this.id = Objects.requireNonNullElseGet(id, ContextUtils::newThreadId);
        this.title = Objects.requireNonNullElse(title, DEFAULT_TITLE);
        this.model = model;
        this.segments = new ArrayList<>(Objects.requireNonNullElseGet(segments, List::of));
        this.createdAt = createdAt > 0 ? createdAt : now;
        this.updatedAt = updatedAt > 0 ? updatedAt : this.createdAt;
        this.nextSequence = nextSequence;
        this.metadata = new LinkedHashMap<>(Objects.requireNonNullElseGet(metadata, Map::of));
    }

    /**
     * Appends a segment, overwriting whatever sequence it carries with the next one from this thread.
     *
     * @return The sequence assigned to the segment
     */
    public long addSegment(@NonNull final ContextSegment segment) {
        final var sequence = nextSequence++;
        segments.add(segment.withSequence(sequence));
        touch();
        return sequence;
    }

    public long peekSequence() {
        return nextSequence;
    }

    public void clear() {
        segments.clear();
        nextSequence = 0;
        touch();
    }

    public void setModel(@NonNull String model) {
        this.model = model;
        touch();
    }

    public void setTitle(@NonNull String title) {
        this.title = title;
        touch();
    }

    public AgentThread withTitle(@NonNull String title) {
        this.title = title;
        return this;
    }

    public AgentThread withId(@NonNull String id) {
        this.id = id;
        return this;
    }

    public List<ContextSegment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(@NonNull String key, String value) {
        metadata.put(key, value);
        touch();
    }

    /**
     * Independent copy. Segments are immutable and shared.
     */
    public AgentThread copy() {
        return new AgentThread(id, title, model, segments, createdAt, updatedAt, nextSequence, metadata);
    }

    void replaceSegments(final List<ContextSegment> replacement) {
        segments.clear();
        segments.addAll(replacement);
    }

    void touch() {
        updatedAt = Math.max(updatedAt + 1, ContextUtils.epochMicro());
    }
}
