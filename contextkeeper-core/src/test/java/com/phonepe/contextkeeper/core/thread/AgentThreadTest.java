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

import org.junit.jupiter.api.Test;

import com.phonepe.contextkeeper.core.context.ContextSegment;
import com.phonepe.contextkeeper.core.context.SegmentKind;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.utils.JsonUtils;

import lombok.SneakyThrows;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentThreadTest {

    @Test
    void testNewThread() {
        final var thread = new AgentThread("claude-sonnet-4-5-20250929");
        assertTrue(thread.getId().startsWith("T-"));
        assertEquals(AgentThread.DEFAULT_TITLE, thread.getTitle());
        assertEquals(0, thread.peekSequence());
        assertTrue(thread.getSegments().isEmpty());
        assertEquals(thread.getCreatedAt(), thread.getUpdatedAt());
        assertNotEquals(thread.getId(), new AgentThread("m").getId());
    }

    @Test
    void testAddSegmentAssignsSequence() {
        final var thread = new AgentThread("m");
        final var before = thread.getUpdatedAt();
        assertEquals(0, thread.addSegment(ContextSegment.chat(List.of(Message.user("a")))));
        assertEquals(1, thread.addSegment(new ContextSegment(SegmentKind.TOOL_EXCHANGE,
                                                             List.of(Message.user("b")),
                                                             42)));
        assertEquals(2, thread.peekSequence());
        assertEquals(List.of(0L, 1L), thread.getSegments().stream().map(ContextSegment::getSequence).toList());
        assertTrue(thread.getUpdatedAt() > before);
    }

    @Test
    void testSegmentsCannotBeModifiedDirectly() {
        final var thread = new AgentThread("m");
        assertThrows(UnsupportedOperationException.class,
                     () -> thread.getSegments().add(ContextSegment.chat(List.of())));
    }

    @Test
    void testClearResetsSequence() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("a"))));
        thread.addSegment(ContextSegment.chat(List.of(Message.user("b"))));
        thread.clear();
        assertTrue(thread.getSegments().isEmpty());
        assertEquals(0, thread.addSegment(ContextSegment.chat(List.of(Message.user("c")))));
    }

    @Test
    void testSettersBumpUpdateTime() {
        final var thread = new AgentThread("m").withTitle("Fix build").withId("T-fixed");
        assertEquals("Fix build", thread.getTitle());
        assertEquals("T-fixed", thread.getId());
        final var before = thread.getUpdatedAt();
        thread.setModel("gpt-4o");
        assertEquals("gpt-4o", thread.getModel());
        final var afterModel = thread.getUpdatedAt();
        assertTrue(afterModel > before);
        thread.setTitle("Renamed");
        assertTrue(thread.getUpdatedAt() > afterModel);
    }

    @Test
    void testCopyIsIndependent() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("a"))));
        thread.putMetadata("cwd", "/tmp");
        final var copy = thread.copy();
        copy.addSegment(ContextSegment.chat(List.of(Message.user("b"))));
        copy.putMetadata("cwd", "/home");
        assertEquals(1, thread.getSegments().size());
        assertEquals(1, thread.peekSequence());
        assertEquals("/tmp", thread.getMetadata().get("cwd"));
        assertEquals(2, copy.getSegments().size());
        assertEquals(thread.getId(), copy.getId());
    }

    @Test
    @SneakyThrows
    void testSerialization() {
        final var mapper = JsonUtils.createMapper();
        final var thread = new AgentThread("m").withTitle("Serialized");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("hello"), Message.assistant("hi"))));
        thread.putMetadata("key", "value");

        final var parsed = mapper.readValue(mapper.writeValueAsBytes(thread), AgentThread.class);
        assertEquals(thread.getId(), parsed.getId());
        assertEquals("Serialized", parsed.getTitle());
        assertEquals("m", parsed.getModel());
        assertEquals(thread.getSegments(), parsed.getSegments());
        assertEquals(thread.getCreatedAt(), parsed.getCreatedAt());
        assertEquals(thread.getUpdatedAt(), parsed.getUpdatedAt());
        assertEquals(1, parsed.peekSequence());
        assertEquals("value", parsed.getMetadata().get("key"));
    }
}
