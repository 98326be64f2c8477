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

import com.phonepe.contextkeeper.core.TestUtils;
import com.phonepe.contextkeeper.core.context.ContextSegment;
import com.phonepe.contextkeeper.core.context.ToolPairing;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.llm.Role;
import com.phonepe.contextkeeper.core.llm.blocks.TextBlock;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadRepairerTest {

    @Test
    void testOrphanedResultSegmentRemoved() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("q"), Message.assistant("a"))));
        thread.addSegment(ContextSegment.toolExchange(List.of(TestUtils.userToolResult("lost"))));
        thread.addSegment(ContextSegment.chat(List.of(Message.user("next"))));
        final var before = thread.getUpdatedAt();

        assertEquals(1, ThreadRepairer.repair(thread));
        assertEquals(2, thread.getSegments().size());
        assertEquals(List.of(0L, 2L), thread.getSegments().stream().map(ContextSegment::getSequence).toList());
        assertTrue(thread.getUpdatedAt() > before);
        assertEquals(3, thread.peekSequence());
    }

    @Test
    void testSecondRunRemovesNothing() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("q"), TestUtils.assistantToolUse("t1"))));
        thread.addSegment(ContextSegment.toolExchange(List.of(
                Message.of(Role.USER, TestUtils.toolResult("t1"), TestUtils.toolResult("ghost")))));
        thread.addSegment(ContextSegment.toolExchange(List.of(TestUtils.userToolResult("ghost-2"))));

        assertEquals(2, ThreadRepairer.repair(thread));
        final var repairedAt = thread.getUpdatedAt();
        assertEquals(0, ThreadRepairer.repair(thread));
        assertEquals(repairedAt, thread.getUpdatedAt());

        assertEquals(2, thread.getSegments().size());
        final var toolExchange = thread.getSegments().get(1);
        assertEquals(List.of(TestUtils.toolResult("t1")), toolExchange.getMessages().get(0).getContent());
        assertTrue(ToolPairing.toolUseIds(thread.getSegments())
                           .containsAll(ToolPairing.toolResultIds(thread.getSegments())));
    }

    @Test
    void testConsistentThreadUntouched() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("q"), TestUtils.assistantToolUse("t1"))));
        thread.addSegment(ContextSegment.toolExchange(List.of(TestUtils.userToolResult("t1"),
                                                              Message.assistant("done"))));
        final var segments = List.copyOf(thread.getSegments());
        final var before = thread.getUpdatedAt();

        assertEquals(0, ThreadRepairer.repair(thread));
        assertEquals(segments, thread.getSegments());
        assertEquals(before, thread.getUpdatedAt());
    }

    @Test
    void testToolUseFromUserDoesNotCount() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.of(Role.USER, TestUtils.toolUse("t1")))));
        thread.addSegment(ContextSegment.toolExchange(List.of(
                Message.of(Role.USER, TestUtils.toolResult("t1"), new TextBlock("note")))));

        assertEquals(1, ThreadRepairer.repair(thread));
        assertEquals(2, thread.getSegments().size());
        assertEquals(List.of(new TextBlock("note")), thread.getSegments().get(1).getMessages().get(0).getContent());
    }

    @Test
    void testEmptySegmentsDropped() {
        final var thread = new AgentThread("m");
        thread.addSegment(ContextSegment.chat(List.of(Message.user("q"))));
        thread.addSegment(ContextSegment.chat(List.of(new Message(Role.ASSISTANT, List.of()))));
        final var before = thread.getUpdatedAt();

        assertEquals(0, ThreadRepairer.repair(thread));
        assertEquals(1, thread.getSegments().size());
        assertTrue(thread.getUpdatedAt() > before);
    }
}
