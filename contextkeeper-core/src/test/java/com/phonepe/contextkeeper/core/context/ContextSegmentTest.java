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

import org.junit.jupiter.api.Test;

import com.phonepe.contextkeeper.core.TestUtils;
import com.phonepe.contextkeeper.core.llm.Message;
import com.phonepe.contextkeeper.core.tokens.TokenCounter;
import com.phonepe.contextkeeper.core.utils.JsonUtils;

import lombok.SneakyThrows;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextSegmentTest {

    @Test
    void testTokenCountIsMemoizedPerModel() {
        final var counter = mock(TokenCounter.class);
        when(counter.countMessages(eq("model-a"), anyList())).thenReturn(42);
        when(counter.countMessages(eq("model-b"), anyList())).thenReturn(7);
        final var segment = ContextSegment.chat(List.of(Message.user("hello")));

        assertFalse(segment.cachedTokenCount().isPresent());
        assertEquals(42, segment.tokenCount("model-a", counter));
        assertEquals(42, segment.tokenCount("model-a", counter));
        verify(counter, times(1)).countMessages(eq("model-a"), anyList());
        assertEquals(42, segment.cachedTokenCount().getAsInt());

        assertEquals(7, segment.tokenCount("model-b", counter));
        verify(counter, times(1)).countMessages(eq("model-b"), anyList());
    }

    @Test
    void testWithSequenceKeepsCount() {
        final var counter = mock(TokenCounter.class);
        when(counter.countMessages(eq("m"), anyList())).thenReturn(10);
        final var segment = ContextSegment.toolExchange(List.of(TestUtils.userToolResult("t1")));
        segment.tokenCount("m", counter);

        final var restamped = segment.withSequence(5);
        assertEquals(5, restamped.getSequence());
        assertEquals(0, segment.getSequence());
        assertEquals(10, restamped.cachedTokenCount().getAsInt());
        assertEquals(10, restamped.tokenCount("m", counter));
        verify(counter, times(1)).countMessages(eq("m"), anyList());
    }

    @Test
    void testSystemSegment() {
        final var segment = ContextSegment.system("You are a coding assistant");
        assertEquals(SegmentKind.SYSTEM, segment.getKind());
        assertEquals(List.of(Message.user("You are a coding assistant")), segment.getMessages());
        assertEquals(0, segment.getSequence());
        assertEquals("You are a coding assistant".length(),
                     segment.tokenCount("m", new TestUtils.CharTokenCounter()));
    }

    @Test
    void testMessagesAreImmutable() {
        final var segment = ContextSegment.chat(List.of(Message.user("a")));
        assertThrows(UnsupportedOperationException.class, () -> segment.getMessages().add(Message.user("b")));
        assertTrue(ContextSegment.of(SegmentKind.SUMMARY, null).getMessages().isEmpty());
    }

    @Test
    @SneakyThrows
    void testSerialization() {
        final var mapper = JsonUtils.createMapper();
        final var segment = new ContextSegment(SegmentKind.CHAT_HISTORY,
                                               List.of(Message.user("read a.txt"),
                                                       TestUtils.assistantToolUse("t1")),
                                               3);
        segment.tokenCount("m", new TestUtils.CharTokenCounter());

        final var json = mapper.writeValueAsString(segment);
        assertFalse(json.contains("cachedTokenCount"));
        final var parsed = mapper.readValue(json, ContextSegment.class);
        assertEquals(segment, parsed);
        assertFalse(parsed.cachedTokenCount().isPresent());
    }
}
