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

import com.phonepe.contextkeeper.core.llm.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LastTurnSplitterTest {

    @Test
    void testEmpty() {
        final var split = LastTurnSplitter.split(List.of());
        assertTrue(split.getLastTurn().isEmpty());
        assertTrue(split.getOlder().isEmpty());
    }

    @Test
    void testLastChatIsTheTurn() {
        final var segments = segments(SegmentKind.SUMMARY, SegmentKind.CHAT_HISTORY, SegmentKind.CHAT_HISTORY);
        final var split = LastTurnSplitter.split(segments);
        assertEquals(List.of(2L), sequences(split.getLastTurn()));
        assertEquals(List.of(0L, 1L), sequences(split.getOlder()));
    }

    @Test
    void testTrailingToolExchangesStayWithTheirChat() {
        final var segments = segments(SegmentKind.CHAT_HISTORY,
                                      SegmentKind.CHAT_HISTORY,
                                      SegmentKind.REPO_CONTEXT,
                                      SegmentKind.CHAT_HISTORY,
                                      SegmentKind.TOOL_EXCHANGE,
                                      SegmentKind.TOOL_EXCHANGE);
        final var split = LastTurnSplitter.split(segments);
        // The chat reached inside the tool run is kept. Scanning continues to the REPO_CONTEXT and stops there
        assertEquals(List.of(3L, 4L, 5L), sequences(split.getLastTurn()));
        assertEquals(List.of(0L, 1L, 2L), sequences(split.getOlder()));
    }

    @Test
    void testChatInsideToolRunExtendsToPreviousChat() {
        final var segments = segments(SegmentKind.SUMMARY,
                                      SegmentKind.CHAT_HISTORY,
                                      SegmentKind.CHAT_HISTORY,
                                      SegmentKind.TOOL_EXCHANGE);
        final var split = LastTurnSplitter.split(segments);
        assertEquals(List.of(1L, 2L, 3L), sequences(split.getLastTurn()));
        assertEquals(List.of(0L), sequences(split.getOlder()));
    }

    @Test
    void testOtherKindsInsideToolRunDoNotStopScan() {
        final var segments = segments(SegmentKind.CHAT_HISTORY,
                                      SegmentKind.INSTRUCTIONS,
                                      SegmentKind.TOOL_EXCHANGE);
        final var split = LastTurnSplitter.split(segments);
        assertEquals(List.of(0L, 1L, 2L), sequences(split.getLastTurn()));
        assertTrue(split.getOlder().isEmpty());
    }

    @Test
    void testTrailingNonChatSegmentPreservesNothing() {
        final var segments = segments(SegmentKind.CHAT_HISTORY, SegmentKind.REPO_CONTEXT);
        final var split = LastTurnSplitter.split(segments);
        assertTrue(split.getLastTurn().isEmpty());
        assertEquals(List.of(0L, 1L), sequences(split.getOlder()));
    }

    @Test
    void testSplitReconstitutesInput() {
        final var kinds = List.of(SegmentKind.SYSTEM, SegmentKind.CHAT_HISTORY, SegmentKind.TOOL_EXCHANGE,
                                  SegmentKind.SUMMARY, SegmentKind.CHAT_HISTORY, SegmentKind.TOOL_EXCHANGE,
                                  SegmentKind.CHAT_HISTORY, SegmentKind.TOOL_EXCHANGE);
        for (int end = 0; end <= kinds.size(); end++) {
            final var segments = segments(kinds.subList(0, end).toArray(SegmentKind[]::new));
            final var split = LastTurnSplitter.split(segments);
            final var joined = new ArrayList<>(split.getOlder());
            joined.addAll(split.getLastTurn());
            assertEquals(segments, joined);
        }
    }

    private static List<ContextSegment> segments(SegmentKind... kinds) {
        return IntStream.range(0, kinds.length)
                .mapToObj(i -> new ContextSegment(kinds[i], List.of(Message.user("segment " + i)), i))
                .toList();
    }

    private static List<Long> sequences(List<ContextSegment> segments) {
        return segments.stream()
                .map(ContextSegment::getSequence)
                .collect(Collectors.toList());
    }
}
