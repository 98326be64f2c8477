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

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Finds the trailing span of segments that forms the current turn.
 * <p>
 * Scans backwards from the newest segment. Tool exchanges extend the span and open a tool run. A chat segment
 * extends the span; outside a tool run it is the start of the turn, inside one it closes the run and the scan
 * goes on so that the assistant message carrying the tool calls and the user message before it stay together.
 * Any other kind ends the scan outside a tool run and is skipped inside one.
 */
@UtilityClass
public class LastTurnSplitter {

    public static SegmentSplit split(final List<ContextSegment> segments) {
        if (segments.isEmpty()) {
            return new SegmentSplit(List.of(), List.of());
        }
        var lastTurnStart = segments.size();
        var inToolSequence = false;
        for (int i = segments.size() - 1; i >= 0; i--) {
            final var kind = segments.get(i).getKind();
            if (kind == SegmentKind.TOOL_EXCHANGE) {
                inToolSequence = true;
                lastTurnStart = i;
            }
            else if (kind == SegmentKind.CHAT_HISTORY) {
                lastTurnStart = i;
                if (!inToolSequence) {
                    break;
                }
                inToolSequence = false;
            }
            else if (!inToolSequence) {
                break;
            }
        }
        return new SegmentSplit(List.copyOf(segments.subList(lastTurnStart, segments.size())),
                                List.copyOf(segments.subList(0, lastTurnStart)));
    }
}
