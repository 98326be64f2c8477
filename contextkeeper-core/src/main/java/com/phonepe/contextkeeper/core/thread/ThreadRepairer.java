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
import com.phonepe.contextkeeper.core.context.ToolPairing;
import com.phonepe.contextkeeper.core.llm.ContentBlock;
import com.phonepe.contextkeeper.core.llm.Message;

import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes tool results that reference a tool use no assistant message in the thread has emitted. Such threads are
 * rejected by providers.
 * <p>
 * Messages without content and segments without messages are removed as well, including ones that were already
 * empty before the repair. These removals are not part of the returned count but do bump the update timestamp.
 */
@Slf4j
@UtilityClass
public class ThreadRepairer {

    /**
     * Repairs the thread in place. The update timestamp is bumped only if something was removed.
     *
     * @return Number of tool results removed
     */
    public static int repair(@NonNull final AgentThread thread) {
        final var segments = thread.getSegments();
        final var knownToolUses = ToolPairing.toolUseIds(segments);
        final var repaired = new ArrayList<ContextSegment>(segments.size());
        var removedResults = 0;
        var changed = false;
        for (final var segment : segments) {
            try {
                final var messages = new ArrayList<Message>(segment.getMessages().size());
                for (final var message : segment.getMessages()) {
                    final var kept = retainedBlocks(message, knownToolUses);
                    removedResults += message.getContent().size() - kept.size();
                    if (!kept.isEmpty()) {
                        messages.add(kept.size() == message.getContent().size()
                                     ? message
                                     : new Message(message.getRole(), kept));
                    }
                }
                if (messages.isEmpty()) {
                    log.debug("Removing segment {} of thread {} as it has no content left",
                              segment.getSequence(), thread.getId());
                    changed = true;
                    continue;
                }
                if (messages.size() != segment.getMessages().size() || !messages.equals(segment.getMessages())) {
                    changed = true;
                    repaired.add(new ContextSegment(segment.getKind(), messages, segment.getSequence()));
                }
                else {
                    repaired.add(segment);
                }
            }
            catch (RuntimeException e) {
                log.warn("Skipping malformed segment {} of thread {}: {}",
                         segment.getSequence(), thread.getId(), e.getMessage());
                repaired.add(segment);
            }
        }
        if (changed) {
            thread.replaceSegments(repaired);
            thread.touch();
            log.info("Repaired thread {}: removed {} orphaned tool results, {} segments left",
                     thread.getId(), removedResults, repaired.size());
        }
        return removedResults;
    }

    private static List<ContentBlock> retainedBlocks(final Message message, final Set<String> knownToolUses) {
        return message.getContent()
                .stream()
                .filter(block -> ToolPairing.toolResultId(message, block)
                        .map(knownToolUses::contains)
                        .orElse(true))
                .toList();
    }
}
