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

import com.phonepe.contextkeeper.core.llm.LlmRequest;
import com.phonepe.contextkeeper.core.llm.ToolDefinition;
import com.phonepe.contextkeeper.core.model.ModelCatalog;
import com.phonepe.contextkeeper.core.tokens.TokenCounter;
import com.phonepe.contextkeeper.core.utils.ContextUtils;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Builds requests that fit in the context window of the target model.
 * <p>
 * Tool declarations and the last turn are always sent. The system prompt is replaced by the short one, or dropped if
 * there is none, when it does not fit along with them. The remaining budget is filled greedily with
 * older segments, newest first. A segment that does not fit is skipped and older, smaller segments are still
 * considered. Budgeting never throws; running short of budget shows up as {@link BuiltContext#isTruncated()}.
 */
@Slf4j
public class ContextManager {
    private final ModelCatalog catalog;
    private final TokenCounter counter;
    private final ContextConfig config;

    public ContextManager(@NonNull ModelCatalog catalog, @NonNull TokenCounter counter) {
        this(catalog, counter, ContextConfig.DEFAULT);
    }

    public ContextManager(@NonNull ModelCatalog catalog,
                          @NonNull TokenCounter counter,
                          @NonNull ContextConfig config) {
        this.catalog = catalog;
        this.counter = counter;
        this.config = config;
    }

    public BuiltContext buildRequest(@NonNull final BuildContextParams params) {
        final var model = params.getModel();
        final var modelInfo = catalog.infoFor(model);
        final var maxOutput = Objects.requireNonNullElse(params.getMaxOutputTokens(),
                                                         modelInfo.getDefaultMaxOutputTokens());
        final var budget = budget(modelInfo.getMaxContextTokens(), maxOutput);

        final var systemTokens = counter.countText(model, params.getSystemPrompt());
        final var tools = Objects.requireNonNullElse(params.getTools(), List.<ToolDefinition>of());
        final var toolsTokens = counter.countTools(model, tools);

        final var split = LastTurnSplitter.split(Objects.requireNonNullElse(params.getSegments(),
                                                                           List.<ContextSegment>of()));
        final var lastTurnTokens = split.getLastTurn()
                .stream()
                .mapToInt(segment -> segment.tokenCount(model, counter))
                .sum();

        var systemPrompt = params.getSystemPrompt();
        var systemUsedTokens = systemTokens;
        var shortPromptUsed = false;
        if (systemTokens + toolsTokens + lastTurnTokens > budget) {
            // An absent short prompt means no system text at all
            systemPrompt = params.getShortSystemPrompt();
            systemUsedTokens = counter.countText(model, systemPrompt);
            shortPromptUsed = true;
            log.warn("Mandatory content for model {} needs {} tokens against a budget of {}. "
                             + "Switching to {}",
                     model, systemTokens + toolsTokens + lastTurnTokens, budget,
                     systemPrompt == null ? "no system prompt" : "short system prompt");
        }

        var remaining = ContextUtils.saturatingSub(budget, systemUsedTokens + toolsTokens + lastTurnTokens);

        final var candidates = new ArrayList<>(split.getOlder());
        candidates.sort(Comparator.comparingLong(ContextSegment::getSequence).reversed());

        final var included = new ArrayList<ContextSegment>();
        var dropped = 0;
        for (final var segment : candidates) {
            final var segmentTokens = segment.tokenCount(model, counter);
            if (segmentTokens <= remaining) {
                included.add(segment);
                remaining = ContextUtils.saturatingSub(remaining, segmentTokens);
            }
            else {
                dropped++;
            }
        }

        for (final var orphaned : unpairedSegments(included, split.getLastTurn())) {
            included.remove(orphaned);
            remaining += orphaned.tokenCount(model, counter);
            dropped++;
        }

        Collections.reverse(included);

        final var messages = Stream.concat(included.stream(), split.getLastTurn().stream())
                .flatMap(segment -> segment.getMessages().stream())
                .toList();

        final var totalTokens = ContextUtils.saturatingSub(budget, remaining);
        log.debug("Built request for model {}: budget: {}, used: {}, included: {}, dropped: {}",
                  model, budget, totalTokens, included.size() + split.getLastTurn().size(), dropped);
        return BuiltContext.builder()
                .request(LlmRequest.builder()
                                 .model(model)
                                 .system(systemPrompt)
                                 .messages(messages)
                                 .tools(List.copyOf(tools))
                                 .maxTokens(maxOutput)
                                 .stream(true)
                                 .build())
                .totalTokens(totalTokens)
                .budget(budget)
                .truncated(dropped > 0)
                .segmentsIncluded(included.size() + split.getLastTurn().size())
                .segmentsDropped(dropped)
                .shortSystemPromptUsed(shortPromptUsed)
                .build();
    }

    /**
     * Tokens available for outbound content: context window minus output reservation minus safety margin
     */
    public int budget(int maxContextTokens, int maxOutputTokens) {
        final var safetyBuffer = (int) ((long) maxContextTokens * config.getSafetyMarginPercent() / 100);
        return ContextUtils.saturatingSub(ContextUtils.saturatingSub(maxContextTokens, maxOutputTokens),
                                          safetyBuffer);
    }

    /**
     * Greedy selection can keep a tool result while dropping the assistant message that asked for it, or the
     * other way round. Providers reject such requests, so selected segments with a tool use or result whose
     * counterpart is not being sent are removed until the selection is consistent. The last turn is never
     * touched.
     */
    private static List<ContextSegment> unpairedSegments(final List<ContextSegment> selected,
                                                         final List<ContextSegment> lastTurn) {
        final var kept = new ArrayList<>(selected);
        final var removed = new ArrayList<ContextSegment>();
        var changed = true;
        while (changed) {
            final var retained = new ArrayList<ContextSegment>(kept);
            retained.addAll(lastTurn);
            final var useIds = ToolPairing.toolUseIds(retained);
            final var resultIds = ToolPairing.toolResultIds(retained);
            final var unpaired = kept.stream()
                    .filter(segment -> !ToolPairing.toolResultIds(List.of(segment)).stream().allMatch(useIds::contains)
                            || !ToolPairing.toolUseIds(List.of(segment)).stream().allMatch(resultIds::contains))
                    .toList();
            changed = !unpaired.isEmpty();
            kept.removeAll(unpaired);
            removed.addAll(unpaired);
        }
        if (!removed.isEmpty()) {
            log.debug("Removed {} segments with unpaired tool calls from selection", removed.size());
        }
        return removed;
    }
}
