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

import com.phonepe.contextkeeper.core.llm.ToolDefinition;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Input for building a budgeted request
 */
@Value
@Builder
@With
public class BuildContextParams {
    @NonNull
    String model;

    String systemPrompt;

    /**
     * Abbreviated system prompt, used when the full one does not fit along with the mandatory content
     */
    String shortSystemPrompt;

    @Builder.Default
    List<ToolDefinition> tools = List.of();

    /**
     * All segments of the thread, ordered by sequence
     */
    @Builder.Default
    List<ContextSegment> segments = List.of();

    /**
     * Overrides the default output reservation for the model
     */
    Integer maxOutputTokens;
}
