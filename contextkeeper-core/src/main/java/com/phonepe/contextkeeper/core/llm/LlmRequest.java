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

package com.phonepe.contextkeeper.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Map;

/**
 * Provider agnostic request, ready to be handed over to a transport
 */
@Value
@Builder
@With
public class LlmRequest {
    String model;

    /**
     * System prompt. Providers place this appropriately
     */
    String system;

    @Builder.Default
    List<Message> messages = List.of();

    @Builder.Default
    List<ToolDefinition> tools = List.of();

    /**
     * Maximum tokens to generate
     */
    @Builder.Default
    Integer maxTokens = 4096;

    Float temperature;

    @Builder.Default
    boolean stream = true;

    ThinkingConfig thinking;

    /**
     * Provider specific options
     */
    @Builder.Default
    Map<String, JsonNode> extra = Map.of();
}
