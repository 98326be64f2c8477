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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Prompt and tool parameters for building a request out of a thread. Model and segments come from the thread.
 */
@Value
@Builder
public class BuildContextOptions {
    String systemPrompt;

    String shortSystemPrompt;

    @Singular
    List<ToolDefinition> tools;

    Integer maxOutputTokens;
}
