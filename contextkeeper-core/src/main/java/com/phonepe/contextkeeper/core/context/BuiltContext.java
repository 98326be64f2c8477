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

import lombok.Builder;
import lombok.Value;

/**
 * Result of building a budgeted request
 */
@Value
@Builder
public class BuiltContext {
    /**
     * Request ready to be sent
     */
    LlmRequest request;

    /**
     * Estimated tokens used by the request
     */
    int totalTokens;

    /**
     * Token budget available for the request
     */
    int budget;

    /**
     * Set if at least one segment was left out
     */
    boolean truncated;

    int segmentsIncluded;

    int segmentsDropped;

    /**
     * Set if the full system prompt did not fit and the short one, possibly absent, was sent instead
     */
    boolean shortSystemPromptUsed;
}
