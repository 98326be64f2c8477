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

package com.phonepe.contextkeeper.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Metadata about a specific model
 */
@Value
@Builder
@With
public class ModelInfo {
    public static final int DEFAULT_CONTEXT_WINDOW = 128_000;
    public static final int DEFAULT_MAX_OUTPUT = 4_096;
    public static final String UNKNOWN_PROVIDER = "unknown";

    /**
     * Model identifier, for example claude-sonnet-4-20250514
     */
    @NonNull
    String name;

    /**
     * Size of the context window in tokens
     */
    int maxContextTokens;

    /**
     * Output tokens reserved when the caller does not specify a limit
     */
    int defaultMaxOutputTokens;

    @NonNull
    @Builder.Default
    TokenizerKind tokenizer = TokenizerKind.HEURISTIC;

    @Builder.Default
    boolean supportsTools = true;

    boolean supportsThinking;

    @NonNull
    @Builder.Default
    String provider = UNKNOWN_PROVIDER;

    public static ModelInfo of(String name,
                               int maxContextTokens,
                               int defaultMaxOutputTokens,
                               TokenizerKind tokenizer,
                               String provider) {
        return ModelInfo.builder()
                .name(name)
                .maxContextTokens(maxContextTokens)
                .defaultMaxOutputTokens(defaultMaxOutputTokens)
                .tokenizer(tokenizer)
                .provider(provider)
                .build();
    }

    /**
     * Conservative defaults used for models missing from the catalog
     */
    public static ModelInfo fallback(String name) {
        return of(name, DEFAULT_CONTEXT_WINDOW, DEFAULT_MAX_OUTPUT, TokenizerKind.HEURISTIC, UNKNOWN_PROVIDER);
    }
}
