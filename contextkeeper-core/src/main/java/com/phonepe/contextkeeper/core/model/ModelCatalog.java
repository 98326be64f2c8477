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

import com.google.common.base.Strings;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Catalog of known models with their context window sizes and token counting strategy.
 * <p>
 * Lookups never fail. Unknown models get {@link ModelInfo#fallback(String)}.
 */
@Slf4j
public class ModelCatalog {
    private static final int VERSIONLESS_NAME_PARTS = 3;

    private final Map<String, ModelInfo> models = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ModelCatalog() {
        this(true);
    }

    public ModelCatalog(boolean seedDefaults) {
        if (seedDefaults) {
            seedDefaults();
        }
    }

    /**
     * Find a model by name. Exact matches win. Otherwise a prefix match is attempted so that version-less names
     * (claude-sonnet-4) and dated names (gpt-4o-2024-08-06) resolve to a registered model. Among prefix matches
     * the longest matched prefix wins; ties go to the model registered first.
     */
    public Optional<ModelInfo> get(final String model) {
        if (Strings.isNullOrEmpty(model)) {
            return Optional.empty();
        }
        final var readLock = lock.readLock();
        readLock.lock();
        try {
            final var exact = models.get(model);
            if (null != exact) {
                return Optional.of(exact);
            }
            ModelInfo best = null;
            var bestLength = 0;
            for (final var entry : models.entrySet()) {
                final var name = entry.getKey();
                final var matchLength = prefixMatchLength(name, model);
                if (matchLength > bestLength) {
                    best = entry.getValue();
                    bestLength = matchLength;
                }
            }
            return Optional.ofNullable(best);
        }
        finally {
            readLock.unlock();
        }
    }

    public ModelInfo infoFor(final String model) {
        return get(model).orElseGet(() -> {
            log.debug("Model {} not found in catalog. Using heuristic defaults", model);
            return ModelInfo.fallback(Objects.requireNonNullElse(model, ""));
        });
    }

    public void register(final ModelInfo info) {
        final var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            models.put(info.getName(), info);
        }
        finally {
            writeLock.unlock();
        }
    }

    public List<String> list() {
        final var readLock = lock.readLock();
        readLock.lock();
        try {
            return List.copyOf(models.keySet());
        }
        finally {
            readLock.unlock();
        }
    }

    public List<String> providers() {
        return snapshot().stream()
                .map(ModelInfo::getProvider)
                .distinct()
                .sorted()
                .toList();
    }

    public List<String> modelsForProvider(final String provider) {
        return snapshot().stream()
                .filter(info -> info.getProvider().equals(provider))
                .map(ModelInfo::getName)
                .sorted()
                .toList();
    }

    private List<ModelInfo> snapshot() {
        final var readLock = lock.readLock();
        readLock.lock();
        try {
            return new ArrayList<>(models.values());
        }
        finally {
            readLock.unlock();
        }
    }

    private static int prefixMatchLength(final String registered, final String requested) {
        if (registered.startsWith(requested)) {
            return requested.length();
        }
        final var parts = registered.split("-");
        final var versionless = String.join("-",
                                            List.of(parts).subList(0, Math.min(parts.length,
                                                                               VERSIONLESS_NAME_PARTS)));
        return requested.startsWith(versionless) ? versionless.length() : 0;
    }

    private void seedDefaults() {
        // Anthropic
        register(ModelInfo.of("claude-opus-4-5-20251101", 200_000, 16_384, TokenizerKind.CLAUDE, "anthropic")
                         .withSupportsThinking(true));
        register(ModelInfo.of("claude-sonnet-4-5-20250929", 200_000, 16_384, TokenizerKind.CLAUDE, "anthropic")
                         .withSupportsThinking(true));
        register(ModelInfo.of("claude-haiku-4-5-20251001", 200_000, 8_192, TokenizerKind.CLAUDE, "anthropic")
                         .withSupportsThinking(true));
        register(ModelInfo.of("claude-sonnet-4-20250514", 200_000, 8_192, TokenizerKind.CLAUDE, "anthropic")
                         .withSupportsThinking(true));
        register(ModelInfo.of("claude-opus-4-20250514", 200_000, 8_192, TokenizerKind.CLAUDE, "anthropic")
                         .withSupportsThinking(true));
        register(ModelInfo.of("claude-3-5-sonnet-20241022", 200_000, 8_192, TokenizerKind.CLAUDE, "anthropic"));
        register(ModelInfo.of("claude-3-5-haiku-20241022", 200_000, 8_192, TokenizerKind.CLAUDE, "anthropic"));
        register(ModelInfo.of("claude-3-opus-20240229", 200_000, 4_096, TokenizerKind.CLAUDE, "anthropic"));
        register(ModelInfo.of("claude-3-haiku-20240307", 200_000, 4_096, TokenizerKind.CLAUDE, "anthropic"));

        // OpenAI
        register(ModelInfo.of("gpt-5.2-2025-12-11", 256_000, 32_768, TokenizerKind.GPT_LIKE, "openai"));
        register(ModelInfo.of("gpt-5.2-pro-2025-12-11", 256_000, 32_768, TokenizerKind.GPT_LIKE, "openai")
                         .withSupportsThinking(true));
        register(ModelInfo.of("gpt-5-mini-2025-08-07", 128_000, 16_384, TokenizerKind.GPT_LIKE, "openai"));
        register(ModelInfo.of("gpt-4o", 128_000, 16_384, TokenizerKind.GPT_LIKE, "openai"));
        register(ModelInfo.of("gpt-4o-mini", 128_000, 16_384, TokenizerKind.GPT_LIKE, "openai"));
        register(ModelInfo.of("gpt-4-turbo", 128_000, 4_096, TokenizerKind.GPT_LIKE, "openai"));
        register(ModelInfo.of("o1", 200_000, 100_000, TokenizerKind.GPT_LIKE, "openai")
                         .withSupportsThinking(true));
        register(ModelInfo.of("o1-mini", 128_000, 65_536, TokenizerKind.GPT_LIKE, "openai")
                         .withSupportsThinking(true));
        register(ModelInfo.of("o3-mini", 200_000, 100_000, TokenizerKind.GPT_LIKE, "openai")
                         .withSupportsThinking(true));

        // Google
        register(ModelInfo.of("gemini-2.5-flash", 1_000_000, 8_192, TokenizerKind.GEMINI, "gemini"));
        register(ModelInfo.of("gemini-2.5-pro", 1_000_000, 8_192, TokenizerKind.GEMINI, "gemini")
                         .withSupportsThinking(true));
        register(ModelInfo.of("gemini-2.0-flash", 1_000_000, 8_192, TokenizerKind.GEMINI, "gemini"));
        register(ModelInfo.of("gemini-1.5-pro", 2_000_000, 8_192, TokenizerKind.GEMINI, "gemini"));
        register(ModelInfo.of("gemini-1.5-flash", 1_000_000, 8_192, TokenizerKind.GEMINI, "gemini"));

        // xAI
        register(ModelInfo.of("grok-4", 256_000, 32_768, TokenizerKind.GPT_LIKE, "grok")
                         .withSupportsThinking(true));
        register(ModelInfo.of("grok-4-fast-reasoning", 2_000_000, 32_768, TokenizerKind.GPT_LIKE, "grok")
                         .withSupportsThinking(true));
        register(ModelInfo.of("grok-4-fast-non-reasoning", 2_000_000, 32_768, TokenizerKind.GPT_LIKE, "grok"));
        register(ModelInfo.of("grok-4-1-fast-reasoning", 2_000_000, 32_768, TokenizerKind.GPT_LIKE, "grok")
                         .withSupportsThinking(true));
        register(ModelInfo.of("grok-4-1-fast-non-reasoning", 2_000_000, 32_768, TokenizerKind.GPT_LIKE, "grok"));
        register(ModelInfo.of("grok-code-fast-1", 256_000, 32_768, TokenizerKind.GPT_LIKE, "grok")
                         .withSupportsThinking(true));
        register(ModelInfo.of("grok-3", 131_072, 16_384, TokenizerKind.GPT_LIKE, "grok"));
        register(ModelInfo.of("grok-3-mini", 131_072, 16_384, TokenizerKind.GPT_LIKE, "grok"));
        register(ModelInfo.of("grok-2-1212", 131_072, 8_192, TokenizerKind.GPT_LIKE, "grok"));
        register(ModelInfo.of("grok-2-vision-1212", 32_768, 8_192, TokenizerKind.GPT_LIKE, "grok"));

        // Groq
        register(ModelInfo.of("llama-3.3-70b-versatile", 128_000, 8_192, TokenizerKind.GPT_LIKE, "groq"));
        register(ModelInfo.of("llama-3.1-70b-versatile", 128_000, 8_192, TokenizerKind.GPT_LIKE, "groq"));
        register(ModelInfo.of("llama-3.1-8b-instant", 128_000, 8_192, TokenizerKind.GPT_LIKE, "groq"));
        register(ModelInfo.of("mixtral-8x7b-32768", 32_768, 4_096, TokenizerKind.GPT_LIKE, "groq"));
        register(ModelInfo.of("gemma2-9b-it", 8_192, 4_096, TokenizerKind.GPT_LIKE, "groq"));
    }
}
