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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelCatalogTest {

    private final ModelCatalog catalog = new ModelCatalog();

    @Test
    void testExactMatch() {
        final var info = catalog.infoFor("claude-sonnet-4-5-20250929");
        assertEquals("claude-sonnet-4-5-20250929", info.getName());
        assertEquals(200_000, info.getMaxContextTokens());
        assertEquals(16_384, info.getDefaultMaxOutputTokens());
        assertEquals(TokenizerKind.CLAUDE, info.getTokenizer());
        assertEquals("anthropic", info.getProvider());
    }

    @Test
    void testPrefixMatchPrefersLongestMatch() {
        final var info = catalog.get("claude-sonnet-4-5").orElseThrow();
        assertEquals("claude-sonnet-4-5-20250929", info.getName());
    }

    @Test
    void testVersionedQueryMatchesBaseModel() {
        final var info = catalog.get("gpt-4o-2024-08-06").orElseThrow();
        assertEquals("gpt-4o", info.getName());
        assertEquals(TokenizerKind.GPT_LIKE, info.getTokenizer());
    }

    @Test
    void testUnknownModelFallsBackToDefaults() {
        assertFalse(catalog.get("totally-unknown-model").isPresent());
        final var info = catalog.infoFor("totally-unknown-model");
        assertEquals("totally-unknown-model", info.getName());
        assertEquals(ModelInfo.DEFAULT_CONTEXT_WINDOW, info.getMaxContextTokens());
        assertEquals(ModelInfo.DEFAULT_MAX_OUTPUT, info.getDefaultMaxOutputTokens());
        assertEquals(TokenizerKind.HEURISTIC, info.getTokenizer());
        assertEquals(ModelInfo.UNKNOWN_PROVIDER, info.getProvider());
    }

    @Test
    void testBlankModel() {
        assertFalse(catalog.get(null).isPresent());
        assertFalse(catalog.get("").isPresent());
        assertEquals(ModelInfo.DEFAULT_CONTEXT_WINDOW, catalog.infoFor(null).getMaxContextTokens());
    }

    @Test
    void testRegisterOverridesAndAdds() {
        final var empty = new ModelCatalog(false);
        assertTrue(empty.list().isEmpty());
        empty.register(ModelInfo.of("local-model", 8_000, 1_000, TokenizerKind.HEURISTIC, "local"));
        assertEquals(List.of("local-model"), empty.list());
        empty.register(ModelInfo.of("local-model", 16_000, 1_000, TokenizerKind.HEURISTIC, "local"));
        assertEquals(16_000, empty.infoFor("local-model").getMaxContextTokens());
        assertEquals(1, empty.list().size());
    }

    @Test
    void testProviders() {
        assertEquals(List.of("anthropic", "gemini", "grok", "groq", "openai"), catalog.providers());
        final var groqModels = catalog.modelsForProvider("groq");
        assertEquals(List.of("gemma2-9b-it",
                             "llama-3.1-70b-versatile",
                             "llama-3.1-8b-instant",
                             "llama-3.3-70b-versatile",
                             "mixtral-8x7b-32768"),
                     groqModels);
        assertTrue(catalog.modelsForProvider("nobody").isEmpty());
    }
}
