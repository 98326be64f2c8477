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

import com.knuddels.jtokkit.api.EncodingType;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Token counting strategy for a model family.
 * <p>
 * Claude and Gemini do not ship public BPE tokenizers usable from java. cl100k is close enough for budgeting and
 * is used for all tokenizer families.
 */
@Getter
@AllArgsConstructor
public enum TokenizerKind {
    CLAUDE(EncodingType.CL100K_BASE),
    GPT_LIKE(EncodingType.CL100K_BASE),
    GEMINI(EncodingType.CL100K_BASE),
    /**
     * Roughly four characters per token
     */
    HEURISTIC(null),
    ;

    private final EncodingType encodingType;

    public boolean isHeuristic() {
        return encodingType == null;
    }
}
