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

package com.phonepe.contextkeeper.core.tokens;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Fixed overheads used while estimating token counts. All values are in tokens.
 */
@Value
@Builder
@With
public class TokenCountingConfig {

    public static final TokenCountingConfig DEFAULT = TokenCountingConfig.builder()
            .messageOverhead(4)
            .batchBoundaryOverhead(3)
            .toolUseOverhead(10)
            .toolResultOverhead(10)
            .imageTokens(1000)
            .perToolOverhead(20)
            .build();

    /**
     * Role and formatting overhead, added once per message
     */
    int messageOverhead;

    /**
     * Added once per counting call, irrespective of the number of messages
     */
    int batchBoundaryOverhead;

    /**
     * Structural overhead of a tool use block, on top of name and arguments
     */
    int toolUseOverhead;

    /**
     * Structural overhead of a tool result block, on top of the payload
     */
    int toolResultOverhead;

    /**
     * Flat estimate for an image, either as a content block or as a tool result
     */
    int imageTokens;

    /**
     * Structural overhead per declared tool, on top of name, description and schema
     */
    int perToolOverhead;
}
