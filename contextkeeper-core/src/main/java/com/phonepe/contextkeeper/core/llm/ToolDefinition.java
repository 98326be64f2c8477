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

import com.phonepe.contextkeeper.core.utils.JsonUtils;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Declaration of a tool that the model is allowed to call
 */
@Value
@With
@Builder
@Jacksonized
public class ToolDefinition {
    @NonNull
    String name;

    @NonNull
    String description;

    /**
     * JSON schema for the input parameters
     */
    @NonNull
    JsonNode inputSchema;

    /**
     * Declare a tool whose input schema is generated from the given parameter class
     */
    public static ToolDefinition forInput(String name, String description, Class<?> inputType) {
        return new ToolDefinition(name, description, JsonUtils.schema(inputType));
    }
}
