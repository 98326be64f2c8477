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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import com.phonepe.contextkeeper.core.llm.results.ImageToolResult;
import com.phonepe.contextkeeper.core.llm.results.JsonToolResult;
import com.phonepe.contextkeeper.core.llm.results.TextToolResult;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Payload of a tool result. Tools can return plain text, structured json or an image.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "contentType")
@JsonSubTypes(
        {
                @JsonSubTypes.Type(name = "TEXT", value = TextToolResult.class),
                @JsonSubTypes.Type(name = "JSON", value = JsonToolResult.class),
                @JsonSubTypes.Type(name = "IMAGE", value = ImageToolResult.class),
        }
)
public abstract class ToolResultContent {
    private final ToolResultContentType contentType;

    public abstract <T> T accept(ToolResultContentVisitor<T> visitor);
}
