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

/**
 * Kind of a context segment. Declared in order of intended retention priority, highest first.
 */
public enum SegmentKind {
    /**
     * System prompt
     */
    SYSTEM,
    /**
     * Static instructions and guidelines
     */
    INSTRUCTIONS,
    /**
     * Repository context like files and structure
     */
    REPO_CONTEXT,
    /**
     * User and assistant turns
     */
    CHAT_HISTORY,
    /**
     * Tool results, kept together with the assistant turn that requested them
     */
    TOOL_EXCHANGE,
    /**
     * Summarized older context
     */
    SUMMARY,
}
