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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Image payload, either inline or by reference
 */
@Value
@Builder
@Jacksonized
public class ImageContent {
    public enum SourceType {
        BASE64,
        URL,
    }

    @NonNull
    SourceType sourceType;

    /**
     * Base64 encoded bytes or the url, depending on {@link #sourceType}
     */
    @NonNull
    String data;

    String mediaType;

    public static ImageContent base64(String data, String mediaType) {
        return new ImageContent(SourceType.BASE64, data, mediaType);
    }

    public static ImageContent url(String url) {
        return new ImageContent(SourceType.URL, url, null);
    }
}
