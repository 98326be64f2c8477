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

package com.phonepe.contextkeeper.core.transport;

import com.fasterxml.jackson.databind.JsonNode;

import com.phonepe.contextkeeper.core.errors.ContextKeeperError;
import com.phonepe.contextkeeper.core.errors.ErrorType;

import lombok.Value;

import java.util.List;

/**
 * Output events of a request as received from the provider, or the error that ended it. Events are not interpreted
 * here.
 */
@Value
public class TransportResponse {
    List<JsonNode> events;
    ContextKeeperError error;

    public static TransportResponse success(List<JsonNode> events) {
        return new TransportResponse(List.copyOf(events), ContextKeeperError.success());
    }

    public static TransportResponse failure(ContextKeeperError error) {
        return new TransportResponse(List.of(), error);
    }

    public boolean isSuccess() {
        return error.getErrorType() == ErrorType.SUCCESS;
    }
}
