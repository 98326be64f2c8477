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

package com.phonepe.contextkeeper.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Errors that can be reported by thread persistence and transports. Budgeting itself never fails.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    LOCK_ACQUISITION_FAILED("Could not acquire %s lock on thread store: %s", true),
    THREAD_READ_FAILURE("Failed to read thread %s: %s", true),
    THREAD_WRITE_FAILURE("Failed to write thread %s: %s", true),
    THREAD_DELETE_FAILURE("Failed to delete thread %s: %s", true),
    STORE_INITIALIZATION_FAILURE("Failed to initialize thread store at %s: %s", false),
    SERIALIZATION_ERROR("Error serializing thread %s to JSON. Error: %s", false),
    TRANSPORT_FAILURE("Transport failed to send request for model %s: %s", true),
    ;

    private final String message;
    private final boolean retryable;
}
