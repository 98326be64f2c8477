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

import lombok.Getter;

/**
 * Raised by thread stores when persistence fails. Callers can inspect {@link #getError()} to decide whether
 * to retry.
 */
@Getter
public class ThreadStoreException extends RuntimeException {
    private final transient ContextKeeperError error;

    public ThreadStoreException(ContextKeeperError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static ThreadStoreException of(ErrorType errorType, Throwable cause, Object... args) {
        return new ThreadStoreException(ContextKeeperError.error(errorType, cause, args), cause);
    }

    public static ThreadStoreException of(ErrorType errorType, Object... args) {
        return new ThreadStoreException(ContextKeeperError.error(errorType, args), null);
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }
}
