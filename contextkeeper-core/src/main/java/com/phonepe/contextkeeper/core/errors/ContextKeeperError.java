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

import com.phonepe.contextkeeper.core.utils.ContextUtils;

import lombok.Value;

/**
 * Error with a human readable message
 */
@Value
public class ContextKeeperError {
    ErrorType errorType;
    String message;

    public static ContextKeeperError success() {
        return new ContextKeeperError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static ContextKeeperError error(ErrorType errorType, Object... args) {
        return new ContextKeeperError(errorType, String.format(errorType.getMessage(), args));
    }

    /**
     * Builds an error from the root cause of the throwable. The last template argument is filled with the root
     * cause message.
     */
    public static ContextKeeperError error(ErrorType errorType, Throwable throwable, Object... args) {
        final var allArgs = new Object[args.length + 1];
        System.arraycopy(args, 0, allArgs, 0, args.length);
        allArgs[args.length] = ContextUtils.rootCause(throwable).getMessage();
        return error(errorType, allArgs);
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
