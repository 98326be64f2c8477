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

package com.phonepe.contextkeeper.core.utils;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Small helpers used across the context and thread packages
 */
@UtilityClass
public class ContextUtils {

    public static long epochMicro() {
        return ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
    }

    public static String newThreadId() {
        return "T-" + UUID.randomUUID();
    }

    /**
     * Subtraction clamped at zero. Token budgets never go negative.
     */
    public static int saturatingSub(int value, int delta) {
        return value > delta ? value - delta : 0;
    }

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
