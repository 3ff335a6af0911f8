/*
 * Copyright (c) 2017-2021 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rabbitbus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validation helpers shared by the resource definitions.
 */
abstract class Definitions {

    static String requireNotBlank(String value, String message) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    static long requirePositiveMillis(Duration duration, String label) {
        if (duration == null) {
            throw new IllegalArgumentException(label + " duration must not be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(label + " duration must not be negative");
        }
        if (duration.isZero()) {
            throw new IllegalArgumentException(label + " duration must not be zero");
        }
        long millis;
        try {
            millis = duration.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(label + " duration is too long to be expressed in milliseconds", e);
        }
        // the broker only takes whole milliseconds
        if (millis < 1) {
            throw new IllegalArgumentException(label + " duration must be at least 1 millisecond");
        }
        return millis;
    }

    static int requirePositive(int value, String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    static <T> T requireNotNull(T value, String message) {
        if (value == null) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    // all entries are checked before the caller mutates anything
    static Map<String, Object> requireValidArguments(Map<String, Object> arguments) {
        requireNotNull(arguments, "Arguments must not be null");
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            requireNotBlank(entry.getKey(), "Argument key must not be blank");
            requireNotNull(entry.getValue(), "Argument value must not be null");
        }
        return arguments;
    }

    static Map<String, Object> snapshot(Map<String, Object> arguments) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
