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

/**
 * Base class of the exceptions raised by this library.
 */
public class RabbitBusException extends RuntimeException {

    public RabbitBusException() {
    }

    public RabbitBusException(String message) {
        super(message);
    }

    public RabbitBusException(String message, Throwable cause) {
        super(message, cause);
    }

    public RabbitBusException(Throwable cause) {
        super(cause);
    }
}
