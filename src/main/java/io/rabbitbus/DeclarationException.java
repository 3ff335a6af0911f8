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
 * Failure of a single resource operation (declaration, binding or deletion) reported by a {@link Declarator}.
 * <p>
 * The subclass tells whether repeating the operation can succeed:
 * {@link TransientDeclarationException} is retried by the {@link DeclarationEngine},
 * {@link RejectedDeclarationException} is not.
 */
public abstract class DeclarationException extends RabbitBusException {

    protected DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
