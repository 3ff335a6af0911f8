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

import reactor.util.annotation.Nullable;

/**
 * What happened to one resource during {@link DeclarationEngine#initialize()}.
 */
public class DeclarationOutcome {

    private final ResourceKind kind;

    private final Object definition;

    private final int attempts;

    private final Throwable failure;

    DeclarationOutcome(ResourceKind kind, Object definition, int attempts, @Nullable Throwable failure) {
        this.kind = kind;
        this.definition = definition;
        this.attempts = attempts;
        this.failure = failure;
    }

    public ResourceKind getKind() {
        return kind;
    }

    /**
     * @return the {@link ExchangeDefinition}, {@link QueueDefinition} or {@link BindingDefinition}
     */
    public Object getDefinition() {
        return definition;
    }

    /**
     * @return how many times the {@link Declarator} was called for this resource
     */
    public int getAttempts() {
        return attempts;
    }

    @Nullable
    public Throwable getFailure() {
        return failure;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return true if the broker refused the resource, false if it succeeded or failed transiently
     */
    public boolean isRejected() {
        return failure instanceof DeclarationException && !((DeclarationException) failure).isTransient();
    }

    @Override
    public String toString() {
        return "DeclarationOutcome{" +
            "kind=" + kind +
            ", definition=" + definition +
            ", attempts=" + attempts +
            ", failure=" + failure +
            '}';
    }
}
