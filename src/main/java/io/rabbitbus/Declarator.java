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

import reactor.core.publisher.Mono;

/**
 * Performs resource operations against the broker, one resource per call.
 * <p>
 * Each returned {@link Mono} must be cold: the operation is issued on subscription,
 * and subscribing again issues it again (this is how the {@link DeclarationEngine} retries).
 * Failures should be signalled as {@link DeclarationException}s so that transient
 * errors can be told apart from broker rejections. Any other error is considered transient.
 * <p>
 * Implementations must support concurrent calls.
 *
 * @see ChannelDeclarator
 */
public interface Declarator {

    Mono<Void> declareExchange(ExchangeDefinition exchange);

    Mono<Void> declareQueue(QueueDefinition queue);

    Mono<Void> bindQueue(BindingDefinition binding);

    /**
     * Delete an exchange.
     *
     * @param exchange the name of the exchange
     * @param ifUnused only delete the exchange if it has no bindings
     * @return a mono completing once the broker confirmed the deletion
     */
    Mono<Void> deleteExchange(String exchange, boolean ifUnused);

    /**
     * Delete a queue.
     *
     * @param queue the name of the queue
     * @param ifUnused only delete the queue if it has no consumers
     * @param ifEmpty only delete the queue if it has no messages
     * @return a mono completing once the broker confirmed the deletion
     */
    Mono<Void> deleteQueue(String queue, boolean ifUnused, boolean ifEmpty);
}
