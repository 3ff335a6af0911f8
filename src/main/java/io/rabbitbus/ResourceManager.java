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

import java.util.function.Consumer;

/**
 * Collects the exchanges, queues and bindings an application needs, then declares them
 * with {@link #initialize()}.
 * <p>
 * Registration methods are meant to be called from a single thread and must all return
 * before {@link #initialize()} is subscribed. Registering resources while an initialization
 * is in flight is not supported.
 */
public interface ResourceManager {

    default ResourceManager declareExchange(String name, ExchangeType type) {
        return declareExchange(name, type, null);
    }

    /**
     * Register an exchange (created on {@link #initialize()} if needed).
     *
     * @param name the name of the exchange
     * @param type the exchange type
     * @param configurer callback to change the defaults of the exchange, can be null
     * @return this resource manager
     * @throws IllegalArgumentException if the name is blank or the configurer passes invalid values
     */
    ResourceManager declareExchange(String name, ExchangeType type, Consumer<ExchangeDefinition.Builder> configurer);

    ResourceManager declareExchange(ExchangeDefinition exchange);

    default ResourceManager declareQueue(String name) {
        return declareQueue(name, null);
    }

    /**
     * Register a queue (created on {@link #initialize()} if needed).
     *
     * @param name the name of the queue
     * @param configurer callback to change the defaults of the queue, can be null
     * @return this resource manager
     * @throws IllegalArgumentException if the name is blank or the configurer passes invalid values
     */
    ResourceManager declareQueue(String name, Consumer<QueueDefinition.Builder> configurer);

    ResourceManager declareQueue(QueueDefinition queue);

    default ResourceManager bindQueue(String exchange, String queue) {
        return bindQueue(exchange, queue, "");
    }

    default ResourceManager bindQueue(String exchange, String queue, String routingKey) {
        return bindQueue(BindingDefinition.binding(exchange, queue, routingKey));
    }

    /**
     * Register a binding, declared on {@link #initialize()} after all exchanges and queues.
     *
     * @param binding the binding
     * @return this resource manager
     */
    ResourceManager bindQueue(BindingDefinition binding);

    /**
     * Delete an exchange. Unlike declarations, the deletion is not deferred to
     * {@link #initialize()}: it is issued when the returned mono is subscribed.
     *
     * @param name the name of the exchange
     * @param ifUnused when true, the exchange is only deleted if it has no bindings
     * @return a mono completing once the exchange is deleted
     */
    Mono<Void> deleteExchange(String name, boolean ifUnused);

    default Mono<Void> deleteExchange(String name) {
        return deleteExchange(name, false);
    }

    /**
     * Delete a queue when the returned mono is subscribed.
     *
     * @param name the name of the queue
     * @param ifUnused when true, the queue is only deleted if it has no consumers
     * @param ifEmpty when true, the queue is only deleted if it has no messages
     * @return a mono completing once the queue is deleted
     */
    Mono<Void> deleteQueue(String name, boolean ifUnused, boolean ifEmpty);

    default Mono<Void> deleteQueue(String name) {
        return deleteQueue(name, false, false);
    }

    /**
     * Declare all the registered resources: exchanges first, then queues, then bindings.
     * <p>
     * The mono errors with a {@link TopologyInitializationException} if at least one
     * resource could not be declared.
     *
     * @return a mono completing once the topology is declared
     */
    Mono<Void> initialize();
}
