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

import java.util.Objects;

/**
 * Exchange-to-queue binding.
 * <p>
 * The exchange and the queue are referenced by name only, they may already exist
 * on the broker without being declared by this library.
 */
public final class BindingDefinition {

    private final String exchange, queue, routingKey;

    private BindingDefinition(String exchange, String queue, String routingKey) {
        this.exchange = Definitions.requireNotBlank(exchange, "Exchange name must not be blank");
        this.queue = Definitions.requireNotBlank(queue, "Queue name must not be blank");
        this.routingKey = Definitions.requireNotNull(routingKey, "Routing key must not be null");
    }

    public static BindingDefinition binding(String exchange, String queue) {
        return binding(exchange, queue, "");
    }

    /**
     * Create an exchange-to-queue binding definition.
     *
     * @param exchange the source exchange, must not be blank
     * @param queue the destination queue, must not be blank
     * @param routingKey the binding key, may be empty
     * @return the binding definition
     */
    public static BindingDefinition binding(String exchange, String queue, String routingKey) {
        return new BindingDefinition(exchange, queue, routingKey);
    }

    public String getExchange() {
        return exchange;
    }

    public String getQueue() {
        return queue;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BindingDefinition that = (BindingDefinition) o;
        return exchange.equals(that.exchange) &&
            queue.equals(that.queue) &&
            routingKey.equals(that.routingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exchange, queue, routingKey);
    }

    @Override
    public String toString() {
        return "BindingDefinition{" +
            "exchange='" + exchange + '\'' +
            ", queue='" + queue + '\'' +
            ", routingKey='" + routingKey + '\'' +
            '}';
    }
}
