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

import com.rabbitmq.client.AMQP;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Entry point to declare a topology and publish messages against it.
 * <p>
 * The short forms of the publish methods use the default exchange ({@code ""})
 * and an empty routing key, and behave exactly like the full forms.
 *
 * @see RabbitBusFactory
 */
public interface RabbitBus extends AutoCloseable {

    /**
     * @return the resource manager of this bus, always the same instance
     */
    ResourceManager resourceManager();

    default Mono<Void> publish(Object messageContent) {
        return publish("", messageContent);
    }

    default Mono<Void> publish(String routingKey, Object messageContent) {
        return publish("", routingKey, messageContent);
    }

    default Mono<Void> publish(String exchange, String routingKey, Object messageContent) {
        return publish(exchange, routingKey, messageContent, null);
    }

    /**
     * Publish a message, without waiting for the broker confirmation.
     *
     * @param exchange the exchange
     * @param routingKey the routing key
     * @param messageContent the content, encoded by the configured {@link MessageCodec}
     * @param properties AMQP properties, can be null
     * @return a mono completing once the message is sent
     */
    Mono<Void> publish(String exchange, String routingKey, Object messageContent, @Nullable AMQP.BasicProperties properties);

    default Mono<Boolean> publishWithConfirms(Object messageContent) {
        return publishWithConfirms("", messageContent);
    }

    default Mono<Boolean> publishWithConfirms(String routingKey, Object messageContent) {
        return publishWithConfirms("", routingKey, messageContent);
    }

    default Mono<Boolean> publishWithConfirms(String exchange, String routingKey, Object messageContent) {
        return publishWithConfirms(exchange, routingKey, messageContent, null);
    }

    /**
     * Publish a message and wait for the broker confirmation.
     *
     * @param exchange the exchange
     * @param routingKey the routing key
     * @param messageContent the content, encoded by the configured {@link MessageCodec}
     * @param properties AMQP properties, can be null
     * @return a mono of true if the broker acknowledged the message, false if it did not
     * @see PublishEngine#publishWithConfirms(String, String, Object, AMQP.BasicProperties)
     */
    Mono<Boolean> publishWithConfirms(String exchange, String routingKey, Object messageContent,
                                      @Nullable AMQP.BasicProperties properties);

    /**
     * Release the connections and threads of the bus.
     */
    @Override
    void close();
}
