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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Encodes message content and sends it through a {@link Publisher}.
 * <p>
 * Encoding happens on subscription. Nothing is sent if the returned mono is not subscribed.
 * Concurrent calls are allowed but their ordering is not guaranteed.
 */
public class PublishEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PublishEngine.class);

    private final Publisher publisher;

    private final MessageCodec codec;

    public PublishEngine(Publisher publisher, MessageCodec codec) {
        this.publisher = Definitions.requireNotNull(publisher, "Publisher must not be null");
        this.codec = Definitions.requireNotNull(codec, "Codec must not be null");
    }

    /**
     * Send a message without waiting for the broker confirmation.
     *
     * @param exchange the exchange, {@code ""} for the default exchange
     * @param routingKey the routing key
     * @param content the content, encoded with the {@link MessageCodec}
     * @param properties AMQP properties, can be null
     * @return a mono completing once the message is sent, erroring with a {@link PublishException}
     * if the content cannot be encoded, or with the error of the {@link Publisher}
     */
    public Mono<Void> publish(String exchange, String routingKey, Object content, @Nullable AMQP.BasicProperties properties) {
        return message(exchange, routingKey, content, properties).flatMap(publisher::send);
    }

    /**
     * Send a message and wait for the broker confirmation.
     *
     * @param exchange the exchange, {@code ""} for the default exchange
     * @param routingKey the routing key
     * @param content the content, encoded with the {@link MessageCodec}
     * @param properties AMQP properties, can be null
     * @return a mono emitting true if the broker acknowledged the message, false if it
     * negatively acknowledged or returned it. The mono completes empty if no confirmation
     * was received, and errors if the message could not be sent.
     */
    public Mono<Boolean> publishWithConfirms(String exchange, String routingKey, Object content,
                                             @Nullable AMQP.BasicProperties properties) {
        return message(exchange, routingKey, content, properties)
            .flatMap(message -> publisher.sendWithConfirms(message)
                .doOnNext(result -> {
                    if (!result.isDelivered()) {
                        LOGGER.debug("Message not delivered: {}", result);
                    }
                })
                .map(OutboundMessageResult::isDelivered)
                .switchIfEmpty(Mono.defer(() -> {
                    LOGGER.warn("No confirmation received for {}", message);
                    return Mono.empty();
                })));
    }

    private Mono<OutboundMessage> message(String exchange, String routingKey, Object content,
                                          @Nullable AMQP.BasicProperties properties) {
        Definitions.requireNotNull(exchange, "Exchange must not be null");
        Definitions.requireNotNull(routingKey, "Routing key must not be null");
        Definitions.requireNotNull(content, "Message content must not be null");
        return Mono.fromCallable(() -> new OutboundMessage(exchange, routingKey, properties, encode(content)));
    }

    private byte[] encode(Object content) {
        try {
            return codec.encode(content);
        } catch (Exception e) {
            throw new PublishException("Error while encoding message content of type " + content.getClass().getName(), e);
        }
    }
}
