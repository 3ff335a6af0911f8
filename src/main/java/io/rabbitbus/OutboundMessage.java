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

import com.rabbitmq.client.AMQP.BasicProperties;
import reactor.util.annotation.Nullable;

/**
 * An encoded message, ready to be handed to a {@link Publisher}.
 */
public class OutboundMessage {

    private final String exchange;

    private final String routingKey;

    private final BasicProperties properties;

    private final byte[] body;

    /**
     * @param exchange the target exchange, {@code ""} for the default exchange
     * @param routingKey the routing key, {@code ""} if the exchange ignores it
     * @param properties AMQP properties of the message, can be null
     * @param body the encoded payload
     */
    public OutboundMessage(String exchange, String routingKey, @Nullable BasicProperties properties, byte[] body) {
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.properties = properties;
        this.body = body;
    }

    public OutboundMessage(String exchange, String routingKey, byte[] body) {
        this(exchange, routingKey, null, body);
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    @Nullable
    public BasicProperties getProperties() {
        return properties;
    }

    public byte[] getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "OutboundMessage{" +
            "exchange='" + exchange + '\'' +
            ", routingKey='" + routingKey + '\'' +
            ", properties=" + properties +
            ", body=" + body.length + " byte(s)" +
            '}';
    }
}
