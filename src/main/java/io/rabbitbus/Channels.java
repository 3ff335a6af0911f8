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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.SignalType;

import java.io.IOException;
import java.util.function.BiConsumer;

/**
 * Channel opening and closing logic of the AMQP adapters.
 */
public abstract class Channels {

    private static final Logger LOGGER = LoggerFactory.getLogger(Channels.class);

    /**
     * Closes the channel if it is still open, and emits a warn-level log message if it cannot.
     */
    public static final BiConsumer<SignalType, Channel> CLOSING_HANDLER = (signalType, channel) -> {
        int channelNumber = channel.getChannelNumber();
        LOGGER.debug("closing channel {} by signal {}", channelNumber, signalType);
        try {
            if (channel.isOpen() && channel.getConnection().isOpen()) {
                channel.close();
            }
        } catch (Exception e) {
            LOGGER.warn("Channel {} didn't close normally: {}", channelNumber, e.getMessage());
        }
    };

    static Channel open(Connection connection) {
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new RabbitBusException("No channel available on connection " + connection);
            }
            return channel;
        } catch (IOException e) {
            throw new RabbitBusException("Error while creating channel", e);
        }
    }
}
