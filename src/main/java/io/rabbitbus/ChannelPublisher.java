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
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.SignalType;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * {@link Publisher} sending messages with the RabbitMQ Java client.
 * <p>
 * Each message takes a channel from a {@link ChannelPool} and gives it back once sent,
 * or once confirmed for {@link #sendWithConfirms(OutboundMessage)}.
 */
public class ChannelPublisher implements Publisher, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelPublisher.class);

    static final String DELIVERY_TAG_HEADER = "rabbit_bus_delivery_tag";

    private final Mono<? extends Channel> channelMono;

    private final BiConsumer<SignalType, Channel> channelCloseHandler;

    private final boolean trackReturned;

    // confirmations arrive on the connection I/O thread, channels are given back from another thread
    private final ExecutorService channelCloseThreadPool = Executors.newCachedThreadPool();

    public ChannelPublisher(ChannelPool channelPool) {
        this(channelPool, false);
    }

    /**
     * @param channelPool the pool to take channels from
     * @param trackReturned whether confirmed messages are published with the mandatory flag,
     *                      an unroutable message then yields a returned result
     */
    public ChannelPublisher(ChannelPool channelPool, boolean trackReturned) {
        this(channelPool.getChannelMono(), channelPool.getChannelCloseHandler(), trackReturned);
    }

    public ChannelPublisher(Mono<? extends Channel> channelMono, BiConsumer<SignalType, Channel> channelCloseHandler,
                            boolean trackReturned) {
        this.channelMono = Definitions.requireNotNull(channelMono, "Channel mono must not be null");
        this.channelCloseHandler = Definitions.requireNotNull(channelCloseHandler, "Channel close handler must not be null");
        this.trackReturned = trackReturned;
    }

    @Override
    public Mono<Void> send(OutboundMessage message) {
        return channelMono.flatMap(channel -> Mono.<Void>fromRunnable(() -> {
                try {
                    channel.basicPublish(message.getExchange(), message.getRoutingKey(),
                        message.getProperties(), message.getBody());
                } catch (IOException e) {
                    throw new PublishException("Error while sending " + message, e);
                }
            })
            .doFinally(signalType -> channelCloseHandler.accept(signalType, channel)))
            .doOnError(e -> LOGGER.warn("Send failed with exception {}", e.toString()));
    }

    @Override
    public Mono<OutboundMessageResult> sendWithConfirms(OutboundMessage message) {
        return channelMono.flatMap(channel -> Mono.<OutboundMessageResult>create(sink -> publishConfirmed(channel, message, sink))
            .doFinally(signalType -> {
                if (signalType == SignalType.ON_ERROR) {
                    channelCloseHandler.accept(signalType, channel);
                } else {
                    channelCloseThreadPool.execute(() -> channelCloseHandler.accept(signalType, channel));
                }
            }));
    }

    private void publishConfirmed(Channel channel, OutboundMessage message, MonoSink<OutboundMessageResult> sink) {
        try {
            channel.confirmSelect();
        } catch (IOException e) {
            sink.error(new PublishException("Error while setting publisher confirms on channel", e));
            return;
        }
        long deliveryTag = channel.getNextPublishSeqNo();
        AtomicBoolean returned = new AtomicBoolean(false);

        ConfirmListener confirmListener = new ConfirmListener() {

            @Override
            public void handleAck(long tag, boolean multiple) {
                confirm(tag, multiple, true);
            }

            @Override
            public void handleNack(long tag, boolean multiple) {
                confirm(tag, multiple, false);
            }

            private void confirm(long tag, boolean multiple, boolean ack) {
                if (tag == deliveryTag || (multiple && tag > deliveryTag)) {
                    sink.success(new OutboundMessageResult(message, ack, returned.get()));
                }
            }
        };
        ReturnListener returnListener = (replyCode, replyText, exchange, routingKey, properties, body) -> {
            Object tag = properties.getHeaders() == null ? null : properties.getHeaders().get(DELIVERY_TAG_HEADER);
            if (tag instanceof Long && (Long) tag == deliveryTag) {
                LOGGER.debug("Message returned by the broker: {} {}", replyCode, replyText);
                returned.set(true);
            }
        };
        // the broker closes the channel on errors like a missing exchange
        ShutdownListener shutdownListener = signal -> {
            if (!signal.isInitiatedByApplication()) {
                sink.error(new PublishException("Channel closed before confirmation of " + message, signal));
            }
        };

        channel.addConfirmListener(confirmListener);
        channel.addShutdownListener(shutdownListener);
        if (trackReturned) {
            channel.addReturnListener(returnListener);
        }
        sink.onDispose(() -> {
            channel.removeConfirmListener(confirmListener);
            channel.removeShutdownListener(shutdownListener);
            if (trackReturned) {
                channel.removeReturnListener(returnListener);
            }
        });

        try {
            channel.basicPublish(message.getExchange(), message.getRoutingKey(), trackReturned,
                trackReturned ? withDeliveryTag(message.getProperties(), deliveryTag) : message.getProperties(),
                message.getBody());
        } catch (Exception e) {
            sink.error(new PublishException("Error while sending " + message, e));
        }
    }

    private static AMQP.BasicProperties withDeliveryTag(AMQP.BasicProperties properties, long deliveryTag) {
        AMQP.BasicProperties baseProperties = properties != null ? properties : new AMQP.BasicProperties();
        Map<String, Object> headers = baseProperties.getHeaders() != null ?
            new HashMap<>(baseProperties.getHeaders()) : new HashMap<>();
        headers.put(DELIVERY_TAG_HEADER, deliveryTag);
        return baseProperties.builder().headers(headers).build();
    }

    @Override
    public void close() {
        channelCloseThreadPool.shutdown();
    }
}
