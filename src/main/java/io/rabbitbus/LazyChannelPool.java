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
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * {@link ChannelPool} that opens channels on demand and keeps a bounded number of idle ones.
 * <p>
 * A channel is given back to the pool only if it is still open and its user completed
 * normally. Channels that are not taken back are closed.
 */
public class LazyChannelPool implements ChannelPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(LazyChannelPool.class);

    public static final int DEFAULT_CHANNEL_POOL_SIZE = 5;

    private final Mono<? extends Connection> connectionMono;
    private final BlockingQueue<Channel> idleChannels;
    private final Scheduler subscriptionScheduler;
    private final boolean privateSubscriptionScheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LazyChannelPool(Mono<? extends Connection> connectionMono, ChannelPoolOptions channelPoolOptions) {
        int capacity = channelPoolOptions.getMaxCacheSize() == null ?
            DEFAULT_CHANNEL_POOL_SIZE : channelPoolOptions.getMaxCacheSize();
        this.idleChannels = new LinkedBlockingQueue<>(capacity);
        this.connectionMono = connectionMono;
        this.privateSubscriptionScheduler = channelPoolOptions.getSubscriptionScheduler() == null;
        this.subscriptionScheduler = privateSubscriptionScheduler ?
            Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "rabbit-bus-channel-pool") :
            channelPoolOptions.getSubscriptionScheduler();
    }

    @Override
    public Mono<? extends Channel> getChannelMono() {
        return connectionMono.map(connection -> {
            if (closed.get()) {
                throw new RabbitBusException("Channel pool is closed");
            }
            Channel channel = idleChannels.poll();
            while (channel != null && !channel.isOpen()) {
                channel = idleChannels.poll();
            }
            if (channel == null) {
                channel = Channels.open(connection);
                LOGGER.debug("opened channel {}", channel.getChannelNumber());
            } else {
                channel.clearConfirmListeners();
                channel.clearReturnListeners();
            }
            return channel;
        })
        .subscribeOn(subscriptionScheduler);
    }

    @Override
    public BiConsumer<SignalType, Channel> getChannelCloseHandler() {
        return (signalType, channel) -> {
            if (!channel.isOpen()) {
                return;
            }
            boolean pooled = signalType == SignalType.ON_COMPLETE && !closed.get() && idleChannels.offer(channel);
            if (!pooled) {
                Channels.CLOSING_HANDLER.accept(signalType, channel);
            }
        };
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            List<Channel> channels = new ArrayList<>();
            idleChannels.drainTo(channels);
            channels.forEach(channel -> Channels.CLOSING_HANDLER.accept(SignalType.ON_COMPLETE, channel));
            if (privateSubscriptionScheduler) {
                subscriptionScheduler.dispose();
            }
        }
    }
}
