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

import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

/**
 * Options of the {@link LazyChannelPool} the {@link ChannelPublisher} takes its channels from.
 * <p>
 * Declarations do not use the pool: {@link ChannelDeclarator} opens a channel per operation.
 * {@link RabbitBusFactory} sizes the pool from {@link BusOptions#getChannelPoolSize()}.
 */
public class ChannelPoolOptions {

    private Integer maxCacheSize;

    private Scheduler subscriptionScheduler;

    /**
     * Number of idle publishing channels kept open between messages. A channel given
     * back while this many are idle is closed.
     * <p>
     * {@link LazyChannelPool#DEFAULT_CHANNEL_POOL_SIZE} if not set.
     *
     * @param maxCacheSize a strictly positive number of channels
     * @return these options
     */
    public ChannelPoolOptions maxCacheSize(int maxCacheSize) {
        this.maxCacheSize = Definitions.requirePositive(maxCacheSize, "Max cache size must be greater than 0");
        return this;
    }

    @Nullable
    public Integer getMaxCacheSize() {
        return maxCacheSize;
    }

    /**
     * Scheduler channels are taken from the pool (or opened) on, as opening a channel
     * blocks on a broker round trip. A private bounded elastic scheduler, disposed with
     * the pool, if not set.
     *
     * @param subscriptionScheduler the scheduler, or null for the private one
     * @return these options
     */
    public ChannelPoolOptions subscriptionScheduler(@Nullable Scheduler subscriptionScheduler) {
        this.subscriptionScheduler = subscriptionScheduler;
        return this;
    }

    @Nullable
    public Scheduler getSubscriptionScheduler() {
        return subscriptionScheduler;
    }
}
