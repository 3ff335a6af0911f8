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
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.function.BiConsumer;

/**
 * Channels used by the {@link ChannelPublisher}, one channel per message in flight.
 */
public interface ChannelPool extends AutoCloseable {

    /**
     * @return a mono of a channel the caller has exclusive use of until it gives it back
     * with {@link #getChannelCloseHandler()}
     */
    Mono<? extends Channel> getChannelMono();

    /**
     * The logic to give a channel back once the caller is done with it.
     *
     * @return the closing logic to use
     */
    BiConsumer<SignalType, Channel> getChannelCloseHandler();

    @Override
    void close();
}
