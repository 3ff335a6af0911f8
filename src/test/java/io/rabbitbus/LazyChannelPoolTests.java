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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;

import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LazyChannelPoolTests {

    LazyChannelPool lazyChannelPool;

    Connection connection;
    Channel channel1, channel2, channel3;

    @BeforeEach
    void setUp() throws IOException {
        connection = mock(Connection.class);
        when(connection.isOpen()).thenReturn(true);
        channel1 = channel(1);
        channel2 = channel(2);
        channel3 = channel(3);
        when(connection.createChannel()).thenReturn(channel1, channel2, channel3);
    }

    @AfterEach
    void tearDown() {
        if (lazyChannelPool != null) {
            lazyChannelPool.close();
        }
    }

    LazyChannelPool pool(int maxCacheSize) {
        return new LazyChannelPool(Mono.just(connection),
            new ChannelPoolOptions().maxCacheSize(maxCacheSize).subscriptionScheduler(Schedulers.immediate()));
    }

    @Test
    void channelIsOpenedLazilyAndReused() throws Exception {
        lazyChannelPool = pool(2);

        verify(connection, never()).createChannel();

        StepVerifier.withVirtualTime(() ->
                Mono.when(
                        // 1#
                        useChannelBetween(Duration.ZERO, ofSeconds(1)),
                        // 2#
                        useChannelBetween(ofSeconds(2), ofSeconds(3))
                ))
                .expectSubscription()
                .thenAwait(ofSeconds(3))
                .verifyComplete();

        // 0 -> 1# creates channel1
        // 1 -> 1# gives channel1 back to the pool
        // 2 -> 2# takes channel1 from the pool
        // 3 -> 2# gives channel1 back to the pool

        verifyBasicPublish(channel1, 2);
        verifyBasicPublish(channel2, 0);
        verify(channel1, never()).close();
        verify(channel1, times(1)).clearConfirmListeners();

        lazyChannelPool.close();

        verify(channel1).close();
        verify(channel2, never()).close();
    }

    @Test
    void channelIsClosedWhenPoolIsFull() throws Exception {
        lazyChannelPool = pool(2);

        StepVerifier.withVirtualTime(() ->
                Mono.when(
                        // 1#
                        useChannelBetween(ofSeconds(1), ofSeconds(4)),
                        // 2#
                        useChannelBetween(ofSeconds(2), ofSeconds(5)),
                        // 3#
                        useChannelBetween(ofSeconds(3), ofSeconds(6))
                ))
                .expectSubscription()
                .thenAwait(ofSeconds(6))
                .verifyComplete();

        // 1, 2, 3 -> 1#, 2# and 3# create a channel each
        // 4, 5 -> 1# and 2# give their channel back to the pool
        // 6 -> 3# closes channel3 (pool is full)

        verifyBasicPublish(channel1, 1);
        verifyBasicPublish(channel2, 1);
        verifyBasicPublish(channel3, 1);
        verify(channel1, never()).close();
        verify(channel2, never()).close();
        verify(channel3).close();

        lazyChannelPool.close();

        verify(channel1).close();
        verify(channel2).close();
    }

    @Test
    void channelIsClosedAfterError() throws Exception {
        lazyChannelPool = pool(2);

        Channel channel = lazyChannelPool.getChannelMono().block();
        lazyChannelPool.getChannelCloseHandler().accept(SignalType.ON_ERROR, channel);

        verify(channel1).close();
        lazyChannelPool.getChannelMono().block();
        verify(connection, times(2)).createChannel();
    }

    @Test
    void closedChannelIsNotTakenFromThePool() throws Exception {
        lazyChannelPool = pool(2);

        Channel channel = lazyChannelPool.getChannelMono().block();
        lazyChannelPool.getChannelCloseHandler().accept(SignalType.ON_COMPLETE, channel);
        when(channel1.isOpen()).thenReturn(false);

        assertThat(lazyChannelPool.getChannelMono().block()).isSameAs(channel2);
    }

    @Test
    void closedPoolRefusesChannels() {
        lazyChannelPool = pool(2);
        lazyChannelPool.close();

        StepVerifier.create(lazyChannelPool.getChannelMono())
            .verifyErrorMessage("Channel pool is closed");
    }

    private Mono<Void> useChannelBetween(Duration from, Duration to) {
        return Mono.delay(from)
                .then(lazyChannelPool.getChannelMono())
                .flatMap(channel ->
                        Mono.just(1)
                                .doOnNext(i -> {
                                    try {
                                        channel.basicPublish("", "", null, new byte[0]);
                                    } catch (IOException e) {
                                        throw new RabbitBusException("Error while publishing", e);
                                    }
                                })
                                .delayElement(to.minus(from))
                                .doFinally(signalType -> lazyChannelPool.getChannelCloseHandler().accept(signalType, channel))
                )
                .then();
    }

    private void verifyBasicPublish(Channel channel, int times) throws Exception {
        verify(channel, times(times)).basicPublish(any(), any(), any(), any());
    }

    private Channel channel(int channelNumber) {
        Channel channel = mock(Channel.class);
        when(channel.getChannelNumber()).thenReturn(channelNumber);
        when(channel.isOpen()).thenReturn(true);
        when(channel.getConnection()).thenReturn(connection);
        return channel;
    }
}
