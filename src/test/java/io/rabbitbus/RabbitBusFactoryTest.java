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

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class RabbitBusFactoryTest {

    @Test
    void connectionFactoryIsConfiguredFromOptions() {
        BusOptions options = new BusOptions()
            .host("rabbit.internal")
            .port(5673)
            .username("bus")
            .password("secret")
            .virtualHost("/orders")
            .heartbeatTimeout(Duration.ofSeconds(30));

        ConnectionFactory connectionFactory = RabbitBusFactory.connectionFactory(options);

        assertThat(connectionFactory.getHost()).isEqualTo("rabbit.internal");
        assertThat(connectionFactory.getPort()).isEqualTo(5673);
        assertThat(connectionFactory.getUsername()).isEqualTo("bus");
        assertThat(connectionFactory.getPassword()).isEqualTo("secret");
        assertThat(connectionFactory.getVirtualHost()).isEqualTo("/orders");
        assertThat(connectionFactory.getRequestedHeartbeat()).isEqualTo(30);
        assertThat(connectionFactory.isAutomaticRecoveryEnabled()).isTrue();
        assertThat(connectionFactory.isTopologyRecoveryEnabled()).isTrue();
    }

    @Test
    void defaultOptionsTargetLocalBroker() {
        BusOptions options = new BusOptions();

        assertThat(options.getHost()).isEqualTo("localhost");
        assertThat(options.getPort()).isEqualTo(5672);
        assertThat(options.getUsername()).isEqualTo("guest");
        assertThat(options.getVirtualHost()).isEqualTo("/");
        assertThat(options.getHeartbeatTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(options.getChannelPoolSize()).isGreaterThanOrEqualTo(8);
        assertThat(options.isTrackReturned()).isFalse();
        assertThat(options.getCodec()).isInstanceOf(JacksonMessageCodec.class);
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThatThrownBy(() -> new BusOptions().host(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BusOptions().port(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BusOptions().channelPoolSize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BusOptions().heartbeatTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void busOwnsBothConnections() throws Exception {
        ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
        Connection publisherConnection = mock(Connection.class);
        Connection resourceConnection = mock(Connection.class);
        when(connectionFactory.newConnection("publisher-connection")).thenReturn(publisherConnection);
        when(connectionFactory.newConnection("resource-management-connection")).thenReturn(resourceConnection);

        RabbitBus bus = RabbitBusFactory.create(new BusOptions().connectionFactory(connectionFactory));

        assertThat(bus.resourceManager()).isInstanceOf(DeclarationEngine.class);
        verify(publisherConnection, never()).createChannel();

        bus.close();

        verify(resourceConnection).close();
        verify(publisherConnection).close();
    }

    @Test
    void openedConnectionIsClosedWhenTheNextOneFails() throws Exception {
        ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
        Connection publisherConnection = mock(Connection.class);
        when(connectionFactory.newConnection("publisher-connection")).thenReturn(publisherConnection);
        when(connectionFactory.newConnection("resource-management-connection"))
            .thenThrow(new IOException("Connection refused"));

        assertThatThrownBy(() -> RabbitBusFactory.create(new BusOptions().connectionFactory(connectionFactory)))
            .isInstanceOf(RabbitBusException.class)
            .hasMessage("Error while opening connection resource-management-connection")
            .hasCauseInstanceOf(IOException.class);

        verify(publisherConnection).close();
    }
}
