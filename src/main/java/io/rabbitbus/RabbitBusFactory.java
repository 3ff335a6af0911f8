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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Creates {@link RabbitBus} instances.
 */
public abstract class RabbitBusFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(RabbitBusFactory.class);

    /**
     * Create a bus connected to a local broker with the default credentials.
     *
     * @return the bus
     */
    public static RabbitBus create() {
        return create(new BusOptions());
    }

    /**
     * Create a bus with one connection for publishing and one for resource management.
     *
     * @param options connection parameters and collaborators
     * @return the bus
     * @throws RabbitBusException if a connection cannot be opened
     */
    public static RabbitBus create(BusOptions options) {
        ConnectionFactory connectionFactory = options.getConnectionFactory() == null ?
            connectionFactory(options) : options.getConnectionFactory();

        List<AutoCloseable> resources = new ArrayList<>();
        try {
            Connection publisherConnection = newConnection(connectionFactory, "publisher-connection");
            resources.add(publisherConnection);
            Connection resourceConnection = newConnection(connectionFactory, "resource-management-connection");
            resources.add(resourceConnection);

            LazyChannelPool channelPool = new LazyChannelPool(Mono.just(publisherConnection),
                new ChannelPoolOptions().maxCacheSize(options.getChannelPoolSize()));
            ChannelPublisher publisher = new ChannelPublisher(channelPool, options.isTrackReturned());
            ChannelDeclarator declarator = new ChannelDeclarator(Mono.just(resourceConnection));
            resources.addAll(Arrays.asList(channelPool, publisher, declarator));

            return new DefaultRabbitBus(
                new DeclarationEngine(declarator, options.getDeclarationOptions()),
                new PublishEngine(publisher, options.getCodec()),
                resources
            );
        } catch (RuntimeException e) {
            Collections.reverse(resources);
            resources.forEach(resource -> {
                try {
                    resource.close();
                } catch (Exception closingException) {
                    LOGGER.warn("Error while closing {}: {}", resource, closingException.getMessage());
                }
            });
            throw e;
        }
    }

    /**
     * Create a bus from engines built with custom {@link Declarator} and {@link Publisher} implementations.
     *
     * @param declarationEngine the engine the bus exposes as its {@link ResourceManager}
     * @param publishEngine the engine the bus publishes with
     * @param resources released in reverse order when the bus is closed
     * @return the bus
     */
    public static RabbitBus create(DeclarationEngine declarationEngine, PublishEngine publishEngine,
                                   AutoCloseable... resources) {
        return new DefaultRabbitBus(declarationEngine, publishEngine, Arrays.asList(resources));
    }

    static ConnectionFactory connectionFactory(BusOptions options) {
        ConnectionFactory connectionFactory = new ConnectionFactory();
        connectionFactory.setAutomaticRecoveryEnabled(true);
        connectionFactory.setTopologyRecoveryEnabled(true);
        connectionFactory.setHost(options.getHost());
        connectionFactory.setPort(options.getPort());
        connectionFactory.setUsername(options.getUsername());
        connectionFactory.setPassword(options.getPassword());
        connectionFactory.setVirtualHost(options.getVirtualHost());
        connectionFactory.setRequestedHeartbeat((int) options.getHeartbeatTimeout().getSeconds());
        connectionFactory.useNio();
        return connectionFactory;
    }

    private static Connection newConnection(ConnectionFactory connectionFactory, String name) {
        try {
            Connection connection = connectionFactory.newConnection(name);
            LOGGER.debug("Opened connection {} to {}:{}", name, connectionFactory.getHost(), connectionFactory.getPort());
            return connection;
        } catch (Exception e) {
            throw new RabbitBusException("Error while opening connection " + name, e);
        }
    }
}
