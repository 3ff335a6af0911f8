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

import com.rabbitmq.client.ConnectionFactory;
import reactor.util.annotation.Nullable;

import java.time.Duration;

/**
 * Connection parameters and collaborators of a {@link RabbitBus}.
 */
public class BusOptions {

    private String host = ConnectionFactory.DEFAULT_HOST;

    private int port = ConnectionFactory.DEFAULT_AMQP_PORT;

    private String username = ConnectionFactory.DEFAULT_USER;

    private String password = ConnectionFactory.DEFAULT_PASS;

    private String virtualHost = ConnectionFactory.DEFAULT_VHOST;

    private Duration heartbeatTimeout = Duration.ofSeconds(10);

    /**
     * Maximum number of idle publishing channels.
     * <p>
     * Default is twice the number of processors, with a minimum of 8.
     */
    private int channelPoolSize = Math.max(8, Runtime.getRuntime().availableProcessors() * 2);

    private boolean trackReturned = false;

    private DeclarationOptions declarationOptions = new DeclarationOptions();

    private MessageCodec codec;

    /**
     * When set, used as is and the connection settings of these options are ignored.
     */
    private ConnectionFactory connectionFactory;

    public String getHost() {
        return host;
    }

    public BusOptions host(String host) {
        this.host = Definitions.requireNotBlank(host, "Host must not be blank");
        return this;
    }

    public int getPort() {
        return port;
    }

    public BusOptions port(int port) {
        this.port = Definitions.requirePositive(port, "Port must be greater than 0");
        return this;
    }

    public String getUsername() {
        return username;
    }

    public BusOptions username(String username) {
        this.username = Definitions.requireNotNull(username, "Username must not be null");
        return this;
    }

    public String getPassword() {
        return password;
    }

    public BusOptions password(String password) {
        this.password = Definitions.requireNotNull(password, "Password must not be null");
        return this;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public BusOptions virtualHost(String virtualHost) {
        this.virtualHost = Definitions.requireNotBlank(virtualHost, "Virtual host must not be blank");
        return this;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public BusOptions heartbeatTimeout(Duration heartbeatTimeout) {
        if (heartbeatTimeout == null || heartbeatTimeout.isNegative()) {
            throw new IllegalArgumentException("Heartbeat timeout must not be negative");
        }
        this.heartbeatTimeout = heartbeatTimeout;
        return this;
    }

    public int getChannelPoolSize() {
        return channelPoolSize;
    }

    public BusOptions channelPoolSize(int channelPoolSize) {
        this.channelPoolSize = Definitions.requirePositive(channelPoolSize, "Channel pool size must be greater than 0");
        return this;
    }

    public boolean isTrackReturned() {
        return trackReturned;
    }

    /**
     * Set whether confirmed messages are mandatory, so that unroutable messages are
     * reported as not delivered. Default is false.
     *
     * @param trackReturned
     * @return this {@link BusOptions} instance
     * @see <a href="https://www.rabbitmq.com/publishers.html#unroutable">Mandatory flag</a>
     */
    public BusOptions trackReturned(boolean trackReturned) {
        this.trackReturned = trackReturned;
        return this;
    }

    public DeclarationOptions getDeclarationOptions() {
        return declarationOptions;
    }

    public BusOptions declarationOptions(DeclarationOptions declarationOptions) {
        this.declarationOptions = Definitions.requireNotNull(declarationOptions, "Declaration options must not be null");
        return this;
    }

    /**
     * @return the codec, a {@link JacksonMessageCodec} if none was set
     */
    public MessageCodec getCodec() {
        return codec == null ? new JacksonMessageCodec() : codec;
    }

    public BusOptions codec(MessageCodec codec) {
        this.codec = codec;
        return this;
    }

    @Nullable
    public ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    public BusOptions connectionFactory(@Nullable ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        return this;
    }
}
