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
import com.rabbitmq.client.Command;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.impl.AMQImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Declarator} issuing AMQP methods with the RabbitMQ Java client.
 * <p>
 * Every operation runs on its own channel, opened for the operation and closed afterwards:
 * a broker rejection closes the channel it happens on, so operations running concurrently
 * never share one. Replies are handed over to a dedicated scheduler, never processed on
 * the connection I/O thread.
 */
public class ChannelDeclarator implements Declarator, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelDeclarator.class);

    private final Mono<? extends Connection> connectionMono;

    private final Scheduler resourceManagementScheduler;

    private final boolean privateResourceManagementScheduler;

    public ChannelDeclarator(Mono<? extends Connection> connectionMono) {
        this(connectionMono, null);
    }

    /**
     * @param connectionMono the connection to open channels on, should be cached
     * @param resourceManagementScheduler the scheduler replies are published on, a private
     *                                    bounded elastic scheduler if null
     */
    public ChannelDeclarator(Mono<? extends Connection> connectionMono, Scheduler resourceManagementScheduler) {
        this.connectionMono = Definitions.requireNotNull(connectionMono, "Connection mono must not be null");
        this.privateResourceManagementScheduler = resourceManagementScheduler == null;
        this.resourceManagementScheduler = resourceManagementScheduler == null ?
            Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "rabbit-bus-resource-management") :
            resourceManagementScheduler;
    }

    @Override
    public Mono<Void> declareExchange(ExchangeDefinition exchange) {
        AMQP.Exchange.Declare declare = new AMQImpl.Exchange.Declare.Builder()
            .exchange(exchange.getName())
            .type(exchange.getType().getType())
            .durable(exchange.isDurable())
            .autoDelete(exchange.isAutoDelete())
            .internal(exchange.isInternal())
            .passive(exchange.isPassive())
            .arguments(exchange.getArguments())
            .build();
        return rpc(declare, "declaration of exchange " + exchange.getName());
    }

    @Override
    public Mono<Void> declareQueue(QueueDefinition queue) {
        AMQP.Queue.Declare declare = new AMQImpl.Queue.Declare.Builder()
            .queue(queue.getName())
            .durable(queue.isDurable())
            .exclusive(queue.isExclusive())
            .autoDelete(queue.isAutoDelete())
            .passive(queue.isPassive())
            .arguments(queue.getArguments())
            .build();
        return rpc(declare, "declaration of queue " + queue.getName());
    }

    @Override
    public Mono<Void> bindQueue(BindingDefinition binding) {
        AMQP.Queue.Bind bind = new AMQImpl.Queue.Bind.Builder()
            .exchange(binding.getExchange())
            .queue(binding.getQueue())
            .routingKey(binding.getRoutingKey())
            .build();
        return rpc(bind, "binding of queue " + binding.getQueue() + " to exchange " + binding.getExchange());
    }

    @Override
    public Mono<Void> deleteExchange(String exchange, boolean ifUnused) {
        AMQP.Exchange.Delete delete = new AMQImpl.Exchange.Delete.Builder()
            .exchange(exchange)
            .ifUnused(ifUnused)
            .build();
        return rpc(delete, "deletion of exchange " + exchange);
    }

    @Override
    public Mono<Void> deleteQueue(String queue, boolean ifUnused, boolean ifEmpty) {
        AMQP.Queue.Delete delete = new AMQImpl.Queue.Delete.Builder()
            .queue(queue)
            .ifUnused(ifUnused)
            .ifEmpty(ifEmpty)
            .build();
        return rpc(delete, "deletion of queue " + queue);
    }

    private Mono<Void> rpc(Method method, String operation) {
        return connectionMono
            .map(Channels::open)
            .flatMap(channel -> Mono.fromCompletionStage(() -> asyncRpc(channel, method))
                .publishOn(resourceManagementScheduler)
                .doFinally(signalType -> Channels.CLOSING_HANDLER.accept(signalType, channel)))
            .doOnNext(command -> LOGGER.debug("{} succeeded", operation))
            .onErrorMap(error -> DeclarationExceptions.classify(error, operation))
            .then();
    }

    private static CompletableFuture<Command> asyncRpc(Channel channel, Method method) {
        try {
            return channel.asyncCompletableRpc(method);
        } catch (IOException e) {
            throw new RabbitBusException("Error during RPC call", e);
        }
    }

    @Override
    public void close() {
        if (privateResourceManagementScheduler) {
            resourceManagementScheduler.dispose();
        }
    }
}
