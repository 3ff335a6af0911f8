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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

class DefaultRabbitBus implements RabbitBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRabbitBus.class);

    private final DeclarationEngine declarationEngine;

    private final PublishEngine publishEngine;

    // closed in reverse order
    private final List<AutoCloseable> resources;

    private final AtomicBoolean closingOrClosed = new AtomicBoolean(false);

    DefaultRabbitBus(DeclarationEngine declarationEngine, PublishEngine publishEngine, List<AutoCloseable> resources) {
        this.declarationEngine = Definitions.requireNotNull(declarationEngine, "Declaration engine must not be null");
        this.publishEngine = Definitions.requireNotNull(publishEngine, "Publish engine must not be null");
        this.resources = new ArrayList<>(resources);
    }

    @Override
    public ResourceManager resourceManager() {
        return declarationEngine;
    }

    @Override
    public Mono<Void> publish(String exchange, String routingKey, Object messageContent,
                              @Nullable AMQP.BasicProperties properties) {
        return publishEngine.publish(exchange, routingKey, messageContent, properties);
    }

    @Override
    public Mono<Boolean> publishWithConfirms(String exchange, String routingKey, Object messageContent,
                                             @Nullable AMQP.BasicProperties properties) {
        return publishEngine.publishWithConfirms(exchange, routingKey, messageContent, properties);
    }

    @Override
    public void close() {
        if (closingOrClosed.compareAndSet(false, true)) {
            for (int i = resources.size() - 1; i >= 0; i--) {
                AutoCloseable resource = resources.get(i);
                try {
                    resource.close();
                } catch (Exception e) {
                    LOGGER.warn("Error while closing {}: {}", resource, e.getMessage());
                }
            }
        }
    }
}
