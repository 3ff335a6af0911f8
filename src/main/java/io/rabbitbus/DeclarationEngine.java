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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.ParallelFlux;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link ResourceManager} that declares resources through a {@link Declarator}.
 * <p>
 * On {@link #initialize()}, identical definitions are declared once, resources of the same
 * kind are declared concurrently, and each kind waits for the previous one to be
 * completely handled: exchanges, then queues, then bindings. Transient failures are
 * retried with an exponential backoff (see {@link DeclarationOptions}). A failed resource
 * does not prevent the others, including those of later kinds, from being declared.
 * <p>
 * Only one initialization can be in flight at a time. Once it has terminated,
 * {@link #initialize()} can be subscribed again and declares the whole topology again.
 */
public class DeclarationEngine implements ResourceManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationEngine.class);

    private final Declarator declarator;

    private final DeclarationOptions options;

    private final List<ExchangeDefinition> exchangeDefinitions = new CopyOnWriteArrayList<>();

    private final List<QueueDefinition> queueDefinitions = new CopyOnWriteArrayList<>();

    private final List<BindingDefinition> bindingDefinitions = new CopyOnWriteArrayList<>();

    private final AtomicBoolean initializing = new AtomicBoolean(false);

    public DeclarationEngine(Declarator declarator) {
        this(declarator, new DeclarationOptions());
    }

    public DeclarationEngine(Declarator declarator, DeclarationOptions options) {
        this.declarator = Definitions.requireNotNull(declarator, "Declarator must not be null");
        this.options = options == null ? new DeclarationOptions() : options;
    }

    @Override
    public ResourceManager declareExchange(String name, ExchangeType type, Consumer<ExchangeDefinition.Builder> configurer) {
        ExchangeDefinition.Builder builder = ExchangeDefinition.exchange(name, type);
        if (configurer != null) {
            configurer.accept(builder);
        }
        return declareExchange(builder.build());
    }

    @Override
    public ResourceManager declareExchange(ExchangeDefinition exchange) {
        exchangeDefinitions.add(Definitions.requireNotNull(exchange, "Exchange definition must not be null"));
        return this;
    }

    @Override
    public ResourceManager declareQueue(String name, Consumer<QueueDefinition.Builder> configurer) {
        QueueDefinition.Builder builder = QueueDefinition.queue(name);
        if (configurer != null) {
            configurer.accept(builder);
        }
        return declareQueue(builder.build());
    }

    @Override
    public ResourceManager declareQueue(QueueDefinition queue) {
        queueDefinitions.add(Definitions.requireNotNull(queue, "Queue definition must not be null"));
        return this;
    }

    @Override
    public ResourceManager bindQueue(BindingDefinition binding) {
        bindingDefinitions.add(Definitions.requireNotNull(binding, "Binding definition must not be null"));
        return this;
    }

    @Override
    public Mono<Void> deleteExchange(String name, boolean ifUnused) {
        Definitions.requireNotBlank(name, "Exchange name must not be blank");
        return Mono.defer(() -> declarator.deleteExchange(name, ifUnused))
            .retryWhen(retry())
            .doOnSuccess(v -> LOGGER.debug("Deleted exchange {}", name));
    }

    @Override
    public Mono<Void> deleteQueue(String name, boolean ifUnused, boolean ifEmpty) {
        Definitions.requireNotBlank(name, "Queue name must not be blank");
        return Mono.defer(() -> declarator.deleteQueue(name, ifUnused, ifEmpty))
            .retryWhen(retry())
            .doOnSuccess(v -> LOGGER.debug("Deleted queue {}", name));
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (!initializing.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException("An initialization is already in progress"));
            }
            List<ExchangeDefinition> exchanges = distinct(exchangeDefinitions);
            List<QueueDefinition> queues = distinct(queueDefinitions);
            List<BindingDefinition> bindings = distinct(bindingDefinitions);

            Mono<DeclarationReport> report = declareAll(ResourceKind.EXCHANGE, exchanges, declarator::declareExchange)
                .flatMap(exchangeOutcomes -> declareAll(ResourceKind.QUEUE, queues, declarator::declareQueue)
                    .flatMap(queueOutcomes -> declareAll(ResourceKind.BINDING, bindings, declarator::bindQueue)
                        .map(bindingOutcomes -> new DeclarationReport(exchangeOutcomes, queueOutcomes, bindingOutcomes))));
            if (options.getTimeout() != null) {
                report = report.timeout(options.getTimeout());
            }
            return report
                .flatMap(this::complete)
                .doFinally(signalType -> initializing.set(false));
        });
    }

    private Mono<Void> complete(DeclarationReport report) {
        if (report.isSuccessful()) {
            LOGGER.debug("Declared {} resource(s)", report.getOutcomes().size());
            return Mono.empty();
        }
        TopologyInitializationException exception = new TopologyInitializationException(report);
        LOGGER.warn(exception.getMessage());
        return Mono.error(exception);
    }

    private <T> Mono<List<DeclarationOutcome>> declareAll(ResourceKind kind, List<T> definitions,
                                                          Function<T, Mono<Void>> operation) {
        if (definitions.isEmpty()) {
            LOGGER.debug("No {} found to declare.", kind.name().toLowerCase());
            return Mono.just(Collections.emptyList());
        }

        ParallelFlux<T> rails = options.getMaxConcurrency() == null ?
            Flux.fromIterable(definitions).parallel() :
            Flux.fromIterable(definitions).parallel(options.getMaxConcurrency());

        return rails
            .runOn(options.getScheduler())
            .doOnNext(definition -> LOGGER.debug("Will declare {}", definition))
            .flatMap(definition -> declare(kind, definition, operation), false,
                options.getMaxConcurrency() == null ? Integer.MAX_VALUE : 1)
            .sequential()
            .collectList();
    }

    private <T> Mono<DeclarationOutcome> declare(ResourceKind kind, T definition, Function<T, Mono<Void>> operation) {
        AtomicInteger attempts = new AtomicInteger(0);
        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return operation.apply(definition);
            })
            .retryWhen(retry().doBeforeRetry(signal ->
                LOGGER.debug("Retrying {} after failure #{}: {}", definition, signal.totalRetries() + 1, signal.failure().getMessage())))
            .then(Mono.fromCallable(() -> new DeclarationOutcome(kind, definition, attempts.get(), null)))
            .doOnNext(outcome -> LOGGER.debug("Declared {}", definition))
            .onErrorResume(error -> {
                LOGGER.warn("Could not declare {} after {} attempt(s): {}", definition, attempts.get(), error.getMessage());
                return Mono.just(new DeclarationOutcome(kind, definition, attempts.get(), error));
            });
    }

    private RetryBackoffSpec retry() {
        return Retry.backoff(options.getMaxRetries(), options.getMinBackoff())
            .maxBackoff(options.getMaxBackoff())
            .jitter(options.getJitterFactor())
            .filter(options.getRetryPredicate())
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    // structural de-duplication, first seen wins
    private static <T> List<T> distinct(List<T> definitions) {
        return new ArrayList<>(new LinkedHashSet<>(definitions));
    }
}
