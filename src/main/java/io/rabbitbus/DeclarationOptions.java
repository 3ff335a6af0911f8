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
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Options for the {@link DeclarationEngine}.
 */
public class DeclarationOptions {

    /**
     * Errors the engine retries. Broker rejections are never retried by default.
     */
    public static final Predicate<Throwable> TRANSIENT_FAILURE_PREDICATE =
        throwable -> !(throwable instanceof DeclarationException) || ((DeclarationException) throwable).isTransient();

    /**
     * Number of retries after the first attempt of each resource operation. Default is 3.
     */
    private long maxRetries = 3;

    /**
     * First backoff delay, doubled on each retry. Default is 100 ms.
     */
    private Duration minBackoff = Duration.ofMillis(100);

    /**
     * Upper bound of the backoff delay. Default is 10 seconds.
     */
    private Duration maxBackoff = Duration.ofSeconds(10);

    private double jitterFactor = 0.5;

    private Predicate<Throwable> retryPredicate = TRANSIENT_FAILURE_PREDICATE;

    /**
     * Scheduler used to fan out the declarations of a resource kind.
     * <p>
     * The default is {@link Schedulers#parallel()}.
     */
    private Scheduler scheduler = Schedulers.parallel();

    /**
     * Maximum number of concurrent declarations for a resource kind.
     * <p>
     * Not limited by default (only by the parallelism of the scheduler).
     */
    private Integer maxConcurrency;

    /**
     * Overall time limit of an initialization. No limit by default.
     */
    private Duration timeout;

    public long getMaxRetries() {
        return maxRetries;
    }

    public DeclarationOptions maxRetries(long maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be greater than or equal to 0");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public Duration getMinBackoff() {
        return minBackoff;
    }

    public DeclarationOptions minBackoff(Duration minBackoff) {
        if (minBackoff == null || minBackoff.isNegative()) {
            throw new IllegalArgumentException("Min backoff must not be negative");
        }
        this.minBackoff = minBackoff;
        return this;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public DeclarationOptions maxBackoff(Duration maxBackoff) {
        if (maxBackoff == null || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Max backoff must not be negative");
        }
        this.maxBackoff = maxBackoff;
        return this;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    /**
     * Set the jitter applied to each backoff delay, between 0 (no jitter) and 1.
     * <p>
     * Default is 0.5.
     *
     * @param jitterFactor
     * @return this {@link DeclarationOptions} instance
     */
    public DeclarationOptions jitterFactor(double jitterFactor) {
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("Jitter factor must be between 0 and 1");
        }
        this.jitterFactor = jitterFactor;
        return this;
    }

    public Predicate<Throwable> getRetryPredicate() {
        return retryPredicate;
    }

    /**
     * Set which failures are retried.
     * <p>
     * Default is {@link #TRANSIENT_FAILURE_PREDICATE}.
     *
     * @param retryPredicate
     * @return this {@link DeclarationOptions} instance
     */
    public DeclarationOptions retryPredicate(Predicate<Throwable> retryPredicate) {
        this.retryPredicate = Definitions.requireNotNull(retryPredicate, "Retry predicate must not be null");
        return this;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public DeclarationOptions scheduler(Scheduler scheduler) {
        this.scheduler = Definitions.requireNotNull(scheduler, "Scheduler must not be null");
        return this;
    }

    @Nullable
    public Integer getMaxConcurrency() {
        return maxConcurrency;
    }

    public DeclarationOptions maxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Definitions.requirePositive(maxConcurrency, "Max concurrency must be greater than 0");
        return this;
    }

    @Nullable
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Set a time limit for a whole initialization. Declarations still in flight
     * when it is reached are cancelled and the initialization fails with a
     * {@link java.util.concurrent.TimeoutException}.
     *
     * @param timeout
     * @return this {@link DeclarationOptions} instance
     */
    public DeclarationOptions timeout(@Nullable Duration timeout) {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be greater than 0");
        }
        this.timeout = timeout;
        return this;
    }
}
