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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a queue to declare.
 * <p>
 * Use {@link #queue(String)} to get a {@link Builder}. Unlike server-named queues,
 * a queue definition always carries an explicit, non-blank name.
 */
public final class QueueDefinition {

    static final String MESSAGE_TTL = "x-message-ttl";
    static final String EXPIRES = "x-expires";
    static final String MAX_LENGTH = "x-max-length";
    static final String MAX_LENGTH_BYTES = "x-max-length-bytes";
    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final boolean passive;
    private final Map<String, Object> arguments;

    private QueueDefinition(Builder builder) {
        this.name = builder.name;
        this.durable = builder.durable;
        this.exclusive = builder.exclusive;
        this.autoDelete = builder.autoDelete;
        this.passive = builder.passive;
        this.arguments = Definitions.snapshot(builder.arguments);
    }

    /**
     * Start the definition of a queue.
     *
     * @param name the name of the queue, must not be blank
     * @return a durable, non-exclusive, non-auto-delete queue builder
     * @throws IllegalArgumentException if the name is blank
     */
    public static Builder queue(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isPassive() {
        return passive;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueueDefinition that = (QueueDefinition) o;
        return durable == that.durable &&
            exclusive == that.exclusive &&
            autoDelete == that.autoDelete &&
            passive == that.passive &&
            name.equals(that.name) &&
            arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, durable, exclusive, autoDelete, passive, arguments);
    }

    @Override
    public String toString() {
        return "QueueDefinition{" +
            "name='" + name + '\'' +
            ", durable=" + durable +
            ", exclusive=" + exclusive +
            ", autoDelete=" + autoDelete +
            ", passive=" + passive +
            ", arguments=" + arguments +
            '}';
    }

    /**
     * Fluent API to configure a {@link QueueDefinition}.
     * <p>
     * The argument helpers validate their input before touching the builder:
     * a rejected call leaves it unchanged.
     */
    public static final class Builder {

        private final String name;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private boolean passive = false;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Definitions.requireNotBlank(name, "Queue name must not be blank");
        }

        /**
         * Durable queues remain active when a server restarts. Note that durable queues
         * do not necessarily hold persistent messages.
         *
         * @param durable
         * @return this builder
         */
        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        /**
         * Exclusive queues may only be accessed by the current connection, and are deleted
         * when that connection closes.
         *
         * @param exclusive
         * @return this builder
         */
        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        /**
         * If set, the queue is deleted once its last consumer is cancelled. A queue that never
         * had a consumer is not deleted.
         *
         * @param autoDelete
         * @return this builder
         */
        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        /**
         * If set, the broker only checks the queue exists with the same properties
         * and fails the declaration otherwise.
         *
         * @param passive
         * @return this builder
         */
        public Builder passive(boolean passive) {
            this.passive = passive;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(
                Definitions.requireNotBlank(key, "Argument key must not be blank"),
                Definitions.requireNotNull(value, "Argument value must not be null")
            );
            return this;
        }

        public Builder arguments(Map<String, Object> arguments) {
            this.arguments.putAll(Definitions.requireValidArguments(arguments));
            return this;
        }

        /**
         * Time-to-live of the messages in the queue.
         *
         * @param duration a strictly positive duration
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/ttl.html#message-ttl-using-x-args">Message TTL</a>
         */
        public Builder messageTTL(Duration duration) {
            return argument(MESSAGE_TTL, Definitions.requirePositiveMillis(duration, "Message ttl"));
        }

        /**
         * Time-to-live of the queue itself, once unused.
         *
         * @param duration a strictly positive duration
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/ttl.html#queue-ttl-using-x-args">Queue TTL</a>
         */
        public Builder queueTTL(Duration duration) {
            return argument(EXPIRES, Definitions.requirePositiveMillis(duration, "Queue ttl"));
        }

        /**
         * Limit the queue to a number of messages.
         *
         * @param maximumNumberOfMessages a strictly positive number
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/maxlength.html">Queue Length Limit</a>
         */
        public Builder maximumLengthOfQueueByMessageCounts(int maximumNumberOfMessages) {
            return argument(MAX_LENGTH, Definitions.requirePositive(
                maximumNumberOfMessages, "Maximum number of messages must be greater than 0"));
        }

        /**
         * Limit the queue to a total of message body bytes.
         *
         * @param maximumNumberOfBytes a strictly positive number
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/maxlength.html">Queue Length Limit</a>
         */
        public Builder maximumLengthOfQueueByMessageSizes(int maximumNumberOfBytes) {
            return argument(MAX_LENGTH_BYTES, Definitions.requirePositive(
                maximumNumberOfBytes, "Maximum number of bytes must be greater than 0"));
        }

        /**
         * The exchange expired, rejected or overflowed messages are republished to.
         * It does not have to exist when the queue is declared.
         *
         * @param deadLetterExchange
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/dlx.html">Dead Letter Exchanges</a>
         */
        public Builder deadLetterExchange(String deadLetterExchange) {
            return argument(DEAD_LETTER_EXCHANGE,
                Definitions.requireNotNull(deadLetterExchange, "Dead letter exchange must not be null"));
        }

        /**
         * Routing key used when dead-lettering, the message's own routing key otherwise.
         *
         * @param deadLetterRoutingKey
         * @return this builder
         */
        public Builder deadLetterRoutingKey(String deadLetterRoutingKey) {
            return argument(DEAD_LETTER_ROUTING_KEY,
                Definitions.requireNotNull(deadLetterRoutingKey, "Dead letter routing key must not be null"));
        }

        public QueueDefinition build() {
            return new QueueDefinition(this);
        }
    }
}
