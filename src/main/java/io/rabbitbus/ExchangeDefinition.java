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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of an exchange to declare.
 * <p>
 * Instances are created with the fluent {@link Builder} returned by
 * {@link #exchange(String, ExchangeType)}. Two definitions with the same name, type,
 * flags and arguments are equal and are declared only once by the {@link DeclarationEngine}.
 */
public final class ExchangeDefinition {

    static final String ALTERNATE_EXCHANGE = "alternate-exchange";

    private final String name;
    private final ExchangeType type;
    private final boolean durable, autoDelete, internal, passive;
    private final Map<String, Object> arguments;

    private ExchangeDefinition(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.durable = builder.durable;
        this.autoDelete = builder.autoDelete;
        this.internal = builder.internal;
        this.passive = builder.passive;
        this.arguments = Definitions.snapshot(builder.arguments);
    }

    /**
     * Start the definition of an exchange.
     *
     * @param name the name of the exchange, must not be blank
     * @param type the exchange type
     * @return a builder, durable and non-auto-delete by default
     * @throws IllegalArgumentException if the name is blank or the type is null
     */
    public static Builder exchange(String name, ExchangeType type) {
        return new Builder(name, type);
    }

    public String getName() {
        return name;
    }

    public ExchangeType getType() {
        return type;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isInternal() {
        return internal;
    }

    public boolean isPassive() {
        return passive;
    }

    /**
     * @return an unmodifiable view of the exchange arguments, never null
     */
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
        ExchangeDefinition that = (ExchangeDefinition) o;
        return durable == that.durable &&
            autoDelete == that.autoDelete &&
            internal == that.internal &&
            passive == that.passive &&
            name.equals(that.name) &&
            type == that.type &&
            arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, durable, autoDelete, internal, passive, arguments);
    }

    @Override
    public String toString() {
        return "ExchangeDefinition{" +
            "name='" + name + '\'' +
            ", type=" + type +
            ", durable=" + durable +
            ", autoDelete=" + autoDelete +
            ", internal=" + internal +
            ", passive=" + passive +
            ", arguments=" + arguments +
            '}';
    }

    /**
     * Fluent API to configure an {@link ExchangeDefinition}.
     * <p>
     * Not thread-safe. Every call to {@link #build()} takes a new snapshot.
     */
    public static final class Builder {

        private final String name;
        private final ExchangeType type;
        private boolean durable = true, autoDelete = false, internal = false, passive = false;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private Builder(String name, ExchangeType type) {
            this.name = Definitions.requireNotBlank(name, "Exchange name must not be blank");
            this.type = Definitions.requireNotNull(type, "Exchange type must not be null");
        }

        /**
         * Durable exchanges remain active when a server restarts. Non-durable exchanges
         * (transient exchanges) are purged if/when a server restarts.
         *
         * @param durable
         * @return this builder
         */
        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        /**
         * If set, the exchange is deleted when all queues have finished using it.
         *
         * @param autoDelete
         * @return this builder
         */
        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        /**
         * Internal exchanges cannot be published to directly by clients.
         *
         * @param internal
         * @return this builder
         */
        public Builder internal(boolean internal) {
            this.internal = internal;
            return this;
        }

        /**
         * If set, the broker only checks the exchange exists with the same properties
         * and fails the declaration otherwise. Broker state is never modified.
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
         * Set the alternate exchange, which receives the messages this exchange cannot route.
         *
         * @param exchange the name of the alternate exchange
         * @return this builder
         * @see <a href="https://www.rabbitmq.com/ae.html">Alternate Exchanges</a>
         */
        public Builder alternate(String exchange) {
            return argument(ALTERNATE_EXCHANGE, Definitions.requireNotBlank(exchange, "Alternate exchange must not be blank"));
        }

        public ExchangeDefinition build() {
            return new ExchangeDefinition(this);
        }
    }
}
