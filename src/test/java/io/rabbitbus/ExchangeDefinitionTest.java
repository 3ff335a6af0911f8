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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ExchangeDefinitionTest {

    @ParameterizedTest
    @EnumSource(ExchangeType.class)
    void defaultsToDurableNonAutoDeleteExchangeWithoutArguments(ExchangeType type) {
        ExchangeDefinition exchange = ExchangeDefinition.exchange("name", type).build();

        assertThat(exchange.getName()).isEqualTo("name");
        assertThat(exchange.getType()).isEqualTo(type);
        assertThat(exchange.isDurable()).isTrue();
        assertThat(exchange.isAutoDelete()).isFalse();
        assertThat(exchange.isPassive()).isFalse();
        assertThat(exchange.isInternal()).isFalse();
        assertThat(exchange.getArguments()).isEmpty();
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", " ", "\t", "  \n "})
    void blankNameIsRejected(String name) {
        assertThatThrownBy(() -> ExchangeDefinition.exchange(name, ExchangeType.DIRECT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Exchange name must not be blank");
    }

    @Test
    void nullTypeIsRejected() {
        assertThatThrownBy(() -> ExchangeDefinition.exchange("name", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void settersCanBeCalledSeveralTimes() {
        ExchangeDefinition exchange = ExchangeDefinition.exchange("name", ExchangeType.TOPIC)
            .durable(false)
            .autoDelete(true)
            .passive(true)
            .durable(true)
            .passive(false)
            .argument("a", 1)
            .argument("a", 2)
            .build();

        assertThat(exchange.isDurable()).isTrue();
        assertThat(exchange.isAutoDelete()).isTrue();
        assertThat(exchange.isPassive()).isFalse();
        assertThat(exchange.getArguments()).containsExactly(entry("a", 2));
    }

    @Test
    void alternateSetsAlternateExchangeArgument() {
        ExchangeDefinition exchange = ExchangeDefinition.exchange("orders", ExchangeType.DIRECT)
            .alternate("unrouted")
            .build();

        assertThat(exchange.getArguments()).containsEntry("alternate-exchange", "unrouted");
    }

    @Test
    void argumentsWithInvalidEntryAreRejectedAsAWhole() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("valid", "value");
        arguments.put(" ", "value");
        ExchangeDefinition.Builder builder = ExchangeDefinition.exchange("name", ExchangeType.FANOUT);

        assertThatThrownBy(() -> builder.arguments(arguments)).isInstanceOf(IllegalArgumentException.class);
        assertThat(builder.build().getArguments()).isEmpty();
    }

    @Test
    void builtDefinitionIsASnapshot() {
        ExchangeDefinition.Builder builder = ExchangeDefinition.exchange("name", ExchangeType.HEADERS).argument("a", 1);
        ExchangeDefinition first = builder.build();
        builder.argument("b", 2).durable(false);

        assertThat(first.getArguments()).containsOnlyKeys("a");
        assertThat(first.isDurable()).isTrue();
        assertThatThrownBy(() -> first.getArguments().put("c", 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void identicalDefinitionsAreEqual() {
        ExchangeDefinition first = ExchangeDefinition.exchange("name", ExchangeType.DIRECT)
            .argument("a", 1).argument("b", "two").build();
        ExchangeDefinition second = ExchangeDefinition.exchange("name", ExchangeType.DIRECT)
            .argument("b", "two").argument("a", 1).build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.toString()).startsWith("ExchangeDefinition{name='name', type=DIRECT, durable=true");
    }

    @Test
    void changingAnyFieldBreaksEquality() {
        ExchangeDefinition reference = ExchangeDefinition.exchange("name", ExchangeType.DIRECT).build();

        assertThat(ExchangeDefinition.exchange("other", ExchangeType.DIRECT).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.TOPIC).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.DIRECT).durable(false).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.DIRECT).autoDelete(true).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.DIRECT).passive(true).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.DIRECT).internal(true).build()).isNotEqualTo(reference);
        assertThat(ExchangeDefinition.exchange("name", ExchangeType.DIRECT)
            .arguments(Collections.singletonMap("a", 1)).build()).isNotEqualTo(reference);
    }
}
