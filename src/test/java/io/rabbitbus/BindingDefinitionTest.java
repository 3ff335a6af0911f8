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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingDefinitionTest {

    @Test
    void routingKeyDefaultsToEmptyString() {
        BindingDefinition binding = BindingDefinition.binding("exchange", "queue");

        assertThat(binding.getExchange()).isEqualTo("exchange");
        assertThat(binding.getQueue()).isEqualTo("queue");
        assertThat(binding.getRoutingKey()).isEmpty();
    }

    @Test
    void blankExchangeOrQueueIsRejected() {
        assertThatThrownBy(() -> BindingDefinition.binding(" ", "queue"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Exchange name must not be blank");
        assertThatThrownBy(() -> BindingDefinition.binding("exchange", ""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Queue name must not be blank");
        assertThatThrownBy(() -> BindingDefinition.binding("exchange", "queue", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityIsStructuralOverTheTriple() {
        BindingDefinition binding = BindingDefinition.binding("exchange", "queue", "key");

        assertThat(binding)
            .isEqualTo(BindingDefinition.binding("exchange", "queue", "key"))
            .hasSameHashCodeAs(BindingDefinition.binding("exchange", "queue", "key"))
            .isNotEqualTo(BindingDefinition.binding("other", "queue", "key"))
            .isNotEqualTo(BindingDefinition.binding("exchange", "other", "key"))
            .isNotEqualTo(BindingDefinition.binding("exchange", "queue", "other"));
        assertThat(binding).hasToString("BindingDefinition{exchange='exchange', queue='queue', routingKey='key'}");
    }
}
