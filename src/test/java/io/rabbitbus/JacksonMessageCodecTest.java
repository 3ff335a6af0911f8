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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonMessageCodecTest {

    static class OrderCreated {

        private final String orderId;
        private final int quantity;

        OrderCreated(String orderId, int quantity) {
            this.orderId = orderId;
            this.quantity = quantity;
        }

        public String getOrderId() {
            return orderId;
        }

        public int getQuantity() {
            return quantity;
        }
    }

    static class Opaque {
    }

    @Test
    void objectsAreEncodedAsJson() throws Exception {
        byte[] body = new JacksonMessageCodec().encode(new OrderCreated("A-1", 3));

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"orderId\":\"A-1\",\"quantity\":3}");
    }

    @Test
    void stringsAreEncodedAsJsonStrings() throws Exception {
        assertThat(new String(new JacksonMessageCodec().encode("hello"), StandardCharsets.UTF_8)).isEqualTo("\"hello\"");
    }

    @Test
    void bytesArePassedThrough() throws Exception {
        byte[] raw = {1, 2, 3};

        assertThat(new JacksonMessageCodec().encode(raw)).isSameAs(raw);
    }

    @Test
    void providedObjectMapperIsUsed() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        byte[] body = new JacksonMessageCodec(objectMapper).encode(new OrderCreated("A-1", 3));

        assertThat(new String(body, StandardCharsets.UTF_8)).contains("\"order_id\":\"A-1\"");
    }

    @Test
    void unserializableContentFails() {
        assertThatThrownBy(() -> new JacksonMessageCodec().encode(new Opaque()))
            .isInstanceOf(JsonProcessingException.class);
    }
}
