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

/**
 * JSON {@link MessageCodec} backed by Jackson.
 * <p>
 * {@code byte[]} content is sent as is.
 */
public class JacksonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    public JacksonMessageCodec() {
        this(new ObjectMapper());
    }

    public JacksonMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Definitions.requireNotNull(objectMapper, "Object mapper must not be null");
    }

    @Override
    public byte[] encode(Object content) throws JsonProcessingException {
        if (content instanceof byte[]) {
            return (byte[]) content;
        }
        return objectMapper.writeValueAsBytes(content);
    }
}
