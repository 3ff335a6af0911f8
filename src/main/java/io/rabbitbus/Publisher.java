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

import reactor.core.publisher.Mono;

/**
 * Sends messages to the broker.
 *
 * @see ChannelPublisher
 */
public interface Publisher {

    /**
     * Send a message without waiting for the broker.
     *
     * @param message the message to send
     * @return a mono completing once the message has been handed to the client library
     */
    Mono<Void> send(OutboundMessage message);

    /**
     * Send a message and wait for the broker confirmation.
     * <p>
     * The mono emits at most one result. It completes empty if no confirmation
     * could be correlated to the message, and errors if the message could not be sent.
     *
     * @param message the message to send
     * @return a mono of the confirmation
     * @see <a href="https://www.rabbitmq.com/confirms.html#publisher-confirms">Publisher Confirms</a>
     */
    Mono<OutboundMessageResult> sendWithConfirms(OutboundMessage message);
}
