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

/**
 * Broker confirmation of a message sent with {@link Publisher#sendWithConfirms(OutboundMessage)}.
 */
public class OutboundMessageResult {

    private final OutboundMessage outboundMessage;

    private final boolean ack;

    private final boolean returned;

    public OutboundMessageResult(OutboundMessage outboundMessage, boolean ack) {
        this(outboundMessage, ack, false);
    }

    /**
     * @param outboundMessage the confirmed message
     * @param ack whether the broker acknowledged the message
     * @param returned whether the broker returned the message as unroutable
     */
    public OutboundMessageResult(OutboundMessage outboundMessage, boolean ack, boolean returned) {
        this.outboundMessage = outboundMessage;
        this.ack = ack;
        this.returned = returned;
    }

    public OutboundMessage getOutboundMessage() {
        return outboundMessage;
    }

    /**
     * A message can be acknowledged and still not routed to any queue,
     * see {@link #isReturned()}.
     *
     * @return true if the broker acknowledged the message
     */
    public boolean isAck() {
        return ack;
    }

    /**
     * Only tracked for mandatory messages.
     *
     * @return true if the message was unroutable and has been returned
     */
    public boolean isReturned() {
        return returned;
    }

    /**
     * @return true if the message was acknowledged and not returned
     */
    public boolean isDelivered() {
        return ack && !returned;
    }

    @Override
    public String toString() {
        return "OutboundMessageResult{" +
            "outboundMessage=" + outboundMessage +
            ", ack=" + ack +
            ", returned=" + returned +
            '}';
    }
}
