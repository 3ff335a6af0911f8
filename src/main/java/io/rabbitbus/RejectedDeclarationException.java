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
 * The broker refused the operation, e.g. a passive declaration of a missing resource,
 * a re-declaration with different properties, or a permission error.
 * Repeating the same operation gives the same answer.
 */
public class RejectedDeclarationException extends DeclarationException {

    private final int replyCode;

    public RejectedDeclarationException(String message, int replyCode, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }

    /**
     * @return the AMQP reply code sent by the broker, e.g. 406 for {@code PRECONDITION_FAILED}
     */
    public int getReplyCode() {
        return replyCode;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
