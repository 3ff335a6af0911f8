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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies the errors of the RabbitMQ Java client into {@link DeclarationException}s.
 * <p>
 * A channel or connection closed by the broker with one of the {@link #REJECTION_REPLY_CODES}
 * is a rejection. Anything else (I/O error, timeout, connection not ready, other close
 * reasons) is considered transient.
 */
public abstract class DeclarationExceptions {

    public static final Set<Integer> REJECTION_REPLY_CODES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        AMQP.ACCESS_REFUSED,
        AMQP.NOT_FOUND,
        AMQP.RESOURCE_LOCKED,
        AMQP.PRECONDITION_FAILED,
        AMQP.NOT_ALLOWED,
        AMQP.NOT_IMPLEMENTED
    )));

    /**
     * @param error the error raised by the client library
     * @param operation description of the failed operation, used in the message
     * @return the error itself if it is already classified, a classified wrapper otherwise
     */
    public static DeclarationException classify(Throwable error, String operation) {
        if (error instanceof DeclarationException) {
            return (DeclarationException) error;
        }
        ShutdownSignalException shutdownSignal = shutdownSignal(error);
        if (shutdownSignal != null) {
            int replyCode = replyCode(shutdownSignal.getReason());
            if (REJECTION_REPLY_CODES.contains(replyCode)) {
                return new RejectedDeclarationException(
                    "Broker rejected " + operation + " (reply code " + replyCode + ")", replyCode, error);
            }
        }
        return new TransientDeclarationException("Error during " + operation, error);
    }

    static ShutdownSignalException shutdownSignal(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ShutdownSignalException) {
                return (ShutdownSignalException) current;
            }
            if (!(current instanceof CompletionException || current instanceof ExecutionException
                || current instanceof IOException || current instanceof RabbitBusException)) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    static int replyCode(Method reason) {
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode();
        } else if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode();
        }
        return -1;
    }
}
