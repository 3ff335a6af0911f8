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
 * At least one resource could not be declared, after retries for transient failures.
 * <p>
 * The resources that were declared successfully stay on the broker. Each failure cause
 * is also attached as a suppressed exception.
 */
public class TopologyInitializationException extends RabbitBusException {

    private final DeclarationReport report;

    public TopologyInitializationException(DeclarationReport report) {
        super(message(report));
        this.report = report;
        report.getFailures().forEach(outcome -> addSuppressed(outcome.getFailure()));
    }

    public DeclarationReport getReport() {
        return report;
    }

    private static String message(DeclarationReport report) {
        StringBuilder builder = new StringBuilder()
            .append(report.getFailures().size())
            .append(" of ")
            .append(report.getOutcomes().size())
            .append(" resource(s) could not be declared:");
        for (DeclarationOutcome failure : report.getFailures()) {
            builder.append(System.lineSeparator())
                .append(failure.isRejected() ? "  rejected " : "  gave up on ")
                .append(failure.getDefinition())
                .append(" after ")
                .append(failure.getAttempts())
                .append(" attempt(s): ")
                .append(failure.getFailure());
        }
        return builder.toString();
    }
}
