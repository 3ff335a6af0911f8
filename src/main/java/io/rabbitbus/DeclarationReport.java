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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcomes of all the resources handled by one {@link DeclarationEngine#initialize()} call.
 */
public class DeclarationReport {

    private final List<DeclarationOutcome> outcomes;

    DeclarationReport(List<DeclarationOutcome> exchanges, List<DeclarationOutcome> queues, List<DeclarationOutcome> bindings) {
        List<DeclarationOutcome> all = new ArrayList<>(exchanges.size() + queues.size() + bindings.size());
        all.addAll(exchanges);
        all.addAll(queues);
        all.addAll(bindings);
        this.outcomes = Collections.unmodifiableList(all);
    }

    public List<DeclarationOutcome> getOutcomes() {
        return outcomes;
    }

    public List<DeclarationOutcome> getOutcomes(ResourceKind kind) {
        return outcomes.stream().filter(outcome -> outcome.getKind() == kind).collect(Collectors.toList());
    }

    public List<DeclarationOutcome> getFailures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).collect(Collectors.toList());
    }

    public boolean isSuccessful() {
        return outcomes.stream().allMatch(DeclarationOutcome::isSuccess);
    }

    @Override
    public String toString() {
        return "DeclarationReport{" +
            "outcomes=" + outcomes +
            '}';
    }
}
