package dev.mars.arbiter.storage;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.arbiter.core.ExecutionStatus;
import dev.mars.arbiter.core.RunRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering and filtering shared by the store implementations.
 */
final class RunQueries {

    static final Comparator<RunRecord> NEWEST_FIRST =
            Comparator.comparing(RunRecord::startTime, Comparator.nullsLast(Comparator.reverseOrder()));

    private RunQueries() {
    }

    static List<RunRecord> newest(Collection<RunRecord> runs, int limit) {
        return runs.stream().sorted(NEWEST_FIRST).limit(Math.max(0, limit)).toList();
    }

    static List<RunRecord> recentErrors(Collection<RunRecord> runs, int limit) {
        return runs.stream()
                .filter(r -> r.status() == ExecutionStatus.FAILED || r.errorMessage() != null)
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }
}
