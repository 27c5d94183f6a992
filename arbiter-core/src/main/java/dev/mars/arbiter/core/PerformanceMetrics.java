package dev.mars.arbiter.core;

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

import java.util.Collection;
import java.util.List;

/**
 * Averages computed over completed runs only.
 */
public record PerformanceMetrics(double averageTokensPerRun, double averageDurationMs, long totalRuns) {

    public static PerformanceMetrics of(Collection<RunRecord> runs) {
        List<RunRecord> completed = runs.stream().filter(RunRecord::isSuccessful).toList();
        if (completed.isEmpty()) {
            return new PerformanceMetrics(0.0, 0.0, 0);
        }
        double tokens = completed.stream()
                .mapToInt(r -> r.tokensUsed() != null ? r.tokensUsed() : 0)
                .average().orElse(0.0);
        double duration = completed.stream()
                .mapToLong(r -> r.durationMs() != null ? r.durationMs() : 0L)
                .average().orElse(0.0);
        return new PerformanceMetrics(tokens, duration, completed.size());
    }
}
