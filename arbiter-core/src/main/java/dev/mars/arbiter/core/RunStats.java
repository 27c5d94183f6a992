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

/**
 * Aggregate counters over a set of runs.
 */
public record RunStats(long totalRuns, long successfulRuns, long failedRuns, double averageDurationMs,
                       long totalTokens) {

    public static RunStats of(Collection<RunRecord> runs) {
        long successful = 0;
        long failed = 0;
        long durationSum = 0;
        long durationCount = 0;
        long tokens = 0;
        for (RunRecord run : runs) {
            if (run.status() == ExecutionStatus.COMPLETED) {
                successful++;
            } else if (run.status() == ExecutionStatus.FAILED) {
                failed++;
            }
            if (run.durationMs() != null) {
                durationSum += run.durationMs();
                durationCount++;
            }
            if (run.tokensUsed() != null) {
                tokens += run.tokensUsed();
            }
        }
        double average = durationCount == 0 ? 0.0 : (double) durationSum / durationCount;
        return new RunStats(runs.size(), successful, failed, average, tokens);
    }
}
