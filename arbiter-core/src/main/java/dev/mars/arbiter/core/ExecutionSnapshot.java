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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a {@link WorkflowExecution} at a point in time.
 */
public record ExecutionSnapshot(
        String id,
        String workflowId,
        ExecutionStatus status,
        Instant startTime,
        Instant endTime,
        Object eventData,
        int currentLevel,
        String currentAgent,
        List<WorkflowLogEntry> executionLog,
        List<LevelOutcome> levelOutcomes,
        Object result,
        String error) {

    public ExecutionSnapshot {
        executionLog = List.copyOf(executionLog);
        levelOutcomes = List.copyOf(levelOutcomes);
    }

    public Duration elapsed() {
        return Duration.between(startTime, endTime != null ? endTime : Instant.now());
    }
}
