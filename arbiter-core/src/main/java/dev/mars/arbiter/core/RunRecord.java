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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted record of one run: a workflow execution, an agent invocation or a
 * management API request.
 *
 * <p>Workflow execution runs carry the execution log and the outcome of every
 * level that was reached, including when the execution failed part way.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record RunRecord(
        String id,
        String workflowId,
        String executionId,
        RunType runType,
        ExecutionStatus status,
        Instant startTime,
        Instant endTime,
        Long durationMs,
        Object requestData,
        Object responseData,
        String errorMessage,
        String errorCode,
        Integer tokensUsed,
        Map<String, Object> metadata,
        List<String> tags,
        List<WorkflowLogEntry> executionLog,
        List<LevelOutcome> levelOutcomes) {

    public RunRecord {
        Objects.requireNonNull(id, "Run id cannot be null");
        Objects.requireNonNull(runType, "Run type cannot be null");
        Objects.requireNonNull(status, "Run status cannot be null");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        executionLog = executionLog != null ? List.copyOf(executionLog) : List.of();
        levelOutcomes = levelOutcomes != null ? List.copyOf(levelOutcomes) : List.of();
    }

    public static Builder builder(RunType runType) {
        return new Builder(runType);
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }

    public static final class Builder {
        private String id = "run_" + UUID.randomUUID();
        private final RunType runType;
        private String workflowId;
        private String executionId;
        private ExecutionStatus status = ExecutionStatus.COMPLETED;
        private Instant startTime = Instant.now();
        private Instant endTime;
        private Object requestData;
        private Object responseData;
        private String errorMessage;
        private String errorCode;
        private Integer tokensUsed;
        private Map<String, Object> metadata;
        private List<String> tags;
        private List<WorkflowLogEntry> executionLog;
        private List<LevelOutcome> levelOutcomes;

        private Builder(RunType runType) {
            this.runType = runType;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder requestData(Object requestData) {
            this.requestData = requestData;
            return this;
        }

        public Builder responseData(Object responseData) {
            this.responseData = responseData;
            return this;
        }

        public Builder error(String errorCode, String errorMessage) {
            this.errorCode = errorCode;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder tokensUsed(Integer tokensUsed) {
            this.tokensUsed = tokensUsed;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder executionLog(List<WorkflowLogEntry> executionLog) {
            this.executionLog = executionLog;
            return this;
        }

        public Builder levelOutcomes(List<LevelOutcome> levelOutcomes) {
            this.levelOutcomes = levelOutcomes;
            return this;
        }

        public RunRecord build() {
            Instant end = endTime != null ? endTime : Instant.now();
            long duration = Duration.between(startTime, end).toMillis();
            return new RunRecord(id, workflowId, executionId, runType, status, startTime, end, duration,
                    requestData, responseData, errorMessage, errorCode, tokensUsed, metadata, tags,
                    executionLog, levelOutcomes);
        }
    }
}
