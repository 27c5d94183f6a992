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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One line of an execution's log.
 *
 * @param levelNumber workflow level the entry refers to (0 for the root agent), or {@code null}
 */
public record WorkflowLogEntry(
        Instant timestamp,
        LogLevel level,
        String message,
        String agentId,
        Integer levelNumber,
        Map<String, Object> data) {

    public WorkflowLogEntry {
        Objects.requireNonNull(level, "Log level cannot be null");
        Objects.requireNonNull(message, "Log message cannot be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static WorkflowLogEntry info(String message, String agentId, Integer levelNumber, Map<String, Object> data) {
        return new WorkflowLogEntry(Instant.now(), LogLevel.INFO, message, agentId, levelNumber, data);
    }

    public static WorkflowLogEntry warn(String message, String agentId, Integer levelNumber, Map<String, Object> data) {
        return new WorkflowLogEntry(Instant.now(), LogLevel.WARN, message, agentId, levelNumber, data);
    }

    public static WorkflowLogEntry error(String message, String agentId, Integer levelNumber, Map<String, Object> data) {
        return new WorkflowLogEntry(Instant.now(), LogLevel.ERROR, message, agentId, levelNumber, data);
    }
}
