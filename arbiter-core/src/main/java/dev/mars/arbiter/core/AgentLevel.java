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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One stage of a workflow.
 *
 * <p>Conditional levels must supply a non-empty condition; parallel levels ignore it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record AgentLevel(int level, List<AgentConfig> agents, ExecutionMode executionMode, String condition) {

    public AgentLevel {
        Objects.requireNonNull(executionMode, "Execution mode cannot be null");
        agents = agents != null ? List.copyOf(agents) : List.of();
        if (executionMode == ExecutionMode.CONDITIONAL && (condition == null || condition.isBlank())) {
            throw new IllegalArgumentException("Conditional level " + level + " requires a condition");
        }
        if (executionMode == ExecutionMode.PARALLEL) {
            condition = null;
        }
    }

    public static AgentLevel parallel(int level, AgentConfig... agents) {
        return new AgentLevel(level, Arrays.asList(agents), ExecutionMode.PARALLEL, null);
    }

    public static AgentLevel conditional(int level, String condition, AgentConfig... agents) {
        return new AgentLevel(level, Arrays.asList(agents), ExecutionMode.CONDITIONAL, condition);
    }
}
