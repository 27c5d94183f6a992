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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate result of one executed (or skipped) level.
 *
 * @param agentResults agent id to response, in dispatch order
 */
public record LevelOutcome(int level, ExecutionMode mode, boolean skipped, Map<String, AgentResponse> agentResults) {

    public LevelOutcome {
        agentResults = agentResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(agentResults))
                : Map.of();
    }

    public static LevelOutcome skipped(int level, ExecutionMode mode) {
        return new LevelOutcome(level, mode, true, Map.of());
    }

    public long successCount() {
        return agentResults.values().stream().filter(AgentResponse::success).count();
    }

    public long failureCount() {
        return agentResults.size() - successCount();
    }

    /**
     * Output handed to the next level: agent id to response data for every
     * successful agent.
     */
    public Map<String, Object> output() {
        Map<String, Object> output = new LinkedHashMap<>();
        agentResults.forEach((agentId, response) -> {
            if (response.success()) {
                output.put(agentId, response.data());
            }
        });
        return output;
    }
}
