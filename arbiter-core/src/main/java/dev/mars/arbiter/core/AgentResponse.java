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

/**
 * Result reported by the agent executor for one agent invocation.
 *
 * <p>A response with {@code success == false} is an ordinary outcome; it does not
 * abort the workflow.
 */
public record AgentResponse(boolean success, Object data, String error, Metadata metadata) {

    public record Metadata(String agentId, long executionTimeMs, Integer tokensUsed, String model) {
    }

    public static AgentResponse success(String agentId, Object data, long executionTimeMs) {
        return new AgentResponse(true, data, null, new Metadata(agentId, executionTimeMs, null, null));
    }

    public static AgentResponse failure(String agentId, String error, long executionTimeMs) {
        return new AgentResponse(false, null, error, new Metadata(agentId, executionTimeMs, null, null));
    }

    public int tokens() {
        return metadata != null && metadata.tokensUsed() != null ? metadata.tokensUsed() : 0;
    }
}
