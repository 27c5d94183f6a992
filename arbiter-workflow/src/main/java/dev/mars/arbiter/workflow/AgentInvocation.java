package dev.mars.arbiter.workflow;

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
 * Where an agent call sits within a workflow execution.
 *
 * @param level    workflow level of the agent, 0 for the root agent
 * @param metadata trigger metadata of the event that started the execution
 */
public record AgentInvocation(String workflowId, String executionId, int level, String userPrompt,
                              Map<String, Object> metadata) {

    public AgentInvocation {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
