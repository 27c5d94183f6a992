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
import java.util.List;
import java.util.Map;

/**
 * Definition of a single AI agent within a workflow.
 *
 * @param id            agent identifier, unique within the workflow
 * @param name          display name
 * @param description   free text
 * @param model         model identifier passed to the agent executor
 * @param systemPrompt  instructions for the model, must not be blank
 * @param availableTools names of the tools the agent may call
 * @param level         the level this agent belongs to (0 for the root agent)
 * @param metadata      free-form settings
 */
public record AgentConfig(
        String id,
        String name,
        String description,
        String model,
        String systemPrompt,
        List<String> availableTools,
        int level,
        Map<String, Object> metadata) {

    public AgentConfig {
        availableTools = availableTools != null ? List.copyOf(availableTools) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static AgentConfig of(String id, String name, String systemPrompt) {
        return new AgentConfig(id, name, null, null, systemPrompt, List.of(), 0, Map.of());
    }

    public AgentConfig atLevel(int newLevel) {
        return new AgentConfig(id, name, description, model, systemPrompt, availableTools, newLevel, metadata);
    }
}
