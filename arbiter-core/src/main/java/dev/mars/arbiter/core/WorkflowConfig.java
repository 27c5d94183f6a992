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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.arbiter.core.exceptions.WorkflowValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Persisted definition of a workflow: its trigger, root agent and ordered levels.
 *
 * <p>Instances are immutable. The trigger is always rebound to the workflow id, so a
 * trigger read back from a workflow can be handed straight to the registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class WorkflowConfig {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final EventTrigger trigger;
    private final AgentConfig rootAgent;
    private final String userPrompt;
    private final List<AgentLevel> levels;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    @JsonCreator
    public WorkflowConfig(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("version") String version,
            @JsonProperty("trigger") EventTrigger trigger,
            @JsonProperty("rootAgent") AgentConfig rootAgent,
            @JsonProperty("userPrompt") String userPrompt,
            @JsonProperty("levels") List<AgentLevel> levels,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("updatedAt") Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        this.name = name;
        this.description = description;
        this.version = version != null ? version : "1.0.0";
        this.trigger = trigger != null ? trigger.forWorkflow(id) : new EventTrigger.Manual(id);
        this.rootAgent = rootAgent;
        this.userPrompt = userPrompt;
        this.levels = levels != null ? List.copyOf(levels) : List.of();
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .version(version)
                .trigger(trigger)
                .rootAgent(rootAgent)
                .userPrompt(userPrompt)
                .levels(levels)
                .metadata(metadata)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    /**
     * Checks the structural rules of the definition.
     *
     * @throws WorkflowValidationException listing every violation found
     */
    public void validate() throws WorkflowValidationException {
        List<String> violations = new ArrayList<>();
        if (id.isBlank()) {
            violations.add("id is required");
        }
        if (name == null || name.isBlank()) {
            violations.add("name is required");
        }
        if (rootAgent == null) {
            violations.add("rootAgent is required");
        } else {
            if (rootAgent.id() == null || rootAgent.id().isBlank()) {
                violations.add("rootAgent.id is required");
            }
            if (rootAgent.name() == null || rootAgent.name().isBlank()) {
                violations.add("rootAgent.name is required");
            }
            if (rootAgent.systemPrompt() == null || rootAgent.systemPrompt().isBlank()) {
                violations.add("rootAgent.systemPrompt is required");
            }
        }
        Set<String> agentIds = new HashSet<>();
        if (rootAgent != null && rootAgent.id() != null && !rootAgent.id().isBlank()) {
            agentIds.add(rootAgent.id());
        }
        int previous = 0;
        for (AgentLevel level : levels) {
            if (level.level() <= previous) {
                violations.add("level " + level.level() + " must be greater than " + previous);
            }
            previous = Math.max(previous, level.level());
            for (AgentConfig agent : level.agents()) {
                if (agent.id() == null || agent.id().isBlank()) {
                    violations.add("level " + level.level() + " has an agent without an id");
                    continue;
                }
                if (!agentIds.add(agent.id())) {
                    violations.add("agent id '" + agent.id() + "' in level " + level.level() + " is already used");
                }
                if (agent.systemPrompt() == null || agent.systemPrompt().isBlank()) {
                    violations.add("agent '" + agent.id() + "' in level " + level.level()
                            + " requires a systemPrompt");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(id, violations);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public EventTrigger getTrigger() {
        return trigger;
    }

    public AgentConfig getRootAgent() {
        return rootAgent;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public List<AgentLevel> getLevels() {
        return levels;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonIgnore
    public int getAgentCount() {
        return (rootAgent != null ? 1 : 0) + levels.stream().mapToInt(l -> l.agents().size()).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkflowConfig that)) {
            return false;
        }
        return id.equals(that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(version, that.version)
                && Objects.equals(trigger, that.trigger)
                && Objects.equals(rootAgent, that.rootAgent)
                && Objects.equals(levels, that.levels)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, version, trigger, rootAgent, levels, updatedAt);
    }

    @Override
    public String toString() {
        return "WorkflowConfig{id='" + id + "', name='" + name + "', trigger=" + trigger.kind().wireName()
                + ", levels=" + levels.size() + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String version;
        private EventTrigger trigger;
        private AgentConfig rootAgent;
        private String userPrompt;
        private final List<AgentLevel> levels = new ArrayList<>();
        private Map<String, Object> metadata;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder trigger(EventTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder rootAgent(AgentConfig rootAgent) {
            this.rootAgent = rootAgent;
            return this;
        }

        public Builder userPrompt(String userPrompt) {
            this.userPrompt = userPrompt;
            return this;
        }

        public Builder level(AgentLevel level) {
            this.levels.add(level);
            return this;
        }

        public Builder levels(List<AgentLevel> levels) {
            this.levels.clear();
            this.levels.addAll(levels);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkflowConfig build() {
            return new WorkflowConfig(id, name, description, version, trigger, rootAgent, userPrompt,
                    levels, metadata, createdAt, updatedAt);
        }
    }
}
