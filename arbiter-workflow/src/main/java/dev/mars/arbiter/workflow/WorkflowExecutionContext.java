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

import dev.mars.arbiter.core.AgentResponse;
import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.LevelOutcome;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.WorkflowExecution;
import dev.mars.arbiter.core.WorkflowLogEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory state carried through one execution: the accumulated agent responses,
 * the merged agent outputs ({@code state}) and the output of the last executed level.
 *
 * <p>Updates are made under the execution's monitor. The engine closes the context
 * as soon as it decides the outcome, before the run is recorded; updates arriving
 * after that, such as a level resolving after its timeout, are dropped.
 */
public final class WorkflowExecutionContext {

    private final WorkflowExecution execution;
    private final WorkflowConfig workflow;
    private final Event event;
    private final Map<String, Object> state = new LinkedHashMap<>();
    private final Map<String, AgentResponse> agentResponses = new LinkedHashMap<>();
    private Object lastOutput;
    private LevelOutcome lastLevel;
    private boolean closed;

    public WorkflowExecutionContext(WorkflowExecution execution, WorkflowConfig workflow, Event event) {
        this.execution = Objects.requireNonNull(execution, "Execution cannot be null");
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        this.lastOutput = event.data();
    }

    public WorkflowExecution getExecution() {
        return execution;
    }

    public WorkflowConfig getWorkflow() {
        return workflow;
    }

    public Event getEvent() {
        return event;
    }

    public Map<String, Object> getState() {
        synchronized (execution) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(state));
        }
    }

    public Map<String, AgentResponse> getAgentResponses() {
        synchronized (execution) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(agentResponses));
        }
    }

    /**
     * Output of the root agent or of the last executed (not skipped) level; the
     * event data before anything ran.
     */
    public Object getLastOutput() {
        synchronized (execution) {
            return lastOutput;
        }
    }

    public LevelOutcome getLastLevel() {
        synchronized (execution) {
            return lastLevel;
        }
    }

    boolean recordRoot(AgentResponse response, WorkflowLogEntry entry) {
        synchronized (execution) {
            if (!accepting()) {
                return false;
            }
            String agentId = workflow.getRootAgent().id();
            agentResponses.put(agentId, response);
            if (response.success()) {
                state.put(agentId, response.data());
            }
            lastOutput = response.data();
            execution.appendLog(entry);
            return true;
        }
    }

    boolean recordLevel(LevelOutcome outcome, WorkflowLogEntry entry) {
        synchronized (execution) {
            if (!accepting()) {
                return false;
            }
            execution.recordLevel(outcome);
            execution.appendLog(entry);
            lastLevel = outcome;
            if (!outcome.skipped()) {
                agentResponses.putAll(outcome.agentResults());
                state.putAll(outcome.output());
                lastOutput = outcome.output();
            }
            return true;
        }
    }

    boolean log(WorkflowLogEntry entry) {
        synchronized (execution) {
            if (!accepting()) {
                return false;
            }
            execution.appendLog(entry);
            return true;
        }
    }

    void advanceTo(int level, String agentId) {
        synchronized (execution) {
            if (accepting()) {
                execution.advanceTo(level, agentId);
            }
        }
    }

    /**
     * Stops accepting updates.
     *
     * @param finalEntry appended as the last log entry, may be {@code null}
     */
    void close(WorkflowLogEntry finalEntry) {
        synchronized (execution) {
            if (!accepting()) {
                return;
            }
            if (finalEntry != null) {
                execution.appendLog(finalEntry);
            }
            closed = true;
        }
    }

    private boolean accepting() {
        return !closed && !execution.isTerminal();
    }
}
