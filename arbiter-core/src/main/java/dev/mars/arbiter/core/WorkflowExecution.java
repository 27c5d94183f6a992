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

import dev.mars.arbiter.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Run state of one workflow execution.
 *
 * <p>All mutators are synchronized and rejected once the status is terminal, at
 * which point the record no longer changes. Cancellation is requested from any
 * thread via {@link #requestCancellation()} and acted upon by the engine at the
 * next level boundary.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkflowExecution {

    private final String id;
    private final String workflowId;
    private final Instant startTime;
    private final Object eventData;

    private ExecutionStatus status = ExecutionStatus.PENDING;
    private Instant endTime;
    private int currentLevel;
    private String currentAgent;
    private final List<WorkflowLogEntry> executionLog = new ArrayList<>();
    private final List<LevelOutcome> levelOutcomes = new ArrayList<>();
    private Object result;
    private String error;
    private volatile boolean cancellationRequested;

    public WorkflowExecution(String workflowId, Object eventData) {
        this("exec_" + UUID.randomUUID(), workflowId, eventData);
    }

    public WorkflowExecution(String id, String workflowId, Object eventData) {
        this.id = Objects.requireNonNull(id, "Execution id cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow id cannot be null");
        this.eventData = eventData;
        this.startTime = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Object getEventData() {
        return eventData;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized int getCurrentLevel() {
        return currentLevel;
    }

    public synchronized String getCurrentAgent() {
        return currentAgent;
    }

    public synchronized List<WorkflowLogEntry> getExecutionLog() {
        return List.copyOf(executionLog);
    }

    public synchronized List<LevelOutcome> getLevelOutcomes() {
        return List.copyOf(levelOutcomes);
    }

    public synchronized Object getResult() {
        return result;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    /**
     * Marks the execution for cancellation.
     *
     * @return {@code false} when the execution has already finished
     */
    public synchronized boolean requestCancellation() {
        if (status.isTerminal()) {
            return false;
        }
        cancellationRequested = true;
        return true;
    }

    public synchronized void start() throws InvalidTransitionException {
        transitionTo(ExecutionStatus.RUNNING);
    }

    public synchronized void appendLog(WorkflowLogEntry entry) {
        ensureMutable();
        executionLog.add(Objects.requireNonNull(entry, "Log entry cannot be null"));
    }

    public synchronized void advanceTo(int level, String agentId) {
        ensureMutable();
        this.currentLevel = level;
        this.currentAgent = agentId;
    }

    public synchronized void recordLevel(LevelOutcome outcome) {
        ensureMutable();
        levelOutcomes.add(outcome);
        currentLevel = outcome.level();
    }

    /**
     * Moves the execution to a terminal status, setting result and error in the same step.
     */
    public synchronized void finish(ExecutionStatus terminal, Object result, String error)
            throws InvalidTransitionException {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        transitionTo(terminal);
        this.result = result;
        this.error = error;
        this.endTime = Instant.now();
    }

    public synchronized ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(id, workflowId, status, startTime, endTime, eventData, currentLevel,
                currentAgent, executionLog, levelOutcomes, result, error);
    }

    private void transitionTo(ExecutionStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        status = target;
    }

    private void ensureMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " is " + status + " and can no longer change");
        }
    }

    @Override
    public String toString() {
        return "WorkflowExecution{id='" + id + "', workflowId='" + workflowId + "', status=" + getStatus() + "}";
    }
}
