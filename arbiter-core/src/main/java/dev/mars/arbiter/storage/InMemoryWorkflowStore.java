package dev.mars.arbiter.storage;

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

import dev.mars.arbiter.core.PerformanceMetrics;
import dev.mars.arbiter.core.RunRecord;
import dev.mars.arbiter.core.RunStats;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.exceptions.DuplicateWorkflowException;
import dev.mars.arbiter.core.exceptions.WorkflowNotFoundException;
import io.vertx.core.Future;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link WorkflowStore}. Data is lost when the process stops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final Map<String, WorkflowConfig> workflows = new ConcurrentHashMap<>();
    private final Map<String, List<RunRecord>> runsByWorkflow = new ConcurrentHashMap<>();

    @Override
    public Future<Void> open() {
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> close() {
        return Future.succeededFuture();
    }

    @Override
    public Future<WorkflowConfig> createWorkflow(WorkflowConfig workflow) {
        Instant now = Instant.now();
        WorkflowConfig stored = workflow.toBuilder()
                .createdAt(workflow.getCreatedAt() != null ? workflow.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        if (workflows.putIfAbsent(workflow.getId(), stored) != null) {
            return Future.failedFuture(new DuplicateWorkflowException(workflow.getId()));
        }
        return Future.succeededFuture(stored);
    }

    @Override
    public Future<Optional<WorkflowConfig>> getWorkflow(String workflowId) {
        return Future.succeededFuture(Optional.ofNullable(workflows.get(workflowId)));
    }

    @Override
    public Future<List<WorkflowConfig>> listWorkflows() {
        List<WorkflowConfig> all = new ArrayList<>(workflows.values());
        all.sort(Comparator.comparing(WorkflowConfig::getId));
        return Future.succeededFuture(all);
    }

    @Override
    public Future<WorkflowConfig> updateWorkflow(WorkflowConfig workflow) {
        WorkflowConfig updated = workflows.computeIfPresent(workflow.getId(), (id, existing) ->
                workflow.toBuilder()
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(Instant.now())
                        .build());
        if (updated == null) {
            return Future.failedFuture(new WorkflowNotFoundException(workflow.getId()));
        }
        return Future.succeededFuture(updated);
    }

    @Override
    public Future<Void> deleteWorkflow(String workflowId) {
        if (workflows.remove(workflowId) == null) {
            return Future.failedFuture(new WorkflowNotFoundException(workflowId));
        }
        runsByWorkflow.remove(workflowId);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> recordRun(RunRecord run) {
        runsByWorkflow.computeIfAbsent(keyOf(run.workflowId()), k -> new CopyOnWriteArrayList<>()).add(run);
        return Future.succeededFuture();
    }

    @Override
    public Future<List<RunRecord>> getRuns(String workflowId, int limit) {
        return Future.succeededFuture(RunQueries.newest(runsByWorkflow.getOrDefault(keyOf(workflowId), List.of()), limit));
    }

    @Override
    public Future<List<RunRecord>> getRunsByExecution(String executionId) {
        return Future.succeededFuture(allRuns().stream()
                .filter(r -> executionId.equals(r.executionId()))
                .sorted(Comparator.comparing(RunRecord::startTime))
                .toList());
    }

    @Override
    public Future<List<RunRecord>> getRecentErrors(int limit) {
        return Future.succeededFuture(RunQueries.recentErrors(allRuns(), limit));
    }

    @Override
    public Future<RunStats> getRunStats(String workflowId) {
        return Future.succeededFuture(RunStats.of(runsFor(workflowId)));
    }

    @Override
    public Future<PerformanceMetrics> getPerformanceMetrics(String workflowId) {
        return Future.succeededFuture(PerformanceMetrics.of(runsFor(workflowId)));
    }

    private Collection<RunRecord> runsFor(String workflowId) {
        return workflowId == null ? allRuns() : runsByWorkflow.getOrDefault(workflowId, List.of());
    }

    private List<RunRecord> allRuns() {
        List<RunRecord> all = new ArrayList<>();
        runsByWorkflow.values().forEach(all::addAll);
        return all;
    }

    private static String keyOf(String workflowId) {
        return workflowId != null ? workflowId : "";
    }
}
