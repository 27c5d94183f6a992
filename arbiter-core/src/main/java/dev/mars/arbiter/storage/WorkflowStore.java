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
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for workflow definitions and run records.
 *
 * <p>Every operation is asynchronous. Failures are reported through the returned
 * future:</p>
 * <ul>
 *   <li>{@link #updateWorkflow} and {@link #deleteWorkflow} fail with
 *       {@code WorkflowNotFoundException} for unknown ids</li>
 *   <li>{@link #createWorkflow} fails with {@code DuplicateWorkflowException} for existing ids</li>
 *   <li>I/O problems surface as {@code StorageException}</li>
 * </ul>
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link FileWorkflowStore} - JSON documents on disk (default)</li>
 *   <li>{@link InMemoryWorkflowStore} - In-memory storage (testing only)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public interface WorkflowStore extends RunRecorder {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Prepares the store for use. Idempotent.
     */
    Future<Void> open();

    Future<Void> close();

    // =========================================================================
    // Workflows
    // =========================================================================

    Future<WorkflowConfig> createWorkflow(WorkflowConfig workflow);

    Future<Optional<WorkflowConfig>> getWorkflow(String workflowId);

    Future<List<WorkflowConfig>> listWorkflows();

    Future<WorkflowConfig> updateWorkflow(WorkflowConfig workflow);

    /**
     * Deletes the workflow together with its runs.
     */
    Future<Void> deleteWorkflow(String workflowId);

    // =========================================================================
    // Runs
    // =========================================================================

    /**
     * Returns the most recent runs of a workflow, newest first.
     */
    Future<List<RunRecord>> getRuns(String workflowId, int limit);

    Future<List<RunRecord>> getRunsByExecution(String executionId);

    /**
     * Returns the most recent failed runs across all workflows, newest first.
     */
    Future<List<RunRecord>> getRecentErrors(int limit);

    /**
     * @param workflowId restricts the statistics to one workflow, or {@code null} for all
     */
    Future<RunStats> getRunStats(String workflowId);

    /**
     * @param workflowId restricts the metrics to one workflow, or {@code null} for all
     */
    Future<PerformanceMetrics> getPerformanceMetrics(String workflowId);
}
