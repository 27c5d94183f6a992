package dev.mars.arbiter.workflow.observability;

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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Arbiter execution engine.
 *
 * Provides the following metrics:
 * - arbiter.execution.active (gauge) - Currently running executions
 * - arbiter.execution.total (counter) - Executions started
 * - arbiter.execution.completed (counter) - Executions completed
 * - arbiter.execution.failed (counter) - Executions failed
 * - arbiter.execution.cancelled (counter) - Executions cancelled
 * - arbiter.execution.levels.executed (counter) - Levels whose agents ran
 * - arbiter.execution.levels.skipped (counter) - Conditional levels skipped
 * - arbiter.execution.agents.failed (counter) - Agent calls that failed or returned a failure
 * - arbiter.execution.duration.seconds (histogram) - Execution duration distribution
 *
 * Without a configured OpenTelemetry SDK the instruments are no-ops.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0 (OpenTelemetry)
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "arbiter-workflow";

    // Singleton instance
    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter executionsTotal;
    private final LongCounter executionsCompleted;
    private final LongCounter executionsFailed;
    private final LongCounter executionsCancelled;
    private final LongCounter levelsExecuted;
    private final LongCounter levelsSkipped;
    private final LongCounter agentsFailed;

    // Histograms
    private final DoubleHistogram executionDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeExecutions = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> TRIGGER_KIND_KEY = AttributeKey.stringKey("trigger.kind");
    private static final AttributeKey<String> EXECUTION_MODE_KEY = AttributeKey.stringKey("execution.mode");
    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    public WorkflowMetrics(Meter meter) {
        executionsTotal = meter.counterBuilder("arbiter.execution.total")
                .setDescription("Total number of workflow executions started")
                .setUnit("1")
                .build();

        executionsCompleted = meter.counterBuilder("arbiter.execution.completed")
                .setDescription("Number of completed workflow executions")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("arbiter.execution.failed")
                .setDescription("Number of failed workflow executions")
                .setUnit("1")
                .build();

        executionsCancelled = meter.counterBuilder("arbiter.execution.cancelled")
                .setDescription("Number of cancelled workflow executions")
                .setUnit("1")
                .build();

        levelsExecuted = meter.counterBuilder("arbiter.execution.levels.executed")
                .setDescription("Number of workflow levels whose agents ran")
                .setUnit("1")
                .build();

        levelsSkipped = meter.counterBuilder("arbiter.execution.levels.skipped")
                .setDescription("Number of conditional levels skipped")
                .setUnit("1")
                .build();

        agentsFailed = meter.counterBuilder("arbiter.execution.agents.failed")
                .setDescription("Number of agent calls that failed")
                .setUnit("1")
                .build();

        executionDuration = meter.histogramBuilder("arbiter.execution.duration.seconds")
                .setDescription("Workflow execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("arbiter.execution.active")
                .setDescription("Number of currently running workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeExecutions.get()));

        logger.info("WorkflowMetrics initialized");
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry meter provider.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    public void recordExecutionStarted(String workflowId, String triggerKind) {
        executionsTotal.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId, TRIGGER_KIND_KEY, triggerKind));
        activeExecutions.incrementAndGet();
    }

    public void recordExecutionCompleted(String workflowId, double durationSeconds) {
        activeExecutions.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_ID_KEY, workflowId);
        executionsCompleted.add(1, attrs);
        executionDuration.record(durationSeconds, attrs);
    }

    public void recordExecutionFailed(String workflowId, double durationSeconds, String failureReason) {
        activeExecutions.decrementAndGet();
        executionsFailed.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId,
                FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown"));
        executionDuration.record(durationSeconds, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordExecutionCancelled(String workflowId) {
        activeExecutions.decrementAndGet();
        executionsCancelled.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordLevelExecuted(String workflowId, String executionMode) {
        levelsExecuted.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId, EXECUTION_MODE_KEY, executionMode));
    }

    public void recordLevelSkipped(String workflowId) {
        levelsSkipped.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId));
    }

    public void recordAgentFailed(String workflowId, String agentId) {
        agentsFailed.add(1, Attributes.of(WORKFLOW_ID_KEY, workflowId, AGENT_ID_KEY, agentId));
    }

    /**
     * Get the current number of running executions.
     */
    public long getActiveExecutions() {
        return activeExecutions.get();
    }
}
