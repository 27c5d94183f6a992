package dev.mars.arbiter.service;

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

import dev.mars.arbiter.config.ArbiterConfig;
import dev.mars.arbiter.core.AgentResponse;
import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.core.ExecutionSnapshot;
import dev.mars.arbiter.core.ExecutionStatus;
import dev.mars.arbiter.core.PerformanceMetrics;
import dev.mars.arbiter.core.RunRecord;
import dev.mars.arbiter.core.RunStats;
import dev.mars.arbiter.core.RunType;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.WorkflowExecution;
import dev.mars.arbiter.core.exceptions.ArbiterException;
import dev.mars.arbiter.core.exceptions.ErrorCode;
import dev.mars.arbiter.core.exceptions.ServiceInitializationException;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.core.exceptions.WorkflowNotFoundException;
import dev.mars.arbiter.core.exceptions.WorkflowValidationException;
import dev.mars.arbiter.events.EventProcessingResult;
import dev.mars.arbiter.events.EventSubscription;
import dev.mars.arbiter.events.TriggerRegistry;
import dev.mars.arbiter.events.trigger.WebhookRequest;
import dev.mars.arbiter.events.trigger.WebhookResult;
import dev.mars.arbiter.service.lifecycle.ShutdownSequence;
import dev.mars.arbiter.service.lifecycle.ShutdownSequence.Phase;
import dev.mars.arbiter.storage.WorkflowStore;
import dev.mars.arbiter.workflow.ExecutionEngine;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Facade tying storage, triggers and the execution engine together.
 *
 * <p>Every trigger event is routed to {@link #handleEvent(Event)}, which loads the
 * event's workflow and runs it. Workflow changes made through this class keep the
 * trigger registry in step with the store: a workflow whose trigger is rejected is
 * not persisted.
 *
 * <p>Management operations (create, update, delete) are recorded as
 * {@link RunType#API_REQUEST} runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ArbiterService {

    private static final Logger logger = LoggerFactory.getLogger(ArbiterService.class);

    public static final String API_SOURCE = "api";
    public static final int DEFAULT_RUN_LIMIT = 50;

    private final ArbiterConfig config;
    private final Vertx vertx;
    private final WorkflowStore store;
    private final TriggerRegistry registry;
    private final ExecutionEngine engine;
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicReference<Future<Void>> shutdownResult = new AtomicReference<>();
    private volatile Instant startedAt;

    public ArbiterService(ArbiterConfig config, Vertx vertx, WorkflowStore store,
                          TriggerRegistry registry, ExecutionEngine engine) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.store = Objects.requireNonNull(store, "Workflow store cannot be null");
        this.registry = Objects.requireNonNull(registry, "Trigger registry cannot be null");
        this.engine = Objects.requireNonNull(engine, "Execution engine cannot be null");
    }

    // ==================== Lifecycle ====================

    /**
     * Opens the store, subscribes every persisted workflow to its trigger and starts
     * the registry. A workflow whose trigger is rejected is logged and skipped.
     */
    public Future<Void> initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        logger.info("Initializing Arbiter service ({} environment)", config.getEnvironment());
        return store.open()
                .compose(v -> store.listWorkflows())
                .map(workflows -> {
                    int subscribed = 0;
                    for (WorkflowConfig workflow : workflows) {
                        try {
                            registry.register(workflow.getTrigger(), this::handleEvent);
                            subscribed++;
                        } catch (TriggerConfigurationException e) {
                            logger.warn("Skipping trigger of workflow {}: {}", workflow.getId(), e.getMessage());
                        }
                    }
                    registry.start();
                    startedAt = Instant.now();
                    logger.info("Arbiter service initialized: {} workflow(s), {} trigger(s) active",
                            workflows.size(), subscribed);
                    return (Void) null;
                })
                .recover(err -> {
                    initialized.set(false);
                    logger.error("Arbiter service failed to initialize: {}", err.getMessage());
                    return Future.failedFuture(new ServiceInitializationException(
                            "initialization failed: " + err.getMessage(), err));
                });
    }

    public boolean isInitialized() {
        return initialized.get() && shutdownResult.get() == null;
    }

    public Future<Void> shutdown() {
        return shutdown(new ShutdownSequence(vertx, config.getShutdownHookTimeoutMs()));
    }

    /**
     * Adds this service's hooks to the sequence and runs it: triggers are stopped,
     * running executions drained and the store closed. Idempotent; later calls share
     * the first call's result.
     */
    public Future<Void> shutdown(ShutdownSequence sequence) {
        Promise<Void> promise = Promise.promise();
        if (!shutdownResult.compareAndSet(null, promise.future())) {
            return shutdownResult.get();
        }
        logger.info("Shutting down Arbiter service ({} execution(s) running)", engine.activeCount());
        sequence.on(Phase.STOP_TRIGGERS, "trigger-registry", () -> {
                    registry.stop();
                    return Future.succeededFuture();
                })
                .on(Phase.DRAIN_EXECUTIONS, "execution-engine", engine::shutdown)
                .on(Phase.DRAIN_EXECUTIONS, "cancel-remaining", () -> {
                    int cancelled = engine.cancelAll();
                    if (cancelled > 0) {
                        logger.warn("Cancelled {} execution(s) still running after drain", cancelled);
                    }
                    return Future.succeededFuture();
                })
                .on(Phase.CLOSE_STORAGE, "workflow-store", store::close);
        sequence.run().onComplete(ar -> promise.complete());
        return promise.future();
    }

    // ==================== Event Handling ====================

    /**
     * Runs the workflow the event is bound to.
     *
     * @return the execution's outcome; fails with {@link WorkflowNotFoundException}
     *         when the workflow no longer exists
     */
    Future<EventProcessingResult> handleEvent(Event event) {
        Optional<String> workflowId = event.workflowId();
        if (workflowId.isEmpty()) {
            logger.warn("Event {} from {} is not bound to a workflow, ignoring", event.id(), event.source());
            return Future.succeededFuture(EventProcessingResult.skipped("Event is not bound to a workflow"));
        }
        return loadWorkflow(workflowId.get())
                .compose(workflow -> engine.executeWorkflow(workflow, event))
                .map(execution -> {
                    logger.debug("Event {} finished execution {} with status {}",
                            event.id(), execution.getId(), execution.getStatus());
                    return EventProcessingResult.executed(
                            execution.getId(), execution.getStatus(), execution.getError());
                });
    }

    // ==================== Workflows ====================

    /**
     * Validates and persists a new workflow, then subscribes it to its trigger.
     * When the trigger is rejected the workflow is removed again.
     */
    public Future<WorkflowConfig> createWorkflow(WorkflowConfig workflow) {
        Instant start = Instant.now();
        Future<WorkflowConfig> result;
        try {
            workflow.validate();
            result = store.createWorkflow(workflow)
                    .compose(created -> subscribe(created)
                            .recover(err -> store.deleteWorkflow(created.getId())
                                    .transform(ignored -> Future.<WorkflowConfig>failedFuture(err))));
        } catch (WorkflowValidationException e) {
            result = Future.failedFuture(e);
        }
        return result.onComplete(ar -> {
            if (ar.succeeded()) {
                logger.info("Created workflow {} ({} agent(s), {} trigger)",
                        workflow.getId(), workflow.getAgentCount(), workflow.getTrigger().kind().wireName());
            }
            recordApiRequest("createWorkflow", workflow.getId(), start, ar);
        });
    }

    public Future<Optional<WorkflowConfig>> getWorkflow(String workflowId) {
        return store.getWorkflow(workflowId);
    }

    public Future<List<WorkflowConfig>> listWorkflows() {
        return store.listWorkflows();
    }

    /**
     * Replaces a workflow and resubscribes it. When the new trigger is rejected the
     * previous definition and trigger stay in place.
     */
    public Future<WorkflowConfig> updateWorkflow(WorkflowConfig workflow) {
        Instant start = Instant.now();
        Future<WorkflowConfig> result;
        try {
            workflow.validate();
            result = loadWorkflow(workflow.getId()).compose(existing -> store.updateWorkflow(workflow)
                    .compose(updated -> subscribe(updated)
                            .recover(err -> store.updateWorkflow(existing)
                                    .transform(ignored -> Future.<WorkflowConfig>failedFuture(err)))));
        } catch (WorkflowValidationException e) {
            result = Future.failedFuture(e);
        }
        return result.onComplete(ar -> {
            if (ar.succeeded()) {
                logger.info("Updated workflow {}", workflow.getId());
            }
            recordApiRequest("updateWorkflow", workflow.getId(), start, ar);
        });
    }

    /**
     * Removes the workflow, its runs and its trigger.
     */
    public Future<Void> deleteWorkflow(String workflowId) {
        Instant start = Instant.now();
        return store.deleteWorkflow(workflowId)
                .onSuccess(v -> {
                    registry.unregisterWorkflow(workflowId);
                    logger.info("Deleted workflow {}", workflowId);
                })
                .onComplete(ar -> recordApiRequest("deleteWorkflow", workflowId, start, ar));
    }

    // ==================== Execution ====================

    /**
     * Runs a workflow directly, bypassing its trigger.
     */
    public Future<WorkflowExecution> executeWorkflow(String workflowId, Object eventData) {
        return loadWorkflow(workflowId).compose(workflow -> {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Event.WORKFLOW_ID, workflowId);
            metadata.put("triggeredBy", API_SOURCE);
            Event event = Event.create(TriggerKind.API, API_SOURCE, eventData, metadata);
            logger.info("Executing workflow {} on request (event {})", workflowId, event.id());
            return engine.executeWorkflow(workflow, event);
        });
    }

    /**
     * Runs one agent of a stored workflow on its own; the call is recorded as an
     * agent execution run.
     */
    public Future<AgentResponse> executeAgent(String workflowId, String agentId, Object input) {
        return loadWorkflow(workflowId).compose(workflow -> engine.executeAgent(workflow, agentId, input));
    }

    public boolean cancelExecution(String executionId) {
        return engine.cancel(executionId);
    }

    public List<ExecutionSnapshot> getActiveExecutions() {
        return engine.getActiveExecutions();
    }

    public Optional<ExecutionSnapshot> getExecution(String executionId) {
        return engine.getExecution(executionId);
    }

    // ==================== Triggers ====================

    /**
     * Subscribes an existing workflow to the trigger, replacing its current one.
     * The stored definition is not changed.
     */
    public Future<EventSubscription> registerTrigger(EventTrigger trigger) {
        if (trigger.workflowId() == null) {
            return Future.failedFuture(new TriggerConfigurationException(trigger.kind(), "trigger is not bound to a workflow"));
        }
        return loadWorkflow(trigger.workflowId()).compose(workflow -> {
            try {
                return Future.succeededFuture(registry.register(trigger, this::handleEvent));
            } catch (TriggerConfigurationException e) {
                return Future.<EventSubscription>failedFuture(e);
            }
        });
    }

    public boolean unregisterTrigger(EventTrigger trigger) {
        return registry.unregister(trigger);
    }

    public Future<EventProcessingResult> triggerManual(String workflowId, Object data) {
        return registry.triggerManual(workflowId, data);
    }

    public Future<WebhookResult> handleWebhook(WebhookRequest request) {
        return registry.handleWebhook(request);
    }

    public List<EventSubscription> getSubscriptions() {
        return registry.getSubscriptions();
    }

    // ==================== Runs & Metrics ====================

    public Future<List<RunRecord>> getWorkflowRuns(String workflowId) {
        return getWorkflowRuns(workflowId, DEFAULT_RUN_LIMIT);
    }

    public Future<List<RunRecord>> getWorkflowRuns(String workflowId, int limit) {
        return store.getRuns(workflowId, limit);
    }

    public Future<List<RunRecord>> getExecutionRuns(String executionId) {
        return store.getRunsByExecution(executionId);
    }

    /**
     * @param workflowId restricts the statistics to one workflow, or {@code null} for all
     */
    public Future<RunStats> getRunStats(String workflowId) {
        return store.getRunStats(workflowId);
    }

    public Future<PerformanceMetrics> getPerformanceMetrics(String workflowId) {
        return store.getPerformanceMetrics(workflowId);
    }

    public Future<List<RunRecord>> getRecentErrors(int limit) {
        return store.getRecentErrors(limit);
    }

    public Future<ServiceStatus> getStatus() {
        if (!isInitialized()) {
            return Future.failedFuture(new ArbiterException(ErrorCode.SERVICE_UNAVAILABLE,
                    ErrorCode.SERVICE_UNAVAILABLE.formatMessage("service is not running")));
        }
        return Future.all(store.listWorkflows(), store.getRunStats(null))
                .map(all -> {
                    List<WorkflowConfig> workflows = all.resultAt(0);
                    RunStats runStats = all.resultAt(1);
                    return new ServiceStatus(
                            workflows.size(),
                            engine.activeCount(),
                            registry.getEventStats(),
                            runStats,
                            Duration.between(startedAt, Instant.now()));
                });
    }

    public Vertx getVertx() {
        return vertx;
    }

    // ==================== Helpers ====================

    private Future<WorkflowConfig> loadWorkflow(String workflowId) {
        return store.getWorkflow(workflowId).compose(found -> found.isPresent()
                ? Future.succeededFuture(found.get())
                : Future.failedFuture(new WorkflowNotFoundException(workflowId)));
    }

    private Future<WorkflowConfig> subscribe(WorkflowConfig workflow) {
        try {
            registry.register(workflow.getTrigger(), this::handleEvent);
            return Future.succeededFuture(workflow);
        } catch (TriggerConfigurationException e) {
            logger.warn("Trigger of workflow {} rejected: {}", workflow.getId(), e.getMessage());
            return Future.failedFuture(e);
        }
    }

    private void recordApiRequest(String operation, String workflowId, Instant start, AsyncResult<?> outcome) {
        RunRecord.Builder run = RunRecord.builder(RunType.API_REQUEST)
                .workflowId(workflowId)
                .startTime(start)
                .requestData(Map.of("operation", operation))
                .tags(List.of(operation));
        if (outcome.succeeded()) {
            run.status(ExecutionStatus.COMPLETED);
        } else {
            Throwable cause = outcome.cause();
            String code = cause instanceof ArbiterException arbiterException
                    ? arbiterException.getErrorCode().code()
                    : ErrorCode.INTERNAL_ERROR.code();
            run.status(ExecutionStatus.FAILED).error(code, cause.getMessage());
        }
        store.recordRun(run.build()).onFailure(err ->
                logger.warn("Could not record {} request for workflow {}: {}", operation, workflowId, err.getMessage()));
    }
}
