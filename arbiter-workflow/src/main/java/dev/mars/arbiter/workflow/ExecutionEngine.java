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

import dev.mars.arbiter.core.AgentConfig;
import dev.mars.arbiter.core.AgentLevel;
import dev.mars.arbiter.core.AgentResponse;
import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.ExecutionMode;
import dev.mars.arbiter.core.ExecutionSnapshot;
import dev.mars.arbiter.core.ExecutionStatus;
import dev.mars.arbiter.core.LevelOutcome;
import dev.mars.arbiter.core.RunRecord;
import dev.mars.arbiter.core.RunType;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.WorkflowExecution;
import dev.mars.arbiter.core.WorkflowLogEntry;
import dev.mars.arbiter.core.exceptions.AgentExecutionException;
import dev.mars.arbiter.core.exceptions.ArbiterException;
import dev.mars.arbiter.core.exceptions.ConditionEvaluationException;
import dev.mars.arbiter.core.exceptions.ErrorCode;
import dev.mars.arbiter.core.exceptions.InvalidTransitionException;
import dev.mars.arbiter.core.exceptions.LevelTimeoutException;
import dev.mars.arbiter.core.exceptions.WorkflowValidationException;
import dev.mars.arbiter.storage.RunRecorder;
import dev.mars.arbiter.workflow.condition.ConditionEvaluator;
import dev.mars.arbiter.workflow.observability.WorkflowMetrics;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs workflow executions: the root agent first, then every level in ascending
 * order.
 *
 * <p>A {@link ExecutionMode#PARALLEL} level dispatches all of its agents at once with
 * the previous level's output and waits for every one of them. A
 * {@link ExecutionMode#CONDITIONAL} level runs only when its condition holds, and then
 * chains its agents, each receiving the output of the one before.
 *
 * <p>An agent that returns a failed {@link AgentResponse} only marks its own slot. An
 * agent call that fails outright, a condition that cannot be evaluated, or a level
 * that exceeds {@link EngineOptions#levelTimeoutMs()} fails the execution once the
 * level has resolved; no further levels run. Cancellation is honoured before each
 * level.
 *
 * <p>Every finished execution is handed to the {@link RunRecorder} before it reaches
 * its terminal status. The future returned by
 * {@link #executeWorkflow(WorkflowConfig, Event)} fails only when the workflow is
 * rejected up front; otherwise it completes with the terminal execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionEngine.class);

    private enum Ending { COMPLETED, CANCELLED }

    private record ActiveRun(WorkflowExecutionContext context, Future<WorkflowExecution> completion) {
    }

    private record Conclusion(ExecutionStatus status, Object result, String error, String errorCode) {
    }

    private final AgentExecutor agentExecutor;
    private final ConditionEvaluator conditionEvaluator;
    private final RunRecorder runRecorder;
    private final EngineOptions options;
    private final WorkflowMetrics metrics;
    private final Vertx vertx;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public ExecutionEngine(Vertx vertx, AgentExecutor agentExecutor, ConditionEvaluator conditionEvaluator,
                           RunRecorder runRecorder, EngineOptions options, WorkflowMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.agentExecutor = Objects.requireNonNull(agentExecutor, "Agent executor cannot be null");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "Condition evaluator cannot be null");
        this.runRecorder = Objects.requireNonNull(runRecorder, "Run recorder cannot be null");
        this.options = Objects.requireNonNull(options, "Engine options cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Workflow metrics cannot be null");
    }

    // ==================== Execution ====================

    public Future<WorkflowExecution> executeWorkflow(WorkflowConfig workflow, Event event) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        Objects.requireNonNull(event, "Event cannot be null");
        if (shutdown) {
            return Future.failedFuture(new IllegalStateException("Execution engine is shut down"));
        }
        try {
            workflow.validate();
            checkLevelBound(workflow);
        } catch (WorkflowValidationException e) {
            logger.warn("Rejected execution of workflow {} for event {}: {}", workflow.getId(), event.id(), e.getMessage());
            return Future.failedFuture(e);
        }

        WorkflowExecution execution = new WorkflowExecution(workflow.getId(), event.data());
        WorkflowExecutionContext context = new WorkflowExecutionContext(execution, workflow, event);
        Promise<WorkflowExecution> done = Promise.promise();
        activeRuns.put(execution.getId(), new ActiveRun(context, done.future()));
        metrics.recordExecutionStarted(workflow.getId(), event.type().wireName());

        try {
            execution.start();
        } catch (InvalidTransitionException e) {
            activeRuns.remove(execution.getId());
            return Future.failedFuture(e);
        }
        logger.info("Starting execution {} of workflow {} for {} event {} ({} level(s))",
                execution.getId(), workflow.getId(), event.type().wireName(), event.id(), workflow.getLevels().size());

        runRoot(context)
                .compose(v -> runLevels(context, workflow.getLevels(), 0))
                .transform(outcome -> conclude(context, outcome))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        done.complete(ar.result());
                    } else {
                        done.fail(ar.cause());
                    }
                });
        return done.future();
    }

    private void checkLevelBound(WorkflowConfig workflow) throws WorkflowValidationException {
        if (workflow.getLevels().size() > options.maxLevels()) {
            throw new WorkflowValidationException(workflow.getId(), List.of("workflow declares "
                    + workflow.getLevels().size() + " levels, at most " + options.maxLevels() + " are allowed"));
        }
    }

    private Future<Void> runRoot(WorkflowExecutionContext context) {
        AgentConfig root = context.getWorkflow().getRootAgent();
        context.advanceTo(0, root.id());
        Future<AgentResponse> call = invoke(context, root, context.getEvent().data(), 0);
        return withTimeout(call, 0, new AtomicBoolean()).compose(response -> {
            WorkflowLogEntry entry = response.success()
                    ? WorkflowLogEntry.info("Root agent completed", root.id(), 0, describe(response))
                    : WorkflowLogEntry.warn("Root agent returned a failure", root.id(), 0, describe(response));
            context.recordRoot(response, entry);
            return Future.<Void>succeededFuture();
        });
    }

    private Future<Ending> runLevels(WorkflowExecutionContext context, List<AgentLevel> levels, int index) {
        if (index >= levels.size()) {
            return Future.succeededFuture(Ending.COMPLETED);
        }
        AgentLevel level = levels.get(index);
        if (context.getExecution().isCancellationRequested()) {
            logger.info("Execution {} cancelled before level {}", context.getExecution().getId(), level.level());
            context.log(WorkflowLogEntry.warn("Execution cancelled before level " + level.level(),
                    null, level.level(), null));
            return Future.succeededFuture(Ending.CANCELLED);
        }
        Future<Void> run = level.executionMode() == ExecutionMode.PARALLEL
                ? runParallel(context, level)
                : runConditional(context, level);
        return run.compose(v -> runLevels(context, levels, index + 1));
    }

    private Future<Void> runParallel(WorkflowExecutionContext context, AgentLevel level) {
        Object input = context.getLastOutput();
        context.advanceTo(level.level(), null);
        logger.debug("Execution {} dispatching {} agent(s) of level {} in parallel",
                context.getExecution().getId(), level.agents().size(), level.level());

        List<Future<AgentResponse>> calls = new ArrayList<>();
        for (AgentConfig agent : level.agents()) {
            calls.add(invoke(context, agent, input, level.level()));
        }
        Future<Void> settled = Future.join(calls).transform(joined -> {
            Map<String, AgentResponse> results = new LinkedHashMap<>();
            Throwable firstError = null;
            for (int i = 0; i < calls.size(); i++) {
                String agentId = level.agents().get(i).id();
                Future<AgentResponse> call = calls.get(i);
                if (call.succeeded()) {
                    results.put(agentId, call.result());
                } else {
                    results.put(agentId, AgentResponse.failure(agentId, message(call.cause()), 0));
                    if (firstError == null) {
                        firstError = call.cause();
                    }
                }
            }
            finishLevel(context, new LevelOutcome(level.level(), ExecutionMode.PARALLEL, false, results));
            return firstError == null ? Future.<Void>succeededFuture() : Future.<Void>failedFuture(firstError);
        });
        return withTimeout(settled, level.level(), new AtomicBoolean());
    }

    private Future<Void> runConditional(WorkflowExecutionContext context, AgentLevel level) {
        String executionId = context.getExecution().getId();
        boolean proceed;
        try {
            proceed = conditionEvaluator.evaluate(level.condition(), context);
        } catch (ConditionEvaluationException e) {
            logger.error("Execution {} could not evaluate condition of level {}: {}",
                    executionId, level.level(), e.getMessage());
            context.log(WorkflowLogEntry.error("Condition evaluation failed", null, level.level(),
                    Map.of("condition", level.condition())));
            return Future.failedFuture(e);
        }
        if (!proceed) {
            logger.info("Execution {} skipping level {}: condition '{}' not met",
                    executionId, level.level(), level.condition());
            context.advanceTo(level.level(), null);
            if (context.recordLevel(LevelOutcome.skipped(level.level(), ExecutionMode.CONDITIONAL),
                    WorkflowLogEntry.info("Level " + level.level() + " skipped: condition not met", null,
                            level.level(), Map.of("condition", level.condition())))) {
                metrics.recordLevelSkipped(context.getWorkflow().getId());
            }
            return Future.succeededFuture();
        }

        AtomicBoolean abandoned = new AtomicBoolean();
        Map<String, AgentResponse> results = new ConcurrentHashMap<>();
        List<String> order = new ArrayList<>();
        Future<Object> chain = Future.succeededFuture(context.getLastOutput());
        for (AgentConfig agent : level.agents()) {
            chain = chain.compose(input -> {
                if (abandoned.get()) {
                    return Future.failedFuture(new IllegalStateException("Level " + level.level() + " abandoned"));
                }
                context.advanceTo(level.level(), agent.id());
                return invoke(context, agent, input, level.level()).map(response -> {
                    synchronized (order) {
                        order.add(agent.id());
                    }
                    results.put(agent.id(), response);
                    return response.success() ? response.data() : input;
                });
            });
        }
        Future<Void> settled = chain.transform(ar -> {
            Map<String, AgentResponse> ordered = new LinkedHashMap<>();
            synchronized (order) {
                order.forEach(id -> ordered.put(id, results.get(id)));
            }
            if (ar.failed() && ar.cause() instanceof AgentExecutionException e) {
                ordered.put(e.getAgentId(), AgentResponse.failure(e.getAgentId(), message(e.getCause()), 0));
            }
            finishLevel(context, new LevelOutcome(level.level(), ExecutionMode.CONDITIONAL, false, ordered));
            return ar.succeeded() ? Future.<Void>succeededFuture() : Future.<Void>failedFuture(ar.cause());
        });
        return withTimeout(settled, level.level(), abandoned);
    }

    private void finishLevel(WorkflowExecutionContext context, LevelOutcome outcome) {
        String lastAgent = null;
        for (String agentId : outcome.agentResults().keySet()) {
            lastAgent = agentId;
        }
        if (lastAgent != null) {
            context.advanceTo(outcome.level(), lastAgent);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("successCount", outcome.successCount());
        data.put("failureCount", outcome.failureCount());
        WorkflowLogEntry entry = outcome.failureCount() == 0
                ? WorkflowLogEntry.info("Level " + outcome.level() + " completed", lastAgent, outcome.level(), data)
                : WorkflowLogEntry.warn("Level " + outcome.level() + " completed with " + outcome.failureCount()
                        + " failed agent(s)", lastAgent, outcome.level(), data);
        if (context.recordLevel(outcome, entry)) {
            metrics.recordLevelExecuted(context.getWorkflow().getId(), outcome.mode().wireName());
            logger.info("Execution {} finished level {} ({}): {} succeeded, {} failed",
                    context.getExecution().getId(), outcome.level(), outcome.mode().wireName(),
                    outcome.successCount(), outcome.failureCount());
        }
    }

    private Future<AgentResponse> invoke(WorkflowExecutionContext context, AgentConfig agent, Object input, int level) {
        WorkflowConfig workflow = context.getWorkflow();
        String executionId = context.getExecution().getId();
        AgentInvocation invocation = new AgentInvocation(workflow.getId(), executionId, level,
                workflow.getUserPrompt(), context.getEvent().metadata());

        Future<AgentResponse> call;
        try {
            call = agentExecutor.execute(agent, input, invocation);
        } catch (RuntimeException e) {
            call = Future.failedFuture(e);
        }
        if (call == null) {
            call = Future.failedFuture(new IllegalStateException("Agent executor returned no result"));
        }
        return call.transform(ar -> {
            if (ar.failed()) {
                metrics.recordAgentFailed(workflow.getId(), agent.id());
                logger.error("Agent {} at level {} of execution {} failed: {}",
                        agent.id(), level, executionId, message(ar.cause()));
                return Future.failedFuture(new AgentExecutionException(agent.id(), ar.cause()));
            }
            AgentResponse response = ar.result() != null
                    ? ar.result()
                    : AgentResponse.failure(agent.id(), "Agent returned no response", 0);
            if (!response.success()) {
                metrics.recordAgentFailed(workflow.getId(), agent.id());
                logger.warn("Agent {} at level {} of execution {} returned a failure: {}",
                        agent.id(), level, executionId, response.error());
            }
            return Future.succeededFuture(response);
        });
    }

    private <T> Future<T> withTimeout(Future<T> future, int level, AtomicBoolean abandoned) {
        long timeoutMs = options.levelTimeoutMs();
        if (timeoutMs == 0) {
            return future;
        }
        Promise<T> bounded = Promise.promise();
        long timerId = vertx.setTimer(timeoutMs, id -> {
            if (!future.isComplete()) {
                abandoned.set(true);
                bounded.tryFail(new LevelTimeoutException(level, timeoutMs));
            }
        });
        future.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                bounded.tryComplete(ar.result());
            } else {
                bounded.tryFail(ar.cause());
            }
        });
        return bounded.future();
    }

    // ==================== Completion ====================

    private Future<WorkflowExecution> conclude(WorkflowExecutionContext context, AsyncResult<Ending> outcome) {
        WorkflowExecution execution = context.getExecution();
        Conclusion conclusion;
        if (outcome.succeeded() && outcome.result() == Ending.COMPLETED) {
            context.close(null);
            conclusion = new Conclusion(ExecutionStatus.COMPLETED, context.getLastOutput(), null, null);
        } else if (outcome.succeeded()) {
            context.close(null);
            conclusion = new Conclusion(ExecutionStatus.CANCELLED, null, "Execution cancelled", null);
        } else {
            Throwable cause = outcome.cause();
            String code = cause instanceof ArbiterException arbiter
                    ? arbiter.getErrorCode().code()
                    : ErrorCode.INTERNAL_ERROR.code();
            context.close(WorkflowLogEntry.error("Execution failed", execution.getCurrentAgent(),
                    execution.getCurrentLevel(), Map.of("error", message(cause))));
            conclusion = new Conclusion(ExecutionStatus.FAILED, null, message(cause), code);
        }

        RunRecord run = toRunRecord(context, conclusion);
        return persist(run).transform(persisted -> {
            String error = conclusion.error();
            if (persisted.failed()) {
                logger.error("Failed to record run {} for workflow {} (execution {}): {}",
                        run.id(), execution.getWorkflowId(), execution.getId(), message(persisted.cause()));
                error = (error != null ? error + "; " : "") + "Run not recorded: " + message(persisted.cause());
            }
            try {
                execution.finish(conclusion.status(), conclusion.result(), error);
            } catch (InvalidTransitionException e) {
                logger.error("Execution {} could not reach {}: {}", execution.getId(), conclusion.status(), e.getMessage());
            }
            activeRuns.remove(execution.getId());
            recordOutcome(execution);
            return Future.succeededFuture(execution);
        });
    }

    private RunRecord toRunRecord(WorkflowExecutionContext context, Conclusion conclusion) {
        WorkflowExecution execution = context.getExecution();
        Event event = context.getEvent();
        int tokens = context.getAgentResponses().values().stream().mapToInt(AgentResponse::tokens).sum();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventId", event.id());
        metadata.put("source", event.source());
        metadata.put("levelsExecuted", execution.getLevelOutcomes().stream().filter(o -> !o.skipped()).count());
        metadata.put("levelsSkipped", execution.getLevelOutcomes().stream().filter(LevelOutcome::skipped).count());

        return RunRecord.builder(RunType.WORKFLOW_EXECUTION)
                .workflowId(execution.getWorkflowId())
                .executionId(execution.getId())
                .status(conclusion.status())
                .startTime(execution.getStartTime())
                .endTime(Instant.now())
                .requestData(event.data())
                .responseData(conclusion.result())
                .error(conclusion.errorCode(), conclusion.error())
                .tokensUsed(tokens)
                .metadata(metadata)
                .tags(List.of(event.type().wireName()))
                .executionLog(execution.getExecutionLog())
                .levelOutcomes(execution.getLevelOutcomes())
                .build();
    }

    private Future<Void> persist(RunRecord run) {
        try {
            Future<Void> recorded = runRecorder.recordRun(run);
            return recorded != null ? recorded : Future.succeededFuture();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private void recordOutcome(WorkflowExecution execution) {
        double seconds = Duration.between(execution.getStartTime(),
                execution.getEndTime() != null ? execution.getEndTime() : Instant.now()).toMillis() / 1000.0;
        switch (execution.getStatus()) {
            case COMPLETED -> metrics.recordExecutionCompleted(execution.getWorkflowId(), seconds);
            case CANCELLED -> metrics.recordExecutionCancelled(execution.getWorkflowId());
            default -> metrics.recordExecutionFailed(execution.getWorkflowId(), seconds, execution.getError());
        }
        logger.info("Execution {} of workflow {} finished {} in {} ms",
                execution.getId(), execution.getWorkflowId(), execution.getStatus(), Math.round(seconds * 1000));
    }

    // ==================== Direct Agent Execution ====================

    /**
     * Runs a single agent of the workflow outside any workflow execution and records
     * an {@link RunType#AGENT_EXECUTION} run for the call. A failed recording is logged
     * and does not change the outcome.
     *
     * @return the agent's response; fails when the workflow has no such agent or the agent throws
     */
    public Future<AgentResponse> executeAgent(WorkflowConfig workflow, String agentId, Object input) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        if (shutdown) {
            return Future.failedFuture(new IllegalStateException("Execution engine is shut down"));
        }
        AgentConfig agent = null;
        int level = 0;
        if (workflow.getRootAgent() != null && workflow.getRootAgent().id().equals(agentId)) {
            agent = workflow.getRootAgent();
        } else {
            for (AgentLevel candidate : workflow.getLevels()) {
                for (AgentConfig member : candidate.agents()) {
                    if (member.id().equals(agentId)) {
                        agent = member;
                        level = candidate.level();
                    }
                }
            }
        }
        if (agent == null) {
            return Future.failedFuture(new IllegalArgumentException(
                    "Workflow " + workflow.getId() + " has no agent '" + agentId + "'"));
        }

        AgentConfig target = agent;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agentId", agentId);
        metadata.put("level", level);
        metadata.put("executionType", "direct");
        AgentInvocation invocation = new AgentInvocation(workflow.getId(), null, level,
                workflow.getUserPrompt(), metadata);
        Instant start = Instant.now();
        logger.info("Executing agent {} of workflow {} directly", agentId, workflow.getId());

        Future<AgentResponse> call;
        try {
            call = agentExecutor.execute(target, input, invocation);
        } catch (RuntimeException e) {
            call = Future.failedFuture(e);
        }
        if (call == null) {
            call = Future.failedFuture(new IllegalStateException("Agent executor returned no result"));
        }
        return call.transform(ar -> {
            RunRecord.Builder run = RunRecord.builder(RunType.AGENT_EXECUTION)
                    .workflowId(workflow.getId())
                    .startTime(start)
                    .endTime(Instant.now())
                    .requestData(input)
                    .metadata(metadata)
                    .tags(List.of(agentId));
            Future<AgentResponse> outcome;
            if (ar.failed()) {
                metrics.recordAgentFailed(workflow.getId(), agentId);
                logger.error("Direct execution of agent {} of workflow {} failed: {}",
                        agentId, workflow.getId(), message(ar.cause()));
                run.status(ExecutionStatus.FAILED)
                        .error(ErrorCode.AGENT_EXECUTION_FAILED.code(), message(ar.cause()));
                outcome = Future.failedFuture(new AgentExecutionException(agentId, ar.cause()));
            } else {
                AgentResponse response = ar.result() != null
                        ? ar.result()
                        : AgentResponse.failure(agentId, "Agent returned no response", 0);
                run.status(response.success() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED)
                        .responseData(response.data())
                        .tokensUsed(response.tokens());
                if (!response.success()) {
                    metrics.recordAgentFailed(workflow.getId(), agentId);
                    run.error(ErrorCode.AGENT_EXECUTION_FAILED.code(), response.error());
                }
                outcome = Future.succeededFuture(response);
            }
            RunRecord agentRun = run.build();
            return persist(agentRun).transform(persisted -> {
                if (persisted.failed()) {
                    logger.error("Failed to record run {} for agent {} of workflow {}: {}",
                            agentRun.id(), agentId, workflow.getId(), message(persisted.cause()));
                }
                return outcome;
            });
        });
    }

    // ==================== Management ====================

    /**
     * Requests cancellation of a running execution; it stops before its next level.
     *
     * @return {@code false} when no such execution is running
     */
    public boolean cancel(String executionId) {
        ActiveRun run = activeRuns.get(executionId);
        if (run == null) {
            logger.debug("Cancel requested for execution {} which is not running", executionId);
            return false;
        }
        boolean requested = run.context().getExecution().requestCancellation();
        if (requested) {
            logger.info("Cancellation requested for execution {} of workflow {}",
                    executionId, run.context().getWorkflow().getId());
        }
        return requested;
    }

    public List<ExecutionSnapshot> getActiveExecutions() {
        List<ExecutionSnapshot> snapshots = new ArrayList<>();
        for (ActiveRun run : activeRuns.values()) {
            snapshots.add(run.context().getExecution().snapshot());
        }
        return snapshots;
    }

    /**
     * @return a point-in-time view of a running execution; empty once it has finished
     */
    public Optional<ExecutionSnapshot> getExecution(String executionId) {
        ActiveRun run = activeRuns.get(executionId);
        return run != null ? Optional.of(run.context().getExecution().snapshot()) : Optional.empty();
    }

    public int activeCount() {
        return activeRuns.size();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Rejects further executions.
     *
     * @return completes once every execution still running has finished
     */
    public Future<Void> shutdown() {
        shutdown = true;
        List<Future<WorkflowExecution>> running = new ArrayList<>();
        activeRuns.values().forEach(run -> running.add(run.completion()));
        logger.info("Execution engine shutting down, {} execution(s) still running", running.size());
        return Future.join(running).transform(ar -> Future.<Void>succeededFuture());
    }

    /**
     * Requests cancellation of every running execution.
     *
     * @return the number of executions that accepted the request
     */
    public int cancelAll() {
        int cancelled = 0;
        for (String executionId : activeRuns.keySet()) {
            if (cancel(executionId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    // ==================== Helpers ====================

    private static Map<String, Object> describe(AgentResponse response) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (response.metadata() != null) {
            data.put("executionTimeMs", response.metadata().executionTimeMs());
            if (response.metadata().tokensUsed() != null) {
                data.put("tokensUsed", response.metadata().tokensUsed());
            }
        }
        if (response.error() != null) {
            data.put("error", response.error());
        }
        return data;
    }

    private static String message(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
