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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.arbiter.config.ArbiterJson;
import dev.mars.arbiter.core.PerformanceMetrics;
import dev.mars.arbiter.core.RunRecord;
import dev.mars.arbiter.core.RunStats;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.exceptions.DuplicateWorkflowException;
import dev.mars.arbiter.core.exceptions.StorageException;
import dev.mars.arbiter.core.exceptions.WorkflowNotFoundException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@link WorkflowStore} persisting JSON documents under a base directory.
 *
 * <p>Layout:</p>
 * <pre>
 *   {base}/workflows/{workflowId}.json   one document per workflow, replaced atomically
 *   {base}/runs/{workflowId}.jsonl       run records, one JSON object per line
 * </pre>
 *
 * <p>All file I/O runs on Vert.x worker threads. Writes are serialized on the
 * store instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class FileWorkflowStore implements WorkflowStore {

    private static final Logger logger = LoggerFactory.getLogger(FileWorkflowStore.class);
    private static final String WORKFLOW_SUFFIX = ".json";
    private static final String RUNS_SUFFIX = ".jsonl";
    private static final String UNBOUND_RUNS = "_unbound";

    private final Vertx vertx;
    private final Path baseDir;
    private final Path workflowsDir;
    private final Path runsDir;
    private final ObjectMapper mapper = ArbiterJson.mapper();
    private final Object writeLock = new Object();

    public FileWorkflowStore(Vertx vertx, Path baseDir) {
        this.vertx = vertx;
        this.baseDir = baseDir;
        this.workflowsDir = baseDir.resolve("workflows");
        this.runsDir = baseDir.resolve("runs");
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public Future<Void> open() {
        return blocking("open", () -> {
            Files.createDirectories(workflowsDir);
            Files.createDirectories(runsDir);
            logger.info("Workflow store opened at {}", baseDir.toAbsolutePath());
            return null;
        });
    }

    @Override
    public Future<Void> close() {
        logger.info("Workflow store closed at {}", baseDir.toAbsolutePath());
        return Future.succeededFuture();
    }

    // =========================================================================
    // Workflows
    // =========================================================================

    @Override
    public Future<WorkflowConfig> createWorkflow(WorkflowConfig workflow) {
        return blocking("createWorkflow", () -> {
            synchronized (writeLock) {
                Path file = workflowFile(workflow.getId());
                if (Files.exists(file)) {
                    throw new DuplicateWorkflowException(workflow.getId());
                }
                Instant now = Instant.now();
                WorkflowConfig stored = workflow.toBuilder()
                        .createdAt(workflow.getCreatedAt() != null ? workflow.getCreatedAt() : now)
                        .updatedAt(now)
                        .build();
                writeAtomically(file, mapper.writeValueAsBytes(stored));
                return stored;
            }
        });
    }

    @Override
    public Future<Optional<WorkflowConfig>> getWorkflow(String workflowId) {
        return blocking("getWorkflow", () -> {
            Path file = workflowFile(workflowId);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(file.toFile(), WorkflowConfig.class));
        });
    }

    @Override
    public Future<List<WorkflowConfig>> listWorkflows() {
        return blocking("listWorkflows", () -> {
            List<WorkflowConfig> workflows = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(workflowsDir, "*" + WORKFLOW_SUFFIX)) {
                for (Path file : files) {
                    try {
                        workflows.add(mapper.readValue(file.toFile(), WorkflowConfig.class));
                    } catch (IOException e) {
                        logger.warn("Skipping unreadable workflow document {}: {}", file, e.getMessage());
                    }
                }
            }
            workflows.sort(Comparator.comparing(WorkflowConfig::getId));
            return workflows;
        });
    }

    @Override
    public Future<WorkflowConfig> updateWorkflow(WorkflowConfig workflow) {
        return blocking("updateWorkflow", () -> {
            synchronized (writeLock) {
                Path file = workflowFile(workflow.getId());
                if (!Files.exists(file)) {
                    throw new WorkflowNotFoundException(workflow.getId());
                }
                WorkflowConfig existing = mapper.readValue(file.toFile(), WorkflowConfig.class);
                WorkflowConfig updated = workflow.toBuilder()
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(Instant.now())
                        .build();
                writeAtomically(file, mapper.writeValueAsBytes(updated));
                return updated;
            }
        });
    }

    @Override
    public Future<Void> deleteWorkflow(String workflowId) {
        return blocking("deleteWorkflow", () -> {
            synchronized (writeLock) {
                if (!Files.deleteIfExists(workflowFile(workflowId))) {
                    throw new WorkflowNotFoundException(workflowId);
                }
                Files.deleteIfExists(runsFile(workflowId));
                return null;
            }
        });
    }

    // =========================================================================
    // Runs
    // =========================================================================

    @Override
    public Future<Void> recordRun(RunRecord run) {
        return blocking("recordRun", () -> {
            byte[] line = (mapper.writeValueAsString(run) + "\n").getBytes(StandardCharsets.UTF_8);
            synchronized (writeLock) {
                Files.write(runsFile(run.workflowId()), line,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            return null;
        });
    }

    @Override
    public Future<List<RunRecord>> getRuns(String workflowId, int limit) {
        return blocking("getRuns", () -> RunQueries.newest(readRuns(runsFile(workflowId)), limit));
    }

    @Override
    public Future<List<RunRecord>> getRunsByExecution(String executionId) {
        return blocking("getRunsByExecution", () -> readAllRuns().stream()
                .filter(r -> executionId.equals(r.executionId()))
                .sorted(Comparator.comparing(RunRecord::startTime))
                .toList());
    }

    @Override
    public Future<List<RunRecord>> getRecentErrors(int limit) {
        return blocking("getRecentErrors", () -> RunQueries.recentErrors(readAllRuns(), limit));
    }

    @Override
    public Future<RunStats> getRunStats(String workflowId) {
        return blocking("getRunStats", () -> RunStats.of(runsFor(workflowId)));
    }

    @Override
    public Future<PerformanceMetrics> getPerformanceMetrics(String workflowId) {
        return blocking("getPerformanceMetrics", () -> PerformanceMetrics.of(runsFor(workflowId)));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<RunRecord> runsFor(String workflowId) throws IOException {
        return workflowId == null ? readAllRuns() : readRuns(runsFile(workflowId));
    }

    private List<RunRecord> readAllRuns() throws IOException {
        List<RunRecord> runs = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(runsDir, "*" + RUNS_SUFFIX)) {
            for (Path file : files) {
                runs.addAll(readRuns(file));
            }
        }
        return runs;
    }

    private List<RunRecord> readRuns(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<RunRecord> runs = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                runs.add(mapper.readValue(line, RunRecord.class));
            } catch (IOException e) {
                logger.warn("Skipping malformed run record in {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return runs;
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temp, content);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path workflowFile(String workflowId) {
        return workflowsDir.resolve(encode(workflowId) + WORKFLOW_SUFFIX);
    }

    private Path runsFile(String workflowId) {
        return runsDir.resolve((workflowId != null ? encode(workflowId) : UNBOUND_RUNS) + RUNS_SUFFIX);
    }

    static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

    private <T> Future<T> blocking(String operation, Callable<T> action) {
        return vertx.<T>executeBlocking(action)
                .recover(err -> {
                    if (err instanceof DuplicateWorkflowException || err instanceof WorkflowNotFoundException) {
                        return Future.failedFuture(err);
                    }
                    logger.error("Workflow store operation {} failed: {}", operation, err.getMessage());
                    return Future.failedFuture(new StorageException(operation + ": " + err.getMessage(), err));
                });
    }
}
