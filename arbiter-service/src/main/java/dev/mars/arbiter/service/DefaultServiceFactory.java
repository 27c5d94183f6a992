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
import dev.mars.arbiter.events.TriggerRegistry;
import dev.mars.arbiter.storage.WorkflowStore;
import dev.mars.arbiter.storage.WorkflowStoreFactory;
import dev.mars.arbiter.workflow.AgentExecutor;
import dev.mars.arbiter.workflow.EngineOptions;
import dev.mars.arbiter.workflow.ExecutionEngine;
import dev.mars.arbiter.workflow.SimulatedAgentExecutor;
import dev.mars.arbiter.workflow.condition.SpelConditionEvaluator;
import dev.mars.arbiter.workflow.observability.WorkflowMetrics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Wires the standard components: the configured store, a registry with every
 * trigger adapter, and an engine with SpEL conditions.
 *
 * <p>Without an agent executor of its own, the factory runs agents through the
 * {@link SimulatedAgentExecutor}.
 */
public class DefaultServiceFactory implements ServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(DefaultServiceFactory.class);

    private final Function<Vertx, AgentExecutor> agentExecutorFactory;

    public DefaultServiceFactory() {
        this(SimulatedAgentExecutor::new);
    }

    public DefaultServiceFactory(Function<Vertx, AgentExecutor> agentExecutorFactory) {
        this.agentExecutorFactory = agentExecutorFactory;
    }

    @Override
    public Future<ArbiterService> create(Vertx vertx, ArbiterConfig config) {
        return WorkflowStoreFactory.create(vertx, config.getStorageLocation())
                .compose(store -> initialize(vertx, config, store));
    }

    private Future<ArbiterService> initialize(Vertx vertx, ArbiterConfig config, WorkflowStore store) {
        TriggerRegistry registry = TriggerRegistry.createDefault(vertx, config.getFileWatchDebounceMs());
        ExecutionEngine engine = new ExecutionEngine(
                vertx,
                agentExecutorFactory.apply(vertx),
                new SpelConditionEvaluator(),
                store,
                EngineOptions.from(config),
                WorkflowMetrics.getInstance());
        ArbiterService service = new ArbiterService(config, vertx, store, registry, engine);
        return service.initialize()
                .map(v -> service)
                .recover(err -> {
                    logger.warn("Closing workflow store after failed initialization");
                    return store.close().transform(ignored -> Future.<ArbiterService>failedFuture(err));
                });
    }
}
