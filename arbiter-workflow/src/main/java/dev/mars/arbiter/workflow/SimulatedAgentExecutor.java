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
import dev.mars.arbiter.core.AgentResponse;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Development stand-in for a model provider. Every call succeeds and echoes its
 * input back, optionally after a fixed delay.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class SimulatedAgentExecutor implements AgentExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedAgentExecutor.class);
    private static final String DEFAULT_MODEL = "simulated";

    private final Vertx vertx;
    private final long latencyMs;

    public SimulatedAgentExecutor(Vertx vertx, long latencyMs) {
        this.vertx = vertx;
        this.latencyMs = Math.max(0, latencyMs);
    }

    public SimulatedAgentExecutor(Vertx vertx) {
        this(vertx, 0);
    }

    @Override
    public Future<AgentResponse> execute(AgentConfig agent, Object input, AgentInvocation invocation) {
        logger.debug("Simulating agent {} at level {} of execution {}",
                agent.id(), invocation.level(), invocation.executionId());
        Future<Void> delay = latencyMs > 0 ? vertx.timer(latencyMs).mapEmpty() : Future.succeededFuture();
        return delay.map(v -> respond(agent, input));
    }

    private AgentResponse respond(AgentConfig agent, Object input) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent", agent.name());
        data.put("input", input);
        data.put("output", "Simulated response from " + agent.name());
        String model = agent.model() != null ? agent.model() : DEFAULT_MODEL;
        int tokens = agent.systemPrompt() != null ? agent.systemPrompt().length() / 4 : 0;
        return new AgentResponse(true, data, null,
                new AgentResponse.Metadata(agent.id(), latencyMs, tokens, model));
    }
}
