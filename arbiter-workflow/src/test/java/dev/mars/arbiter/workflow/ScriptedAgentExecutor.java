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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Test agent executor: answers {@code <agentId>-out} unless a behaviour is scripted
 * for the agent, and records every call.
 */
final class ScriptedAgentExecutor implements AgentExecutor {

    record Call(String agentId, Object input, AgentInvocation invocation) {
    }

    private final Map<String, Function<Object, Future<AgentResponse>>> behaviours = new ConcurrentHashMap<>();
    final List<Call> calls = new CopyOnWriteArrayList<>();

    ScriptedAgentExecutor on(String agentId, Function<Object, Future<AgentResponse>> behaviour) {
        behaviours.put(agentId, behaviour);
        return this;
    }

    @Override
    public Future<AgentResponse> execute(AgentConfig agent, Object input, AgentInvocation invocation) {
        calls.add(new Call(agent.id(), input, invocation));
        Function<Object, Future<AgentResponse>> behaviour = behaviours.get(agent.id());
        if (behaviour != null) {
            return behaviour.apply(input);
        }
        return Future.succeededFuture(AgentResponse.success(agent.id(), agent.id() + "-out", 1));
    }

    List<String> calledAgents() {
        return calls.stream().map(Call::agentId).collect(Collectors.toList());
    }

    Call call(String agentId) {
        return calls.stream().filter(c -> c.agentId().equals(agentId)).findFirst().orElseThrow();
    }
}
