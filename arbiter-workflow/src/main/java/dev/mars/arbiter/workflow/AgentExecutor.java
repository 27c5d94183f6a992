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

/**
 * Runs a single agent against a model provider.
 *
 * <p>A response with {@code success == false} is an ordinary outcome recorded in the
 * agent's slot. A failed future means the agent could not be run at all and aborts
 * the execution. The engine never retries a call; retry policy, if any, belongs to
 * the implementation.
 */
@FunctionalInterface
public interface AgentExecutor {

    Future<AgentResponse> execute(AgentConfig agent, Object input, AgentInvocation invocation);
}
