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
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("SimulatedAgentExecutor Tests")
class SimulatedAgentExecutorTest {

    @Test
    @DisplayName("Should echo the input in a successful response")
    void echoesInput(Vertx vertx, VertxTestContext ctx) {
        AgentConfig agent = new AgentConfig("summariser", "Summariser", null, "local-model",
                "Summarise the input", List.of(), 1, Map.of());
        AgentInvocation invocation = new AgentInvocation("wf-1", "exec-1", 1, null, Map.of());

        new SimulatedAgentExecutor(vertx, 10).execute(agent, "text", invocation)
                .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                    assertTrue(response.success());
                    @SuppressWarnings("unchecked")
                    Map<String, Object> data = (Map<String, Object>) response.data();
                    assertEquals("text", data.get("input"));
                    assertEquals("summariser", response.metadata().agentId());
                    assertEquals("local-model", response.metadata().model());
                    assertTrue(response.tokens() > 0);
                    ctx.completeNow();
                })));
    }
}
