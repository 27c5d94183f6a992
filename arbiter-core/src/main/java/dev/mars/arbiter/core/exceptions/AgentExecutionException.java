package dev.mars.arbiter.core.exceptions;

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

/**
 * Wraps an error raised by the agent executor. Unlike a failed
 * {@code AgentResponse}, this aborts the workflow execution.
 */
public class AgentExecutionException extends ArbiterException {

    private final String agentId;

    public AgentExecutionException(String agentId, Throwable cause) {
        super(ErrorCode.AGENT_EXECUTION_FAILED,
                ErrorCode.AGENT_EXECUTION_FAILED.formatMessage(agentId, describe(cause)), cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }

    private static String describe(Throwable cause) {
        return cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
    }
}
