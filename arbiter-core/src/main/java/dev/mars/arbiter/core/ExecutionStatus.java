package dev.mars.arbiter.core;

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
 * Lifecycle of a workflow execution.
 * <pre>
 *   PENDING → RUNNING → COMPLETED | FAILED | CANCELLED
 *   PENDING → CANCELLED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ExecutionStatus {

    /** Created, first level not yet started */
    PENDING,

    /** Levels are being executed */
    RUNNING,

    /** Every level finished */
    COMPLETED,

    /** Stopped by an unrecoverable agent or condition error */
    FAILED,

    /** Stopped by an external cancellation request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public ExecutionStatus[] getValidTransitions() {
        return switch (this) {
            case PENDING -> new ExecutionStatus[]{RUNNING, CANCELLED};
            case RUNNING -> new ExecutionStatus[]{COMPLETED, FAILED, CANCELLED};
            case COMPLETED, FAILED, CANCELLED -> new ExecutionStatus[0];
        };
    }
}
