package dev.mars.arbiter.events;

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

import dev.mars.arbiter.core.ExecutionStatus;

/**
 * Outcome of handing one event to its handler.
 *
 * @param executionId the execution started for the event, if any
 * @param status      the execution's final status, if any
 * @param skipped     {@code true} when the event was deliberately not processed
 */
public record EventProcessingResult(
        boolean success,
        String executionId,
        ExecutionStatus status,
        String error,
        boolean skipped,
        String reason) {

    public static EventProcessingResult executed(String executionId, ExecutionStatus status, String error) {
        return new EventProcessingResult(status == ExecutionStatus.COMPLETED, executionId, status, error, false, null);
    }

    public static EventProcessingResult skipped(String reason) {
        return new EventProcessingResult(true, null, null, null, true, reason);
    }

    public static EventProcessingResult failed(String error) {
        return new EventProcessingResult(false, null, null, error, false, null);
    }
}
