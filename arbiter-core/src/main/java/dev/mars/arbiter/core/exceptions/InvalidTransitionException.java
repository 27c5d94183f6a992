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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Thrown when an execution is moved to a status its current status does not allow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends ArbiterException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final Enum<?>[] validTransitions;

    /**
     * @param entityId         the execution whose transition was rejected
     * @param currentState     its current status
     * @param requestedState   the status that was requested
     * @param validTransitions the statuses reachable from the current one
     */
    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Enum<?>[] validTransitions) {
        super(ErrorCode.INVALID_TRANSITION, String.format("Invalid transition for '%s': %s -> %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = validTransitions;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public Enum<?>[] getValidTransitions() {
        return validTransitions;
    }

    private static String formatTransitions(Enum<?>[] transitions) {
        if (transitions == null) {
            return "[]";
        }
        return Arrays.stream(transitions).map(Enum::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
