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
import java.util.Optional;

/**
 * Standardized error codes for Arbiter failures.
 *
 * <p>Naming conventions:</p>
 * <ul>
 *   <li>{@code *_NOT_FOUND} - Resource does not exist (404)</li>
 *   <li>{@code *_INVALID} - Invalid definition or configuration (400)</li>
 *   <li>{@code *_DUPLICATE}, {@code INVALID_TRANSITION} - State conflict (409)</li>
 *   <li>{@code *_UNAVAILABLE} - Service temporarily unavailable (503)</li>
 *   <li>{@code INTERNAL_*}, {@code *_FAILED} - Server-side errors (500)</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorCode {

    /** Request or definition validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", 400, "Validation failed: %s"),

    /** Workflow not found */
    WORKFLOW_NOT_FOUND("WORKFLOW_NOT_FOUND", 404, "Workflow '%s' not found"),

    /** Workflow already exists */
    WORKFLOW_DUPLICATE("WORKFLOW_DUPLICATE", 409, "Workflow '%s' already exists"),

    /** Workflow definition is invalid */
    WORKFLOW_INVALID("WORKFLOW_INVALID", 400, "Invalid workflow definition: %s"),

    /** Workflow execution not found */
    EXECUTION_NOT_FOUND("EXECUTION_NOT_FOUND", 404, "Workflow execution '%s' not found"),

    /** No trigger registered for the workflow */
    TRIGGER_NOT_FOUND("TRIGGER_NOT_FOUND", 404, "No trigger registered for workflow '%s'"),

    /** Trigger configuration rejected at registration */
    TRIGGER_CONFIGURATION_INVALID("TRIGGER_CONFIGURATION_INVALID", 400, "Invalid trigger configuration: %s"),

    /** Status machine violation */
    INVALID_TRANSITION("INVALID_TRANSITION", 409, "Invalid state transition: %s"),

    /** Agent raised an error */
    AGENT_EXECUTION_FAILED("AGENT_EXECUTION_FAILED", 500, "Agent '%s' failed: %s"),

    /** Level condition could not be evaluated to a boolean */
    CONDITION_EVALUATION_FAILED("CONDITION_EVALUATION_FAILED", 500, "Condition '%s' could not be evaluated: %s"),

    /** Level did not finish within the configured bound */
    LEVEL_TIMEOUT("LEVEL_TIMEOUT", 504, "Level %d did not finish within %d ms"),

    /** Storage collaborator failed */
    STORAGE_FAILED("STORAGE_FAILED", 500, "Storage operation failed: %s"),

    /** Service not initialized or shutting down */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, "Service temporarily unavailable: %s"),

    /** Unexpected internal error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, "Internal server error: %s");

    private final String code;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }
}
