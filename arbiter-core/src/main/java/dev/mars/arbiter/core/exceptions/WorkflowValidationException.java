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

import java.util.List;

/**
 * Thrown when a workflow definition violates its structural rules.
 * All violations found are reported together.
 */
public class WorkflowValidationException extends ArbiterException {

    private final String workflowId;
    private final List<String> violations;

    public WorkflowValidationException(String workflowId, List<String> violations) {
        super(ErrorCode.WORKFLOW_INVALID,
                ErrorCode.WORKFLOW_INVALID.formatMessage(String.join("; ", violations)));
        this.workflowId = workflowId;
        this.violations = List.copyOf(violations);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
