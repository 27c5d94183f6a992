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

import dev.mars.arbiter.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkflowExecution Tests")
class WorkflowExecutionTest {

    @Test
    @DisplayName("Should start pending with a generated id")
    void shouldStartPending() {
        WorkflowExecution execution = new WorkflowExecution("wf-1", Map.of("x", 1));

        assertEquals(ExecutionStatus.PENDING, execution.getStatus());
        assertTrue(execution.getId().startsWith("exec_"));
        assertEquals("wf-1", execution.getWorkflowId());
        assertNull(execution.getEndTime());
    }

    @Test
    @DisplayName("Should set result and end time when finished")
    void shouldFinish() throws Exception {
        WorkflowExecution execution = new WorkflowExecution("wf-1", null);
        execution.start();
        execution.appendLog(WorkflowLogEntry.info("root done", "root", 0, null));

        execution.finish(ExecutionStatus.COMPLETED, "answer", null);

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals("answer", execution.getResult());
        assertNotNull(execution.getEndTime());
        assertEquals(1, execution.getExecutionLog().size());
    }

    @Test
    @DisplayName("Should reject mutation once terminal")
    void shouldRejectMutationOnceTerminal() throws Exception {
        WorkflowExecution execution = new WorkflowExecution("wf-1", null);
        execution.start();
        execution.finish(ExecutionStatus.FAILED, null, "boom");

        assertThrows(IllegalStateException.class,
                () -> execution.appendLog(WorkflowLogEntry.info("late", null, null, null)));
        assertThrows(IllegalStateException.class, () -> execution.advanceTo(3, "a"));
        assertThrows(InvalidTransitionException.class,
                () -> execution.finish(ExecutionStatus.COMPLETED, "x", null));
        assertFalse(execution.requestCancellation());
        assertEquals("boom", execution.getError());
    }

    @Test
    @DisplayName("Should reject completing an execution that never started")
    void shouldRejectCompletingPending() {
        WorkflowExecution execution = new WorkflowExecution("wf-1", null);

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> execution.finish(ExecutionStatus.COMPLETED, null, null));
        assertEquals(ExecutionStatus.PENDING, ex.getCurrentState());
        assertEquals(ExecutionStatus.COMPLETED, ex.getRequestedState());
    }

    @Test
    @DisplayName("Snapshot should not change after further mutation")
    void snapshotShouldBeStable() throws Exception {
        WorkflowExecution execution = new WorkflowExecution("wf-1", null);
        execution.start();
        ExecutionSnapshot before = execution.snapshot();

        execution.appendLog(WorkflowLogEntry.info("later", null, 1, null));

        assertTrue(before.executionLog().isEmpty());
        assertEquals(ExecutionStatus.RUNNING, before.status());
        assertEquals(1, execution.snapshot().executionLog().size());
    }
}
