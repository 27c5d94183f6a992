package dev.mars.arbiter.workflow.condition;

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
import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.WorkflowConfig;
import dev.mars.arbiter.core.WorkflowExecution;
import dev.mars.arbiter.core.exceptions.ConditionEvaluationException;
import dev.mars.arbiter.workflow.WorkflowExecutionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpelConditionEvaluator Tests")
class SpelConditionEvaluatorTest {

    private final SpelConditionEvaluator evaluator = new SpelConditionEvaluator();
    private WorkflowExecutionContext context;

    @BeforeEach
    void setUp() {
        WorkflowConfig workflow = WorkflowConfig.builder("wf-triage")
                .name("Triage")
                .rootAgent(AgentConfig.of("root", "Root", "Classify the ticket"))
                .build();
        Event event = Event.create(TriggerKind.WEBHOOK, "webhook:/tickets",
                Map.of("priority", "high", "size", 12), Map.of());
        context = new WorkflowExecutionContext(new WorkflowExecution("wf-triage", event.data()), workflow, event);
    }

    @Test
    @DisplayName("Should expose event data and workflow id")
    void exposesVariables() throws Exception {
        assertTrue(evaluator.evaluate("#event['priority'] == 'high'", context));
        assertTrue(evaluator.evaluate("#event['size'] > 10 and #workflowId == 'wf-triage'", context));
        assertFalse(evaluator.evaluate("#event['priority'] == 'low'", context));
        assertTrue(evaluator.evaluate("#state.isEmpty() and #lastLevel == null", context));
    }

    @Test
    @DisplayName("Should reject expressions that do not yield a boolean")
    void rejectsNonBoolean() {
        ConditionEvaluationException ex = assertThrows(ConditionEvaluationException.class,
                () -> evaluator.evaluate("#event['size']", context));
        assertEquals("#event['size']", ex.getCondition());
        assertThrows(ConditionEvaluationException.class, () -> evaluator.evaluate("#missing", context));
    }

    @Test
    @DisplayName("Should report syntax errors")
    void rejectsMalformedExpression() {
        assertThrows(ConditionEvaluationException.class, () -> evaluator.evaluate("#event[", context));
        assertThrows(ConditionEvaluationException.class, () -> evaluator.evaluate(" ", context));
    }

    @Test
    @DisplayName("Should not allow type references")
    void rejectsTypeReferences() {
        assertThrows(ConditionEvaluationException.class,
                () -> evaluator.evaluate("T(java.lang.System).exit(1) == null", context));
    }
}
