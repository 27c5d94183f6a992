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

import dev.mars.arbiter.core.exceptions.ConditionEvaluationException;
import dev.mars.arbiter.workflow.WorkflowExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates level conditions as Spring Expression Language expressions.
 *
 * <p>Variables available to an expression:
 * <ul>
 *   <li>{@code #event} - data of the triggering event</li>
 *   <li>{@code #state} - agent id to output of every successful agent so far</li>
 *   <li>{@code #responses} - agent id to {@code AgentResponse}</li>
 *   <li>{@code #lastLevel} - the previous {@code LevelOutcome}, {@code null} right after the root agent</li>
 *   <li>{@code #workflowId} - id of the running workflow</li>
 * </ul>
 *
 * <p>Expressions run in a read-only {@link SimpleEvaluationContext}: map entries are
 * reached by index ({@code #state['classifier']['label'] == 'urgent'}) and record
 * components through their accessor methods ({@code #lastLevel.successCount() > 0}).
 * Type references and constructors are not available.
 *
 * <p>Examples:
 * <pre>
 * #event['priority'] == 'high'
 * #responses['triage'].success()
 * #lastLevel != null and #lastLevel.failureCount() == 0
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class SpelConditionEvaluator implements ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(SpelConditionEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    @Override
    public boolean evaluate(String condition, WorkflowExecutionContext context) throws ConditionEvaluationException {
        if (condition == null || condition.isBlank()) {
            throw new ConditionEvaluationException(String.valueOf(condition), "condition is empty");
        }
        Expression expression = parse(condition);

        Object value;
        try {
            value = expression.getValue(createEvaluationContext(context));
        } catch (EvaluationException e) {
            throw new ConditionEvaluationException(condition, e.getMessage(), e);
        }
        if (!(value instanceof Boolean result)) {
            throw new ConditionEvaluationException(condition,
                    "expected a boolean but got " + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        logger.debug("Condition '{}' evaluated to {} for execution {}",
                condition, result, context.getExecution().getId());
        return result;
    }

    private Expression parse(String condition) throws ConditionEvaluationException {
        Expression cached = cache.get(condition);
        if (cached != null) {
            return cached;
        }
        try {
            Expression parsed = parser.parseExpression(condition);
            cache.put(condition, parsed);
            return parsed;
        } catch (ParseException e) {
            throw new ConditionEvaluationException(condition, e.getMessage(), e);
        }
    }

    private static EvaluationContext createEvaluationContext(WorkflowExecutionContext context) {
        SimpleEvaluationContext evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding()
                .withInstanceMethods()
                .build();
        evaluationContext.setVariable("event", context.getEvent().data());
        evaluationContext.setVariable("state", context.getState());
        evaluationContext.setVariable("responses", context.getAgentResponses());
        evaluationContext.setVariable("lastLevel", context.getLastLevel());
        evaluationContext.setVariable("workflowId", context.getWorkflow().getId());
        return evaluationContext;
    }
}
