package dev.mars.arbiter.events.cron;

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

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * {@link CronScheduler} backed by cron-utils for expression parsing and Vert.x
 * one-shot timers for firing.
 *
 * <p>Five-field expressions use UNIX semantics; six-field expressions carry a
 * leading seconds field (Spring semantics). After each firing the next timer is
 * armed from the following matching time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class VertxCronScheduler implements CronScheduler {

    private static final Logger logger = LoggerFactory.getLogger(VertxCronScheduler.class);

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private final Vertx vertx;

    public VertxCronScheduler(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    @Override
    public ScheduledJob schedule(String expression, ZoneId zone, Runnable task) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        TimerJob job = new TimerJob(expression, zone, executionTime, task);
        job.armNext();
        return job;
    }

    static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        Cron cron = switch (fields) {
            case 5 -> UNIX_PARSER.parse(trimmed);
            case 6 -> SECONDS_PARSER.parse(trimmed);
            default -> throw new IllegalArgumentException(
                    "Cron expression must have 5 or 6 fields, got " + fields + ": '" + trimmed + "'");
        };
        return cron.validate();
    }

    private final class TimerJob implements ScheduledJob {
        private final String expression;
        private final ZoneId zone;
        private final ExecutionTime executionTime;
        private final Runnable task;
        private volatile boolean cancelled;
        private volatile long timerId = -1;
        private volatile ZonedDateTime nextFire;

        TimerJob(String expression, ZoneId zone, ExecutionTime executionTime, Runnable task) {
            this.expression = expression;
            this.zone = zone;
            this.executionTime = executionTime;
            this.task = task;
        }

        void armNext() {
            if (cancelled) {
                return;
            }
            ZonedDateTime now = ZonedDateTime.now(zone);
            Optional<ZonedDateTime> next = executionTime.nextExecution(now);
            if (next.isEmpty()) {
                logger.warn("Cron expression '{}' has no future firing time, job stops", expression);
                nextFire = null;
                return;
            }
            nextFire = next.get();
            long delay = Math.max(1, Duration.between(now, nextFire).toMillis());
            timerId = vertx.setTimer(delay, id -> {
                if (cancelled) {
                    return;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Cron task for '{}' failed: {}", expression, e.getMessage(), e);
                }
                armNext();
            });
        }

        @Override
        public void cancel() {
            cancelled = true;
            long id = timerId;
            if (id >= 0) {
                vertx.cancelTimer(id);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public Optional<ZonedDateTime> nextFireTime() {
            return Optional.ofNullable(nextFire);
        }
    }
}
