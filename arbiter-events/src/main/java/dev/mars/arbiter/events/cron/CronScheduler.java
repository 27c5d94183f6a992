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

import java.time.ZoneId;

/**
 * Cron scheduling capability used by the cron trigger adapter.
 */
public interface CronScheduler {

    /**
     * @throws IllegalArgumentException when the expression cannot be parsed
     */
    void validate(String expression);

    /**
     * Runs {@code task} at every time matching the expression in the given zone.
     *
     * @throws IllegalArgumentException when the expression cannot be parsed
     */
    ScheduledJob schedule(String expression, ZoneId zone, Runnable task);
}
