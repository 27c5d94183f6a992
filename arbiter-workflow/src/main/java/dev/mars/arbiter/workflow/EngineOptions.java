package dev.mars.arbiter.workflow;

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

import dev.mars.arbiter.config.ArbiterConfig;

/**
 * Bounds applied by the {@link ExecutionEngine}.
 *
 * @param levelTimeoutMs longest a single level (or the root agent) may run; 0 disables the bound
 * @param maxLevels      largest number of levels a workflow may declare
 */
public record EngineOptions(long levelTimeoutMs, int maxLevels) {

    public static final long DEFAULT_LEVEL_TIMEOUT_MS = 300_000;
    public static final int DEFAULT_MAX_LEVELS = 50;

    public EngineOptions {
        if (levelTimeoutMs < 0) {
            throw new IllegalArgumentException("Level timeout cannot be negative: " + levelTimeoutMs);
        }
        if (maxLevels < 1) {
            throw new IllegalArgumentException("Max levels must be positive: " + maxLevels);
        }
    }

    public static EngineOptions defaults() {
        return new EngineOptions(DEFAULT_LEVEL_TIMEOUT_MS, DEFAULT_MAX_LEVELS);
    }

    public static EngineOptions from(ArbiterConfig config) {
        return new EngineOptions(config.getLevelTimeoutMs(), config.getMaxLevels());
    }
}
