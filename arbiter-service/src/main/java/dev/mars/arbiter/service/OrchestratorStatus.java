package dev.mars.arbiter.service;

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

import java.time.Duration;

/**
 * Snapshot reported by {@link ServiceOrchestrator#getStatus()}.
 *
 * @param initialized      a service has been built and initialized
 * @param initializing     an initialization attempt is in flight
 * @param serviceAvailable the service accepts work
 * @param healthMonitoring the periodic health check is running
 * @param environment      the configured environment name
 * @param uptime           time since the orchestrator was created
 */
public record OrchestratorStatus(
        boolean initialized,
        boolean initializing,
        boolean serviceAvailable,
        boolean healthMonitoring,
        String environment,
        Duration uptime) {
}
