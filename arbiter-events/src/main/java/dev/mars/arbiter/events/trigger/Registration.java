package dev.mars.arbiter.events.trigger;

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

import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.events.EventHandler;

import java.util.Objects;

/**
 * Bookkeeping an adapter keeps for one registered trigger.
 */
public interface Registration {

    String id();

    EventTrigger trigger();

    EventHandler handler();

    /**
     * Reverses the side effects of the registration (timers, watches).
     */
    default void release() {
    }

    default boolean matches(EventTrigger other) {
        return other.kind() == trigger().kind()
                && Objects.equals(other.workflowId(), trigger().workflowId())
                && Objects.equals(other.registrationKey(), trigger().registrationKey());
    }
}
