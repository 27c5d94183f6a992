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
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventHandler;

import java.util.Set;

/**
 * Turns one family of external signals into {@link dev.mars.arbiter.core.Event}s.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 *   <li>{@link #register} validates the trigger before touching any state and fails
 *       with {@link TriggerConfigurationException} without registering anything</li>
 *   <li>{@link #unregister} of a trigger that was never registered logs a warning and
 *       returns {@code false}</li>
 *   <li>Handler failures on automatically fired events are logged and swallowed;
 *       the registration stays armed</li>
 *   <li>{@link #stop} reverses every live registration and is idempotent</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public interface TriggerAdapter {

    /**
     * The trigger kinds this adapter serves.
     */
    Set<TriggerKind> kinds();

    /**
     * @return the generated registration id
     */
    String register(EventTrigger trigger, EventHandler handler) throws TriggerConfigurationException;

    /**
     * @return {@code true} when a matching registration was found and reversed
     */
    boolean unregister(EventTrigger trigger);

    void start();

    void stop();

    int activeCount();
}
