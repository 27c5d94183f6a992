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

import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.core.exceptions.TriggerNotFoundException;
import dev.mars.arbiter.events.EventHandler;
import dev.mars.arbiter.events.EventProcessingResult;
import io.vertx.core.Future;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fires workflows on explicit request.
 *
 * <p>Unlike the automatic adapters, the handler's outcome, including its failure,
 * is returned to whoever invoked {@link #trigger(String, Object)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class ManualTriggerAdapter extends AbstractTriggerAdapter<ManualTriggerAdapter.ManualRegistration> {

    public static final String SOURCE = "manual-trigger";

    record ManualRegistration(String id, EventTrigger trigger, EventHandler handler) implements Registration {
    }

    @Override
    public Set<TriggerKind> kinds() {
        return Set.of(TriggerKind.MANUAL);
    }

    @Override
    protected String idPrefix() {
        return "manual";
    }

    @Override
    protected ManualRegistration createRegistration(String registrationId, EventTrigger trigger, EventHandler handler)
            throws TriggerConfigurationException {
        requireWorkflow(trigger);
        return new ManualRegistration(registrationId, trigger, handler);
    }

    /**
     * Fires the workflow's manual registration with the given payload.
     *
     * @return the handler's result; fails with {@link TriggerNotFoundException} when the
     *         workflow has no manual registration
     */
    public Future<EventProcessingResult> trigger(String workflowId, Object data) {
        for (ManualRegistration registration : registrations.snapshot()) {
            if (registration.trigger().workflowId().equals(workflowId)) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("triggeredBy", "manual");
                metadata.put("registrationId", registration.id());
                metadata.put(Event.WORKFLOW_ID, workflowId);
                Event event = Event.create(TriggerKind.MANUAL, SOURCE, data != null ? data : Map.of(), metadata);
                logger.info("Manual trigger fired event {} for workflow {}", event.id(), workflowId);
                return dispatch(registration, event);
            }
        }
        logger.warn("Manual trigger requested for workflow {} which has no manual registration", workflowId);
        return Future.failedFuture(new TriggerNotFoundException(workflowId));
    }
}
