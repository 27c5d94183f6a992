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
import dev.mars.arbiter.events.EventHandler;
import dev.mars.arbiter.events.cron.CronScheduler;
import dev.mars.arbiter.events.cron.ScheduledJob;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires workflows on a cron schedule.
 *
 * <p>The schedule and timezone are validated before anything is scheduled. Each
 * firing produces an event with data {@code {schedule, timezone}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class CronTriggerAdapter extends AbstractTriggerAdapter<CronTriggerAdapter.CronRegistration> {

    private final CronScheduler scheduler;

    record CronRegistration(String id, EventTrigger trigger, EventHandler handler, String schedule,
                            String timezone, AtomicReference<ScheduledJob> job) implements Registration {

        @Override
        public void release() {
            ScheduledJob scheduled = job.get();
            if (scheduled != null) {
                scheduled.cancel();
            }
        }
    }

    public CronTriggerAdapter(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Set<TriggerKind> kinds() {
        return Set.of(TriggerKind.CRON);
    }

    @Override
    protected String idPrefix() {
        return "cron";
    }

    @Override
    protected CronRegistration createRegistration(String registrationId, EventTrigger trigger, EventHandler handler)
            throws TriggerConfigurationException {
        requireWorkflow(trigger);
        EventTrigger.Cron cron = (EventTrigger.Cron) trigger;
        String schedule = cron.schedule();
        try {
            scheduler.validate(schedule);
        } catch (IllegalArgumentException e) {
            throw new TriggerConfigurationException(TriggerKind.CRON,
                    "invalid cron expression '" + schedule + "': " + e.getMessage(), e);
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(cron.effectiveTimezone());
        } catch (DateTimeException e) {
            throw new TriggerConfigurationException(TriggerKind.CRON,
                    "invalid timezone '" + cron.timezone() + "'", e);
        }

        CronRegistration registration = new CronRegistration(registrationId, trigger, handler, schedule,
                cron.effectiveTimezone(), new AtomicReference<>());
        try {
            registration.job().set(scheduler.schedule(schedule, zone, () -> onTick(registration)));
        } catch (IllegalArgumentException e) {
            throw new TriggerConfigurationException(TriggerKind.CRON, e.getMessage(), e);
        }
        return registration;
    }

    private void onTick(CronRegistration registration) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("schedule", registration.schedule());
        data.put("timezone", registration.timezone());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("jobId", registration.id());
        metadata.put("schedule", registration.schedule());
        metadata.put("timezone", registration.timezone());
        metadata.put(Event.WORKFLOW_ID, registration.trigger().workflowId());

        fire(registration, Event.create(TriggerKind.CRON, "cron:" + registration.schedule(), data, metadata));
    }
}
