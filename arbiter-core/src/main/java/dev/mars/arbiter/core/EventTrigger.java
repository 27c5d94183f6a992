package dev.mars.arbiter.core;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Trigger configuration attached to a workflow.
 *
 * <p>The variant set is closed: one record per {@link TriggerKind}, each carrying
 * its own strongly typed settings plus the owning workflow id. Unregistration
 * matches on {@link #workflowId()} together with {@link #registrationKey()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventTrigger.Manual.class, name = "manual"),
        @JsonSubTypes.Type(value = EventTrigger.Cron.class, name = "cron"),
        @JsonSubTypes.Type(value = EventTrigger.FileWatch.class, name = "file-watch"),
        @JsonSubTypes.Type(value = EventTrigger.Webhook.class, name = "webhook"),
        @JsonSubTypes.Type(value = EventTrigger.Api.class, name = "api")
})
public sealed interface EventTrigger
        permits EventTrigger.Manual, EventTrigger.Cron, EventTrigger.FileWatch,
                EventTrigger.Webhook, EventTrigger.Api {

    String DEFAULT_TIMEZONE = "UTC";

    TriggerKind kind();

    /**
     * The workflow this trigger starts, or {@code null} when not yet bound.
     */
    String workflowId();

    /**
     * Returns a copy of this trigger bound to the given workflow.
     */
    EventTrigger forWorkflow(String workflowId);

    /**
     * Kind-specific key identifying the registration within a workflow.
     */
    String registrationKey();

    record Manual(@JsonProperty("workflowId") String workflowId) implements EventTrigger {

        @Override
        public TriggerKind kind() {
            return TriggerKind.MANUAL;
        }

        @Override
        public Manual forWorkflow(String workflowId) {
            return new Manual(workflowId);
        }

        @Override
        public String registrationKey() {
            return workflowId;
        }
    }

    record Cron(String workflowId, String schedule, String timezone) implements EventTrigger {

        @Override
        public TriggerKind kind() {
            return TriggerKind.CRON;
        }

        @Override
        public Cron forWorkflow(String workflowId) {
            return new Cron(workflowId, schedule, timezone);
        }

        @Override
        public String registrationKey() {
            return schedule;
        }

        public String effectiveTimezone() {
            return timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
        }
    }

    /**
     * Watches {@code path} recursively. An empty or missing {@code events} set
     * subscribes to every {@link FileEventKind}; {@code pattern} is an optional glob
     * applied to the file name.
     */
    record FileWatch(String workflowId, String path, String pattern, Set<FileEventKind> events)
            implements EventTrigger {

        public FileWatch {
            events = events == null || events.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.allOf(FileEventKind.class))
                    : Collections.unmodifiableSet(EnumSet.copyOf(events));
        }

        @Override
        public TriggerKind kind() {
            return TriggerKind.FILE_WATCH;
        }

        @Override
        public FileWatch forWorkflow(String workflowId) {
            return new FileWatch(workflowId, path, pattern, events);
        }

        @Override
        public String registrationKey() {
            return path;
        }

        public boolean accepts(FileEventKind kind) {
            return events.contains(kind);
        }
    }

    record Webhook(String workflowId, String endpoint, String method, Map<String, String> headers,
                   WebhookAuthentication authentication) implements EventTrigger {

        public Webhook {
            method = method == null || method.isBlank() ? "POST" : method.toUpperCase(Locale.ROOT);
            headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        }

        @Override
        public TriggerKind kind() {
            return TriggerKind.WEBHOOK;
        }

        @Override
        public Webhook forWorkflow(String workflowId) {
            return new Webhook(workflowId, endpoint, method, headers, authentication);
        }

        @Override
        public String registrationKey() {
            return method + " " + endpoint;
        }
    }

    record Api(String workflowId, String endpoint, String method) implements EventTrigger {

        public Api {
            method = method == null || method.isBlank() ? "POST" : method.toUpperCase(Locale.ROOT);
        }

        @Override
        public TriggerKind kind() {
            return TriggerKind.API;
        }

        @Override
        public Api forWorkflow(String workflowId) {
            return new Api(workflowId, endpoint, method);
        }

        @Override
        public String registrationKey() {
            return method + " " + endpoint;
        }
    }
}
