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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical, immutable notification produced by a trigger adapter.
 *
 * <p>{@code data} is the trigger-specific payload handed to the root agent.
 * {@code metadata} carries the owning {@code workflowId} whenever the originating
 * trigger is bound to a workflow.
 *
 * @param id        globally unique identifier, prefixed by the trigger kind
 * @param type      the trigger kind that produced the event
 * @param source    human-readable origin tag, e.g. {@code cron:0 * * * *}
 * @param timestamp creation time
 * @param data      trigger-specific payload
 * @param metadata  string-keyed auxiliary information
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record Event(
        String id,
        TriggerKind type,
        String source,
        Instant timestamp,
        Object data,
        Map<String, Object> metadata) {

    public static final String WORKFLOW_ID = "workflowId";

    public Event {
        Objects.requireNonNull(id, "Event id cannot be null");
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(source, "Event source cannot be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Creates an event with a freshly generated identifier and the current time.
     */
    public static Event create(TriggerKind type, String source, Object data, Map<String, Object> metadata) {
        return new Event(newId(type), type, source, Instant.now(), data, metadata);
    }

    /**
     * Generates a unique event identifier for the given kind.
     */
    public static String newId(TriggerKind type) {
        return type.idPrefix() + "_" + UUID.randomUUID();
    }

    /**
     * Returns the workflow this event is bound to, if any.
     */
    public Optional<String> workflowId() {
        Object value = metadata.get(WORKFLOW_ID);
        return value instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }
}
