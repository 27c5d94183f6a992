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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registrations of one adapter, keyed by registration id.
 *
 * <p>Mutations run under a lock and publish a fresh immutable map. Firing code reads
 * {@link #snapshot()} and never holds the lock while a handler runs.
 *
 * @param <R> the adapter's registration type
 */
public final class RegistrationTable<R extends Registration> {

    private final Object lock = new Object();
    private volatile Map<String, R> entries = Map.of();

    public void add(R registration) {
        synchronized (lock) {
            Map<String, R> next = new LinkedHashMap<>(entries);
            next.put(registration.id(), registration);
            entries = Collections.unmodifiableMap(next);
        }
    }

    /**
     * Removes the oldest registration matching the trigger's workflow and key.
     */
    public Optional<R> removeMatching(EventTrigger trigger) {
        synchronized (lock) {
            for (R registration : entries.values()) {
                if (registration.matches(trigger)) {
                    Map<String, R> next = new LinkedHashMap<>(entries);
                    next.remove(registration.id());
                    entries = Collections.unmodifiableMap(next);
                    return Optional.of(registration);
                }
            }
            return Optional.empty();
        }
    }

    public List<R> removeAll() {
        synchronized (lock) {
            List<R> removed = new ArrayList<>(entries.values());
            entries = Map.of();
            return removed;
        }
    }

    public Optional<R> get(String registrationId) {
        return Optional.ofNullable(entries.get(registrationId));
    }

    public Collection<R> snapshot() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
