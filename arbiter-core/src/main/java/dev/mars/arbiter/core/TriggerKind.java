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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of external signal that can start a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum TriggerKind {

    MANUAL("manual", "manual"),
    CRON("cron", "cron"),
    FILE_WATCH("file-watch", "file"),
    WEBHOOK("webhook", "webhook"),
    API("api", "api");

    private final String wireName;
    private final String idPrefix;

    TriggerKind(String wireName, String idPrefix) {
        this.wireName = wireName;
        this.idPrefix = idPrefix;
    }

    /**
     * Returns the external name used in JSON and log output.
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the prefix used for event identifiers of this kind.
     */
    public String idPrefix() {
        return idPrefix;
    }

    @JsonCreator
    public static TriggerKind fromWireName(String value) {
        for (TriggerKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown trigger kind: " + value);
    }
}
