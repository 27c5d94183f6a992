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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authentication requirement attached to a webhook trigger.
 *
 * <p>Expected settings per scheme:
 * <ul>
 *   <li>{@code bearer}: {@code token}</li>
 *   <li>{@code basic}: {@code username}, {@code password}</li>
 *   <li>{@code api_key}: {@code key}, optionally {@code header} (default {@code X-API-Key})</li>
 * </ul>
 */
public record WebhookAuthentication(Scheme type, Map<String, String> config) {

    public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    public enum Scheme {
        BEARER("bearer"),
        BASIC("basic"),
        API_KEY("api_key");

        private final String wireName;

        Scheme(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Scheme fromWireName(String value) {
            for (Scheme scheme : values()) {
                if (scheme.wireName.equalsIgnoreCase(value) || scheme.name().equalsIgnoreCase(value)) {
                    return scheme;
                }
            }
            throw new IllegalArgumentException("Unknown authentication scheme: " + value);
        }
    }

    public WebhookAuthentication {
        Objects.requireNonNull(type, "Authentication type cannot be null");
        config = config != null ? Map.copyOf(config) : Map.of();
    }

    public static WebhookAuthentication bearer(String token) {
        return new WebhookAuthentication(Scheme.BEARER, Map.of("token", token));
    }

    public static WebhookAuthentication basic(String username, String password) {
        return new WebhookAuthentication(Scheme.BASIC, Map.of("username", username, "password", password));
    }

    public static WebhookAuthentication apiKey(String header, String key) {
        return new WebhookAuthentication(Scheme.API_KEY, Map.of("header", header, "key", key));
    }

    /**
     * Lists the settings this scheme requires but that are missing or blank.
     */
    public List<String> missingSettings() {
        List<String> required = switch (type) {
            case BEARER -> List.of("token");
            case BASIC -> List.of("username", "password");
            case API_KEY -> List.of("key");
        };
        List<String> missing = new ArrayList<>();
        for (String key : required) {
            String value = config.get(key);
            if (value == null || value.isBlank()) {
                missing.add(key);
            }
        }
        return missing;
    }
}
