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
import dev.mars.arbiter.core.WebhookAuthentication;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventHandler;
import io.vertx.core.Future;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Serves {@link TriggerKind#WEBHOOK} and {@link TriggerKind#API} triggers.
 *
 * <p>The HTTP surface lives outside this module; it hands each inbound call to
 * {@link #handleRequest(WebhookRequest)}, which matches endpoint and method,
 * checks the configured headers and authentication, and fires the workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class WebhookTriggerAdapter extends AbstractTriggerAdapter<WebhookTriggerAdapter.WebhookRegistration> {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    record WebhookRegistration(String id, EventTrigger trigger, EventHandler handler, String endpoint,
                               String method, Map<String, String> headers, WebhookAuthentication authentication)
            implements Registration {
    }

    @Override
    public Set<TriggerKind> kinds() {
        return Set.of(TriggerKind.WEBHOOK, TriggerKind.API);
    }

    @Override
    protected String idPrefix() {
        return "webhook";
    }

    @Override
    protected WebhookRegistration createRegistration(String registrationId, EventTrigger trigger,
                                                     EventHandler handler) throws TriggerConfigurationException {
        requireWorkflow(trigger);
        String endpoint;
        String method;
        Map<String, String> headers = Map.of();
        WebhookAuthentication authentication = null;
        if (trigger instanceof EventTrigger.Webhook webhook) {
            endpoint = webhook.endpoint();
            method = webhook.method();
            headers = webhook.headers();
            authentication = webhook.authentication();
        } else if (trigger instanceof EventTrigger.Api api) {
            endpoint = api.endpoint();
            method = api.method();
        } else {
            throw new TriggerConfigurationException(trigger.kind(), "unsupported trigger");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new TriggerConfigurationException(trigger.kind(), "endpoint is required");
        }
        if (!METHODS.contains(method)) {
            throw new TriggerConfigurationException(trigger.kind(), "unsupported HTTP method " + method);
        }
        if (authentication != null && !authentication.missingSettings().isEmpty()) {
            throw new TriggerConfigurationException(trigger.kind(),
                    authentication.type().wireName() + " authentication is missing " + authentication.missingSettings());
        }
        return new WebhookRegistration(registrationId, trigger, handler, endpoint, method, headers, authentication);
    }

    /**
     * Processes an inbound call. The returned future always succeeds; failures are
     * reported through {@link WebhookResult#status()}.
     */
    public Future<WebhookResult> handleRequest(WebhookRequest request) {
        WebhookRegistration registration = find(request);
        if (registration == null) {
            logger.warn("No webhook registered for {} {}", request.method(), request.endpoint());
            return Future.succeededFuture(WebhookResult.notFound());
        }
        if (!headersMatch(registration, request)) {
            logger.warn("Webhook {} rejected request with invalid headers", registration.id());
            return Future.succeededFuture(WebhookResult.rejected(registration.id(), "Invalid headers"));
        }
        if (!authenticated(registration.authentication(), request)) {
            logger.warn("Webhook {} rejected unauthenticated request", registration.id());
            return Future.succeededFuture(WebhookResult.unauthorized(registration.id()));
        }

        TriggerKind kind = registration.trigger().kind();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("webhookId", registration.id());
        metadata.put("endpoint", registration.endpoint());
        metadata.put("method", registration.method());
        metadata.put("headers", redact(request.headers(), registration.authentication()));
        metadata.put(Event.WORKFLOW_ID, registration.trigger().workflowId());
        Event event = Event.create(kind, kind.wireName() + ":" + registration.endpoint(),
                request.body() != null ? request.body() : Map.of(), metadata);

        return dispatch(registration, event)
                .map(result -> WebhookResult.accepted(registration.id(), result))
                .otherwise(err -> {
                    logger.error("Webhook {} failed processing event {} for workflow {}: {}",
                            registration.id(), event.id(), registration.trigger().workflowId(), err.getMessage(), err);
                    return WebhookResult.failed(registration.id());
                });
    }

    private WebhookRegistration find(WebhookRequest request) {
        for (WebhookRegistration registration : registrations.snapshot()) {
            if (registration.endpoint().equals(request.endpoint())
                    && registration.method().equalsIgnoreCase(request.method())) {
                return registration;
            }
        }
        return null;
    }

    private static boolean headersMatch(WebhookRegistration registration, WebhookRequest request) {
        for (Map.Entry<String, String> expected : registration.headers().entrySet()) {
            String actual = request.header(expected.getKey()).orElse(null);
            if (!expected.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }

    private static boolean authenticated(WebhookAuthentication authentication, WebhookRequest request) {
        if (authentication == null) {
            return true;
        }
        Map<String, String> config = authentication.config();
        return switch (authentication.type()) {
            case BEARER -> constantTimeEquals("Bearer " + config.get("token"),
                    request.header("Authorization").orElse(null));
            case BASIC -> constantTimeEquals("Basic " + Base64.getEncoder().encodeToString(
                            (config.get("username") + ":" + config.get("password")).getBytes(StandardCharsets.UTF_8)),
                    request.header("Authorization").orElse(null));
            case API_KEY -> constantTimeEquals(config.get("key"),
                    request.header(apiKeyHeader(authentication)).orElse(null));
        };
    }

    private static Map<String, String> redact(Map<String, String> headers, WebhookAuthentication authentication) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.computeIfPresent("Authorization", (k, v) -> "***");
        if (authentication != null && authentication.type() == WebhookAuthentication.Scheme.API_KEY) {
            copy.computeIfPresent(apiKeyHeader(authentication), (k, v) -> "***");
        }
        return new LinkedHashMap<>(copy);
    }

    private static String apiKeyHeader(WebhookAuthentication authentication) {
        return authentication.config().getOrDefault("header", WebhookAuthentication.DEFAULT_API_KEY_HEADER);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
