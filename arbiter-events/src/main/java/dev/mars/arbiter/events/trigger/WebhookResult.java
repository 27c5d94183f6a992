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

import dev.mars.arbiter.events.EventProcessingResult;

/**
 * Answer to a {@link WebhookRequest}. Never carries an exception; failures are
 * described by {@link Status}.
 */
public record WebhookResult(Status status, String message, String webhookId, EventProcessingResult result) {

    public enum Status {
        ACCEPTED(200),
        REJECTED(400),
        UNAUTHORIZED(401),
        NOT_FOUND(404),
        FAILED(500);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    public static WebhookResult accepted(String webhookId, EventProcessingResult result) {
        return new WebhookResult(Status.ACCEPTED, "Webhook processed", webhookId, result);
    }

    public static WebhookResult notFound() {
        return new WebhookResult(Status.NOT_FOUND, "Webhook not found", null, null);
    }

    public static WebhookResult rejected(String webhookId, String message) {
        return new WebhookResult(Status.REJECTED, message, webhookId, null);
    }

    public static WebhookResult unauthorized(String webhookId) {
        return new WebhookResult(Status.UNAUTHORIZED, "Authentication failed", webhookId, null);
    }

    public static WebhookResult failed(String webhookId) {
        return new WebhookResult(Status.FAILED, "Processing failed", webhookId, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
