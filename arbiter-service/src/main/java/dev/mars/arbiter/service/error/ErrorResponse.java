package dev.mars.arbiter.service.error;

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

import dev.mars.arbiter.core.exceptions.ErrorCode;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Client-facing description of a failure.
 *
 * @param code      stable error code, see {@link ErrorCode}
 * @param status    HTTP-equivalent status
 * @param message   message safe to show to the caller
 * @param timestamp when the response was produced
 * @param requestId correlation id for matching the server-side log entry
 */
public record ErrorResponse(
    String code,
    int status,
    String message,
    Instant timestamp,
    String requestId
) {
    /**
     * Creates an ErrorResponse with an explicit message.
     */
    public static ErrorResponse withMessage(ErrorCode code, String message, String requestId) {
        return new ErrorResponse(
            code.code(),
            code.httpStatus(),
            message,
            Instant.now(),
            requestId != null ? requestId : generateRequestId()
        );
    }

    /**
     * Creates an ErrorResponse with a formatted message from ErrorCode's template.
     */
    public static ErrorResponse of(ErrorCode code, Object... messageArgs) {
        return withMessage(code, code.formatMessage(messageArgs), null);
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("error", new JsonObject()
                .put("code", code)
                .put("status", status)
                .put("message", message)
                .put("timestamp", timestamp.toString())
                .put("requestId", requestId));
    }

    static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
