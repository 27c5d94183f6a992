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

import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.ErrorCode;
import dev.mars.arbiter.core.exceptions.StorageException;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.core.exceptions.WorkflowNotFoundException;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorTranslator Tests")
class ErrorTranslatorTest {

    private final ErrorTranslator development = new ErrorTranslator(false);
    private final ErrorTranslator production = new ErrorTranslator(true);

    @Nested
    @DisplayName("Client errors")
    class ClientErrorTests {

        @Test
        @DisplayName("Unknown workflow should map to a 404 with its message")
        void notFound() {
            ErrorResponse response = production.translate(new WorkflowNotFoundException("wf-9"), "req-1");

            assertEquals("WORKFLOW_NOT_FOUND", response.code());
            assertEquals(404, response.status());
            assertEquals("Workflow 'wf-9' not found", response.message());
            assertEquals("req-1", response.requestId());
            assertTrue(response.isClientError());
        }

        @Test
        @DisplayName("Trigger configuration error should keep its code")
        void triggerConfiguration() {
            ErrorResponse response = production.translate(
                    new TriggerConfigurationException(TriggerKind.CRON, "bad schedule"));

            assertEquals(ErrorCode.TRIGGER_CONFIGURATION_INVALID.code(), response.code());
            assertEquals(400, response.status());
            assertTrue(response.message().contains("bad schedule"));
            assertTrue(response.requestId().startsWith("req-"));
        }

        @Test
        @DisplayName("Illegal argument should map to a validation error")
        void illegalArgument() {
            ErrorResponse response = production.translate(new IllegalArgumentException("limit must be positive"));

            assertEquals("VALIDATION_ERROR", response.code());
            assertEquals(400, response.status());
            assertEquals("limit must be positive", response.message());
        }

        @Test
        @DisplayName("Wrapped failure should be unwrapped first")
        void unwrapsCompletionException() {
            ErrorResponse response = development.translate(
                    new CompletionException(new WorkflowNotFoundException("wf-1")));

            assertEquals(404, response.status());
        }
    }

    @Nested
    @DisplayName("Internal errors")
    class InternalErrorTests {

        @Test
        @DisplayName("Production should hide internal details")
        void productionHidesDetails() {
            ErrorResponse response = production.translate(new NullPointerException("secret.path was null"));

            assertEquals("INTERNAL_ERROR", response.code());
            assertEquals(500, response.status());
            assertEquals(ErrorTranslator.GENERIC_MESSAGE, response.message());
        }

        @Test
        @DisplayName("Production should hide storage failure details")
        void productionHidesStorageFailure() {
            ErrorResponse response = production.translate(
                    new StorageException("write /var/lib/arbiter/wf-1.json", new IOException("disk full")));

            assertEquals("STORAGE_FAILED", response.code());
            assertEquals(ErrorTranslator.GENERIC_MESSAGE, response.message());
        }

        @Test
        @DisplayName("Development should show the failure")
        void developmentShowsDetails() {
            ErrorResponse response = development.translate(new IllegalStateException("engine stalled"));

            assertEquals(500, response.status());
            assertEquals("IllegalStateException: engine stalled", response.message());
        }

        @Test
        @DisplayName("Missing failure should produce a generic internal error")
        void nullFailure() {
            ErrorResponse response = development.translate(null);

            assertEquals("INTERNAL_ERROR", response.code());
            assertEquals(ErrorTranslator.GENERIC_MESSAGE, response.message());
        }
    }

    @Test
    @DisplayName("JSON form should carry every field under 'error'")
    void toJson() {
        JsonObject json = ErrorResponse.of(ErrorCode.EXECUTION_NOT_FOUND, "exec-1").toJson();

        JsonObject error = json.getJsonObject("error");
        assertEquals("EXECUTION_NOT_FOUND", error.getString("code"));
        assertEquals(404, error.getInteger("status"));
        assertEquals("Workflow execution 'exec-1' not found", error.getString("message"));
        assertNotNull(error.getString("timestamp"));
        assertNotNull(error.getString("requestId"));
    }
}
