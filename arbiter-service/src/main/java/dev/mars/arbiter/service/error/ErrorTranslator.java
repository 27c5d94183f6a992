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

import dev.mars.arbiter.config.ArbiterConfig;
import dev.mars.arbiter.core.exceptions.ArbiterException;
import dev.mars.arbiter.core.exceptions.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps failures to {@link ErrorResponse}s.
 *
 * <p>{@link ArbiterException}s keep their own code. Argument errors become
 * {@link ErrorCode#VALIDATION_ERROR}; anything else is an
 * {@link ErrorCode#INTERNAL_ERROR}. In production mode the message of a 500
 * response is replaced by a generic one; the full failure is always logged.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class ErrorTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ErrorTranslator.class);

    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    private final boolean production;

    public ErrorTranslator(boolean production) {
        this.production = production;
    }

    public static ErrorTranslator forConfig(ArbiterConfig config) {
        return new ErrorTranslator(config.isProduction());
    }

    public boolean isProduction() {
        return production;
    }

    public ErrorResponse translate(Throwable failure) {
        return translate(failure, null);
    }

    public ErrorResponse translate(Throwable failure, String requestId) {
        Throwable cause = unwrap(failure);
        if (cause == null) {
            return ErrorResponse.withMessage(ErrorCode.INTERNAL_ERROR, GENERIC_MESSAGE, requestId);
        }

        ErrorCode code;
        if (cause instanceof ArbiterException arbiterException) {
            code = arbiterException.getErrorCode() != null ? arbiterException.getErrorCode() : ErrorCode.INTERNAL_ERROR;
        } else if (cause instanceof IllegalArgumentException) {
            code = ErrorCode.VALIDATION_ERROR;
        } else {
            code = ErrorCode.INTERNAL_ERROR;
        }
        logError(code, cause);

        String message;
        if (code.httpStatus() == 500 && production) {
            message = GENERIC_MESSAGE;
        } else if (code == ErrorCode.INTERNAL_ERROR && !(cause instanceof ArbiterException)) {
            message = describe(cause);
        } else if (cause.getMessage() != null) {
            message = cause.getMessage();
        } else {
            message = code.formatMessage("unknown");
        }
        return ErrorResponse.withMessage(code, message, requestId);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null
            ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
            : cause.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void logError(ErrorCode code, Throwable failure) {
        if (code.httpStatus() >= 500) {
            logger.error("Server error [{}]: {}", code.code(), failure.getMessage(), failure);
        } else {
            logger.warn("Client error [{}]: {}", code.code(), failure.getMessage());
        }
    }
}
