package dev.mars.arbiter.core.exceptions;

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

/**
 * Thrown by a trigger adapter when a registration is rejected.
 * Nothing is registered when this is raised.
 */
public class TriggerConfigurationException extends ArbiterException {

    private final TriggerKind kind;

    public TriggerConfigurationException(TriggerKind kind, String message) {
        super(ErrorCode.TRIGGER_CONFIGURATION_INVALID,
                ErrorCode.TRIGGER_CONFIGURATION_INVALID.formatMessage(kind.wireName() + ": " + message));
        this.kind = kind;
    }

    public TriggerConfigurationException(TriggerKind kind, String message, Throwable cause) {
        super(ErrorCode.TRIGGER_CONFIGURATION_INVALID,
                ErrorCode.TRIGGER_CONFIGURATION_INVALID.formatMessage(kind.wireName() + ": " + message), cause);
        this.kind = kind;
    }

    public TriggerKind getKind() {
        return kind;
    }
}
