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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for ExecutionStatus transition validation.
 */
class ExecutionStatusTransitionTest {

    private static EnumSet<ExecutionStatus> validTargets(ExecutionStatus from) {
        return switch (from) {
            case PENDING -> EnumSet.of(ExecutionStatus.RUNNING, ExecutionStatus.CANCELLED);
            case RUNNING -> EnumSet.of(ExecutionStatus.COMPLETED, ExecutionStatus.FAILED, ExecutionStatus.CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }

    static Stream<Arguments> allStatusPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ExecutionStatus from : ExecutionStatus.values()) {
            Set<ExecutionStatus> valid = validTargets(from);
            for (ExecutionStatus to : ExecutionStatus.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} -> {1} should be {2}")
    @MethodSource("allStatusPairs")
    void canTransitionTo_coversAllPairs(ExecutionStatus from, ExecutionStatus to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @EnumSource(ExecutionStatus.class)
    void getValidTransitions_matchesCanTransitionTo(ExecutionStatus from) {
        Set<ExecutionStatus> fromMethod = EnumSet.noneOf(ExecutionStatus.class);
        fromMethod.addAll(Arrays.asList(from.getValidTransitions()));
        assertEquals(validTargets(from), fromMethod);
    }

    @Test
    void terminalStatuses_haveNoTransitions() {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            assertEquals(status.isTerminal(), status.getValidTransitions().length == 0, status.name());
        }
    }
}
