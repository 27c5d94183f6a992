package dev.mars.arbiter.storage;

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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Factory for creating opened {@link WorkflowStore} instances from a storage location.
 *
 * <ul>
 *   <li><b>memory</b> - {@link InMemoryWorkflowStore}, not durable</li>
 *   <li>anything else - treated as a directory for {@link FileWorkflowStore}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class WorkflowStoreFactory {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowStoreFactory.class);

    public static final String MEMORY = "memory";

    private WorkflowStoreFactory() {
        // Utility class
    }

    public static Future<WorkflowStore> create(Vertx vertx, String location) {
        if (location == null || location.isBlank() || MEMORY.equalsIgnoreCase(location.trim())) {
            LOG.warn("Using InMemoryWorkflowStore - DATA WILL NOT SURVIVE RESTART!");
            InMemoryWorkflowStore store = new InMemoryWorkflowStore();
            return store.open().map(v -> (WorkflowStore) store);
        }
        Path path = Path.of(location.trim());
        LOG.info("Creating FileWorkflowStore: path={}", path);
        FileWorkflowStore store = new FileWorkflowStore(vertx, path);
        return store.open().map(v -> (WorkflowStore) store);
    }
}
