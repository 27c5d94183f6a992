package dev.mars.arbiter.events.watch;

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

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Filesystem watching capability used by the file-watch trigger adapter.
 */
public interface FileWatchService {

    /**
     * Starts watching {@code root} (recursively when it is a directory).
     *
     * @param listener receives every change; called from a watcher thread
     * @throws IOException when the path cannot be watched
     */
    FileWatch watch(Path root, Consumer<FileChange> listener) throws IOException;
}
