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

import dev.mars.arbiter.core.FileEventKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NioFileWatchService Tests")
class NioFileWatchServiceTest {

    @TempDir
    Path root;

    private final NioFileWatchService service = new NioFileWatchService();
    private final List<FileChange> changes = new CopyOnWriteArrayList<>();
    private FileWatch watch;

    @AfterEach
    void tearDown() {
        if (watch != null) {
            watch.close();
        }
    }

    private boolean seen(FileEventKind kind, Path path) {
        return changes.stream().anyMatch(c -> c.kind() == kind && c.path().equals(path));
    }

    @Test
    @DisplayName("Should report a created file")
    void reportsCreatedFile() throws IOException {
        Path dir = root.toAbsolutePath().normalize();
        watch = service.watch(dir, changes::add);

        Path file = Files.writeString(dir.resolve("input.txt"), "hello");

        await().atMost(Duration.ofSeconds(15)).until(() -> seen(FileEventKind.CREATED, file));
    }

    @Test
    @DisplayName("Should watch directories created after the watch started")
    void watchesNewSubdirectories() throws IOException {
        Path dir = root.toAbsolutePath().normalize();
        watch = service.watch(dir, changes::add);

        Path nested = Files.createDirectory(dir.resolve("incoming"));
        await().atMost(Duration.ofSeconds(15)).until(() -> seen(FileEventKind.CREATED, nested));

        Path file = Files.writeString(nested.resolve("order.json"), "{}");
        await().atMost(Duration.ofSeconds(15)).until(() -> changes.stream()
                .anyMatch(c -> c.path().equals(file)));
    }

    @Test
    @DisplayName("Should reject a path that does not exist")
    void rejectsMissingPath() {
        assertThrows(IOException.class, () -> service.watch(root.resolve("missing"), changes::add));
    }

    @Test
    @DisplayName("Close should be idempotent")
    void closeIsIdempotent() throws IOException {
        watch = service.watch(root, changes::add);
        watch.close();
        assertDoesNotThrow(watch::close);
    }
}
