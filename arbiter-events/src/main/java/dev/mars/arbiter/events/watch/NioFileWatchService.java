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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link FileWatchService} built on the JDK {@link WatchService}.
 *
 * <p>Directories are watched recursively: every existing subdirectory is registered
 * up front and directories created later are registered as they appear (and reported
 * as {@link FileEventKind#CREATED}). Watching a single file watches its parent and
 * filters to that file. Each watch owns one daemon polling thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class NioFileWatchService implements FileWatchService {

    private static final Logger logger = LoggerFactory.getLogger(NioFileWatchService.class);

    @Override
    public FileWatch watch(Path root, Consumer<FileChange> listener) throws IOException {
        Path target = root.toAbsolutePath().normalize();
        if (!Files.exists(target)) {
            throw new IOException("Path does not exist: " + target);
        }
        NioWatch watch = new NioWatch(target, listener);
        watch.begin();
        return watch;
    }

    private static final class NioWatch implements FileWatch {
        private final Path target;
        private final boolean singleFile;
        private final Consumer<FileChange> listener;
        private final WatchService watchService;
        private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        NioWatch(Path target, Consumer<FileChange> listener) throws IOException {
            this.target = target;
            this.singleFile = !Files.isDirectory(target);
            this.listener = listener;
            this.watchService = FileSystems.getDefault().newWatchService();
        }

        void begin() throws IOException {
            try {
                if (singleFile) {
                    registerDirectory(target.getParent());
                } else {
                    registerTree(target);
                }
            } catch (IOException e) {
                watchService.close();
                throw e;
            }
            Thread thread = new Thread(this::poll, "arbiter-file-watch-" + target.getFileName());
            thread.setDaemon(true);
            thread.start();
            logger.debug("Watching {} ({} director{})", target, directories.size(),
                    directories.size() == 1 ? "y" : "ies");
        }

        private void registerTree(Path start) throws IOException {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    registerDirectory(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        private void registerDirectory(Path dir) throws IOException {
            WatchKey key = dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            directories.put(key, dir);
        }

        private void poll() {
            while (!closed.get()) {
                WatchKey key;
                try {
                    key = watchService.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ClosedWatchServiceException e) {
                    return;
                }
                Path dir = directories.get(key);
                if (dir != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        handle(dir, event);
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        }

        private void handle(Path dir, WatchEvent<?> event) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                logger.warn("File watch on {} overflowed, some changes were lost", target);
                return;
            }
            Path path = dir.resolve((Path) event.context());
            if (singleFile && !path.equals(target)) {
                return;
            }
            FileEventKind kind;
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                kind = FileEventKind.CREATED;
                if (!singleFile && Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                    try {
                        registerTree(path);
                    } catch (IOException e) {
                        logger.warn("Could not watch new directory {}: {}", path, e.getMessage());
                    }
                }
            } else if (event.kind() == StandardWatchEventKinds.ENTRY_MODIFY) {
                if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                    return;
                }
                kind = FileEventKind.MODIFIED;
            } else {
                kind = FileEventKind.DELETED;
            }
            try {
                listener.accept(new FileChange(kind, path));
            } catch (RuntimeException e) {
                logger.error("File watch listener failed for {}: {}", path, e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("Error closing watch service for {}: {}", target, e.getMessage());
            }
            logger.debug("Stopped watching {}", target);
        }
    }
}
