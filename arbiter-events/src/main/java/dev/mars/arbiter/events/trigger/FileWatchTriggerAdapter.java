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

import dev.mars.arbiter.core.Event;
import dev.mars.arbiter.core.EventTrigger;
import dev.mars.arbiter.core.FileEventKind;
import dev.mars.arbiter.core.TriggerKind;
import dev.mars.arbiter.core.exceptions.TriggerConfigurationException;
import dev.mars.arbiter.events.EventHandler;
import dev.mars.arbiter.events.watch.FileChange;
import dev.mars.arbiter.events.watch.FileWatch;
import dev.mars.arbiter.events.watch.FileWatchService;
import io.vertx.core.Vertx;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires workflows when files under a watched path change.
 *
 * <p>Notifications for the same file arriving within the debounce window are
 * coalesced into one event; a modification following a creation is reported as
 * the creation. Hidden entries (any path segment starting with {@code .}) and names
 * not matching the optional glob are ignored. The configured event kinds are
 * applied to the coalesced change.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public class FileWatchTriggerAdapter extends AbstractTriggerAdapter<FileWatchTriggerAdapter.WatchRegistration> {

    public static final long DEFAULT_DEBOUNCE_MS = 100;

    private final Vertx vertx;
    private final FileWatchService watchService;
    private final long debounceMs;

    record PendingChange(FileEventKind kind, long timerId) {
    }

    record WatchRegistration(String id, EventTrigger trigger, EventHandler handler, Path root,
                             PathMatcher matcher, AtomicReference<FileWatch> watch,
                             Map<Path, PendingChange> pending, Vertx vertx) implements Registration {

        @Override
        public void release() {
            FileWatch active = watch.getAndSet(null);
            if (active != null) {
                active.close();
            }
            pending.values().forEach(p -> vertx.cancelTimer(p.timerId()));
            pending.clear();
        }

        EventTrigger.FileWatch config() {
            return (EventTrigger.FileWatch) trigger;
        }
    }

    public FileWatchTriggerAdapter(Vertx vertx, FileWatchService watchService, long debounceMs) {
        this.vertx = vertx;
        this.watchService = watchService;
        this.debounceMs = Math.max(0, debounceMs);
    }

    public FileWatchTriggerAdapter(Vertx vertx, FileWatchService watchService) {
        this(vertx, watchService, DEFAULT_DEBOUNCE_MS);
    }

    @Override
    public Set<TriggerKind> kinds() {
        return Set.of(TriggerKind.FILE_WATCH);
    }

    @Override
    protected String idPrefix() {
        return "watcher";
    }

    @Override
    protected WatchRegistration createRegistration(String registrationId, EventTrigger trigger, EventHandler handler)
            throws TriggerConfigurationException {
        requireWorkflow(trigger);
        EventTrigger.FileWatch config = (EventTrigger.FileWatch) trigger;
        if (config.path() == null || config.path().isBlank()) {
            throw new TriggerConfigurationException(TriggerKind.FILE_WATCH, "path is required");
        }
        Path root;
        try {
            root = Path.of(config.path()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new TriggerConfigurationException(TriggerKind.FILE_WATCH, "invalid path '" + config.path() + "'", e);
        }
        if (!Files.exists(root)) {
            throw new TriggerConfigurationException(TriggerKind.FILE_WATCH, "path does not exist: " + root);
        }
        PathMatcher matcher = null;
        if (config.pattern() != null && !config.pattern().isBlank()) {
            try {
                matcher = FileSystems.getDefault().getPathMatcher("glob:" + config.pattern());
            } catch (IllegalArgumentException e) {
                throw new TriggerConfigurationException(TriggerKind.FILE_WATCH,
                        "invalid pattern '" + config.pattern() + "'", e);
            }
        }

        WatchRegistration registration = new WatchRegistration(registrationId, trigger, handler, root, matcher,
                new AtomicReference<>(), new ConcurrentHashMap<>(), vertx);
        try {
            registration.watch().set(watchService.watch(root, change -> onChange(registration, change)));
        } catch (IOException e) {
            throw new TriggerConfigurationException(TriggerKind.FILE_WATCH,
                    "cannot watch " + root + ": " + e.getMessage(), e);
        }
        return registration;
    }

    private void onChange(WatchRegistration registration, FileChange change) {
        if (registration.watch().get() == null || ignored(registration, change.path())) {
            return;
        }
        if (debounceMs == 0) {
            emit(registration, change.kind(), change.path());
            return;
        }
        registration.pending().compute(change.path(), (path, previous) -> {
            FileEventKind kind = change.kind();
            if (previous != null) {
                vertx.cancelTimer(previous.timerId());
                if (previous.kind() == FileEventKind.CREATED && kind == FileEventKind.MODIFIED) {
                    kind = FileEventKind.CREATED;
                }
            }
            FileEventKind settled = kind;
            long timerId = vertx.setTimer(debounceMs, id -> {
                if (registration.pending().remove(path, new PendingChange(settled, id))) {
                    emit(registration, settled, path);
                }
            });
            return new PendingChange(kind, timerId);
        });
    }

    private boolean ignored(WatchRegistration registration, Path path) {
        Path relative = registration.root().equals(path) ? path.getFileName() : registration.root().relativize(path);
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return registration.matcher() != null && !registration.matcher().matches(path.getFileName());
    }

    private void emit(WatchRegistration registration, FileEventKind kind, Path path) {
        if (!registration.config().accepts(kind)) {
            logger.debug("Ignoring {} of {} for watcher {}", kind.wireName(), path, registration.id());
            return;
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("eventType", kind.wireName());
        data.put("filePath", path.toString());
        data.put("fileName", fileName);
        data.put("fileExtension", dot > 0 ? fileName.substring(dot) : "");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("watcherId", registration.id());
        metadata.put("eventType", kind.wireName());
        metadata.put("filePath", path.toString());
        metadata.put(Event.WORKFLOW_ID, registration.trigger().workflowId());

        fire(registration, Event.create(TriggerKind.FILE_WATCH,
                "file-watch:" + registration.config().path(), data, metadata));
    }
}
