package de.mirkosertic.doctree.watcher;

import de.mirkosertic.doctree.LiveIndex;
import de.mirkosertic.doctree.config.ApplicationConfig;
import de.mirkosertic.doctree.store.RecordReader;
import de.mirkosertic.doctree.store.WatchSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a {@link LiveIndex} in sync with the store directory.
 * <p>
 * The watch thread only classifies each changed path into an identifier and queues it. A
 * scheduled loop drains the queue every debounce interval into a {@link PendingChangeSet} and
 * applies it: deletions first, then one re-read per updated identifier. Many events for the
 * same item within one interval therefore cost a single read.
 * <p>
 * Because deletions run before updates, a delete followed by an update in the same interval
 * leaves the item in the index (as long as it can still be read).
 */
public class ChangeWatcher implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(ChangeWatcher.class);

    private final LiveIndex index;
    private final DirectoryWatcherService watcherService;
    private final long debounceMs;

    private final ConcurrentLinkedQueue<ChangeEvent> pendingEvents = new ConcurrentLinkedQueue<>();
    private final PendingChangeSet pendingChanges = new PendingChangeSet();
    private final AtomicBoolean rebuildRequested = new AtomicBoolean(false);
    private final Object flushLock = new Object();
    private final ScheduledExecutorService flushScheduler =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "watch-debounce");
                t.setDaemon(true);
                return t;
            });

    private volatile ScheduledFuture<?> flushTask;
    private volatile WatchState state = WatchState.IDLE;

    public ChangeWatcher(final ApplicationConfig config, final LiveIndex index,
                         final DirectoryWatcherService watcherService) {
        this(index, watcherService, config.getWatchDebounceMs());
    }

    public ChangeWatcher(final LiveIndex index, final DirectoryWatcherService watcherService, final long debounceMs) {
        this.index = index;
        this.watcherService = watcherService;
        this.debounceMs = debounceMs;
    }

    /**
     * Subscribe to change notifications below the store directory and start the flush loop.
     *
     * @throws WatchSetupException if the directory cannot be watched; the watcher stays idle
     */
    public synchronized void start() throws WatchSetupException {
        if (state != WatchState.IDLE) {
            logger.warn("Change watcher cannot start, it is {}", state);
            return;
        }

        final Path baseDirectory = index.getBaseDirectory();
        try {
            watcherService.watchDirectory(baseDirectory, this);
        } catch (final IOException e) {
            throw new WatchSetupException("Cannot watch " + baseDirectory, e);
        }

        flushTask = flushScheduler.scheduleAtFixedRate(this::flushSafely, debounceMs, debounceMs, TimeUnit.MILLISECONDS);
        state = WatchState.WATCHING;
        logger.info("Watching {} with {}ms debounce", baseDirectory, debounceMs);
    }

    /**
     * Stop watching and terminate the flush loop. Queued events that were not flushed yet are dropped.
     */
    public synchronized void stop() {
        if (state == WatchState.STOPPED) {
            return;
        }
        logger.info("Stopping change watcher");

        final ScheduledFuture<?> task = flushTask;
        if (task != null) {
            task.cancel(false);
        }

        try {
            watcherService.stopAll();
        } catch (final IOException e) {
            logger.error("Error stopping directory watcher", e);
        }

        flushScheduler.shutdown();
        try {
            if (!flushScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                flushScheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            flushScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        state = WatchState.STOPPED;
    }

    public WatchState getState() {
        return state;
    }

    @Override
    public void onFileCreated(final Path file) {
        logger.trace("File created: {}", file);
        enqueue(file, ChangeType.UPDATE);
    }

    @Override
    public void onFileModified(final Path file) {
        logger.trace("File modified: {}", file);
        enqueue(file, ChangeType.UPDATE);
    }

    @Override
    public void onFileDeleted(final Path file) {
        logger.trace("File deleted: {}", file);
        enqueue(file, ChangeType.DELETE);
    }

    @Override
    public void onOverflow(final Path directory) {
        logger.warn("Change events for {} were lost, next flush rebuilds the index", directory);
        rebuildRequested.set(true);
    }

    private void enqueue(final Path file, final ChangeType type) {
        RecordReader.classifyPath(file)
                .ifPresent(identifier -> pendingEvents.add(new ChangeEvent(identifier, type)));
    }

    private void flushSafely() {
        try {
            flush();
        } catch (final RuntimeException e) {
            logger.error("Error flushing change events", e);
        }
    }

    /**
     * Apply everything queued so far to the index. Events queued while this runs are left for
     * the next flush.
     */
    void flush() {
        synchronized (flushLock) {
            ChangeEvent event;
            while ((event = pendingEvents.poll()) != null) {
                if (event.type() == ChangeType.DELETE) {
                    pendingChanges.markDeleted(event.identifier());
                } else {
                    pendingChanges.markUpdated(event.identifier());
                }
            }

            try {
                if (rebuildRequested.getAndSet(false)) {
                    index.rebuild();
                    return;
                }
                if (pendingChanges.isEmpty()) {
                    return;
                }

                logger.debug("Flushing {} deletions and {} updates",
                        pendingChanges.toDelete().size(), pendingChanges.toUpdate().size());

                for (final UUID identifier : pendingChanges.toDelete()) {
                    index.remove(identifier);
                }
                for (final UUID identifier : pendingChanges.toUpdate()) {
                    index.refresh(identifier);
                }
            } finally {
                pendingChanges.clear();
            }
        }
    }

    record ChangeEvent(UUID identifier, ChangeType type) {}

    enum ChangeType { UPDATE, DELETE }

    public enum WatchState {
        IDLE,
        WATCHING,
        STOPPED
    }
}
