package de.mirkosertic.doctree.watcher;

import java.nio.file.Path;

/**
 * Receives raw change notifications from {@link DirectoryWatcherService}.
 * <p>
 * Callbacks run on the watch thread. Implementations must return quickly and must not read files.
 */
public interface FileChangeListener {

    void onFileCreated(Path file);

    void onFileModified(Path file);

    void onFileDeleted(Path file);

    /**
     * The operating system dropped events for {@code directory}; some changes were not reported.
     */
    void onOverflow(Path directory);
}
