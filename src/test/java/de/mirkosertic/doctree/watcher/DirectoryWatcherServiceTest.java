package de.mirkosertic.doctree.watcher;

import de.mirkosertic.doctree.IndexExecutorService;
import de.mirkosertic.doctree.LiveIndex;
import de.mirkosertic.doctree.TestStore;
import de.mirkosertic.doctree.model.DocumentFormat;
import de.mirkosertic.doctree.model.Item;
import de.mirkosertic.doctree.model.Parent;
import de.mirkosertic.doctree.store.RecordReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Tests against the real file system watcher. Notifications may take a few seconds on
 * platforms that poll.
 */
@DisplayName("DirectoryWatcherService Tests")
class DirectoryWatcherServiceTest {

    @TempDir
    Path tempDir;

    private DirectoryWatcherService watcherService;

    @BeforeEach
    void setUp() {
        watcherService = new DirectoryWatcherService(50);
    }

    @AfterEach
    void tearDown() throws IOException {
        watcherService.stopAll();
    }

    @Test
    @DisplayName("Should report created, modified and deleted files")
    void shouldReportFileChanges() throws IOException {
        final FileChangeListener listener = mock(FileChangeListener.class);
        watcherService.watchDirectory(tempDir, listener);

        final Path file = tempDir.resolve("a.metadata");
        Files.writeString(file, "{}");
        verify(listener, timeout(15000).atLeastOnce()).onFileCreated(file);

        Files.writeString(file, "{\"visibleName\": \"a\"}");
        verify(listener, timeout(15000).atLeastOnce()).onFileModified(file);

        Files.delete(file);
        verify(listener, timeout(15000).atLeastOnce()).onFileDeleted(file);
    }

    @Test
    @DisplayName("Should watch subdirectories, including ones created later")
    void shouldWatchSubdirectories() throws IOException {
        final Path existing = Files.createDirectory(tempDir.resolve("existing"));
        final FileChangeListener listener = mock(FileChangeListener.class);
        watcherService.watchDirectory(tempDir, listener);

        final Path inExisting = existing.resolve("one.content");
        Files.writeString(inExisting, "{}");
        verify(listener, timeout(15000).atLeastOnce()).onFileCreated(inExisting);

        final Path created = Files.createDirectory(tempDir.resolve("created"));
        // The new directory is registered asynchronously, so keep writing until an event arrives
        final Path inCreated = created.resolve("two.content");
        await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            Files.writeString(inCreated, "{}");
            verify(listener, atLeastOnce()).onFileModified(inCreated);
        });
    }

    @Test
    @DisplayName("Should refuse to watch something that is not a directory")
    void shouldRefuseNonDirectory() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("plain.txt"), "x");

        assertThatThrownBy(() -> watcherService.watchDirectory(file, mock(FileChangeListener.class)))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> watcherService.watchDirectory(tempDir.resolve("missing"),
                mock(FileChangeListener.class)))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should keep a live index in sync with the store directory")
    void shouldUpdateLiveIndexEndToEnd() throws Exception {
        final TestStore store = new TestStore(tempDir);
        final UUID books = store.directory("Books", Parent.ROOT);
        final IndexExecutorService executor = new IndexExecutorService(2);
        final LiveIndex index = new LiveIndex(tempDir, new RecordReader(), executor);
        final ChangeWatcher changeWatcher = new ChangeWatcher(index, watcherService, 100);
        try {
            index.rebuild();
            changeWatcher.start();

            final UUID alice = store.document("Alice", Parent.directory(books), DocumentFormat.EPUB);
            await().atMost(Duration.ofSeconds(15))
                    .untilAsserted(() -> assertThat(index.list("/Books"))
                            .extracting(Item::identifier).containsExactly(alice));

            store.delete(alice);
            await().atMost(Duration.ofSeconds(15))
                    .untilAsserted(() -> assertThat(index.get(alice)).isEmpty());
            assertThat(index.get(books)).isPresent();
        } finally {
            changeWatcher.stop();
            executor.shutdown();
        }
    }
}
