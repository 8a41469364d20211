package de.mirkosertic.doctree;

import de.mirkosertic.doctree.model.Item;
import de.mirkosertic.doctree.model.Parent;
import de.mirkosertic.doctree.store.AmbiguousPathException;
import de.mirkosertic.doctree.store.DocumentStoreException;
import de.mirkosertic.doctree.store.ItemNotFoundException;
import de.mirkosertic.doctree.store.RecordReader;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory view of the document store, keyed by item identifier.
 * <p>
 * The items live in a {@link ConcurrentHashMap}: writers for different identifiers never block
 * each other, and queries iterate a weakly consistent view. Items are immutable, so a query may
 * miss a concurrent update but never sees half of one.
 * <p>
 * A rebuild may overlap with single item updates from the change watcher. Identifiers updated or
 * removed while a rebuild runs are recorded, and the rebuild leaves their entries alone when it
 * swaps in its result, as its own reads of them may be older.
 * <p>
 * Besides the real tree, two virtual views exist: {@value #TRASH_NAME} lists everything whose
 * parent is the trash, {@value #PINNED_NAME} everything that is pinned.
 */
public class LiveIndex {

    private static final Logger logger = LoggerFactory.getLogger(LiveIndex.class);

    public static final String TRASH_NAME = "Trash";
    public static final String PINNED_NAME = "Favorites";

    private final Path baseDirectory;
    private final RecordReader recordReader;
    private final IndexExecutorService executor;
    private final Map<UUID, Item> items = new ConcurrentHashMap<>();
    private final PathResolver pathResolver;
    private final Object rebuildLock = new Object();
    // Shared by single item writes, exclusive for starting, applying and ending a rebuild
    private final ReadWriteLock replaceLock = new ReentrantReadWriteLock();
    private volatile @Nullable Set<UUID> changedDuringRebuild;

    public LiveIndex(final Path baseDirectory, final RecordReader recordReader, final IndexExecutorService executor) {
        this.baseDirectory = baseDirectory;
        this.recordReader = recordReader;
        this.executor = executor;
        this.pathResolver = new PathResolver(items, TRASH_NAME);
    }

    /**
     * Read every item of the store and replace the index contents with the result.
     * <p>
     * Items are read in parallel on the {@link IndexExecutorService}. An item that cannot be read
     * is logged and left out; it does not abort the rebuild. If the store directory itself cannot
     * be listed, the current contents are kept.
     */
    public void rebuild() {
        synchronized (rebuildLock) {
            logger.info("Rebuilding index from {}", baseDirectory);
            final long startTime = System.currentTimeMillis();

            trackChanges(ConcurrentHashMap.newKeySet());
            try {
                rebuildFromDisk(startTime);
            } finally {
                trackChanges(null);
            }
        }
    }

    private void rebuildFromDisk(final long startTime) {
        final List<UUID> identifiers = new ArrayList<>();
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(baseDirectory)) {
            for (final Path entry : entries) {
                RecordReader.metadataIdentifier(entry).ifPresent(identifiers::add);
            }
        } catch (final IOException e) {
            logger.error("Failed to read store directory {}, keeping {} indexed items",
                    baseDirectory, items.size(), e);
            return;
        }

        final Map<UUID, Future<Item>> reads = new LinkedHashMap<>();
        for (final UUID identifier : identifiers) {
            reads.put(identifier, executor.submit(() -> recordReader.readItem(baseDirectory, identifier)));
        }

        final Map<UUID, Item> fresh = new HashMap<>();
        int failed = 0;
        for (final Map.Entry<UUID, Future<Item>> read : reads.entrySet()) {
            try {
                fresh.put(read.getKey(), read.getValue().get());
            } catch (final ExecutionException e) {
                failed++;
                logger.error("Error reading item {} during rebuild", read.getKey(), e.getCause());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Rebuild interrupted, keeping previous index contents");
                return;
            }
        }

        final int kept = replaceContents(fresh);

        logger.info("Indexed {} items in {}ms ({} failed, {} updated concurrently)",
                fresh.size(), System.currentTimeMillis() - startTime, failed, kept);
    }

    /**
     * Replace the index contents with the result of a rebuild, except for identifiers that were
     * updated or removed since the rebuild started.
     *
     * @return the number of identifiers left as they were
     */
    private int replaceContents(final Map<UUID, Item> fresh) {
        replaceLock.writeLock().lock();
        try {
            final Set<UUID> changed = changedDuringRebuild;
            final Set<UUID> skip = changed == null ? Set.of() : changed;
            items.keySet().removeIf(identifier -> !fresh.containsKey(identifier) && !skip.contains(identifier));
            fresh.forEach((identifier, item) -> {
                if (!skip.contains(identifier)) {
                    items.put(identifier, item);
                }
            });
            return skip.size();
        } finally {
            replaceLock.writeLock().unlock();
        }
    }

    private void trackChanges(final @Nullable Set<UUID> changed) {
        replaceLock.writeLock().lock();
        try {
            changedDuringRebuild = changed;
        } finally {
            replaceLock.writeLock().unlock();
        }
    }

    private void markChanged(final UUID identifier) {
        final Set<UUID> changed = changedDuringRebuild;
        if (changed != null) {
            changed.add(identifier);
        }
    }

    /**
     * Re-read one item from disk and insert or overwrite its entry.
     *
     * @return {@code true} if the item was read; on failure the previous entry is left as it was
     */
    public boolean refresh(final UUID identifier) {
        replaceLock.readLock().lock();
        try {
            final Item item = recordReader.readItem(baseDirectory, identifier);
            items.put(identifier, item);
            markChanged(identifier);
            logger.debug("Updated {} from disk", identifier);
            return true;
        } catch (final IOException e) {
            logger.error("Failed to read {} from disk", identifier, e);
            return false;
        } finally {
            replaceLock.readLock().unlock();
        }
    }

    /**
     * @return {@code true} if an entry was removed
     */
    public boolean remove(final UUID identifier) {
        replaceLock.readLock().lock();
        try {
            final boolean removed = items.remove(identifier) != null;
            markChanged(identifier);
            if (removed) {
                logger.debug("Removed {}", identifier);
            }
            return removed;
        } finally {
            replaceLock.readLock().unlock();
        }
    }

    /**
     * List the items directly below a path.
     * <ul>
     *   <li>the root path lists items whose parent is the root,</li>
     *   <li>{@value #TRASH_NAME} lists the trash,</li>
     *   <li>{@value #PINNED_NAME} lists all pinned items, wherever they are,</li>
     *   <li>any other path is resolved and its children are listed.</li>
     * </ul>
     * A path that cannot be resolved, or that names a document, yields an empty set.
     *
     * @throws AmbiguousPathException if the path matches several items
     */
    public Set<Item> list(final String path) throws AmbiguousPathException {
        final ItemPath itemPath = ItemPath.parse(path);

        if (itemPath.isRoot()) {
            return select(item -> item.parent().isRoot());
        }
        if (itemPath.isSingleSegment(TRASH_NAME)) {
            return trash();
        }
        if (itemPath.isSingleSegment(PINNED_NAME)) {
            return pinned();
        }

        final UUID directoryId;
        try {
            directoryId = pathResolver.resolve(itemPath);
        } catch (final ItemNotFoundException e) {
            logger.warn("Cannot list {}: {}", itemPath, e.getMessage());
            return Set.of();
        }

        final Item directory = items.get(directoryId);
        if (directory == null || !directory.isDirectory()) {
            logger.warn("Cannot list {}: not a directory", itemPath);
            return Set.of();
        }
        return select(item -> item.parent().isDirectory(directoryId));
    }

    public Set<Item> pinned() {
        return select(Item::pinned);
    }

    public Set<Item> trash() {
        return select(item -> item.parent().isTrash());
    }

    /**
     * Move an item below another directory, the root (empty target) or the trash.
     * <p>
     * The new parent is written to the item's metadata file, then only that item is re-read.
     *
     * @throws ItemNotFoundException  if the item or the target cannot be resolved
     * @throws AmbiguousPathException if either path matches several items
     * @throws NotDirectoryException  if the target is a document
     * @throws DocumentStoreException if the target is the item itself or lies below it
     * @throws IOException            if the metadata file cannot be rewritten
     */
    public void moveItem(final String itemPath, final String targetDirPath) throws IOException {
        final ItemPath source = ItemPath.parse(itemPath);
        final UUID identifier = pathResolver.resolve(source);

        final ItemPath target = ItemPath.parse(targetDirPath);
        final Parent newParent;
        if (target.isRoot()) {
            newParent = Parent.ROOT;
        } else if (target.isSingleSegment(TRASH_NAME)) {
            newParent = Parent.TRASH;
        } else {
            final UUID targetId = pathResolver.resolve(target);
            final Item targetItem = items.get(targetId);
            if (targetItem == null) {
                throw new ItemNotFoundException(target + " disappeared from the index");
            }
            if (!targetItem.isDirectory()) {
                throw new NotDirectoryException(target.toString());
            }
            if (isSelfOrBelow(targetId, identifier)) {
                throw new DocumentStoreException("Cannot move " + source + " into " + target);
            }
            newParent = Parent.directory(targetId);
        }

        recordReader.rewriteParent(baseDirectory, identifier, newParent);
        logger.info("Moved {} ({}) to {}", source, identifier, newParent);

        if (!refresh(identifier)) {
            logger.warn("Moved item {} could not be re-read, the watcher will pick it up", identifier);
        }
    }

    public Optional<Item> get(final UUID identifier) {
        return Optional.ofNullable(items.get(identifier));
    }

    /**
     * Look up the item a path denotes.
     *
     * @return the item, or empty if the path does not resolve
     * @throws AmbiguousPathException if the path matches several items
     */
    public Optional<Item> find(final String path) throws AmbiguousPathException {
        try {
            return get(pathResolver.resolve(ItemPath.parse(path)));
        } catch (final ItemNotFoundException e) {
            logger.debug("No item at {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * The path of an item as it would be passed to {@link #list(String)} or {@link #find(String)}.
     *
     * @return the path, or empty if the item is unknown or its parent chain is broken
     */
    public Optional<String> pathOf(final UUID identifier) {
        return pathResolver.pathOf(identifier).map(ItemPath::toString);
    }

    /**
     * Point-in-time copy of the whole index.
     */
    public Map<UUID, Item> snapshot() {
        return Map.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    private boolean isSelfOrBelow(final UUID candidate, final UUID ancestor) {
        final Set<UUID> visited = new HashSet<>();
        UUID current = candidate;
        while (current != null && visited.add(current)) {
            if (current.equals(ancestor)) {
                return true;
            }
            final Item item = items.get(current);
            current = item == null ? null : item.parent().directoryId();
        }
        return false;
    }

    private Set<Item> select(final Predicate<Item> filter) {
        return items.values().stream()
                .filter(filter)
                .collect(Collectors.toUnmodifiableSet());
    }
}
