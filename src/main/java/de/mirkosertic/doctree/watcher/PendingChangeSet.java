package de.mirkosertic.doctree.watcher;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Identifiers touched since the last flush. Repeated events for one identifier collapse into a
 * single entry.
 * <p>
 * Not thread-safe: only the flush loop of {@link ChangeWatcher} uses it.
 */
final class PendingChangeSet {

    private final Set<UUID> toUpdate = new LinkedHashSet<>();
    private final Set<UUID> toDelete = new LinkedHashSet<>();

    void markUpdated(final UUID identifier) {
        toUpdate.add(identifier);
    }

    void markDeleted(final UUID identifier) {
        toDelete.add(identifier);
    }

    Set<UUID> toUpdate() {
        return Collections.unmodifiableSet(toUpdate);
    }

    Set<UUID> toDelete() {
        return Collections.unmodifiableSet(toDelete);
    }

    boolean isEmpty() {
        return toUpdate.isEmpty() && toDelete.isEmpty();
    }

    void clear() {
        toUpdate.clear();
        toDelete.clear();
    }
}
