package de.mirkosertic.doctree.store;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Several items match the same path even after their parent chains were verified.
 */
public class AmbiguousPathException extends DocumentStoreException {

    private final List<UUID> candidates;

    public AmbiguousPathException(final String path, final Collection<UUID> candidates) {
        super("Path " + path + " matches " + candidates.size() + " items: " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    public List<UUID> getCandidates() {
        return candidates;
    }
}
