package de.mirkosertic.doctree.store;

/**
 * A sidecar file is missing, or a path does not resolve to any item.
 */
public class ItemNotFoundException extends DocumentStoreException {

    public ItemNotFoundException(final String message) {
        super(message);
    }
}
