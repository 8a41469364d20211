package de.mirkosertic.doctree.store;

import java.io.IOException;

/**
 * Base type for failures reported by the document store and its index.
 */
public class DocumentStoreException extends IOException {

    public DocumentStoreException(final String message) {
        super(message);
    }

    public DocumentStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
