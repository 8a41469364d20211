package de.mirkosertic.doctree.store;

/**
 * Filesystem change notifications could not be subscribed to. Live updates are unavailable,
 * the index keeps serving its last contents.
 */
public class WatchSetupException extends DocumentStoreException {

    public WatchSetupException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
