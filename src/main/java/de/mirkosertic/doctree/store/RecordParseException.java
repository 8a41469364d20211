package de.mirkosertic.doctree.store;

/**
 * A sidecar file exists but its content is malformed or does not match the expected schema.
 */
public class RecordParseException extends DocumentStoreException {

    public RecordParseException(final String message) {
        super(message);
    }

    public RecordParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
