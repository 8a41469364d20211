package de.mirkosertic.doctree.model;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

/**
 * One entry of the document store: a directory or a document.
 * <p>
 * Items are immutable. An update replaces the whole item in the index.
 */
public record Item(
        UUID identifier,
        String displayName,
        Parent parent,
        boolean pinned,
        ItemKind kind,
        /** File format; only present for documents. */
        @Nullable DocumentFormat format
) {

    public Item {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(kind, "kind");
        if (kind == ItemKind.DOCUMENT && format == null) {
            throw new IllegalArgumentException("Document " + identifier + " requires a format");
        }
        if (kind == ItemKind.DIRECTORY && format != null) {
            throw new IllegalArgumentException("Directory " + identifier + " cannot have a format");
        }
    }

    public static Item directory(final UUID identifier, final String displayName, final Parent parent,
                                 final boolean pinned) {
        return new Item(identifier, displayName, parent, pinned, ItemKind.DIRECTORY, null);
    }

    public static Item document(final UUID identifier, final String displayName, final Parent parent,
                                final boolean pinned, final DocumentFormat format) {
        return new Item(identifier, displayName, parent, pinned, ItemKind.DOCUMENT, format);
    }

    public boolean isDirectory() {
        return kind == ItemKind.DIRECTORY;
    }

    public boolean isDocument() {
        return kind == ItemKind.DOCUMENT;
    }
}
