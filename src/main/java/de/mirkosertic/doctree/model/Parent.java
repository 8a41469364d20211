package de.mirkosertic.doctree.model;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

/**
 * Logical location of an item: the root, the trash, or a directory item.
 * <p>
 * On disk the parent is stored as {@code ""} for the root, {@code "trash"} for the trash
 * and the directory's identifier otherwise.
 */
public final class Parent {

    public static final Parent ROOT = new Parent(Type.ROOT, null);
    public static final Parent TRASH = new Parent(Type.TRASH, null);

    static final String ROOT_VALUE = "";
    static final String TRASH_VALUE = "trash";

    private final Type type;
    private final @Nullable UUID directory;

    private Parent(final Type type, final @Nullable UUID directory) {
        this.type = type;
        this.directory = directory;
    }

    public static Parent directory(final UUID identifier) {
        return new Parent(Type.DIRECTORY, Objects.requireNonNull(identifier, "identifier"));
    }

    /**
     * Decode the on-disk representation.
     *
     * @throws IllegalArgumentException if the value is neither empty, {@code "trash"} nor a UUID
     */
    public static Parent fromDiskValue(final String value) {
        if (ROOT_VALUE.equals(value)) {
            return ROOT;
        }
        if (TRASH_VALUE.equals(value)) {
            return TRASH;
        }
        return directory(UUID.fromString(value));
    }

    public String toDiskValue() {
        return switch (type) {
            case ROOT -> ROOT_VALUE;
            case TRASH -> TRASH_VALUE;
            case DIRECTORY -> String.valueOf(directory);
        };
    }

    public Type type() {
        return type;
    }

    /**
     * The parent directory's identifier, or {@code null} for the root and the trash.
     */
    public @Nullable UUID directoryId() {
        return directory;
    }

    public boolean isRoot() {
        return type == Type.ROOT;
    }

    public boolean isTrash() {
        return type == Type.TRASH;
    }

    public boolean isDirectory(final UUID identifier) {
        return type == Type.DIRECTORY && identifier.equals(directory);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Parent other)) {
            return false;
        }
        return type == other.type && Objects.equals(directory, other.directory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, directory);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ROOT -> "Root";
            case TRASH -> "Trash";
            case DIRECTORY -> "Directory(" + directory + ")";
        };
    }

    public enum Type {
        ROOT,
        TRASH,
        DIRECTORY
    }
}
