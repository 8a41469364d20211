package de.mirkosertic.doctree.model;

public enum ItemKind {
    DIRECTORY,
    DOCUMENT
}
