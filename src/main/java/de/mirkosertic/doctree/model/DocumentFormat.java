package de.mirkosertic.doctree.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * File format of a document, as recorded in the {@code fileType} field of its content sidecar.
 */
public enum DocumentFormat {

    @JsonProperty("notebook")
    NOTEBOOK,

    @JsonProperty("pdf")
    PDF,

    @JsonProperty("epub")
    EPUB
}
