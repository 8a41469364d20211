package de.mirkosertic.doctree.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Representation of {@code <id>.metadata}. Fields the index does not need are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record MetadataRecord(
        @JsonProperty("type") @Nullable EntryType type,
        @JsonProperty("visibleName") @Nullable String visibleName,
        @JsonProperty("parent") @Nullable String parent,
        @JsonProperty("pinned") @Nullable Boolean pinned
) {

    enum EntryType {
        @JsonProperty("DocumentType")
        DOCUMENT,

        @JsonProperty("CollectionType")
        COLLECTION
    }
}
