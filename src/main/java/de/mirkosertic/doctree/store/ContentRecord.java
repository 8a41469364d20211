package de.mirkosertic.doctree.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.mirkosertic.doctree.model.DocumentFormat;
import org.jspecify.annotations.Nullable;

/**
 * Representation of {@code <id>.content}. Only the file type is of interest here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ContentRecord(
        @JsonProperty("fileType") @Nullable DocumentFormat fileType
) {
}
