package de.mirkosertic.doctree.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import de.mirkosertic.doctree.model.Item;
import de.mirkosertic.doctree.model.Parent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes the sidecar files that describe one item of the store.
 * <p>
 * Every item {@code <id>} owns a {@code <id>.metadata} file and, for documents, a
 * {@code <id>.content} file. Both are JSON objects. This class never caches anything:
 * each call goes to disk.
 */
public class RecordReader {

    private static final Logger logger = LoggerFactory.getLogger(RecordReader.class);

    public static final String METADATA_EXTENSION = "metadata";
    public static final String CONTENT_EXTENSION = "content";

    static final String PARENT_FIELD = "parent";
    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapper objectMapper;

    public RecordReader() {
        this(createObjectMapper());
    }

    public RecordReader(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A mapper that rejects values of the wrong JSON type instead of converting them, so that
     * {@code "pinned": "true"} or {@code "visibleName": 42} fail to parse.
     */
    public static ObjectMapper createObjectMapper() {
        final ObjectMapper mapper = JsonMapper.builder()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
                .build();
        // Textual targets are not covered by ALLOW_COERCION_OF_SCALARS
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Read one item from its sidecar files.
     *
     * @param baseDir    the store directory
     * @param identifier the item to read
     * @return the parsed item, never null
     * @throws ItemNotFoundException if the metadata file, or the content file of a document, is missing
     * @throws RecordParseException  if a sidecar is malformed or does not match the schema
     * @throws IOException           on any other read failure
     */
    public Item readItem(final Path baseDir, final UUID identifier) throws IOException {
        final Path metadataFile = metadataPath(baseDir, identifier);
        final MetadataRecord metadata = readRecord(metadataFile, MetadataRecord.class);

        if (metadata.type() == null) {
            throw missingField(metadataFile, "type");
        }
        if (metadata.visibleName() == null) {
            throw missingField(metadataFile, "visibleName");
        }
        if (metadata.parent() == null) {
            throw missingField(metadataFile, PARENT_FIELD);
        }
        if (metadata.pinned() == null) {
            throw missingField(metadataFile, "pinned");
        }

        final Parent parent;
        try {
            parent = Parent.fromDiskValue(metadata.parent());
        } catch (final IllegalArgumentException e) {
            throw new RecordParseException("Invalid parent '" + metadata.parent() + "' in " + metadataFile, e);
        }

        if (metadata.type() == MetadataRecord.EntryType.COLLECTION) {
            return Item.directory(identifier, metadata.visibleName(), parent, metadata.pinned());
        }

        final Path contentFile = contentPath(baseDir, identifier);
        final ContentRecord content = readRecord(contentFile, ContentRecord.class);
        if (content.fileType() == null) {
            throw missingField(contentFile, "fileType");
        }
        return Item.document(identifier, metadata.visibleName(), parent, metadata.pinned(), content.fileType());
    }

    /**
     * Replace the parent of an item on disk.
     * <p>
     * The metadata file is edited as a JSON tree so that every other field, including fields
     * this class does not know about, is written back unchanged. The new content goes to a
     * temporary sibling first and is then moved over the original.
     *
     * @throws ItemNotFoundException if the metadata file is missing
     * @throws RecordParseException  if the metadata file is not a JSON object with a parent field
     * @throws IOException           on any other read or write failure
     */
    public void rewriteParent(final Path baseDir, final UUID identifier, final Parent newParent) throws IOException {
        final Path metadataFile = metadataPath(baseDir, identifier);
        if (!Files.exists(metadataFile)) {
            throw new ItemNotFoundException(metadataFile + " doesn't exist");
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(Files.readAllBytes(metadataFile));
        } catch (final JsonProcessingException e) {
            throw new RecordParseException("Malformed JSON in " + metadataFile, e);
        }
        if (!(root instanceof ObjectNode metadata)) {
            throw new RecordParseException(metadataFile + " does not contain a JSON object");
        }
        if (!metadata.has(PARENT_FIELD)) {
            throw missingField(metadataFile, PARENT_FIELD);
        }

        metadata.put(PARENT_FIELD, newParent.toDiskValue());

        final Path tempFile = metadataFile.resolveSibling(metadataFile.getFileName() + TEMP_SUFFIX);
        Files.write(tempFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
        try {
            Files.move(tempFile, metadataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(tempFile, metadataFile, StandardCopyOption.REPLACE_EXISTING);
        }
        logger.debug("Set parent of {} to {}", identifier, newParent);
    }

    /**
     * Extract the identifier from a sidecar path.
     *
     * @return the identifier if the path names a {@code .metadata} or {@code .content} file whose
     * stem is a UUID, otherwise empty
     */
    public static Optional<UUID> classifyPath(final Path path) {
        final Optional<UUID> metadata = identifierFor(path, METADATA_EXTENSION);
        return metadata.isPresent() ? metadata : identifierFor(path, CONTENT_EXTENSION);
    }

    /**
     * Like {@link #classifyPath(Path)}, but only accepts metadata files. Each item has exactly
     * one, so enumerating these yields every identifier once.
     */
    public static Optional<UUID> metadataIdentifier(final Path path) {
        return identifierFor(path, METADATA_EXTENSION);
    }

    public static Path metadataPath(final Path baseDir, final UUID identifier) {
        return baseDir.resolve(identifier + "." + METADATA_EXTENSION);
    }

    public static Path contentPath(final Path baseDir, final UUID identifier) {
        return baseDir.resolve(identifier + "." + CONTENT_EXTENSION);
    }

    private static Optional<UUID> identifierFor(final Path path, final String extension) {
        final Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        final String name = fileName.toString();
        final String suffix = "." + extension;
        if (!name.endsWith(suffix) || name.length() == suffix.length()) {
            return Optional.empty();
        }
        return parseIdentifier(name.substring(0, name.length() - suffix.length()));
    }

    // UUID.fromString() also accepts short and upper-case forms; only the canonical lower-case form
    // is an identifier, because that is the name readItem() derives the sidecar paths from
    private static Optional<UUID> parseIdentifier(final String stem) {
        try {
            final UUID uuid = UUID.fromString(stem);
            if (uuid.toString().equals(stem)) {
                return Optional.of(uuid);
            }
        } catch (final IllegalArgumentException e) {
            logger.trace("Not an identifier: {}", stem);
        }
        return Optional.empty();
    }

    private <T> T readRecord(final Path file, final Class<T> type) throws IOException {
        if (!Files.exists(file)) {
            throw new ItemNotFoundException(file + " doesn't exist");
        }
        try {
            final T value = objectMapper.readValue(Files.readAllBytes(file), type);
            if (value == null) {
                throw new RecordParseException(file + " contains JSON null");
            }
            return value;
        } catch (final NoSuchFileException e) {
            throw new ItemNotFoundException(file + " doesn't exist");
        } catch (final JsonProcessingException e) {
            throw new RecordParseException("Malformed " + type.getSimpleName() + " in " + file, e);
        }
    }

    private static RecordParseException missingField(final Path file, final String field) {
        return new RecordParseException("Missing field '" + field + "' in " + file);
    }
}
