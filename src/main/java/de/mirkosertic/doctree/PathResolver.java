package de.mirkosertic.doctree;

import de.mirkosertic.doctree.model.Item;
import de.mirkosertic.doctree.model.Parent;
import de.mirkosertic.doctree.store.AmbiguousPathException;
import de.mirkosertic.doctree.store.ItemNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Maps human readable paths to item identifiers and back.
 * <p>
 * Display names are not unique, so a path is resolved by collecting every item whose name
 * equals the last path segment. A single candidate is accepted as is. With several candidates,
 * each one's parent chain is compared against the remaining path segments:
 * <ul>
 *   <li>a {@code Directory(x)} parent requires a parent segment naming the directory {@code x},
 *       and the comparison continues one level up;</li>
 *   <li>a {@code Trash} parent requires the parent path to be exactly the trash name;</li>
 *   <li>a {@code Root} parent requires that no parent segment is left.</li>
 * </ul>
 * Any other combination does not match. The walk keeps a visited set, so a corrupted store with
 * cyclic parents cannot loop forever.
 */
public class PathResolver {

    private static final Logger logger = LoggerFactory.getLogger(PathResolver.class);

    private final Map<UUID, Item> items;
    private final String trashName;

    /**
     * @param items     live view of the index; only read, never modified
     * @param trashName the reserved top-level segment that denotes the trash
     */
    public PathResolver(final Map<UUID, Item> items, final String trashName) {
        this.items = items;
        this.trashName = trashName;
    }

    /**
     * Resolve a path to an identifier.
     *
     * @throws ItemNotFoundException  if no item, or no verified candidate, matches the path
     * @throws AmbiguousPathException if more than one candidate survives parent chain verification
     */
    public UUID resolve(final ItemPath path) throws ItemNotFoundException, AmbiguousPathException {
        if (path.isRoot()) {
            throw new ItemNotFoundException("The root path does not denote an item");
        }

        final String name = path.name();
        final List<Item> candidates = items.values().stream()
                .filter(item -> item.displayName().equals(name))
                .toList();

        if (candidates.isEmpty()) {
            throw new ItemNotFoundException("No item named '" + name + "' for path " + path);
        }
        if (candidates.size() == 1) {
            return candidates.get(0).identifier();
        }

        final List<UUID> verified = candidates.stream()
                .filter(candidate -> parentChainMatches(path, candidate))
                .map(Item::identifier)
                .toList();

        logger.debug("Path {} has {} candidates, {} verified", path, candidates.size(), verified.size());

        if (verified.isEmpty()) {
            throw new ItemNotFoundException("None of the " + candidates.size() + " items named '" + name
                    + "' is located at " + path);
        }
        if (verified.size() > 1) {
            throw new AmbiguousPathException(path.toString(), verified);
        }
        return verified.get(0);
    }

    /**
     * Check whether the parent chain of {@code candidate} leads to exactly the location {@code path}
     * describes.
     */
    boolean parentChainMatches(final ItemPath path, final Item candidate) {
        final Set<UUID> visited = new HashSet<>();
        visited.add(candidate.identifier());

        ItemPath currentPath = path;
        Item current = candidate;
        while (true) {
            final Parent parent = current.parent();
            final UUID parentId = parent.directoryId();

            if (currentPath.hasParentSegment() && parentId != null) {
                final ItemPath parentPath = currentPath.parent();
                if (!visited.add(parentId)) {
                    logger.warn("Parent cycle detected at {} while resolving {}", parentId, path);
                    return false;
                }
                final Item parentItem = items.get(parentId);
                if (parentItem == null
                        || !parentItem.isDirectory()
                        || !parentItem.displayName().equals(parentPath.name())) {
                    return false;
                }
                currentPath = parentPath;
                current = parentItem;
                continue;
            }

            if (parent.isTrash()) {
                return currentPath.parent().isSingleSegment(trashName);
            }
            if (parent.isRoot()) {
                return !currentPath.hasParentSegment();
            }
            return false;
        }
    }

    /**
     * Reconstruct the path of an item from its parent chain.
     *
     * @return the path, or empty if the item is unknown, a parent is dangling or the chain is cyclic
     */
    public Optional<ItemPath> pathOf(final UUID identifier) {
        Item current = items.get(identifier);
        if (current == null) {
            return Optional.empty();
        }

        final Deque<String> segments = new ArrayDeque<>();
        final Set<UUID> visited = new HashSet<>();
        visited.add(identifier);
        while (true) {
            segments.addFirst(current.displayName());
            final Parent parent = current.parent();
            if (parent.isRoot()) {
                break;
            }
            if (parent.isTrash()) {
                segments.addFirst(trashName);
                break;
            }

            final UUID parentId = parent.directoryId();
            if (!visited.add(parentId)) {
                logger.warn("Parent cycle detected at {} while building path of {}", parentId, identifier);
                return Optional.empty();
            }
            current = items.get(parentId);
            if (current == null || !current.isDirectory()) {
                logger.debug("Parent {} of {} is not an indexed directory", parentId, identifier);
                return Optional.empty();
            }
        }
        return Optional.of(ItemPath.of(List.copyOf(segments)));
    }
}
