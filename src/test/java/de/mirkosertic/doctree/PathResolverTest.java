package de.mirkosertic.doctree;

import de.mirkosertic.doctree.model.DocumentFormat;
import de.mirkosertic.doctree.model.Item;
import de.mirkosertic.doctree.model.Parent;
import de.mirkosertic.doctree.store.AmbiguousPathException;
import de.mirkosertic.doctree.store.ItemNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PathResolver Tests")
class PathResolverTest {

    private Map<UUID, Item> items;
    private PathResolver resolver;

    @BeforeEach
    void setUp() {
        items = new HashMap<>();
        resolver = new PathResolver(items, LiveIndex.TRASH_NAME);
    }

    private Item add(final Item item) {
        items.put(item.identifier(), item);
        return item;
    }

    private Item directory(final String name, final Parent parent) {
        return add(Item.directory(UUID.randomUUID(), name, parent, false));
    }

    private Item document(final String name, final Parent parent) {
        return add(Item.document(UUID.randomUUID(), name, parent, false, DocumentFormat.PDF));
    }

    private static ItemPath path(final String path) {
        return ItemPath.parse(path);
    }

    @Nested
    @DisplayName("Resolving paths")
    class ResolveTests {

        @Test
        @DisplayName("Should return a uniquely named item without checking its parents")
        void shouldReturnUniqueName() throws Exception {
            final Item alice = document("Alice", Parent.directory(UUID.randomUUID()));

            assertThat(resolver.resolve(path("/some/where/Alice"))).isEqualTo(alice.identifier());
        }

        @Test
        @DisplayName("Should fail for an unknown name")
        void shouldFailForUnknownName() {
            directory("Books", Parent.ROOT);

            assertThatThrownBy(() -> resolver.resolve(path("/Comics")))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should fail for the root path")
        void shouldFailForRoot() {
            assertThatThrownBy(() -> resolver.resolve(ItemPath.ROOT))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should pick the duplicate whose parent chain matches the path")
        void shouldDisambiguateByParent() throws Exception {
            final Item folder1 = directory("Folder1", Parent.ROOT);
            final Item folder2 = directory("Folder2", Parent.ROOT);
            final Item notes1 = document("Notes", Parent.directory(folder1.identifier()));
            final Item notes2 = document("Notes", Parent.directory(folder2.identifier()));

            assertThat(resolver.resolve(path("/Folder1/Notes"))).isEqualTo(notes1.identifier());
            assertThat(resolver.resolve(path("/Folder2/Notes"))).isEqualTo(notes2.identifier());
        }

        @Test
        @DisplayName("Should compare the whole chain when parent names collide as well")
        void shouldVerifyFullChain() throws Exception {
            final Item work = directory("Work", Parent.ROOT);
            final Item home = directory("Home", Parent.ROOT);
            final Item workFolder = directory("Folder", Parent.directory(work.identifier()));
            final Item homeFolder = directory("Folder", Parent.directory(home.identifier()));
            document("Notes", Parent.directory(workFolder.identifier()));
            final Item homeNotes = document("Notes", Parent.directory(homeFolder.identifier()));

            assertThat(resolver.resolve(path("/Home/Folder/Notes"))).isEqualTo(homeNotes.identifier());
            assertThat(resolver.resolve(path("/Home/Folder"))).isEqualTo(homeFolder.identifier());
        }

        @Test
        @DisplayName("Should tell a root item from a trashed item of the same name")
        void shouldResolveTrashAndRoot() throws Exception {
            final Item atRoot = document("Notes", Parent.ROOT);
            final Item trashed = document("Notes", Parent.TRASH);

            assertThat(resolver.resolve(path("/Notes"))).isEqualTo(atRoot.identifier());
            assertThat(resolver.resolve(path("Trash/Notes"))).isEqualTo(trashed.identifier());
        }

        @Test
        @DisplayName("Should not match a root item against a path that has a parent segment")
        void shouldNotMatchRootItemBelowDirectory() {
            directory("Folder", Parent.ROOT);
            document("Notes", Parent.ROOT);
            document("Notes", Parent.TRASH);

            // Neither candidate lives below /Folder; a lenient fallback would accept the root one
            assertThatThrownBy(() -> resolver.resolve(path("/Folder/Notes")))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should not match a directory child against a top-level path")
        void shouldNotMatchChildAtTopLevel() {
            final Item a = directory("A", Parent.ROOT);
            final Item b = directory("B", Parent.ROOT);
            document("Notes", Parent.directory(a.identifier()));
            document("Notes", Parent.directory(b.identifier()));

            assertThatThrownBy(() -> resolver.resolve(path("/Notes")))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should require the parent to be a directory")
        void shouldRejectDocumentAsParent() {
            final Item fake = document("Folder", Parent.ROOT);
            document("Notes", Parent.directory(fake.identifier()));
            document("Notes", Parent.ROOT);

            assertThatThrownBy(() -> resolver.resolve(path("/Folder/Notes")))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should treat a dangling parent as no match")
        void shouldTolerateDanglingParent() throws Exception {
            final Item folder = directory("Folder", Parent.ROOT);
            document("Notes", Parent.directory(UUID.randomUUID()));
            final Item real = document("Notes", Parent.directory(folder.identifier()));

            assertThat(resolver.resolve(path("/Folder/Notes"))).isEqualTo(real.identifier());
        }

        @Test
        @DisplayName("Should stop on cyclic parent chains")
        void shouldStopOnCycle() {
            final UUID a = UUID.randomUUID();
            final UUID b = UUID.randomUUID();
            add(Item.directory(a, "Loop", Parent.directory(b), false));
            add(Item.directory(b, "Loop", Parent.directory(a), false));

            assertThatThrownBy(() -> resolver.resolve(path("/Loop/Loop/Loop/Loop/Loop")))
                    .isInstanceOf(ItemNotFoundException.class);
        }

        @Test
        @DisplayName("Should report several verified candidates as ambiguous")
        void shouldReportAmbiguity() {
            final Item folder = directory("Folder", Parent.ROOT);
            final Item first = document("Notes", Parent.directory(folder.identifier()));
            final Item second = document("Notes", Parent.directory(folder.identifier()));

            assertThatThrownBy(() -> resolver.resolve(path("/Folder/Notes")))
                    .isInstanceOfSatisfying(AmbiguousPathException.class, e ->
                            assertThat(e.getCandidates())
                                    .containsExactlyInAnyOrder(first.identifier(), second.identifier()));
        }
    }

    @Nested
    @DisplayName("Reconstructing paths")
    class PathOfTests {

        @Test
        @DisplayName("Should build the path from the parent chain")
        void shouldBuildPath() {
            final Item books = directory("Books", Parent.ROOT);
            final Item fiction = directory("Fiction", Parent.directory(books.identifier()));
            final Item alice = document("Alice", Parent.directory(fiction.identifier()));

            assertThat(resolver.pathOf(alice.identifier())).contains(path("/Books/Fiction/Alice"));
            assertThat(resolver.pathOf(books.identifier())).contains(path("/Books"));
        }

        @Test
        @DisplayName("Should place trashed items below the trash")
        void shouldPrefixTrash() {
            final Item trashed = directory("Old", Parent.TRASH);
            final Item inside = document("Draft", Parent.directory(trashed.identifier()));

            assertThat(resolver.pathOf(inside.identifier())).contains(path("/Trash/Old/Draft"));
        }

        @Test
        @DisplayName("Should give up on unknown items, dangling parents and cycles")
        void shouldFailOnBrokenChains() {
            final Item dangling = document("Lost", Parent.directory(UUID.randomUUID()));
            final UUID a = UUID.randomUUID();
            final UUID b = UUID.randomUUID();
            add(Item.directory(a, "A", Parent.directory(b), false));
            add(Item.directory(b, "B", Parent.directory(a), false));

            assertThat(resolver.pathOf(UUID.randomUUID())).isEmpty();
            assertThat(resolver.pathOf(dangling.identifier())).isEmpty();
            assertThat(resolver.pathOf(a)).isEmpty();
        }

        @Test
        @DisplayName("Should produce paths that resolve back to the same item")
        void shouldRoundTripThroughResolve() throws Exception {
            final Item folder1 = directory("Folder1", Parent.ROOT);
            final Item folder2 = directory("Folder2", Parent.ROOT);
            document("Notes", Parent.directory(folder1.identifier()));
            final Item notes = document("Notes", Parent.directory(folder2.identifier()));

            final ItemPath built = resolver.pathOf(notes.identifier()).orElseThrow();

            assertThat(resolver.resolve(built)).isEqualTo(notes.identifier());
        }
    }
}
