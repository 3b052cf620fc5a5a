package io.github.gitmaster.shelf;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gitmaster.shelf.ShelfException.ConflictException;
import io.github.gitmaster.shelf.ShelfException.FatalException;
import io.github.gitmaster.shelf.ShelfException.MixedChangesException;
import io.github.gitmaster.shelf.ShelfException.NoChangesException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ShelfWorkflowTest {
    private InMemorySnapshotStore store;
    private AtomicInteger refreshes;
    private ShelfWorkflow workflow;

    @BeforeEach
    void setUp() {
        store = new InMemorySnapshotStore();
        refreshes = new AtomicInteger();
        workflow = new ShelfWorkflow(store, store, refreshes::incrementAndGet);
    }

    @Test
    void createShelfCapturesEverything() throws Exception {
        store.stage("s.txt", "s").modify("m.txt", "m");

        workflow.createShelf("wip", ShelfWorkflow.Mode.ALL, false);

        assertEquals(List.of("save(wip,false,false)"), store.calls());
        assertEquals(List.of("wip"), store.labels());
        assertTrue(store.workingTree().isEmpty());
        assertEquals(1, refreshes.get());
    }

    @Test
    void createShelfWithoutChangesDoesNothing() {
        store.createUntracked("u.txt", "u");

        var e = assertThrows(
                NoChangesException.class, () -> workflow.createShelf("wip", ShelfWorkflow.Mode.ALL, false));

        assertEquals(ShelfException.Kind.NO_CHANGES, e.kind());
        assertTrue(store.calls().isEmpty());
        assertEquals(0, refreshes.get());
    }

    @Test
    void createShelfCanIncludeUntrackedFiles() throws Exception {
        store.createUntracked("u.txt", "u");

        workflow.createShelf("new files", ShelfWorkflow.Mode.ALL, true);

        assertEquals(List.of("save(new files,true,false)"), store.calls());
        assertTrue(store.untrackedLayerAt(0));
    }

    @Test
    void keepStagedLeavesStagedChangesInPlace() throws Exception {
        store.stage("s.txt", "s").modify("m.txt", "m");

        workflow.createShelf("wip", ShelfWorkflow.Mode.KEEP_STAGED, false);

        assertEquals(List.of("save(wip,false,true)"), store.calls());
        assertEquals(Map.of("s.txt", "s"), store.workingTree());
    }

    @Test
    void stagedOnlyShelvesJustTheIndex() throws Exception {
        store.stage("s.txt", "s").modify("m.txt", "m");

        workflow.createShelf("staged", ShelfWorkflow.Mode.STAGED_ONLY, false);

        assertEquals(List.of("saveStagedOnly(staged)"), store.calls());
        assertEquals(Map.of("s.txt", "s"), store.contentAt(0));
        assertEquals(Map.of("m.txt", "m"), store.workingTree());
    }

    @Test
    void stagedOnlyNeedsStagedChanges() {
        store.modify("m.txt", "m");

        assertThrows(
                NoChangesException.class,
                () -> workflow.createShelf("staged", ShelfWorkflow.Mode.STAGED_ONLY, false));
        assertTrue(store.calls().isEmpty());
    }

    @Test
    void stagedOnlyRefusesMixedFiles() {
        store.stage("a.txt", "index").modify("a.txt", "worktree").stage("b.txt", "b");

        var e = assertThrows(
                MixedChangesException.class,
                () -> workflow.createShelf("staged", ShelfWorkflow.Mode.STAGED_ONLY, false));

        assertEquals(List.of("a.txt"), e.mixedPaths());
        assertEquals(ShelfException.Kind.MIXED_CHANGES, e.kind());
        assertTrue(store.calls().isEmpty());
    }

    @Test
    void blankShelfNameIsRejected() {
        store.modify("m.txt", "m");
        assertThrows(
                IllegalArgumentException.class, () -> workflow.createShelf("  ", ShelfWorkflow.Mode.ALL, false));
    }

    @Test
    void applyKeepsShelfAndDoesNotRefresh() throws Exception {
        store.withSnapshot("A", Map.of("a.txt", "alpha"));

        workflow.applyShelf(0);

        assertEquals(List.of("A"), store.labels());
        assertEquals(Map.of("a.txt", "alpha"), store.workingTree());
        assertEquals(0, refreshes.get());
    }

    @Test
    void applyOverLocalChangesIsConflict() {
        store.withSnapshot("A", Map.of("a.txt", "alpha")).modify("a.txt", "local");

        var e = assertThrows(ConflictException.class, () -> workflow.applyShelf(0));

        assertTrue(e.getMessage().contains("would be overwritten"));
        assertEquals(Map.of("a.txt", "local"), store.workingTree());
    }

    @Test
    void popRemovesShelfAndRefreshes() throws Exception {
        store.withSnapshot("A", Map.of("a.txt", "alpha")).withSnapshot("B", Map.of("b.txt", "beta"));

        workflow.popShelf(1);

        assertEquals(List.of("A"), store.labels());
        assertEquals(Map.of("b.txt", "beta"), store.workingTree());
        assertEquals(1, refreshes.get());
    }

    @Test
    void failedPopKeepsShelfButStillRefreshes() {
        store.withSnapshot("A", Map.of("a.txt", "alpha")).modify("a.txt", "local");

        assertThrows(ConflictException.class, () -> workflow.popShelf(0));

        assertEquals(List.of("A"), store.labels());
        assertEquals(1, refreshes.get());
    }

    @Test
    void deleteRemovesWithoutApplying() throws Exception {
        store.withSnapshot("A", Map.of("a.txt", "alpha"));

        workflow.deleteShelf(0);

        assertTrue(store.labels().isEmpty());
        assertTrue(store.workingTree().isEmpty());
    }

    @Test
    void unknownPositionIsFatal() {
        store.withSnapshot("A", Map.of("a.txt", "alpha"));

        var e = assertThrows(FatalException.class, () -> workflow.deleteShelf(4));

        assertTrue(e.describe().startsWith("FATAL: No shelf at position 4"));
        assertEquals(List.of("A"), store.labels());
        assertEquals(0, refreshes.get());
    }

    @Test
    void mergeKeepsTargetLabel() throws Exception {
        store.withSnapshot("A", Map.of("a.txt", "alpha"))
                .withSnapshot("B", Map.of("b.txt", "beta"))
                .modify("m.txt", "m");

        workflow.mergeIntoShelf(1);

        assertEquals(List.of("B", "A"), store.labels());
        assertEquals(Map.of("b.txt", "beta", "m.txt", "m"), store.contentAt(0));
        assertEquals(1, refreshes.get());
    }

    @Test
    void listingClampsLimits() throws Exception {
        store.withSnapshot("A", Map.of("a1.txt", "1", "a2.txt", "2"))
                .withSnapshot("B", Map.of("b.txt", "b"))
                .withSnapshot("C", Map.of("c.txt", "c"));

        var clampedLow = workflow.listShelves(0, -5);
        assertEquals(1, clampedLow.size());
        assertEquals(List.of(new ChangeEntry("a1.txt", 1, 0)), clampedLow.get(0).files());

        var all = workflow.listShelves(10_000, 10_000);
        assertEquals(List.of("A", "B", "C"), all.stream().map(l -> l.snapshot().label()).toList());
        assertEquals(2, all.get(0).files().size());
        assertEquals(2, all.get(0).snapshot().fileCount());
    }

    @Test
    void conflictingPathsAreTheOverlapWithLocalChanges() throws Exception {
        store.withSnapshot("A", Map.of("a.txt", "alpha", "b.txt", "beta"))
                .modify("b.txt", "local")
                .createUntracked("z.txt", "z");

        assertEquals(List.of("b.txt"), workflow.conflictingPaths(0));
    }

    @Test
    void previewIsFormattedBySection() {
        var summary = new PreviewSummary(
                List.of(new ChangeEntry("a.txt", 3, 1)),
                List.of(new ChangeEntry("b.txt", 0, 2)),
                List.of("c.txt"));

        assertEquals(
                String.join(
                        "\n",
                        "Staged:",
                        "   a.txt (+3 -1)",
                        "",
                        "Unstaged:",
                        "   b.txt (+0 -2)",
                        "",
                        "Untracked:",
                        "   + c.txt",
                        "",
                        "Total: 3 file(s), +3 -3"),
                ShelfWorkflow.formatPreview(summary));
    }

    @Test
    void emptyPreviewFormatsToNothing() {
        assertEquals("", ShelfWorkflow.formatPreview(PreviewSummary.EMPTY));
    }
}
