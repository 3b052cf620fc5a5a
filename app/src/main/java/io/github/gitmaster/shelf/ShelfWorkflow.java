package io.github.gitmaster.shelf;

import io.github.gitmaster.GitMasterSettings;
import io.github.gitmaster.shelf.ShelfException.ConflictException;
import io.github.gitmaster.shelf.ShelfException.FatalException;
import io.github.gitmaster.shelf.ShelfException.MixedChangesException;
import io.github.gitmaster.shelf.ShelfException.NoChangesException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * User-level shelf operations for front ends. Confirmation is the caller's job; every mutating operation notifies the
 * refresh callback once it has finished, successfully or not.
 */
public final class ShelfWorkflow {
    private static final Logger logger = LogManager.getLogger(ShelfWorkflow.class);

    public enum Mode {
        /** Shelve everything and clean the working tree. */
        ALL,
        /** Shelve everything but leave staged changes in place, ready to commit. */
        KEEP_STAGED,
        /** Shelve only staged changes; unstaged changes stay in the working tree. */
        STAGED_ONLY
    }

    public record ShelfListing(Snapshot snapshot, List<ChangeEntry> files) {}

    private final SnapshotStore store;
    private final PreviewCalculator previewCalculator;
    private final ConflictClassifier classifier;
    private final ReconciliationEngine engine;
    private final Runnable refreshCallback;

    public ShelfWorkflow(SnapshotStore store, PreviewCalculator previewCalculator, Runnable refreshCallback) {
        this.store = store;
        this.previewCalculator = previewCalculator;
        this.classifier = new ConflictClassifier();
        this.engine = new ReconciliationEngine(store, previewCalculator, classifier, refreshCallback);
        this.refreshCallback = refreshCallback;
    }

    public PreviewSummary preview(boolean includeUntracked) throws ShelfException {
        try {
            return previewCalculator.computePreview(includeUntracked);
        } catch (GitAPIException e) {
            throw new FatalException(
                    "Unable to read working-tree changes: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
    }

    public void createShelf(String label, Mode mode, boolean includeUntracked) throws ShelfException {
        if (label.isBlank()) {
            throw new IllegalArgumentException("Shelf name cannot be empty");
        }

        if (mode == Mode.STAGED_ONLY) {
            var summary = preview(false);
            if (summary.staged().isEmpty()) {
                throw new NoChangesException("No staged changes to shelve");
            }
            var mixed = summary.mixedPaths();
            if (!mixed.isEmpty()) {
                throw new MixedChangesException(mixed);
            }
        } else if (preview(includeUntracked).isEmpty()) {
            throw new NoChangesException("No changes to shelve");
        }

        try {
            switch (mode) {
                case ALL -> store.save(label, includeUntracked, false);
                case KEEP_STAGED -> store.save(label, includeUntracked, true);
                case STAGED_ONLY -> store.saveStagedOnly(label);
            }
            logger.info("Shelf '{}' created ({})", label, mode);
        } catch (GitAPIException e) {
            throw new FatalException("Failed to create shelf: " + e.getMessage(), ShelfException.NO_STEP, e);
        } finally {
            refreshCallback.run();
        }
    }

    /** Apply a shelf, keeping it in the list. Applying does not change the stack, so no refresh is signalled. */
    public void applyShelf(int position) throws ShelfException {
        var snapshot = snapshotAt(position);
        try {
            store.apply(position);
            logger.info("Applied shelf '{}'", snapshot.label());
        } catch (GitAPIException e) {
            throw classified("Cannot apply shelf '%s'".formatted(snapshot.label()), e);
        }
    }

    public void popShelf(int position) throws ShelfException {
        var snapshot = snapshotAt(position);
        try {
            store.applyAndDiscard(position);
            logger.info("Popped shelf '{}'", snapshot.label());
        } catch (GitAPIException e) {
            throw classified("Cannot pop shelf '%s'".formatted(snapshot.label()), e);
        } finally {
            refreshCallback.run();
        }
    }

    public void deleteShelf(int position) throws ShelfException {
        var snapshot = snapshotAt(position);
        try {
            store.discard(position);
            logger.info("Deleted shelf '{}' (commit {})", snapshot.label(), snapshot.commitId());
        } catch (GitAPIException e) {
            throw new FatalException("Failed to delete shelf: " + e.getMessage(), ShelfException.NO_STEP, e);
        } finally {
            refreshCallback.run();
        }
    }

    /** Adds the current changes to the shelf at {@code position}, which keeps its label. */
    public void mergeIntoShelf(int position) throws ShelfException {
        var snapshot = snapshotAt(position);
        engine.mergeWorkingChangesIntoSnapshot(position, snapshot.label());
    }

    /** Shelves newest first, with their files. Both limits are clamped to the allowed range. */
    public List<ShelfListing> listShelves(int maxShelves, int maxFilesPerShelf) throws ShelfException {
        int shelfLimit = GitMasterSettings.clampShelves(maxShelves);
        int fileLimit = GitMasterSettings.clampFilesPerShelf(maxFilesPerShelf);
        try {
            var result = new ArrayList<ShelfListing>();
            for (var snapshot : store.list().stream().limit(shelfLimit).toList()) {
                var files = store.files(snapshot.position()).stream()
                        .limit(fileLimit)
                        .toList();
                result.add(new ShelfListing(snapshot, files));
            }
            return result;
        } catch (GitAPIException e) {
            throw new FatalException("Unable to read shelves: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
    }

    /** Paths the shelf touches that also have uncommitted changes; applying it may conflict on these. */
    public List<String> conflictingPaths(int position) throws ShelfException {
        var current = preview(true).allPaths();
        try {
            return store.files(position).stream()
                    .map(ChangeEntry::path)
                    .filter(current::contains)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (GitAPIException e) {
            throw new FatalException("Unable to read shelf files: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
    }

    private Snapshot snapshotAt(int position) throws ShelfException {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        List<Snapshot> snapshots;
        try {
            snapshots = store.list();
        } catch (GitAPIException e) {
            throw new FatalException("Unable to read shelves: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
        if (position >= snapshots.size()) {
            throw new FatalException(
                    "No shelf at position %d (%d shelves)".formatted(position, snapshots.size()),
                    ShelfException.NO_STEP,
                    null);
        }
        return snapshots.get(position);
    }

    private ShelfException classified(String message, GitAPIException e) {
        if (classifier.isConflict(e)) {
            return new ConflictException(
                    message + ": your local changes would be overwritten. Commit or shelve them first.",
                    ShelfException.NO_STEP,
                    e);
        }
        return new FatalException(message + ": " + e.getMessage(), ShelfException.NO_STEP, e);
    }

    /** Human-readable preview: staged, unstaged and untracked sections followed by totals. */
    public static String formatPreview(PreviewSummary summary) {
        var lines = new ArrayList<String>();
        if (!summary.staged().isEmpty()) {
            lines.add("Staged:");
            summary.staged().forEach(f -> lines.add(formatEntry(f)));
            lines.add("");
        }
        if (!summary.unstaged().isEmpty()) {
            lines.add("Unstaged:");
            summary.unstaged().forEach(f -> lines.add(formatEntry(f)));
            lines.add("");
        }
        if (!summary.untracked().isEmpty()) {
            lines.add("Untracked:");
            summary.untracked().forEach(p -> lines.add("   + " + p));
            lines.add("");
        }
        if (summary.totalFiles() > 0) {
            lines.add("Total: %d file(s), +%d -%d"
                    .formatted(summary.totalFiles(), summary.totalAdditions(), summary.totalDeletions()));
        }
        return String.join("\n", lines);
    }

    private static String formatEntry(ChangeEntry entry) {
        return "   %s (+%d -%d)".formatted(entry.path(), entry.additions(), entry.deletions());
    }
}
