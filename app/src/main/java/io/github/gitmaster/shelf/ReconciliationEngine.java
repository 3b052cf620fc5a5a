package io.github.gitmaster.shelf;

import io.github.gitmaster.shelf.ShelfException.CleanupFailureException;
import io.github.gitmaster.shelf.ShelfException.ConflictException;
import io.github.gitmaster.shelf.ShelfException.FatalException;
import io.github.gitmaster.shelf.ShelfException.NoChangesException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * Adds the current uncommitted changes to an existing snapshot.
 *
 * <p>The stack only offers save/apply/discard/apply-and-discard, none of which is transactional, so the merge is run
 * as a six-step saga in which every step has its own compensation:
 *
 * <ol>
 *   <li>save the working tree as a temporary capture (now at position 0)
 *   <li>shift the target position by one to account for that insertion
 *   <li>apply the target onto the now-clean working tree
 *   <li>discard the target, whose content now lives in the working tree
 *   <li>apply-and-discard the temporary capture on top, without restoring its index, producing the union
 *   <li>save the union under the combined label
 * </ol>
 *
 * <p>Every call drives to a terminal state; the refresh callback runs once per terminal outcome after the
 * precondition has passed, because the stack topology may have changed even when the merge failed.
 */
public class ReconciliationEngine {
    private static final Logger logger = LogManager.getLogger(ReconciliationEngine.class);

    public static final String TEMP_LABEL = "RECONCILE_TEMP";

    private final SnapshotStore store;
    private final PreviewCalculator previewCalculator;
    private final ConflictClassifier classifier;
    private final Runnable refreshCallback;

    public ReconciliationEngine(
            SnapshotStore store,
            PreviewCalculator previewCalculator,
            ConflictClassifier classifier,
            Runnable refreshCallback) {
        this.store = store;
        this.previewCalculator = previewCalculator;
        this.classifier = classifier;
        this.refreshCallback = refreshCallback;
    }

    public ReconciliationEngine(SnapshotStore store, PreviewCalculator previewCalculator, Runnable refreshCallback) {
        this(store, previewCalculator, new ConflictClassifier(), refreshCallback);
    }

    /**
     * Merges the working tree's uncommitted changes into the snapshot currently at {@code targetPosition}, storing the
     * union at position 0 as {@code combinedLabel}.
     *
     * @throws NoChangesException the working tree is clean; no primitive was called
     * @throws ConflictException local modifications would have been overwritten; safe to retry after resolving them
     * @throws FatalException an unexpected failure, see {@link ShelfException#step()}
     * @throws CleanupFailureException a failure whose compensation also failed
     */
    public synchronized void mergeWorkingChangesIntoSnapshot(int targetPosition, String combinedLabel)
            throws ShelfException {
        if (targetPosition < 0) {
            throw new IllegalArgumentException("target position must be non-negative: " + targetPosition);
        }
        if (combinedLabel.isBlank()) {
            throw new IllegalArgumentException("combined label must not be blank");
        }

        PreviewSummary preview;
        try {
            preview = previewCalculator.computePreview(true);
        } catch (GitAPIException e) {
            throw new FatalException(
                    "Unable to read working-tree changes: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
        if (preview.isEmpty()) {
            throw new NoChangesException("No changes to add to the shelf");
        }

        try {
            runSaga(targetPosition, combinedLabel, preview);
            logger.info("Added {} changed file(s) to shelf '{}'", preview.totalFiles(), combinedLabel);
        } finally {
            refreshCallback.run();
        }
    }

    private void runSaga(int targetPosition, String combinedLabel, PreviewSummary preview) throws ShelfException {
        var target = readTarget(targetPosition);
        boolean captureUntracked = !preview.untracked().isEmpty();

        // 1. temp capture
        logger.debug("Step 1: saving working tree as {} (untracked={})", TEMP_LABEL, captureUntracked);
        try {
            store.save(TEMP_LABEL, captureUntracked, false);
        } catch (GitAPIException e) {
            throw new FatalException("Could not set aside the current changes: " + e.getMessage(), 1, e);
        }

        // 2 and 3. the temp capture pushed the target up by one
        int applyPosition = PositionTracker.shift(targetPosition, 1);
        logger.debug("Step 3: applying shelf '{}' from position {}", target.label(), applyPosition);
        try {
            store.apply(applyPosition);
        } catch (GitAPIException e) {
            var message = "Could not apply shelf '%s': %s".formatted(target.label(), e.getMessage());
            ShelfException primary = classifier.isConflict(e)
                    ? new ConflictException(message + ". Resolve the conflicting files and try again.", 3, e)
                    : new FatalException(message, 3, e);
            restoreTempCapture(primary);
            throw primary;
        }

        // 4. the target's content is in the working tree now
        int discardPosition = PositionTracker.shift(targetPosition, 1);
        logger.debug("Step 4: discarding shelf '{}' at position {}", target.label(), discardPosition);
        try {
            store.discard(discardPosition);
        } catch (GitAPIException e) {
            var primary = new FatalException(
                    "Could not remove the original shelf '%s': %s".formatted(target.label(), e.getMessage()), 4, e);
            restoreTempCapture(primary);
            throw primary;
        }

        // 5. union of target and temp capture; the index may already hold the target's staged layer
        logger.debug("Step 5: merging {} back from position 0", TEMP_LABEL);
        try {
            store.mergeAndDiscard(0);
        } catch (GitAPIException e) {
            var primary = new ConflictException(
                    "Your changes conflict with shelf '%s' and could not be merged: %s"
                            .formatted(target.label(), e.getMessage()),
                    5,
                    e);
            discardTempCaptureByLabel(primary);
            throw primary;
        }

        // 6. store the union
        boolean includeUntracked = target.hasUntrackedLayer() || captureUntracked;
        logger.debug("Step 6: saving combined shelf '{}' (untracked={})", combinedLabel, includeUntracked);
        try {
            store.save(combinedLabel, includeUntracked, false);
        } catch (GitAPIException e) {
            throw new FatalException(
                    ("Combined changes are in the working tree but could not be shelved as '%s': %s."
                                    + " Shelve them manually.")
                            .formatted(combinedLabel, e.getMessage()),
                    6,
                    e);
        }
    }

    private Snapshot readTarget(int targetPosition) throws ShelfException {
        List<Snapshot> snapshots;
        try {
            snapshots = store.list();
        } catch (GitAPIException e) {
            throw new FatalException("Unable to read shelves: " + e.getMessage(), ShelfException.NO_STEP, e);
        }
        if (targetPosition >= snapshots.size()) {
            throw new FatalException(
                    "No shelf at position %d (%d shelves)".formatted(targetPosition, snapshots.size()),
                    ShelfException.NO_STEP,
                    null);
        }
        return snapshots.get(targetPosition);
    }

    /** Compensation for steps 3 and 4: put the temp capture back into the working tree and off the stack. */
    private void restoreTempCapture(ShelfException primary) throws CleanupFailureException {
        logger.warn("Step {} failed ({}); restoring {} from position 0", primary.step(), primary.kind(), TEMP_LABEL);
        try {
            store.applyAndDiscard(0);
        } catch (GitAPIException cleanup) {
            logger.error("Could not restore {} after step {} failed", TEMP_LABEL, primary.step(), cleanup);
            throw new CleanupFailureException(primary, cleanup);
        }
    }

    /**
     * Compensation for step 5. The temp capture could not be merged back, so it is located by label (its position is
     * unknown after a partial apply) and discarded. The target was already discarded in step 4; its content stays in
     * the working tree.
     */
    private void discardTempCaptureByLabel(ShelfException primary) throws CleanupFailureException {
        logger.warn("Step 5 failed; discarding {} by label", TEMP_LABEL);
        try {
            var temp = store.list().stream()
                    .filter(s -> TEMP_LABEL.equals(s.label()))
                    .findFirst();
            if (temp.isEmpty()) {
                logger.warn("{} is no longer on the stack; nothing to discard", TEMP_LABEL);
                return;
            }
            var snapshot = temp.get();
            store.discard(snapshot.position());
            logger.warn(
                    "Discarded {} (commit {}); recover it with `git stash store {}` if needed",
                    TEMP_LABEL,
                    snapshot.commitId(),
                    snapshot.commitId());
        } catch (GitAPIException cleanup) {
            logger.error("Could not discard {} after step 5 failed", TEMP_LABEL, cleanup);
            throw new CleanupFailureException(primary, cleanup);
        }
    }
}
