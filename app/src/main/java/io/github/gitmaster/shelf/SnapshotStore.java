package io.github.gitmaster.shelf;

import java.util.List;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * The primitive operations on the snapshot stack. Implementations hold no business logic: every call maps to one
 * underlying command, and none of them is transactional with respect to the others.
 *
 * <p>Position 0 is always the most recent snapshot. A save shifts every existing position up by one; removing the
 * snapshot at P shifts every position above P down by one.
 */
public interface SnapshotStore {

    /**
     * Inserts a new snapshot at position 0 capturing the current changes.
     *
     * @param includeUntracked also capture untracked files
     * @param keepStagedInWorkingTree leave staged changes in place after capturing them
     * @throws GitAPIException {@code NoLocalChangesException} if nothing matched the requested layers
     */
    void save(String label, boolean includeUntracked, boolean keepStagedInWorkingTree) throws GitAPIException;

    /** Inserts a new snapshot at position 0 capturing only the staged layer; unstaged changes stay put. */
    void saveStagedOnly(String label) throws GitAPIException;

    /**
     * Copies a snapshot's content, including which changes were staged, onto the working tree without removing it. If
     * this fails on a clean working tree, the tree is left clean.
     */
    void apply(int position) throws GitAPIException;

    /** Removes a snapshot without touching the working tree. */
    void discard(int position) throws GitAPIException;

    /** Apply followed by discard. If applying fails, nothing is discarded. */
    void applyAndDiscard(int position) throws GitAPIException;

    /**
     * Apply followed by discard, onto a working tree that may hold its own staged changes. The snapshot's index is not
     * restored, so modifications it had staged come back unstaged. If applying fails, nothing is discarded.
     */
    void mergeAndDiscard(int position) throws GitAPIException;

    /** Fresh, uncached read of the stack, ordered by position ascending. */
    List<Snapshot> list() throws GitAPIException;

    /** Files stored in the snapshot at {@code position}: the tracked layer first, then the untracked layer. */
    List<ChangeEntry> files(int position) throws GitAPIException;
}
