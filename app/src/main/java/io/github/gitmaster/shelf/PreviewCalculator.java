package io.github.gitmaster.shelf;

import org.eclipse.jgit.api.errors.GitAPIException;

/** Read-only view of the working tree's uncommitted changes. */
public interface PreviewCalculator {

    /**
     * @param includeUntracked when false, {@link PreviewSummary#untracked()} is always empty
     */
    PreviewSummary computePreview(boolean includeUntracked) throws GitAPIException;

    /** True iff some path has both staged and unstaged changes. */
    default boolean detectMixedChanges() throws GitAPIException {
        return computePreview(false).hasMixedChanges();
    }
}
