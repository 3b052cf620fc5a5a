package io.github.gitmaster.shelf;

import java.time.Instant;

/**
 * A stored capture of uncommitted changes (a git stash entry).
 *
 * <p>{@code position} is the entry's index in the stack at the time it was read ({@code stash@{position}}). It is not
 * an identity: any save, discard or pop renumbers the stack, so a Snapshot must be re-read after every mutation.
 *
 * @param commitId object id of the stored capture, useful for recovery with {@code git stash store}
 */
public record Snapshot(
        int position,
        String label,
        String originBranch,
        int fileCount,
        int additions,
        int deletions,
        Instant createdAt,
        boolean hasUntrackedLayer,
        String commitId) {

    public String stashRef() {
        return "stash@{" + position + "}";
    }
}
