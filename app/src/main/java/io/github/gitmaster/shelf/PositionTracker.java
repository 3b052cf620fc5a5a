package io.github.gitmaster.shelf;

/**
 * Maps a stack position captured earlier to the position the same snapshot has now, given how many snapshots were
 * inserted in between. Call it immediately before each primitive that takes the position; never keep the result
 * across a call that can insert or remove a snapshot.
 */
public final class PositionTracker {
    private PositionTracker() {}

    public static int shift(int originalPosition, int insertionsSinceCapture) {
        if (originalPosition < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + originalPosition);
        }
        if (insertionsSinceCapture < 0) {
            throw new IllegalArgumentException("insertions must be non-negative: " + insertionsSinceCapture);
        }
        return Math.addExact(originalPosition, insertionsSinceCapture);
    }
}
