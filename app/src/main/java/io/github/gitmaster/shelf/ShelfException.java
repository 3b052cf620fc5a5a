package io.github.gitmaster.shelf;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A terminal outcome of a shelf operation that did not succeed. {@link #kind()} tells the caller whether a manual
 * retry is safe; {@link #step()} names the reconciliation step that failed.
 */
public abstract class ShelfException extends Exception {

    /** Step number for failures outside the reconciliation saga, or in its precondition. */
    public static final int NO_STEP = 0;

    public enum Kind {
        /** Nothing to capture; no mutation was attempted. */
        NO_CHANGES,
        /** Local modifications would have been overwritten; prior topology was restored as far as possible. */
        CONFLICT,
        /** Unexpected failure unrelated to overwrite conflicts. */
        FATAL,
        /** A failure whose compensating action also failed; the stack may be inconsistent. */
        CLEANUP_FAILURE,
        /** Some paths are both staged and unstaged, which a staged-only capture cannot express. */
        MIXED_CHANGES
    }

    private final int step;

    protected ShelfException(String message, int step, @Nullable Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public abstract Kind kind();

    public int step() {
        return step;
    }

    /** One-line summary naming the kind and step, suitable for a notification. */
    public String describe() {
        return step == NO_STEP
                ? "%s: %s".formatted(kind(), getMessage())
                : "%s at step %d: %s".formatted(kind(), step, getMessage());
    }

    public static class NoChangesException extends ShelfException {
        public NoChangesException(String message) {
            super(message, NO_STEP, null);
        }

        @Override
        public Kind kind() {
            return Kind.NO_CHANGES;
        }
    }

    public static class ConflictException extends ShelfException {
        public ConflictException(String message, int step, @Nullable Throwable cause) {
            super(message, step, cause);
        }

        @Override
        public Kind kind() {
            return Kind.CONFLICT;
        }
    }

    public static class FatalException extends ShelfException {
        public FatalException(String message, int step, @Nullable Throwable cause) {
            super(message, step, cause);
        }

        @Override
        public Kind kind() {
            return Kind.FATAL;
        }
    }

    /**
     * Carries both the primary failure and the failure of the compensation that followed it. The cleanup failure is
     * also attached as a suppressed exception so stack traces show both.
     */
    public static class CleanupFailureException extends ShelfException {
        private final ShelfException primary;
        private final Throwable cleanupOutcome;

        public CleanupFailureException(ShelfException primary, Throwable cleanupOutcome) {
            super(
                    "%s; cleanup also failed: %s".formatted(primary.getMessage(), cleanupOutcome.getMessage()),
                    primary.step(),
                    primary);
            this.primary = primary;
            this.cleanupOutcome = cleanupOutcome;
            addSuppressed(cleanupOutcome);
        }

        public ShelfException primary() {
            return primary;
        }

        public Throwable cleanupOutcome() {
            return cleanupOutcome;
        }

        @Override
        public Kind kind() {
            return Kind.CLEANUP_FAILURE;
        }
    }

    public static class MixedChangesException extends ShelfException {
        private final List<String> mixedPaths;

        public MixedChangesException(List<String> mixedPaths) {
            super(
                    "These files have both staged and unstaged changes: " + String.join(", ", mixedPaths),
                    NO_STEP,
                    null);
            this.mixedPaths = List.copyOf(mixedPaths);
        }

        public List<String> mixedPaths() {
            return mixedPaths;
        }

        @Override
        public Kind kind() {
            return Kind.MIXED_CHANGES;
        }
    }
}
