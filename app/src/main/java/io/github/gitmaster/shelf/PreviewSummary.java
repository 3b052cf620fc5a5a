package io.github.gitmaster.shelf;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Uncommitted changes in the working tree, split by layer. */
public record PreviewSummary(List<ChangeEntry> staged, List<ChangeEntry> unstaged, List<String> untracked) {

    public static final PreviewSummary EMPTY = new PreviewSummary(List.of(), List.of(), List.of());

    public PreviewSummary {
        staged = List.copyOf(staged);
        unstaged = List.copyOf(unstaged);
        untracked = List.copyOf(untracked);
    }

    public boolean isEmpty() {
        return staged.isEmpty() && unstaged.isEmpty() && untracked.isEmpty();
    }

    public boolean hasTrackedChanges() {
        return !staged.isEmpty() || !unstaged.isEmpty();
    }

    /**
     * Paths with both staged and unstaged modifications, sorted. {@code stash push --staged} cannot split these, so a
     * staged-only capture must be refused while any exist.
     */
    public List<String> mixedPaths() {
        var unstagedPaths = unstaged.stream().map(ChangeEntry::path).collect(Collectors.toSet());
        return staged.stream()
                .map(ChangeEntry::path)
                .filter(unstagedPaths::contains)
                .distinct()
                .sorted()
                .toList();
    }

    public boolean hasMixedChanges() {
        return !mixedPaths().isEmpty();
    }

    /** Every path touched in any layer. */
    public Set<String> allPaths() {
        var paths = new HashSet<String>();
        staged.forEach(e -> paths.add(e.path()));
        unstaged.forEach(e -> paths.add(e.path()));
        paths.addAll(untracked);
        return paths;
    }

    public int totalFiles() {
        return staged.size() + unstaged.size() + untracked.size();
    }

    public int totalAdditions() {
        return staged.stream().mapToInt(ChangeEntry::additions).sum()
                + unstaged.stream().mapToInt(ChangeEntry::additions).sum();
    }

    public int totalDeletions() {
        return staged.stream().mapToInt(ChangeEntry::deletions).sum()
                + unstaged.stream().mapToInt(ChangeEntry::deletions).sum();
    }
}
