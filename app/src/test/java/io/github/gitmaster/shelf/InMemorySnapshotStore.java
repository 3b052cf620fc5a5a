package io.github.gitmaster.shelf;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * An in-memory stash and working tree for testing. It models the three layers (staged, unstaged, untracked) as
 * path-to-content maps and behaves like {@code git stash}: saving clears the captured layers, applying refuses to
 * overwrite a path that has local changes, and popping keeps the entry when the apply half fails. Like
 * {@code stash apply --index}, restoring a staged layer is refused while the index has staged changes of its own;
 * {@link #mergeAndDiscard(int)} does not restore the index and is not subject to that.
 *
 * <p>Failures can be injected for the n-th call of any operation.
 */
public class InMemorySnapshotStore implements SnapshotStore, PreviewCalculator {

    public enum Op {
        SAVE,
        SAVE_STAGED,
        APPLY,
        DISCARD,
        APPLY_AND_DISCARD,
        MERGE_AND_DISCARD,
        LIST,
        FILES
    }

    static final class Entry {
        final String label;
        final Map<String, String> staged;
        final Map<String, String> unstaged;
        final Map<String, String> untracked;
        final String commitId;

        Entry(String label, Map<String, String> staged, Map<String, String> unstaged, Map<String, String> untracked,
                String commitId) {
            this.label = label;
            this.staged = new TreeMap<>(staged);
            this.unstaged = new TreeMap<>(unstaged);
            this.untracked = new TreeMap<>(untracked);
            this.commitId = commitId;
        }

        Map<String, String> allFiles() {
            var all = new TreeMap<String, String>();
            all.putAll(staged);
            all.putAll(unstaged);
            all.putAll(untracked);
            return all;
        }
    }

    public static class FakeGitException extends GitAPIException {
        public FakeGitException(String message) {
            super(message);
        }
    }

    private final List<Entry> stack = new ArrayList<>();
    private final Map<String, String> staged = new TreeMap<>();
    private final Map<String, String> unstaged = new TreeMap<>();
    private final Map<String, String> untracked = new TreeMap<>();

    private final List<String> calls = new ArrayList<>();
    private final Map<Op, Integer> callCounts = new HashMap<>();
    private final Map<Op, Map<Integer, GitAPIException>> failures = new HashMap<>();
    private int nextCommit = 1;

    // --- setup ---

    /** Pushes a snapshot below the existing ones, so entries are added oldest last in reading order. */
    public InMemorySnapshotStore withSnapshot(String label, Map<String, String> files) {
        stack.add(new Entry(label, Map.of(), files, Map.of(), newCommitId()));
        return this;
    }

    public InMemorySnapshotStore withStagedSnapshot(String label, Map<String, String> stagedFiles) {
        stack.add(new Entry(label, stagedFiles, Map.of(), Map.of(), newCommitId()));
        return this;
    }

    public InMemorySnapshotStore withUntrackedSnapshot(String label, Map<String, String> untrackedFiles) {
        stack.add(new Entry(label, Map.of(), Map.of(), untrackedFiles, newCommitId()));
        return this;
    }

    public InMemorySnapshotStore stage(String path, String content) {
        staged.put(path, content);
        return this;
    }

    public InMemorySnapshotStore modify(String path, String content) {
        unstaged.put(path, content);
        return this;
    }

    public InMemorySnapshotStore createUntracked(String path, String content) {
        untracked.put(path, content);
        return this;
    }

    /** Makes the {@code nth} (1-based) call of {@code op} fail with {@code error}. */
    public InMemorySnapshotStore failOn(Op op, int nth, GitAPIException error) {
        failures.computeIfAbsent(op, k -> new HashMap<>()).put(nth, error);
        return this;
    }

    public static GitAPIException overwriteConflict(String path) {
        return new FakeGitException(
                "error: Your local changes to the following files would be overwritten by merge:\n\t%s\n%s"
                        .formatted(path, "Please commit your changes or stash them before you merge."));
    }

    // --- inspection ---

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<String> labels() {
        return stack.stream().map(e -> e.label).toList();
    }

    public Map<String, String> contentAt(int position) {
        return stack.get(position).allFiles();
    }

    public boolean untrackedLayerAt(int position) {
        return !stack.get(position).untracked.isEmpty();
    }

    public Map<String, String> stagedAt(int position) {
        return Map.copyOf(stack.get(position).staged);
    }

    public Map<String, String> stagedInWorkingTree() {
        return Map.copyOf(staged);
    }

    public Map<String, String> workingTree() {
        var all = new TreeMap<String, String>();
        all.putAll(staged);
        all.putAll(unstaged);
        all.putAll(untracked);
        return all;
    }

    public int size() {
        return stack.size();
    }

    // --- PreviewCalculator ---

    @Override
    public PreviewSummary computePreview(boolean includeUntracked) {
        return new PreviewSummary(
                entries(staged),
                entries(unstaged),
                includeUntracked ? List.copyOf(untracked.keySet()) : List.of());
    }

    private static List<ChangeEntry> entries(Map<String, String> layer) {
        return layer.entrySet().stream()
                .map(e -> new ChangeEntry(e.getKey(), lineCount(e.getValue()), 0))
                .toList();
    }

    private static int lineCount(String content) {
        return content.isEmpty() ? 0 : content.split("\n", -1).length;
    }

    // --- SnapshotStore ---

    @Override
    public void save(String label, boolean includeUntracked, boolean keepStagedInWorkingTree) throws GitAPIException {
        record(Op.SAVE, "save(%s,%s,%s)".formatted(label, includeUntracked, keepStagedInWorkingTree));
        if (staged.isEmpty() && unstaged.isEmpty() && (!includeUntracked || untracked.isEmpty())) {
            throw new FakeGitException("No local changes to save");
        }
        var capturedUntracked = includeUntracked ? untracked : Map.<String, String>of();
        stack.add(0, new Entry(label, staged, unstaged, capturedUntracked, newCommitId()));
        if (!keepStagedInWorkingTree) {
            staged.clear();
        }
        unstaged.clear();
        if (includeUntracked) {
            untracked.clear();
        }
    }

    @Override
    public void saveStagedOnly(String label) throws GitAPIException {
        record(Op.SAVE_STAGED, "saveStagedOnly(%s)".formatted(label));
        if (staged.isEmpty()) {
            throw new FakeGitException("No local changes to save");
        }
        stack.add(0, new Entry(label, staged, Map.of(), Map.of(), newCommitId()));
        staged.clear();
    }

    @Override
    public void apply(int position) throws GitAPIException {
        record(Op.APPLY, "apply(%d)".formatted(position));
        applyEntry(entryAt(position), true);
    }

    @Override
    public void discard(int position) throws GitAPIException {
        record(Op.DISCARD, "discard(%d)".formatted(position));
        entryAt(position);
        stack.remove(position);
    }

    @Override
    public void applyAndDiscard(int position) throws GitAPIException {
        record(Op.APPLY_AND_DISCARD, "applyAndDiscard(%d)".formatted(position));
        applyEntry(entryAt(position), true);
        stack.remove(position);
    }

    @Override
    public void mergeAndDiscard(int position) throws GitAPIException {
        record(Op.MERGE_AND_DISCARD, "mergeAndDiscard(%d)".formatted(position));
        applyEntry(entryAt(position), false);
        stack.remove(position);
    }

    @Override
    public List<Snapshot> list() throws GitAPIException {
        record(Op.LIST, "list()");
        var result = new ArrayList<Snapshot>();
        for (int i = 0; i < stack.size(); i++) {
            var e = stack.get(i);
            var files = e.allFiles();
            int additions = files.values().stream().mapToInt(InMemorySnapshotStore::lineCount).sum();
            result.add(new Snapshot(
                    i,
                    e.label,
                    "main",
                    files.size(),
                    additions,
                    0,
                    Instant.EPOCH,
                    !e.untracked.isEmpty(),
                    e.commitId));
        }
        return result;
    }

    @Override
    public List<ChangeEntry> files(int position) throws GitAPIException {
        record(Op.FILES, "files(%d)".formatted(position));
        var e = entryAt(position);
        var result = new ArrayList<ChangeEntry>();
        var tracked = new TreeMap<String, String>();
        tracked.putAll(e.staged);
        tracked.putAll(e.unstaged);
        tracked.forEach((p, c) -> result.add(new ChangeEntry(p, lineCount(c), 0)));
        e.untracked.forEach((p, c) -> result.add(new ChangeEntry(p, lineCount(c), 0)));
        return result;
    }

    private void record(Op op, String call) throws GitAPIException {
        calls.add(call);
        int n = callCounts.merge(op, 1, Integer::sum);
        var error = failures.getOrDefault(op, Map.of()).get(n);
        if (error != null) {
            throw error;
        }
    }

    private Entry entryAt(int position) throws GitAPIException {
        if (position < 0 || position >= stack.size()) {
            throw new FakeGitException("stash@{%d} is not a valid reference".formatted(position));
        }
        return stack.get(position);
    }

    private void applyEntry(Entry entry, boolean restoreIndex) throws GitAPIException {
        if (restoreIndex && !entry.staged.isEmpty() && !staged.isEmpty()) {
            var first = entry.staged.keySet().iterator().next();
            throw new FakeGitException(overwriteConflict(first).getMessage() + "\nIndex was not unstashed.");
        }
        var local = workingTree();
        for (var path : entry.staged.keySet()) {
            checkNotDirty(local, path);
        }
        for (var path : entry.unstaged.keySet()) {
            checkNotDirty(local, path);
        }
        for (var path : entry.untracked.keySet()) {
            if (local.containsKey(path)) {
                throw new FakeGitException(path + " already exists, no checkout");
            }
        }
        staged.putAll(entry.staged);
        unstaged.putAll(entry.unstaged);
        untracked.putAll(entry.untracked);
    }

    private static void checkNotDirty(Map<String, String> local, String path) throws GitAPIException {
        if (local.containsKey(path)) {
            throw overwriteConflict(path);
        }
    }

    private String newCommitId() {
        return "%040x".formatted(nextCommit++);
    }

    /** Snapshot of labels and contents by position, for before/after comparisons. */
    public Map<Integer, String> describeStack() {
        var result = new LinkedHashMap<Integer, String>();
        for (int i = 0; i < stack.size(); i++) {
            result.put(i, stack.get(i).label + stack.get(i).allFiles());
        }
        return result;
    }
}
