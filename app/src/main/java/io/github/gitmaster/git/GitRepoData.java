package io.github.gitmaster.git;

import io.github.gitmaster.shelf.ChangeEntry;
import io.github.gitmaster.shelf.PreviewSummary;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.dircache.DirCacheIterator;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.filter.PathFilterGroup;
import org.eclipse.jgit.util.io.DisabledOutputStream;

/**
 * Helper class extracted from GitRepo to encapsulate status- and diff-related reads.
 *
 * <p>Line counts follow {@code git diff --numstat}: additions are lines on the new side of each edit, deletions
 * lines on the old side. Binary files count as zero of both.
 */
public class GitRepoData {
    private static final Logger logger = LogManager.getLogger(GitRepoData.class);

    private final Repository repository;
    private final Git git;

    GitRepoData(GitRepo repo) {
        this.repository = repo.getRepository();
        this.git = repo.getGit();
    }

    /**
     * Staged changes (HEAD vs index), unstaged changes (index vs working tree) and, if requested, untracked files.
     * Each list is sorted by path.
     */
    public PreviewSummary computePreview(boolean includeUntracked) throws GitAPIException {
        var status = git.status().call();

        var stagedPaths = new TreeSet<String>();
        stagedPaths.addAll(status.getAdded());
        stagedPaths.addAll(status.getChanged());
        stagedPaths.addAll(status.getRemoved());

        var unstagedPaths = new TreeSet<String>();
        unstagedPaths.addAll(status.getModified());
        unstagedPaths.addAll(status.getMissing());

        // conflicted paths count as both staged and unstaged, as git diff --cached and git diff both report them
        stagedPaths.addAll(status.getConflicting());
        unstagedPaths.addAll(status.getConflicting());

        var untracked = includeUntracked ? List.copyOf(new TreeSet<>(status.getUntracked())) : List.<String>of();
        logger.trace("Preview: staged={}, unstaged={}, untracked={}", stagedPaths, unstagedPaths, untracked);

        try {
            var staged = stagedPaths.isEmpty()
                    ? List.<ChangeEntry>of()
                    : entriesFor(stagedPaths, headTree(), new DirCacheIterator(repository.readDirCache()));
            var unstaged = unstagedPaths.isEmpty()
                    ? List.<ChangeEntry>of()
                    : entriesFor(
                            unstagedPaths,
                            new DirCacheIterator(repository.readDirCache()),
                            new FileTreeIterator(repository));
            return new PreviewSummary(staged, unstaged, untracked);
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(e);
        }
    }

    /**
     * Files stored in a stash commit: the working-tree layer compared to the stash's base commit, followed by every
     * file of the untracked layer (third parent) if present.
     */
    public List<ChangeEntry> stashFiles(RevCommit stashCommit) throws GitAPIException {
        try {
            var files = new ArrayList<ChangeEntry>();
            files.addAll(numstat(treeOf(stashCommit.getParent(0)), treeOf(stashCommit)));
            if (stashCommit.getParentCount() >= 3) {
                files.addAll(numstat(new EmptyTreeIterator(), treeOf(stashCommit.getParent(2))));
            }
            return files;
        } catch (IOException e) {
            throw new GitRepo.GitWrappedIOException(e);
        }
    }

    private List<ChangeEntry> entriesFor(
            Collection<String> paths, AbstractTreeIterator oldTree, AbstractTreeIterator newTree) throws IOException {
        Map<String, ChangeEntry> byPath = new HashMap<>();
        try (var formatter = newFormatter()) {
            formatter.setPathFilter(PathFilterGroup.createFromStrings(paths));
            for (var entry : formatter.scan(oldTree, newTree)) {
                var changeEntry = toChangeEntry(formatter, entry);
                byPath.put(changeEntry.path(), changeEntry);
            }
        }
        // status may report a path the diff has no hunks for (e.g. a mode-only change)
        return paths.stream()
                .map(p -> byPath.getOrDefault(p, new ChangeEntry(p, 0, 0)))
                .toList();
    }

    private List<ChangeEntry> numstat(AbstractTreeIterator oldTree, AbstractTreeIterator newTree) throws IOException {
        try (var formatter = newFormatter()) {
            var result = new ArrayList<ChangeEntry>();
            for (var entry : formatter.scan(oldTree, newTree)) {
                result.add(toChangeEntry(formatter, entry));
            }
            return result;
        }
    }

    private DiffFormatter newFormatter() {
        var formatter = new DiffFormatter(DisabledOutputStream.INSTANCE);
        formatter.setRepository(repository);
        formatter.setDiffComparator(RawTextComparator.DEFAULT);
        formatter.setDetectRenames(false);
        return formatter;
    }

    private static ChangeEntry toChangeEntry(DiffFormatter formatter, DiffEntry entry) throws IOException {
        var path = entry.getChangeType() == DiffEntry.ChangeType.DELETE ? entry.getOldPath() : entry.getNewPath();
        int additions = 0;
        int deletions = 0;
        for (Edit edit : formatter.toFileHeader(entry).toEditList()) {
            additions += edit.getLengthB();
            deletions += edit.getLengthA();
        }
        return new ChangeEntry(path, additions, deletions);
    }

    private AbstractTreeIterator headTree() throws IOException {
        ObjectId head = repository.resolve("HEAD^{tree}");
        if (head == null) {
            // no commits yet: everything in the index is an addition
            return new EmptyTreeIterator();
        }
        var parser = new CanonicalTreeParser();
        try (var reader = repository.newObjectReader()) {
            parser.reset(reader, head);
        }
        return parser;
    }

    private AbstractTreeIterator treeOf(RevCommit commit) throws IOException {
        var parser = new CanonicalTreeParser();
        try (var reader = repository.newObjectReader()) {
            parser.reset(reader, commit.getTree().getId());
        }
        return parser;
    }
}
