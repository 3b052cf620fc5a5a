package io.github.gitmaster.git;

import io.github.gitmaster.GitMasterSettings;
import io.github.gitmaster.shelf.ChangeEntry;
import io.github.gitmaster.shelf.Snapshot;
import io.github.gitmaster.util.Environment;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

/**
 * A Git repository abstraction. Reads (status, stash list, diff statistics) go through JGit; stash mutations run the
 * git executable so that {@code --index}, {@code --keep-index} and {@code --staged} behave exactly as on the command
 * line, bounded by the configured timeout.
 */
public class GitRepo implements Closeable {
    private static final Logger logger = LogManager.getLogger(GitRepo.class);

    // "On main: label" for labelled stashes, "WIP on main: abc1234 subject" otherwise
    private static final Pattern STASH_MESSAGE = Pattern.compile("^(?:WIP on|On) ([^:]+): (.*)$");

    private final Path gitTopLevel;
    private final Repository repository;
    private final Git git;
    private final GitMasterSettings settings;
    private final GitRepoData data;

    public GitRepo(Path projectRoot) {
        this(projectRoot, GitMasterSettings.load());
    }

    public GitRepo(Path projectRoot, GitMasterSettings settings) {
        this.settings = settings;
        try {
            var builder = new FileRepositoryBuilder().findGitDir(projectRoot.toFile());
            if (builder.getGitDir() == null) {
                throw new IllegalArgumentException("No git repo found at or above " + projectRoot);
            }
            repository = builder.build();
            if (repository.isBare()) {
                repository.close();
                throw new IllegalArgumentException("Shelves need a working tree; " + projectRoot + " is bare");
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to open git repo at " + projectRoot, e);
        }
        git = new Git(repository);
        gitTopLevel = repository.getWorkTree().toPath().toAbsolutePath().normalize();
        data = new GitRepoData(this);
        logger.debug("Opened repository {} (git dir {})", gitTopLevel, repository.getDirectory());
    }

    public GitRepoData data() {
        return data;
    }

    /** Get the JGit instance for direct API access */
    public Git getGit() {
        return git;
    }

    // package-private accessor so GitRepoData can use the repository
    Repository getRepository() {
        return repository;
    }

    public Path getGitTopLevel() {
        return gitTopLevel;
    }

    public GitMasterSettings getSettings() {
        return settings;
    }

    /** Drops JGit's cached refs so the next read sees stash changes made by the git executable. */
    public synchronized void invalidateCaches() {
        logger.trace("GitRepo refresh");
        repository.getRefDatabase().refresh();
    }

    /**
     * Runs the git executable in the top-level directory.
     *
     * @return combined stdout/stderr
     * @throws GitRepoException wrapping the {@link Environment.SubprocessException}, whose output is preserved
     */
    public String runGit(String... args) throws GitAPIException {
        var command = Stream.concat(Stream.of(settings.getGitExecutable()), Stream.of(args))
                .toList();
        try {
            return Environment.instance.runCommand(
                    command, gitTopLevel, settings.getGitTimeout(), line -> logger.trace("git: {}", line));
        } catch (Environment.SubprocessException e) {
            var output = e.getOutput().isBlank() ? e.getMessage() : e.getOutput();
            throw new GitRepoException("git %s failed: %s".formatted(args[0], output), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitRepoException("git %s was interrupted".formatted(args[0]), e);
        }
    }

    /**
     * Create a stash from the current changes.
     *
     * @throws NoLocalChangesException if there was nothing to stash
     */
    public synchronized void createStash(String message, boolean includeUntracked, boolean keepIndex)
            throws GitAPIException {
        if (message.isBlank()) {
            throw new IllegalArgumentException("stash message must not be blank");
        }
        logger.debug(
                "Creating stash with message: {} (untracked={}, keepIndex={})", message, includeUntracked, keepIndex);
        var args = new ArrayList<String>(List.of("stash", "push"));
        if (includeUntracked) {
            args.add("--include-untracked");
        }
        if (keepIndex) {
            args.add("--keep-index");
        }
        args.add("-m");
        args.add(message);
        runStashPush(args);
    }

    /** Create a stash from the staged changes only (requires git 2.35+). */
    public synchronized void createStagedStash(String message) throws GitAPIException {
        if (message.isBlank()) {
            throw new IllegalArgumentException("stash message must not be blank");
        }
        logger.debug("Creating staged-only stash with message: {}", message);
        runStashPush(new ArrayList<>(List.of("stash", "push", "--staged", "-m", message)));
    }

    private void runStashPush(List<String> args) throws GitAPIException {
        try {
            var output = runGit(args.toArray(String[]::new));
            if (output.contains("No local changes to save")) {
                throw new NoLocalChangesException("No local changes to save");
            }
            logger.debug("Stash created: {}", output);
        } finally {
            invalidateCaches();
        }
    }

    /**
     * Apply a stash to the working directory without removing it from the stash list. When the working tree was clean
     * beforehand, a failed apply is rolled back so that no conflict markers or unmerged entries are left behind.
     */
    public synchronized void applyStash(int stashIndex) throws GitAPIException {
        var stashRef = stashRef(stashIndex);
        logger.debug("Applying stash: {}", stashRef);
        runStashApply("stash", "apply", "--index", stashRef);
        logger.debug("Stash applied successfully");
    }

    /**
     * Pop a stash – apply it with its index, then drop it. git keeps the entry if applying fails; a failed pop onto a
     * clean working tree is rolled back like {@link #applyStash(int)}.
     */
    public synchronized void popStash(int stashIndex) throws GitAPIException {
        var stashRef = stashRef(stashIndex);
        logger.debug("Popping stash {}", stashRef);
        runStashApply("stash", "pop", "--index", stashRef);
        logger.debug("Stash pop completed successfully");
    }

    /**
     * Pop a stash onto a working tree that has its own changes. The stash's index is not restored: git refuses
     * {@code --index} whenever the current index is dirty, even for unrelated paths. New files still come back staged.
     */
    public synchronized void mergeStash(int stashIndex) throws GitAPIException {
        var stashRef = stashRef(stashIndex);
        logger.debug("Merging stash {} into the working tree", stashRef);
        try {
            runGit("stash", "pop", stashRef);
        } finally {
            invalidateCaches();
        }
        logger.debug("Stash merged successfully");
    }

    private void runStashApply(String... args) throws GitAPIException {
        boolean wasClean = git.status().call().isClean();
        try {
            runGit(args);
        } catch (GitAPIException e) {
            if (wasClean) {
                resetToHead(e);
            }
            throw e;
        } finally {
            invalidateCaches();
        }
    }

    /** Undoes a partial stash apply. Only valid when the tree was clean before the apply started. */
    private void resetToHead(GitAPIException failure) {
        logger.warn("Stash apply failed on a clean working tree; resetting to HEAD");
        try {
            runGit("reset", "--hard", "--quiet", "HEAD");
            // files restored from an untracked layer
            runGit("clean", "-fd", "--quiet");
        } catch (GitAPIException e) {
            logger.error("Could not reset the working tree after a failed stash apply", e);
            failure.addSuppressed(e);
        }
    }

    /** Drop a stash without applying it */
    public synchronized void dropStash(int stashIndex) throws GitAPIException {
        var stashRef = stashRef(stashIndex);
        logger.debug("Dropping stash at index: {}", stashIndex);
        try {
            var output = runGit("stash", "drop", stashRef);
            logger.debug("Stash dropped successfully: {}", output);
        } finally {
            invalidateCaches();
        }
    }

    private static String stashRef(int stashIndex) {
        if (stashIndex < 0) {
            throw new IllegalArgumentException("stash index must be non-negative: " + stashIndex);
        }
        return "stash@{" + stashIndex + "}";
    }

    /** Lists all stashes, newest first, with per-stash file statistics. */
    public synchronized List<Snapshot> listStashes() throws GitAPIException {
        invalidateCaches();
        var stashes = new ArrayList<Snapshot>();
        int index = 0;
        for (var stashCommit : git.stashList().call()) {
            stashes.add(fromStashCommit(stashCommit, index));
            index++;
        }
        return stashes;
    }

    /** Files stored in the stash at {@code stashIndex}: tracked changes first, then untracked files. */
    public synchronized List<ChangeEntry> listStashFiles(int stashIndex) throws GitAPIException {
        return data.stashFiles(resolveStash(stashIndex));
    }

    /** True if the stash has a third parent, i.e. it was created with {@code --include-untracked}. */
    public synchronized boolean stashHasUntrackedFiles(int stashIndex) throws GitAPIException {
        return resolveStash(stashIndex).getParentCount() >= 3;
    }

    private RevCommit resolveStash(int stashIndex) throws GitAPIException {
        invalidateCaches();
        var stashes = new ArrayList<>(git.stashList().call());
        if (stashIndex < 0 || stashIndex >= stashes.size()) {
            throw new GitStateException("No stash at index %d (%d stashes)".formatted(stashIndex, stashes.size()));
        }
        return parse(stashes.get(stashIndex));
    }

    RevCommit parse(ObjectId commitId) throws GitAPIException {
        try (var revWalk = new RevWalk(repository)) {
            var commit = revWalk.parseCommit(commitId);
            for (var parent : commit.getParents()) {
                revWalk.parseHeaders(parent);
            }
            return commit;
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /** Factory method to create a Snapshot for a stash entry from a JGit RevCommit. */
    Snapshot fromStashCommit(RevCommit stashCommit, int index) throws GitAPIException {
        var commit = parse(stashCommit);
        var subject = commit.getShortMessage();
        var matcher = STASH_MESSAGE.matcher(subject);
        var branch = matcher.matches() ? matcher.group(1) : "unknown";
        var label = matcher.matches() ? matcher.group(2) : subject;

        var files = data.stashFiles(commit);
        int additions = files.stream().mapToInt(ChangeEntry::additions).sum();
        int deletions = files.stream().mapToInt(ChangeEntry::deletions).sum();
        return new Snapshot(
                index,
                label,
                branch,
                files.size(),
                additions,
                deletions,
                commit.getCommitterIdent().getWhenAsInstant(),
                commit.getParentCount() >= 3,
                commit.getName());
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }

    public static class GitRepoException extends GitAPIException {
        public GitRepoException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class GitStateException extends GitAPIException {
        public GitStateException(String message) {
            super(message);
        }
    }

    /** A save found nothing matching the requested layers. */
    public static class NoLocalChangesException extends GitAPIException {
        public NoLocalChangesException(String message) {
            super(message);
        }
    }

    static class GitWrappedIOException extends GitAPIException {
        public GitWrappedIOException(IOException e) {
            this(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }

        public GitWrappedIOException(String message, IOException e) {
            super(message, e);
        }
    }
}
