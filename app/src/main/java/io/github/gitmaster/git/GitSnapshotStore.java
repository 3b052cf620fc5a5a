package io.github.gitmaster.git;

import io.github.gitmaster.shelf.ChangeEntry;
import io.github.gitmaster.shelf.Snapshot;
import io.github.gitmaster.shelf.SnapshotStore;
import java.util.List;
import org.eclipse.jgit.api.errors.GitAPIException;

/** {@link SnapshotStore} backed by the repository's stash. Positions are {@code stash@{n}} indexes. */
public class GitSnapshotStore implements SnapshotStore {
    private final GitRepo repo;

    public GitSnapshotStore(GitRepo repo) {
        this.repo = repo;
    }

    @Override
    public void save(String label, boolean includeUntracked, boolean keepStagedInWorkingTree)
            throws GitAPIException {
        repo.createStash(label, includeUntracked, keepStagedInWorkingTree);
    }

    @Override
    public void saveStagedOnly(String label) throws GitAPIException {
        repo.createStagedStash(label);
    }

    @Override
    public void apply(int position) throws GitAPIException {
        repo.applyStash(position);
    }

    @Override
    public void discard(int position) throws GitAPIException {
        repo.dropStash(position);
    }

    /** Uses {@code git stash pop}, which leaves the entry in place when the apply half fails. */
    @Override
    public void applyAndDiscard(int position) throws GitAPIException {
        repo.popStash(position);
    }

    @Override
    public void mergeAndDiscard(int position) throws GitAPIException {
        repo.mergeStash(position);
    }

    @Override
    public List<Snapshot> list() throws GitAPIException {
        return repo.listStashes();
    }

    @Override
    public List<ChangeEntry> files(int position) throws GitAPIException {
        return repo.listStashFiles(position);
    }
}
