package io.github.gitmaster.git;

import io.github.gitmaster.shelf.PreviewCalculator;
import io.github.gitmaster.shelf.PreviewSummary;
import org.eclipse.jgit.api.errors.GitAPIException;

public class GitPreviewCalculator implements PreviewCalculator {
    private final GitRepo repo;

    public GitPreviewCalculator(GitRepo repo) {
        this.repo = repo;
    }

    @Override
    public PreviewSummary computePreview(boolean includeUntracked) throws GitAPIException {
        return repo.data().computePreview(includeUntracked);
    }
}
