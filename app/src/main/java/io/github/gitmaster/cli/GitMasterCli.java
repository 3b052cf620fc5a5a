package io.github.gitmaster.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.gitmaster.GitMasterSettings;
import io.github.gitmaster.git.GitPreviewCalculator;
import io.github.gitmaster.git.GitRepo;
import io.github.gitmaster.git.GitSnapshotStore;
import io.github.gitmaster.shelf.ChangeEntry;
import io.github.gitmaster.shelf.ShelfException;
import io.github.gitmaster.shelf.ShelfWorkflow;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "gitmaster-shelf",
        mixinStandardHelpOptions = true,
        description = "Manage shelves (git stash entries) of a repository.",
        subcommands = {
            GitMasterCli.ListCommand.class,
            GitMasterCli.PreviewCommand.class,
            GitMasterCli.SaveCommand.class,
            GitMasterCli.ApplyCommand.class,
            GitMasterCli.PopCommand.class,
            GitMasterCli.DropCommand.class,
            GitMasterCli.MergeCommand.class
        })
public final class GitMasterCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(GitMasterCli.class);

    @CommandLine.Option(names = "--repo", description = "Repository directory (default: current directory).")
    Path repoPath = Path.of(".");

    @CommandLine.Spec
    @SuppressWarnings("NullAway.Init")
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GitMasterCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** Opens the repository, runs the action against a workflow, and maps failures to exit code 1. */
    int withWorkflow(WorkflowAction action) {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var settings = GitMasterSettings.load();
        try (var repo = new GitRepo(repoPath.toAbsolutePath().normalize(), settings)) {
            var workflow = new ShelfWorkflow(
                    new GitSnapshotStore(repo),
                    new GitPreviewCalculator(repo),
                    () -> logger.debug("Shelf list changed in {}", repo.getGitTopLevel()));
            action.run(workflow, settings, out);
            out.flush();
            return 0;
        } catch (ShelfException e) {
            logger.debug("Shelf operation failed", e);
            err.println(e.describe());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("I/O failure", e);
            err.println(e.getMessage());
            return 1;
        }
    }

    @FunctionalInterface
    interface WorkflowAction {
        void run(ShelfWorkflow workflow, GitMasterSettings settings, PrintWriter out)
                throws ShelfException, IOException;
    }

    public record JsonShelf(
            int position,
            String name,
            String branch,
            int fileCount,
            int additions,
            int deletions,
            String createdAt,
            boolean untracked,
            List<ChangeEntry> files) {}

    @CommandLine.Command(name = "list", description = "List shelves, newest first.")
    static final class ListCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Option(names = "--json", description = "Print shelves and their files as JSON.")
        boolean json;

        @CommandLine.Option(names = "--max", description = "Maximum number of shelves (1-200).")
        @Nullable
        Integer maxShelves;

        @CommandLine.Option(names = "--max-files", description = "Maximum files per shelf (1-5000).")
        @Nullable
        Integer maxFiles;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                int shelfLimit = maxShelves != null ? maxShelves : settings.getMaxShelves();
                int fileLimit = maxFiles != null ? maxFiles : settings.getMaxFilesPerShelf();
                var listings = workflow.listShelves(shelfLimit, fileLimit);
                if (json) {
                    var shelves = listings.stream()
                            .map(l -> new JsonShelf(
                                    l.snapshot().position(),
                                    l.snapshot().label(),
                                    l.snapshot().originBranch(),
                                    l.snapshot().fileCount(),
                                    l.snapshot().additions(),
                                    l.snapshot().deletions(),
                                    l.snapshot().createdAt().toString(),
                                    l.snapshot().hasUntrackedLayer(),
                                    l.files()))
                            .toList();
                    out.println(toJson(shelves));
                    return;
                }
                if (listings.isEmpty()) {
                    out.println("No shelves");
                    return;
                }
                for (var listing : listings) {
                    var s = listing.snapshot();
                    out.printf(
                            Locale.ROOT,
                            "%d  %s  [%s]  %d file(s) +%d -%d%s%n",
                            s.position(),
                            s.label(),
                            s.originBranch(),
                            s.fileCount(),
                            s.additions(),
                            s.deletions(),
                            s.hasUntrackedLayer() ? "  (untracked)" : "");
                }
            });
        }
    }

    @CommandLine.Command(name = "preview", description = "Show the changes a new shelf would capture.")
    static final class PreviewCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                var summary = workflow.preview(true);
                out.println(summary.isEmpty() ? "No changes" : ShelfWorkflow.formatPreview(summary));
            });
        }
    }

    @CommandLine.Command(name = "save", description = "Create a shelf from the current changes.")
    static final class SaveCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Parameters(index = "0", description = "Shelf name.")
        @SuppressWarnings("NullAway.Init")
        String label;

        @CommandLine.Option(names = "--keep-staged", description = "Keep staged changes in the working tree.")
        boolean keepStaged;

        @CommandLine.Option(names = "--staged-only", description = "Shelve only staged changes.")
        boolean stagedOnly;

        @CommandLine.Option(names = {"-u", "--untracked"}, description = "Include untracked files.")
        boolean untracked;

        @Override
        public Integer call() {
            if (keepStaged && stagedOnly) {
                parent.spec.commandLine().getErr().println("--keep-staged and --staged-only are exclusive");
                return 2;
            }
            var mode = stagedOnly
                    ? ShelfWorkflow.Mode.STAGED_ONLY
                    : keepStaged ? ShelfWorkflow.Mode.KEEP_STAGED : ShelfWorkflow.Mode.ALL;
            return parent.withWorkflow((workflow, settings, out) -> {
                workflow.createShelf(label, mode, untracked);
                out.printf("Shelf \"%s\" created%n", label);
            });
        }
    }

    @CommandLine.Command(name = "apply", description = "Apply a shelf and keep it.")
    static final class ApplyCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Parameters(index = "0", description = "Shelf position.")
        int position;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                workflow.applyShelf(position);
                out.printf("Applied shelf %d%n", position);
            });
        }
    }

    @CommandLine.Command(name = "pop", description = "Apply a shelf and remove it.")
    static final class PopCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Parameters(index = "0", description = "Shelf position.")
        int position;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                workflow.popShelf(position);
                out.printf("Popped shelf %d%n", position);
            });
        }
    }

    @CommandLine.Command(name = "drop", description = "Delete a shelf without applying it.")
    static final class DropCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Parameters(index = "0", description = "Shelf position.")
        int position;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                workflow.deleteShelf(position);
                out.printf("Deleted shelf %d%n", position);
            });
        }
    }

    @CommandLine.Command(name = "merge", description = "Add the current changes to an existing shelf.")
    static final class MergeCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @SuppressWarnings("NullAway.Init")
        GitMasterCli parent;

        @CommandLine.Parameters(index = "0", description = "Shelf position.")
        int position;

        @CommandLine.Option(names = {"-y", "--yes"}, description = "Do not ask for confirmation.")
        boolean yes;

        @Override
        public Integer call() {
            return parent.withWorkflow((workflow, settings, out) -> {
                var summary = workflow.preview(true);
                if (!yes && !summary.isEmpty()) {
                    out.println(ShelfWorkflow.formatPreview(summary));
                    out.printf("%nAdd these changes to shelf %d? [y/N] ", position);
                    out.flush();
                    if (!confirmed()) {
                        out.println("Cancelled");
                        return;
                    }
                }
                workflow.mergeIntoShelf(position);
                out.printf("Added current changes to shelf %d%n", position);
            });
        }

        private static boolean confirmed() throws IOException {
            var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            var answer = reader.readLine();
            return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
        }
    }

    static String toJson(Object value) throws IOException {
        var mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IOException("Unable to serialize shelves", e);
        }
    }
}
