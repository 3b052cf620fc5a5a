package io.github.gitmaster.shelf;

import com.google.common.base.Splitter;
import io.github.gitmaster.util.Environment;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.regex.Pattern;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.eclipse.jgit.api.errors.StashApplyFailureException;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a failed primitive was an overwrite conflict the user can resolve by hand, or something else.
 *
 * <p>The decision is made on the failure text (including captured process output) anywhere in the cause chain. A
 * timeout is always {@link Classification#FATAL}, whatever output the process produced before it was killed.
 */
public final class ConflictClassifier {

    public enum Classification {
        CONFLICT,
        FATAL
    }

    private static final List<Pattern> OVERWRITE_SIGNATURES = List.of(
            Pattern.compile("would be overwritten", Pattern.CASE_INSENSITIVE),
            Pattern.compile("already exists, no checkout", Pattern.CASE_INSENSITIVE),
            Pattern.compile("checkout conflict with files", Pattern.CASE_INSENSITIVE));

    // merge-recursive reports each conflicted path on its own line, e.g. "CONFLICT (content): Merge conflict in a.txt"
    private static final String MERGE_CONFLICT_PREFIX = "CONFLICT (";

    public Classification classify(Throwable rawError) {
        var chain = causeChain(rawError);
        if (chain.stream().anyMatch(t -> t instanceof Environment.TimeoutException)) {
            return Classification.FATAL;
        }
        for (var t : chain) {
            if (t instanceof StashApplyFailureException
                    || t instanceof CheckoutConflictException
                    || t instanceof org.eclipse.jgit.errors.CheckoutConflictException) {
                return Classification.CONFLICT;
            }
            if (matchesOverwrite(t.getMessage())) {
                return Classification.CONFLICT;
            }
            if (t instanceof Environment.SubprocessException se && matchesOverwrite(se.getOutput())) {
                return Classification.CONFLICT;
            }
        }
        return Classification.FATAL;
    }

    public boolean isConflict(Throwable rawError) {
        return classify(rawError) == Classification.CONFLICT;
    }

    private static boolean matchesOverwrite(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (OVERWRITE_SIGNATURES.stream().anyMatch(p -> p.matcher(text).find())) {
            return true;
        }
        for (var line : Splitter.on('\n').trimResults().omitEmptyStrings().split(text)) {
            if (line.startsWith(MERGE_CONFLICT_PREFIX)) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable rawError) {
        var seen = new IdentityHashMap<Throwable, Boolean>();
        var chain = new ArrayList<Throwable>();
        for (Throwable t = rawError; t != null && seen.put(t, Boolean.TRUE) == null; t = t.getCause()) {
            chain.add(t);
        }
        return chain;
    }
}
