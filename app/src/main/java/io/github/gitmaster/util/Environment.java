package io.github.gitmaster.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class Environment {
    private static final Logger logger = LogManager.getLogger(Environment.class);
    public static final Environment instance = new Environment();

    private static final String ANSI_ESCAPE_PATTERN = "\\x1B(?:\\[[;\\d]*[ -/]*[@-~]|\\]\\d+;[^\\x07]*\\x07)";

    private Environment() {}

    /**
     * Runs an external program (no shell) in {@code root}, returning combined stdout and stderr. Output lines are
     * passed to the consumer as they are produced.
     *
     * @param command The program and its arguments.
     * @param root The working directory for the command.
     * @param timeout How long to wait before the process is killed.
     * @param outputConsumer Receives output lines (from stdout or stderr) as they are produced.
     * @throws SubprocessException if the command fails to start, times out, or returns a non-zero exit code.
     * @throws InterruptedException if the thread is interrupted.
     */
    public String runCommand(List<String> command, Path root, Duration timeout, Consumer<String> outputConsumer)
            throws SubprocessException, InterruptedException {
        var display = String.join(" ", command);
        logger.debug("Running `{}` in `{}`", display, root);

        ProcessBuilder pb = createProcessBuilder(root, command);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StartupException(
                    "unable to start `%s` in %s (%s)".formatted(display, root, e.getMessage()), "");
        }

        // start draining stdout/stderr immediately to avoid pipe-buffer deadlock
        CompletableFuture<String> stdoutFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getInputStream(), outputConsumer));
        CompletableFuture<String> stderrFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream(), outputConsumer));

        String combinedOutput;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                String stdout = stdoutFuture.join();
                String stderr = stderrFuture.join();
                combinedOutput = formatOutput(stdout, stderr);
                throw new TimeoutException(
                        "process '%s' did not complete within %d seconds".formatted(display, timeout.toSeconds()),
                        combinedOutput);
            }
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            logger.warn("Process '{}' interrupted.", display);
            throw ie;
        }

        String stdout = stdoutFuture.join();
        String stderr = stderrFuture.join();
        combinedOutput = formatOutput(stdout, stderr);
        int exitCode = process.exitValue();

        if (exitCode != 0) {
            throw new FailureException(
                    "process '%s' signalled error code %d".formatted(display, exitCode), combinedOutput);
        }

        return combinedOutput;
    }

    private static String readStream(InputStream in, Consumer<String> outputConsumer) {
        var lines = new ArrayList<String>();
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                outputConsumer.accept(line);
                lines.add(line);
            }
        } catch (IOException e) {
            logger.error("Error reading stream", e);
            // The returned string will contain lines accumulated so far.
        }
        return String.join("\n", lines);
    }

    private static String formatOutput(String stdout, String stderr) {
        stdout = stdout.trim().replaceAll(ANSI_ESCAPE_PATTERN, "");
        stderr = stderr.trim().replaceAll(ANSI_ESCAPE_PATTERN, "");

        if (stdout.isEmpty() && stderr.isEmpty()) {
            return "";
        }
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return "stdout:\n" + stdout + "\n\nstderr:\n" + stderr;
    }

    private static ProcessBuilder createProcessBuilder(Path root, List<String> command) {
        var pb = new ProcessBuilder(command);
        pb.directory(root.toFile());
        // Redirect input from /dev/null (or NUL on Windows) so interactive prompts fail fast
        if (isWindows()) {
            pb.redirectInput(ProcessBuilder.Redirect.from(new File("NUL")));
        } else {
            pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        }
        // Remove environment variables that might interfere with non-interactive operation
        pb.environment().remove("EDITOR");
        pb.environment().remove("VISUAL");
        pb.environment().put("TERM", "dumb");
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");
        // git's messages are matched on their English text
        pb.environment().put("LC_ALL", "C");
        return pb;
    }

    /** Base exception for subprocess errors. */
    public abstract static class SubprocessException extends IOException {
        private final String output;

        public SubprocessException(String message, String output) {
            super(message);
            this.output = output;
        }

        public String getOutput() {
            return output;
        }
    }

    /** Exception thrown when a subprocess fails to start. */
    public static class StartupException extends SubprocessException {
        public StartupException(String message, String output) {
            super(message, output);
        }
    }

    /** Exception thrown when a subprocess times out. */
    public static class TimeoutException extends SubprocessException {
        public TimeoutException(String message, String output) {
            super(message, output);
        }
    }

    /** Exception thrown when a subprocess returns a non-zero exit code. */
    public static class FailureException extends SubprocessException {
        public FailureException(String message, String output) {
            super(message, output);
        }
    }

    /** Determines if the current operating system is Windows. */
    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }

    /** Returns the current user's home directory as a Path. */
    public static Path getHomePath() {
        return Path.of(System.getProperty("user.home"));
    }
}
