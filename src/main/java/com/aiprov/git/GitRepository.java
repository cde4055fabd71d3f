package com.aiprov.git;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin facade over the git executable for one repository. Every call is a
 * fresh snapshot read; nothing is cached except the resolved work tree root.
 * Once that root is known, commands run from it, so listed and requested paths
 * are always relative to the root even when the repository was opened from a
 * subdirectory.
 */
public class GitRepository {
    private static final Logger log = LoggerFactory.getLogger(GitRepository.class);

    private final Path directory;
    private final String executable;
    private final GitCommandRunner gitCommandRunner;
    private volatile Path workTree;

    public GitRepository(Path directory) {
        this(directory, "git", new GitCommandRunner(Duration.ofSeconds(30)));
    }

    public GitRepository(Path directory, String executable, GitCommandRunner gitCommandRunner) {
        this.directory = directory.toAbsolutePath().normalize();
        this.executable = executable == null || executable.isBlank() ? "git" : executable;
        this.gitCommandRunner = gitCommandRunner;
    }

    public Path directory() {
        return directory;
    }

    public Path workTree() throws IOException {
        Path resolved = workTree;
        if (resolved != null) {
            return resolved;
        }
        GitCommandResult result = execute("rev-parse", "--show-toplevel");
        if (result.launchFailed()) {
            throw new IOException("git executable could not be started: " + executable + " (" + result.trimmedStderr() + ")");
        }
        if (!result.isSuccess() || result.trimmedStdout().isEmpty()) {
            throw new NotARepositoryException(directory, result.trimmedStderr());
        }
        resolved = Path.of(result.trimmedStdout());
        workTree = resolved;
        return resolved;
    }

    public void requireRepository() throws IOException {
        workTree();
    }

    public String resolveCommit(String revision) throws IOException {
        requireRepository();
        if (revision == null || revision.isBlank()) {
            throw new UnknownRevisionException(String.valueOf(revision));
        }
        GitCommandResult result = execute("rev-parse", "--verify", "--quiet", revision + "^{commit}");
        if (!result.isSuccess() || result.trimmedStdout().isEmpty()) {
            throw new UnknownRevisionException(revision);
        }
        return result.trimmedStdout();
    }

    public Optional<String> resolveRef(String ref) throws IOException {
        requireRepository();
        GitCommandResult result = execute("rev-parse", "--verify", "--quiet", ref);
        if (!result.isSuccess() || result.trimmedStdout().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(result.trimmedStdout());
    }

    public String readBlob(String commit, String path) throws IOException {
        String normalized = normalizePath(path);
        GitCommandResult result = execute("cat-file", "blob", commit + ":" + normalized);
        if (!result.isSuccess()) {
            throw new FileNotFoundAtRevisionException(normalized, commit);
        }
        return result.stdout();
    }

    public List<String> listFiles(String commit) throws IOException {
        requireRepository();
        return splitNul(run("ls-tree", "--full-tree", "-r", "-z", "--name-only", commit));
    }

    public List<String> trackedFiles() throws IOException {
        requireRepository();
        return splitNul(run("ls-files", "-z", "--full-name"));
    }

    public List<String> changedFiles(String commit) throws IOException {
        String output = run("diff-tree", "--root", "--no-commit-id", "--name-only", "-r", "-z", commit);
        return splitNul(output);
    }

    public String run(String... args) throws IOException {
        GitCommandResult result = execute(args);
        if (!result.isSuccess()) {
            String command = commandLine(args);
            log.error("git command failed command='{}' exitCode={} timedOut={} stderr={}",
                    command, result.exitCode(), result.timedOut(), result.trimmedStderr());
            throw new IOException("Command failed (" + command + ") exitCode=" + result.exitCode()
                    + " timedOut=" + result.timedOut() + " stderr=" + result.trimmedStderr());
        }
        return result.stdout();
    }

    public GitCommandResult execute(String... args) throws IOException {
        String[] command = new String[args.length + 1];
        command[0] = executable;
        System.arraycopy(args, 0, command, 1, args.length);
        Path root = workTree;
        GitCommandResult result = gitCommandRunner.run(root == null ? directory : root, command);
        if (result.interrupted()) {
            throw new InterruptedIOException("Command interrupted: " + String.join(" ", command));
        }
        return result;
    }

    public static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private String commandLine(String... args) {
        List<String> parts = new ArrayList<>();
        parts.add(executable);
        parts.addAll(Arrays.asList(args));
        return String.join(" ", parts);
    }

    private static List<String> splitNul(String output) {
        List<String> entries = new ArrayList<>();
        for (String entry : output.split("\0")) {
            String trimmed = entry.strip();
            if (!trimmed.isEmpty()) {
                entries.add(trimmed);
            }
        }
        return entries;
    }
}
