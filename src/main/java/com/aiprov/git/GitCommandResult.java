package com.aiprov.git;

public record GitCommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String trimmedStdout() {
        return stdout == null ? "" : stdout.trim();
    }

    public String trimmedStderr() {
        return stderr == null ? "" : stderr.trim();
    }
}
