package com.texclean.files;

public record CommandResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut,
        boolean interrupted,
        boolean launchFailed) {

    public boolean isSuccess() {
        return !timedOut && !interrupted && !launchFailed && exitCode == 0;
    }

    public String failureReason() {
        if (launchFailed) {
            return "could not start: " + stderr;
        }
        if (timedOut) {
            return "timed out";
        }
        if (interrupted) {
            return "interrupted";
        }
        if (exitCode != 0) {
            return "exit code " + exitCode + (stderr.isBlank() ? "" : ": " + stderr);
        }
        return "";
    }
}
