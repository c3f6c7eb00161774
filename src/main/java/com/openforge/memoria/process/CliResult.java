package com.openforge.memoria.process;

public record CliResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** The most useful text to report on failure. */
    public String detail() {
        if (stderr != null && !stderr.isBlank()) return stderr.trim();
        if (stdout != null && !stdout.isBlank()) return stdout.trim();
        return "exit code " + exitCode;
    }
}
