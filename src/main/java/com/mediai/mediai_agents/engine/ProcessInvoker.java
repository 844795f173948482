package com.mediai.mediai_agents.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external tool and captures what it printed.
 */
public interface ProcessInvoker {

    ProcessResult invoke(List<String> command, Path workingDir);

    record ProcessResult(List<String> command, int exitCode, String stdout, String stderr) {

        public boolean success() {
            return exitCode == 0;
        }

        public String commandLine() {
            return String.join(" ", command);
        }
    }
}
