package com.modelrouter.router.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/** Runs a local command to completion. Blocking; callers must keep it off event-loop threads. */
public interface CommandRunner {

    Result run(List<String> command, Duration timeout) throws IOException, InterruptedException;

    record Result(int exitCode, String stdout) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
