package com.modelrouter.router.transport;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}; stderr is merged into stdout.
 *
 * <p>Output is drained on a reader thread while the process runs, so a listing larger than
 * the OS pipe buffer cannot stall the child. One deadline covers draining and exit.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public Result run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        InputStream out = process.getInputStream();
        FutureTask<byte[]> drain = new FutureTask<>(out::readAllBytes);
        Thread reader = new Thread(drain, "command-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        try {
            byte[] stdout = drain.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (!process.waitFor(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                throw timedOut(command, timeout);
            }
            return new Result(process.exitValue(), new String(stdout, StandardCharsets.UTF_8));
        } catch (TimeoutException e) {
            throw timedOut(command, timeout);
        } catch (ExecutionException e) {
            throw new IOException("Could not read output of " + command, e.getCause());
        } finally {
            if (process.isAlive()) process.destroyForcibly();
            out.close();
        }
    }

    private static IOException timedOut(List<String> command, Duration timeout) {
        return new IOException("Command timed out after " + timeout.toMillis() + "ms: " + command);
    }
}
