package com.mendwatch.core.remediation;

import com.mendwatch.core.model.Task;
import com.mendwatch.core.security.FileOperation;
import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs an executable test script from the project tree. The file must pass the
 * {@code execute} check; the script runs with the project root as working directory.
 */
public class TestExecutionHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(TestExecutionHandler.class);

    /** Characters of output kept in a failure message. */
    static final int OUTPUT_TAIL = 2000;

    private final PathGuard pathGuard;
    private final Duration timeout;

    public TestExecutionHandler(PathGuard pathGuard, Duration timeout) {
        this.pathGuard = pathGuard;
        this.timeout = timeout;
    }

    @Override
    public Result<String> handle(Task task) {
        Path script = pathGuard.resolve(task.file());
        if (!pathGuard.validate(FileOperation.EXECUTE, script)) {
            return Result.failure(ErrorKind.VALIDATION, "Not an executable test file: " + task.file());
        }
        log.info("Running tests: {}", task.file());
        Process process;
        try {
            process = new ProcessBuilder(script.toString())
                    .directory(pathGuard.projectRoot().toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            return Result.failure(ErrorKind.EXECUTION, "Failed to start " + task.file() + ": " + e.getMessage());
        }
        try (InputStream out = process.getInputStream()) {
            var reader = new OutputReader(out);
            reader.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return Result.failure(ErrorKind.EXECUTION,
                        "Tests in " + task.file() + " timed out after " + timeout.toSeconds() + "s");
            }
            reader.join(1000);
            int exit = process.exitValue();
            if (exit != 0) {
                return Result.failure(ErrorKind.EXECUTION,
                        "Tests in " + task.file() + " failed with exit code " + exit + ":\n" + reader.tail());
            }
            return Result.ok("Tests in " + task.file() + " passed");
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return Result.failure(ErrorKind.TRANSIENT, "Interrupted while running " + task.file());
        } catch (IOException e) {
            return Result.failure(ErrorKind.EXECUTION, "Failed to read output of " + task.file() + ": " + e.getMessage());
        }
    }

    /**
     * Drains process output so the child never blocks on a full pipe. Decodes through a reader so
     * a multi-byte character split across two reads stays intact.
     */
    static final class OutputReader extends Thread {
        private final Reader in;
        private final StringBuilder buffer = new StringBuilder();

        OutputReader(InputStream in) {
            super("mendwatch-test-output");
            setDaemon(true);
            this.in = new InputStreamReader(in, StandardCharsets.UTF_8);
        }

        @Override
        public void run() {
            char[] chunk = new char[4096];
            try {
                int n;
                while ((n = in.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.append(chunk, 0, n);
                        if (buffer.length() > OUTPUT_TAIL * 2) {
                            buffer.delete(0, buffer.length() - OUTPUT_TAIL);
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Test output stream closed: {}", e.getMessage());
            }
        }

        String tail() {
            synchronized (buffer) {
                int from = Math.max(0, buffer.length() - OUTPUT_TAIL);
                return buffer.substring(from);
            }
        }
    }
}
