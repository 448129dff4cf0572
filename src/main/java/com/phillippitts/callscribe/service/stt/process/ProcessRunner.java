package com.phillippitts.callscribe.service.stt.process;

import com.phillippitts.callscribe.exception.TranscriptionException;
import com.phillippitts.callscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.callscribe.util.ProcessTimeouts;
import com.phillippitts.callscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external speech-to-text process and returns its stdout.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout (transcript) and stderr (diagnostics) concurrently, both capped</li>
 *   <li>Enforce the timeout and terminate runaway processes</li>
 *   <li>Report failures as {@link TranscriptionException} with stderr snippet and timing</li>
 * </ul>
 *
 * <p>Every call keeps its process and gobbler threads in local state, so one runner serves
 * many segments at once.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    static final int STDERR_MAX_BYTES = 256 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    private record Execution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    /**
     * Executes the process described by {@code spec}.
     *
     * @return stdout content (may be empty)
     * @throws TranscriptionException on timeout, non-zero exit, or I/O error
     */
    public String run(ProcessSpec spec) {
        Objects.requireNonNull(spec, "spec");
        long startNanos = System.nanoTime();
        Execution exec = null;
        try {
            exec = start(spec);
            boolean finished = exec.process().waitFor(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw failure(spec, "Timeout after " + spec.timeout().toSeconds() + "s", -1,
                        exec.stderr(), startNanos, null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw failure(spec, "Non-zero exit: " + exitCode, exitCode, exec.stderr(), startNanos, null);
            }
            String output;
            synchronized (exec.stdout()) {
                output = exec.stdout().toString();
            }
            LOG.debug("{} stdout size={} chars in {}ms", spec.engine(), output.length(),
                    TimeUtils.elapsedMillis(startNanos));
            return output;
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw failure(spec, "I/O failure: " + e.getMessage(), -1,
                    exec == null ? null : exec.stderr(), startNanos, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private Execution start(ProcessSpec spec) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(spec.command(), spec.workingDir());
        // Start gobblers before waiting to avoid pipe deadlock
        Thread out = startGobbler(process.getInputStream(), stdout, spec.engine() + "-out", spec.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, spec.engine() + "-err", STDERR_MAX_BYTES);
        return new Execution(process, out, err, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Past the cap the stream is still drained so the child
     * never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(Execution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private TranscriptionException failure(ProcessSpec spec, String msg, int exitCode, StringBuilder stderr,
                                           long startNanos, Throwable cause) {
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(spec.engine())
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNanos));
        for (Map.Entry<String, String> e : spec.diagnostics().entrySet()) {
            builder.metadata(e.getKey(), e.getValue());
        }
        if (stderr != null) {
            synchronized (stderr) {
                builder.metadata("stderr", stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length())));
            }
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
