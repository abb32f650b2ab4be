package io.muxharness.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

public final class ProcessTargetRunner implements TargetRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessTargetRunner.class);
    private static final long DRAIN_GRACE_MS = 500L;
    private static final int MAX_LOG_CHARS = 256;

    private final List<String> targetCommand;
    private final ExecutorService drainers;

    public ProcessTargetRunner(List<String> targetCommand) {
        if (targetCommand == null || targetCommand.isEmpty()) {
            throw new IllegalArgumentException("target command cannot be empty");
        }
        this.targetCommand = List.copyOf(targetCommand);
        AtomicInteger seq = new AtomicInteger();
        this.drainers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "muxharness-drain-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Outcome run(Invocation invocation) {
        ProcessBuilder pb = new ProcessBuilder(commandLine(invocation.args()));
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        long startedAt = System.nanoTime();
        Process process = start(pb, invocation.toString());
        closeQuietly(process);

        StreamCollector out = new StreamCollector(process.getInputStream());
        StreamCollector err = new StreamCollector(process.getErrorStream());
        Future<?> outTask = drainers.submit(out);
        Future<?> errTask = drainers.submit(err);
        try {
            boolean finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                abandon(outTask, process.getInputStream());
                abandon(errTask, process.getErrorStream());
                long elapsed = elapsedMs(startedAt);
                log.warn("target timed out after {} ms: {}", elapsed, invocation);
                return Outcome.timedOut(elapsed);
            }
            // A server forked by the target may inherit the pipes; take what arrived.
            awaitDrain(outTask, process.getInputStream());
            awaitDrain(errTask, process.getErrorStream());
            long elapsed = elapsedMs(startedAt);
            Outcome outcome = Outcome.completed(process.exitValue(), out.text(), err.text(), elapsed);
            if (log.isDebugEnabled()) {
                log.debug("target exit={} in {} ms: {} stderr={}",
                        process.exitValue(), elapsed, invocation, truncate(err.text()));
            }
            return outcome;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            abandon(outTask, process.getInputStream());
            abandon(errTask, process.getErrorStream());
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for target: {}", invocation);
            return Outcome.timedOut(elapsedMs(startedAt));
        }
    }

    @Override
    public void spawnDetached(List<String> args) {
        ProcessBuilder pb = new ProcessBuilder(commandLine(args));
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = start(pb, String.join(" ", args));
        closeQuietly(process);
        log.debug("spawned detached target pid={}: {}", process.pid(), args);
    }

    private List<String> commandLine(List<String> args) {
        List<String> cmd = new ArrayList<>(targetCommand.size() + args.size());
        cmd.addAll(targetCommand);
        cmd.addAll(args);
        return cmd;
    }

    private Process start(ProcessBuilder pb, String description) {
        try {
            return pb.start();
        } catch (IOException e) {
            throw new TargetSpawnException(
                    "Failed to launch target " + targetCommand + " for: " + description, e);
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("failed to close target stdin pid={}: {}", process.pid(), e.getMessage());
        }
    }

    private static void awaitDrain(Future<?> task, InputStream stream) throws InterruptedException {
        try {
            task.get(DRAIN_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(task, stream);
        } catch (ExecutionException e) {
            log.debug("stream drain failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
    }

    // Interrupting a thread blocked in a pipe read does nothing; closing the pipe ends the read.
    private static void abandon(Future<?> task, InputStream stream) {
        task.cancel(true);
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("failed to close abandoned target stream: {}", e.getMessage());
        }
    }

    private static long elapsedMs(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_LOG_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_LOG_CHARS) + "...";
    }

    private static final class StreamCollector implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        private StreamCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[4096];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (buffer) {
                        buffer.write(chunk, 0, n);
                    }
                }
            } catch (IOException e) {
                log.debug("target stream closed early: {}", e.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
