package com.machina.provisioning.terraform;

import com.machina.provisioning.entity.LogLevel;
import com.machina.provisioning.entity.LogSource;
import com.machina.provisioning.exception.ExecutionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the Terraform binary as a child process.
 *
 * stdout/stderr are drained by two reader threads. Each line goes to the context's
 * log sink as it arrives, so output captured before a failure is already recorded when
 * the exception propagates. The last N lines are kept for the error itself. Captured
 * stdout is written to the sink only when the command fails.
 */
@Component
@Slf4j
public class TerraformCommandRunner {

    private static final Duration CANCEL_GRACE = Duration.ofSeconds(30);
    private static final long POLL_MILLIS = 500;

    private final String binary;
    private final Duration timeout;
    private final int tailLines;

    public TerraformCommandRunner(
        @Value("${terraform.binary:terraform}") String binary,
        @Value("${terraform.command-timeout:30m}") Duration timeout,
        @Value("${terraform.output-tail-lines:50}") int tailLines
    ) {
        this.binary = binary;
        this.timeout = timeout;
        this.tailLines = tailLines;
    }

    /**
     * Run and stream stdout to the log sink.
     */
    public CommandResult run(Path workdir, List<String> args, ExecutionContext context) {
        return run(workdir, args, Map.of(), context, false);
    }

    /**
     * Run and capture stdout instead of streaming it (machine-readable output such as {@code show -json}).
     */
    public CommandResult capture(Path workdir, List<String> args, ExecutionContext context) {
        return run(workdir, args, Map.of(), context, true);
    }

    CommandResult run(
        Path workdir,
        List<String> args,
        Map<String, String> extraEnv,
        ExecutionContext context,
        boolean captureStdout
    ) {
        String display = "terraform " + String.join(" ", args);
        if (context.isCancelled()) {
            throw new ExecutionCancelledException("Cancelled before running: " + display);
        }

        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(binary);
        command.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(command)
            .directory(workdir.toFile())
            .redirectErrorStream(false);
        pb.environment().put("TF_IN_AUTOMATION", "1");
        pb.environment().put("TF_INPUT", "0");
        pb.environment().putAll(extraEnv);

        LogSink sink = context.getLogSink();
        Deque<String> tail = new ArrayDeque<>();
        StringBuilder stdout = new StringBuilder();

        log.info("Running {} in {}", display, workdir);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            sink.error("Failed to start " + display + ": " + e.getMessage());
            throw new ExecutionFailedException("Failed to start " + display, e);
        }
        context.attach(process);

        try {
            CountDownLatch latch = new CountDownLatch(2);
            Thread tOut = drain(process.getInputStream(), latch, "tf-stdout-" + context.getDeploymentId(), line -> {
                remember(tail, line);
                if (captureStdout) {
                    synchronized (stdout) {
                        stdout.append(line).append('\n');
                    }
                } else {
                    sink.append(classify(line), LogSource.TERRAFORM, line);
                }
            });
            Thread tErr = drain(process.getErrorStream(), latch, "tf-stderr-" + context.getDeploymentId(), line -> {
                remember(tail, line);
                sink.append(LogLevel.ERROR, LogSource.TERRAFORM, line);
            });
            tOut.start();
            tErr.start();

            boolean finished = awaitExit(process, context);
            if (!finished) {
                process.destroyForcibly();
                String msg = "Command timed out after " + timeout + ": " + display;
                sink.error(msg);
                throw new ExecutionFailedException(msg, -1, snapshot(tail));
            }
            if (!latch.await(5, TimeUnit.SECONDS)) {
                log.warn("Output of {} still draining after exit; trailing lines may be missing", display);
            }

            int exit = process.exitValue();
            if (context.isCancelled()) {
                sink.warn(display + " terminated by cancellation (exit " + exit + ")");
                throw new ExecutionCancelledException("Cancelled while running: " + display);
            }
            String captured;
            synchronized (stdout) {
                captured = stdout.toString();
            }
            if (exit != 0) {
                if (captureStdout) {
                    captured.lines()
                        .filter(line -> !line.isBlank())
                        .forEach(line -> sink.append(classify(line), LogSource.TERRAFORM, line));
                }
                String msg = display + " failed with exit code " + exit;
                sink.error(msg);
                throw new ExecutionFailedException(msg, exit, snapshot(tail));
            }
            return new CommandResult(exit, captured, snapshot(tail));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExecutionFailedException("Interrupted while running " + display, e);
        } finally {
            context.detach();
        }
    }

    /**
     * Waits for exit, escalating to a forcible kill if a cancelled process ignores the
     * termination signal for longer than the grace period.
     */
    private boolean awaitExit(Process process, ExecutionContext context) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().isBefore(deadline)) {
            if (process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
            Instant cancelledAt = context.getCancelledAt();
            if (cancelledAt != null && Instant.now().isAfter(cancelledAt.plus(CANCEL_GRACE))) {
                log.warn("Process {} ignored termination signal, killing", process.pid());
                process.destroyForcibly();
            }
        }
        return false;
    }

    private Thread drain(InputStream stream, CountDownLatch latch, String name, Consumer<String> onLine) {
        Thread thread = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    if (!line.isBlank()) {
                        onLine.accept(line);
                    }
                }
            } catch (IOException e) {
                log.debug("Stream {} closed: {}", name, e.getMessage());
            } finally {
                latch.countDown();
            }
        }, name);
        thread.setDaemon(true);
        return thread;
    }

    private void remember(Deque<String> tail, String line) {
        synchronized (tail) {
            tail.addLast(line);
            while (tail.size() > tailLines) {
                tail.removeFirst();
            }
        }
    }

    private List<String> snapshot(Deque<String> tail) {
        synchronized (tail) {
            return List.copyOf(tail);
        }
    }

    static LogLevel classify(String line) {
        if (line.contains("Error")) {
            return LogLevel.ERROR;
        }
        if (line.contains("Warning")) {
            return LogLevel.WARN;
        }
        return LogLevel.INFO;
    }
}
