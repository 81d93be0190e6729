package com.codelogickeep.coverage.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs an external command (typically the build's test runner) and parses the test
 * count from its output. The process is killed once the timeout elapses.
 * <p>
 * Recognized output: Surefire's {@code Tests run: N} summary (the last occurrence wins)
 * and, failing that, the first {@code N tests} phrase.
 */
public class ProcessTestCountProbe implements TestCountProbe {
    private static final Logger log = LoggerFactory.getLogger(ProcessTestCountProbe.class);

    public static final long DEFAULT_TIMEOUT_SECONDS = 30;

    private static final Pattern SUREFIRE_SUMMARY = Pattern.compile("Tests run:\\s*(\\d+)");
    private static final Pattern GENERIC_COUNT = Pattern.compile("(\\d+)\\s+tests?\\b");

    private final List<String> command;
    private final Path workingDir;
    private final long timeoutSeconds;

    public ProcessTestCountProbe(List<String> command, Path workingDir, long timeoutSeconds) {
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public int count() {
        if (command.isEmpty()) {
            return 0;
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            pb.redirectErrorStream(true);
            log.debug("Running test count probe: {}", command);
            Process process = pb.start();

            StringBuilder output = new StringBuilder();
            Thread reader = new Thread(() -> {
                try (BufferedReader in = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        synchronized (output) {
                            output.append(line).append('\n');
                        }
                    }
                } catch (IOException e) {
                    log.debug("Probe output stream closed: {}", e.getMessage());
                }
            });
            reader.setDaemon(true);
            reader.start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Test count probe timed out after {}s", timeoutSeconds);
                return 0;
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));

            if (process.exitValue() != 0) {
                log.warn("Test count probe exited with code {}", process.exitValue());
                return 0;
            }
            String text;
            synchronized (output) {
                text = output.toString();
            }
            return parseCount(text);
        } catch (IOException e) {
            log.warn("Test count probe failed to start: {}", e.getMessage());
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Test count probe interrupted");
            return 0;
        }
    }

    static int parseCount(String output) {
        try {
            Matcher surefire = SUREFIRE_SUMMARY.matcher(output);
            Integer last = null;
            while (surefire.find()) {
                last = Integer.parseInt(surefire.group(1));
            }
            if (last != null) {
                return last;
            }
            Matcher generic = GENERIC_COUNT.matcher(output);
            if (generic.find()) {
                return Integer.parseInt(generic.group(1));
            }
        } catch (NumberFormatException e) {
            log.warn("Test count out of range in probe output: {}", e.getMessage());
        }
        return 0;
    }
}
