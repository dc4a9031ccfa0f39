package testrelay.agent.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the load tool as a child process and waits for it.
 *
 * stdout and stderr are drained on their own threads so a chatty tool never
 * blocks on a full pipe.
 */
public class LoadToolRunner {

    private static final Logger log = LoggerFactory.getLogger(LoadToolRunner.class);

    private final Duration timeout;

    /**
     * @param timeout wall-clock ceiling, or null to wait for exit
     */
    public LoadToolRunner(Duration timeout) {
        this.timeout = timeout;
    }

    public ToolResult run(Path executable, List<String> args, Path workDir) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(args);

        log.info("Starting {} in {}", String.join(" ", command), workDir);

        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .start();

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outDrain = drain(process.getInputStream(), stdout, "stdout");
        Thread errDrain = drain(process.getErrorStream(), stderr, "stderr");

        boolean timedOut = false;
        try {
            if (timeout == null) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                log.warn("Tool exceeded {} and was killed", timeout);
                kill(process);
                process.waitFor();
            }
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        outDrain.join();
        errDrain.join();

        int exitCode = process.exitValue();
        log.info("Tool exited with code {}", exitCode);

        synchronized (stdout) {
            synchronized (stderr) {
                return new ToolResult(exitCode, stdout.toString(), stderr.toString(), timedOut);
            }
        }
    }

    // Launcher scripts fork the JVM, which would otherwise keep the pipes open.
    // The launcher goes first so it cannot run anything after its child dies.
    private static void kill(Process process) {
        List<ProcessHandle> children = process.descendants().toList();
        process.destroyForcibly();
        children.forEach(ProcessHandle::destroyForcibly);
    }

    private static Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                    log.debug("[{}] {}", name, line);
                }
            } catch (IOException e) {
                log.debug("Stopped reading tool {}: {}", name, e.getMessage());
            }
        }, "tool-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
