package fr.lapetina.llama.orchestrator.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder} and {@link ProcessHandle}.
 */
public final class NativeProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(NativeProcessLauncher.class);

    private final int stderrTailChars;

    public NativeProcessLauncher(int stderrTailChars) {
        this.stderrTailChars = stderrTailChars;
    }

    public NativeProcessLauncher() {
        this(2000);
    }

    @Override
    public ManagedProcess launch(List<String> command, Map<String, String> environment) throws IOException {
        ProcessBuilder builder = newBuilder(command, environment)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);
        Process process = builder.start();
        // Server processes never read stdin; closing it detaches them from our console input
        process.getOutputStream().close();
        log.debug("Process spawned: pid={}, command={}", process.pid(), command);
        return new NativeManagedProcess(process, startTail(process));
    }

    @Override
    public ManagedProcess launchInteractive(List<String> command, Map<String, String> environment) throws IOException {
        Process process = newBuilder(command, environment).start();
        log.debug("Interactive process spawned: pid={}, command={}", process.pid(), command);
        return new NativeManagedProcess(process, startTail(process));
    }

    @Override
    public boolean killByPid(long pid) {
        if (pid <= 0 || pid == ProcessHandle.current().pid()) {
            log.warn("Refusing to kill pid: pid={}", pid);
            return false;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            log.debug("No live process for pid: pid={}", pid);
            return false;
        }
        handle.get().descendants().forEach(ProcessHandle::destroyForcibly);
        boolean issued = handle.get().destroyForcibly();
        log.info("Kill issued by pid: pid={}, accepted={}", pid, issued);
        return issued;
    }

    private ProcessBuilder newBuilder(List<String> command, Map<String, String> environment) {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);
        return builder;
    }

    private OutputTail startTail(Process process) {
        return OutputTail.start(process.getErrorStream(), stderrTailChars, "stderr-" + process.pid());
    }

    private static final class NativeManagedProcess implements ManagedProcess {
        private final Process process;
        private final OutputTail stderr;

        private NativeManagedProcess(Process process, OutputTail stderr) {
            this.process = process;
            this.stderr = stderr;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void forceKill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public OptionalInt exitCode() {
            return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
        }

        @Override
        public String stderrTail() {
            return process.isAlive() ? stderr.get() : stderr.awaitAndGet(500);
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }
    }
}
