package io.fakegateway.core.worker;

import io.fakegateway.core.worker.runtime.WorkerMain;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The worker launcher artifact: a JDK {@code @argfile} at a fixed path in the temporary directory
 * carrying the JVM options, the worker classpath and {@link WorkerMain}. It is written once before
 * any process is spawned; every worker is then started as
 *
 * <pre>{@code
 * <java> @<tmp>/fake-api-gateway-worker.args <entry> <handler>
 * }</pre>
 *
 * <p>
 * Keeping the classpath in a file avoids command-line length limits for large classpaths.
 */
public final class WorkerBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerBootstrap.class);

    /** File name of the launcher inside the temporary directory. */
    public static final String ARGFILE_NAME = "fake-api-gateway-worker.args";

    /** JVM options tuned for short-lived, single-invocation processes. */
    static final List<String> JVM_OPTIONS = List.of("-XX:+UseSerialGC", "-XX:TieredStopAtLevel=1");

    private final Path javaExecutable;
    private final Path argFile;

    private WorkerBootstrap(Path javaExecutable, Path argFile) {
        this.javaExecutable = javaExecutable;
        this.argFile = argFile;
    }

    /**
     * Writes the launcher into {@code tmpDir}, replacing any earlier copy atomically.
     *
     * @param tmpDir         directory holding the launcher
     * @param javaExecutable the {@code java} binary workers run on
     * @param classpath      classpath containing the worker runtime and the function classes
     * @return the materialized bootstrap
     * @throws UncheckedIOException if the file cannot be written
     */
    public static WorkerBootstrap materialize(Path tmpDir, Path javaExecutable, String classpath) {
        Path argFile = tmpDir.resolve(ARGFILE_NAME);
        try {
            Files.createDirectories(tmpDir);
            Path staging = Files.createTempFile(tmpDir, ARGFILE_NAME, ".tmp");
            Files.writeString(staging, render(classpath), StandardCharsets.UTF_8);
            Files.move(staging, argFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write worker launcher " + argFile, e);
        }
        LOG.debug("Worker launcher written to {}", argFile);
        return new WorkerBootstrap(javaExecutable, argFile);
    }

    /** The {@code java} binary of the running JVM. */
    public static Path currentJavaExecutable() {
        return Path.of(System.getProperty("java.home"), "bin", "java");
    }

    /** Command line for one worker; entry and handler are the two positional arguments. */
    public List<String> command(String entry, String handler) {
        return List.of(javaExecutable.toString(), "@" + argFile, entry, handler);
    }

    public Path argFile() {
        return argFile;
    }

    public Path javaExecutable() {
        return javaExecutable;
    }

    static String render(String classpath) {
        StringBuilder out = new StringBuilder();
        JVM_OPTIONS.forEach(option -> out.append(option).append('\n'));
        out.append("-cp\n");
        out.append(quote(classpath)).append('\n');
        out.append(WorkerMain.class.getName()).append('\n');
        return out.toString();
    }

    /** Quotes an argfile token; inside quotes the launcher treats backslash as an escape. */
    private static String quote(String token) {
        return '"' + token.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
