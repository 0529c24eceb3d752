package io.fakegateway.core.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fakegateway.core.error.IpcProtocolException;
import io.fakegateway.core.error.WorkerCrashException;
import io.fakegateway.core.error.WorkerSpawnException;
import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.core.worker.fixtures.CrashHandler;
import io.fakegateway.core.worker.fixtures.EchoHandler;
import io.fakegateway.core.worker.fixtures.EnvHandler;
import io.fakegateway.core.worker.fixtures.HelloHandler;
import io.fakegateway.core.worker.fixtures.MalformedResultHandler;
import io.fakegateway.core.worker.fixtures.SilentExitHandler;
import io.fakegateway.core.worker.fixtures.SlowHandler;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Spawns real worker JVMs on the test classpath and checks the supervisor's terminal outcomes.
 */
class FunctionWorkerTest {

    private static final long TIMEOUT_S = 60;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tmp;

    private WorkerBootstrap bootstrap;
    private final StringBuffer stdout = new StringBuffer();
    private final StringBuffer stderr = new StringBuffer();
    private FunctionWorker worker;

    @BeforeEach
    void setUp() {
        bootstrap = WorkerBootstrap.materialize(
                tmp, WorkerBootstrap.currentJavaExecutable(), System.getProperty("java.class.path"));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (worker != null) {
            worker.closeAll().get(TIMEOUT_S, TimeUnit.SECONDS);
        }
    }

    private FunctionWorker worker(String path, Class<?> entry, Map<String, String> env) {
        worker = new FunctionWorker(new WorkerOptions(
                path, entry.getName(), "handler", env, stdout::append, stderr::append, bootstrap));
        return worker;
    }

    private static LambdaEvent get(String path) {
        return LambdaEvent.fromRequest("GET", path, List.of(Map.entry("Accept", "*/*")), List.of(), "");
    }

    private static Throwable failureOf(CompletableFuture<LambdaResult> outcome) throws Exception {
        try {
            outcome.get(TIMEOUT_S, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        throw new AssertionError("Invocation succeeded unexpectedly");
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_S);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + TIMEOUT_S + " s");
            }
            Thread.sleep(20);
        }
    }

    // ── Successful invocations ──

    @Test
    @DisplayName("hello handler answers and its output is prefixed with the request id")
    void helloInvocation() throws Exception {
        FunctionWorker hello = worker("/hello", HelloHandler.class, Map.of());

        LambdaResult result = hello.invoke("req-1", get("/hello")).get(TIMEOUT_S, TimeUnit.SECONDS);

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.headers()).containsEntry("Content-Type", "text/plain");
        assertThat(result.body()).isEqualTo("hi");
        assertThat(stdout.toString())
                .startsWith("START\tRequestId:req-1\tVersion:$LATEST\n")
                .contains("END\tRequestId: req-1\n")
                .contains("REPORT\tRequestId: req-1\tInitDuration: 0 ms\tDuration: ");
        awaitTrue(() -> stdout.toString().contains(" req-1 INFO hello from /hello\n"));
        awaitTrue(() -> stderr.toString().contains(" req-1 ERR warning from /hello\n"));
        awaitTrue(() -> hello.trackedProcessCount() == 0);
    }

    @Test
    @DisplayName("event reaches the worker intact")
    void eventDelivered() throws Exception {
        FunctionWorker echo = worker("/echo", EchoHandler.class, Map.of());

        LambdaResult result = echo.invoke("req-2", get("/echo?x=1")).get(TIMEOUT_S, TimeUnit.SECONDS);
        JsonNode event = MAPPER.readTree(result.body());

        assertThat(event.get("path").asText()).isEqualTo("/echo?x=1");
        assertThat(event.get("resource").asText()).isEqualTo("/{proxy+}");
        assertThat(event.get("headers").get("Accept").asText()).isEqualTo("*/*");
        assertThat(event.get("isBase64Encoded").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("worker sees only the configured environment")
    void environmentIsolated() throws Exception {
        FunctionWorker env = worker("/env", EnvHandler.class, Map.of("GREETING", "hola"));

        LambdaResult result = env.invoke("req-3", get("/env")).get(TIMEOUT_S, TimeUnit.SECONDS);

        assertThat(result.body()).isEqualTo("hola|unset");
    }

    @Test
    @DisplayName("each invocation runs in a fresh process")
    void processNotReused() throws Exception {
        FunctionWorker hello = worker("/hello", HelloHandler.class, Map.of());

        CompletableFuture<LambdaResult> first = hello.invoke("req-a", get("/hello"));
        CompletableFuture<LambdaResult> second = hello.invoke("req-b", get("/hello"));

        assertThat(first.get(TIMEOUT_S, TimeUnit.SECONDS).body()).isEqualTo("hi");
        assertThat(second.get(TIMEOUT_S, TimeUnit.SECONDS).body()).isEqualTo("hi");
        assertThat(stdout.toString()).contains("END\tRequestId: req-a\n").contains("END\tRequestId: req-b\n");
    }

    // ── Failures ──

    @Test
    @DisplayName("handler exception surfaces as a crash carrying the stack trace")
    void crash() throws Exception {
        FunctionWorker crashing = worker("/crash", CrashHandler.class, Map.of());

        Throwable failure = failureOf(crashing.invoke("req-4", get("/crash")));

        assertThat(failure).isInstanceOf(WorkerCrashException.class).hasMessage("Internal Server Error");
        WorkerCrashException crash = (WorkerCrashException) failure;
        assertThat(crash.exitCode()).isEqualTo(1);
        assertThat(crash.correlationId()).isEqualTo("req-4");
        assertThat(crash.stackLines().get(0)).contains("IllegalStateException").contains("boom");
        assertThat(stdout.toString()).contains("\treq-4\tERROR\t{\"errorType\":\"Error\"");
        assertThat(stdout.toString()).doesNotContain("END\tRequestId: req-4");
    }

    @Test
    @DisplayName("clean exit without a result is still a failure")
    void silentExit() throws Exception {
        FunctionWorker silent = worker("/silent", SilentExitHandler.class, Map.of());

        Throwable failure = failureOf(silent.invoke("req-5", get("/silent")));

        assertThat(failure).isInstanceOf(WorkerCrashException.class).hasMessageContaining("without sending a result");
        assertThat(((WorkerCrashException) failure).exitCode()).isZero();
    }

    @Test
    @DisplayName("malformed result is a protocol violation, never coerced")
    void malformedResult() throws Exception {
        FunctionWorker malformed = worker("/bad", MalformedResultHandler.class, Map.of());

        Throwable failure = failureOf(malformed.invoke("req-6", get("/bad")));

        assertThat(failure).isInstanceOf(IpcProtocolException.class).hasMessageContaining("statusCode");
        awaitTrue(() -> malformed.trackedProcessCount() == 0);
    }

    @Test
    @DisplayName("missing java binary is a spawn failure")
    void spawnFailure() throws Exception {
        bootstrap = WorkerBootstrap.materialize(
                tmp, tmp.resolve("no-such-java"), System.getProperty("java.class.path"));
        FunctionWorker broken = worker("/hello", HelloHandler.class, Map.of());

        Throwable failure = failureOf(broken.invoke("req-7", get("/hello")));

        assertThat(failure).isInstanceOf(WorkerSpawnException.class);
        assertThat(broken.trackedProcessCount()).isZero();
    }

    // ── Shutdown ──

    @Test
    @DisplayName("closeAll kills in-flight workers and fails their invocations")
    void closeAllKillsInFlight() throws Exception {
        FunctionWorker slow = worker("/slow", SlowHandler.class, Map.of());

        CompletableFuture<LambdaResult> outcome = slow.invoke("req-8", get("/slow"));
        awaitTrue(() -> stdout.toString().contains("START\tRequestId:req-8"));
        assertThat(slow.trackedProcessCount()).isEqualTo(1);

        slow.closeAll().get(TIMEOUT_S, TimeUnit.SECONDS);

        assertThat(slow.trackedProcessCount()).isZero();
        assertThat(outcome).isDone();
        assertThatThrownBy(() -> outcome.get(TIMEOUT_S, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerCrashException.class);
        awaitTrue(() -> Thread.getAllStackTraces().keySet().stream()
                .noneMatch(thread -> thread.getName().startsWith("fn/slow-")));
    }

    @Test
    @DisplayName("invoke after closeAll fails without spawning")
    void invokeAfterClose() throws Exception {
        FunctionWorker hello = worker("/hello", HelloHandler.class, Map.of());
        hello.closeAll().get(TIMEOUT_S, TimeUnit.SECONDS);

        Throwable failure = failureOf(hello.invoke("req-9", get("/hello")));

        assertThat(hello.isClosed()).isTrue();
        assertThat(failure).isInstanceOf(WorkerSpawnException.class).hasMessage("Function /hello is closed");
        assertThat(((WorkerSpawnException) failure).correlationId()).isEqualTo("req-9");
        assertThat(hello.trackedProcessCount()).isZero();
        assertThat(stdout.toString()).doesNotContain("START");
    }
}
