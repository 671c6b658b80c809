package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.TraceResult;
import club.ppmc.girasol.model.TraceState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class TraceExecutionTest {

    private static final String LONG_RUNNING = "echo hello; exec sleep 30";

    @TempDir
    Path home;

    private ExecutorService outputReaders;
    private TraceExecutionSettings settings;
    private final List<String> reported = new CopyOnWriteArrayList<>();
    private final List<Long> iterations = new CopyOnWriteArrayList<>();
    private final List<TraceResult> terminated = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        outputReaders = Executors.newCachedThreadPool();
        settings = new TraceExecutionSettings(
                new ShellTracerCommandBuilder(home.resolve("output")),
                TimeUnit.MILLISECONDS,
                Duration.ofSeconds(2),
                outputReaders);
    }

    @AfterEach
    void tearDown() {
        outputReaders.shutdownNow();
    }

    @Test
    void lastingIterations_completeAfterThatManyIntervals() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("three", 3, 50, LONG_RUNNING), 0, "");

        long startedAt = System.nanoTime();
        execution.start();
        TraceResult result = execution.awaitCompletion();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertEquals(TraceState.COMPLETED, result.state());
        assertEquals(TraceState.COMPLETED, execution.getState());
        assertEquals(0, execution.getRemaining());
        assertTrue(elapsedMillis >= 150, "finished after " + elapsedMillis + "ms");
        assertEquals(List.of("hello"), reported);
        assertTrue(iterations.get(0) >= 1);
        assertEquals(List.of(result), terminated);
    }

    @Test
    void round_overridesLasting() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("round", 1000, 20, LONG_RUNNING), 2, "");

        assertEquals(2, execution.getRemaining());
        execution.start();

        assertEquals(TraceState.COMPLETED, execution.awaitCompletion().state());
        assertEquals(0, execution.getRemaining());
    }

    @Test
    void zeroBudget_completesOnFirstTick() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("zero", 0, 20, LONG_RUNNING), 0, "");

        execution.start();

        assertEquals(TraceState.COMPLETED, execution.awaitCompletion().state());
    }

    @Test
    void pattern_reportsOnlyMatchingLines() throws Exception {
        String script = "printf 'keep 1\\ndrop\\nkeep 2\\n'; exec sleep 30";
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("filtered", 3, 50, script), 0, "^keep");

        execution.start();
        execution.awaitCompletion();

        assertEquals(List.of("keep 1", "keep 2"), reported);
    }

    @Test
    void invalidPattern_isRejectedAtConstruction() {
        assertThrows(PatternSyntaxException.class,
                () -> execution(ShellTracerCommandBuilder.script("bad", 1, 1, LONG_RUNNING), 0, "(unclosed"));
    }

    @Test
    void output_isAlsoWrittenToRunLogFile() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("logged", 2, 50, LONG_RUNNING), 0, "");

        execution.start();
        execution.awaitCompletion();

        try (Stream<Path> files = Files.list(home.resolve("output"))) {
            List<Path> logs = files.filter(p -> p.getFileName().toString().startsWith("logged-")).toList();
            assertEquals(1, logs.size());
            assertEquals(List.of("hello"), Files.readAllLines(logs.get(0), StandardCharsets.UTF_8));
        }
    }

    @Test
    void spawnFailure_failsWithProcessSpawn() throws Exception {
        TraceExecution execution = execution(
                ShellTracerCommandBuilder.script("missing", 3, 50, ShellTracerCommandBuilder.MISSING_BINARY), 0, "");

        execution.start();
        TraceResult result = execution.awaitCompletion();

        assertEquals(TraceState.FAILED, result.state());
        assertEquals(ErrorKind.PROCESS_SPAWN, result.errorKind());
        assertNull(result.exitCode());
    }

    @Test
    void unbuildableDefinition_failsWithProcessSpawn() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("blank", 3, 50, ""), 0, "");

        execution.start();

        assertEquals(ErrorKind.PROCESS_SPAWN, execution.awaitCompletion().errorKind());
    }

    @Test
    void unexpectedStartupError_failsAndReleasesWaiters() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("bad\u0000name", 1, 10, LONG_RUNNING), 0, "");

        execution.start();
        TraceResult result = execution.completion().get(5, TimeUnit.SECONDS);

        assertEquals(TraceState.FAILED, result.state());
        assertEquals(ErrorKind.PROCESS_SPAWN, result.errorKind());
        assertEquals(List.of(result), terminated);
    }

    @Test
    void stopBeforeLaunch_completesWithoutSpawning() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("early", 5, 10, LONG_RUNNING), 0, "");

        execution.stop();
        execution.start();
        TraceResult result = execution.completion().get(5, TimeUnit.SECONDS);

        assertEquals(TraceState.COMPLETED, result.state());
        assertNull(result.exitCode());
        assertTrue(reported.isEmpty());
        assertFalse(Files.exists(home.resolve("output")));
    }

    @Test
    void nonZeroExit_failsWithExitCode() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("crash", 1000, 50, "exit 3"), 0, "");

        execution.start();
        TraceResult result = execution.awaitCompletion();

        assertEquals(TraceState.FAILED, result.state());
        assertEquals(ErrorKind.PROCESS_EXIT, result.errorKind());
        assertEquals(3, result.exitCode());
        assertEquals("tracer exited with code 3", result.message());
    }

    @Test
    void cleanEarlyExit_completes() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("quick", 1000, 50, "echo done"), 0, "");

        execution.start();
        TraceResult result = execution.awaitCompletion();

        assertEquals(TraceState.COMPLETED, result.state());
        assertEquals(0, result.exitCode());
        assertEquals(List.of("done"), reported);
    }

    @Test
    void stop_terminatesTracerAndCompletes() throws Exception {
        TraceExecution execution = execution(ShellTracerCommandBuilder.script("stopped", 1000, 20, LONG_RUNNING), 0, "");
        execution.start();
        waitForState(execution, TraceState.RUNNING);

        execution.stop();
        TraceResult result = execution.awaitCompletion();

        assertEquals(TraceState.COMPLETED, result.state());
        assertTrue(execution.getRemaining() > 0);
    }

    @Test
    void completion_resolvesOnlyAfterListenerFinishes() throws Exception {
        var listenerDone = new CompletableFuture<Void>();
        var observedBeforeRelease = new AtomicBoolean();
        var execution = new TraceExecution(
                ShellTracerCommandBuilder.script("ordered", 1, 20, LONG_RUNNING), 0, "", settings,
                (e, result) -> listenerDone,
                (name, iteration, lines) -> { });

        execution.start();
        waitForState(execution, TraceState.COMPLETED);
        observedBeforeRelease.set(execution.completion().isDone());
        listenerDone.complete(null);

        assertFalse(observedBeforeRelease.get());
        assertEquals(TraceState.COMPLETED, execution.completion().get(5, TimeUnit.SECONDS).state());
    }

    private TraceExecution execution(TraceModel model, long round, String pattern) {
        return new TraceExecution(model, round, pattern, settings,
                (e, result) -> {
                    terminated.add(result);
                    return CompletableFuture.completedFuture(null);
                },
                (name, iteration, lines) -> {
                    iterations.add(iteration);
                    reported.addAll(lines);
                });
    }

    private static void waitForState(TraceExecution execution, TraceState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (execution.getState() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, execution.getState());
    }
}
