/**
 * TraceExecution.java
 *
 * 一个正在运行的追踪任务实例，独占一个 tracer 子进程。
 * 状态机：STARTING -> RUNNING -> (STOPPING) -> COMPLETED | FAILED。
 * 所有状态迁移都在该执行自己的单线程调度器（邮箱）中进行；子进程输出由独立的读取线程收集到缓冲区，
 * 每个 interval 触发一次迭代：把缓冲区中通过过滤的输出作为一次报告发出，并把 remaining 减一，减到零即完成。
 * 进入终态后先通知 TraceSupervisor 注销，再唤醒所有等待者。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.TraceResult;
import club.ppmc.girasol.model.TraceState;
import club.ppmc.girasol.model.TracerInvocation;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
public class TraceExecution {

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneId.systemDefault());

    private final TraceModel model;
    private final String runId;
    private final Pattern filter;
    private final TraceExecutionSettings settings;
    private final TraceExecutionListener listener;
    private final TraceOutputSink outputSink;
    private final ScheduledThreadPoolExecutor mailbox;
    private final AtomicLong remaining;
    private final CompletableFuture<TraceResult> completion = new CompletableFuture<>();
    private final List<String> outputBuffer = new ArrayList<>();

    private volatile TraceState state = TraceState.STARTING;
    private volatile boolean terminating;

    // 以下字段只在邮箱线程中访问
    private Process process;
    private ScheduledFuture<?> ticker;
    private ScheduledFuture<?> forcedKill;
    private BufferedWriter outputFile;
    private Path dataFile;
    private long iteration;

    /**
     * @param model 要执行的任务定义。
     * @param round 要完成的迭代次数；不大于零时使用 model.lasting。
     * @param pattern tracer 输出过滤的正则表达式，为空时报告所有输出行。
     * @param settings 共享的运行参数。
     * @param listener 进入终态时的回调。
     * @param outputSink 接收每次迭代的输出报告。
     * @throws java.util.regex.PatternSyntaxException pattern 不是合法的正则表达式。
     */
    public TraceExecution(
            TraceModel model,
            long round,
            String pattern,
            TraceExecutionSettings settings,
            TraceExecutionListener listener,
            TraceOutputSink outputSink) {
        this.model = model;
        this.runId = RUN_ID_FORMAT.format(Instant.now());
        this.filter = StringUtils.hasLength(pattern) ? Pattern.compile(pattern) : null;
        this.settings = settings;
        this.listener = listener;
        this.outputSink = outputSink;
        this.remaining = new AtomicLong(round > 0 ? round : model.lasting());
        this.mailbox = new ScheduledThreadPoolExecutor(1, r -> {
            var thread = new Thread(r, "trace-" + model.name());
            thread.setDaemon(true);
            return thread;
        });
        this.mailbox.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.mailbox.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    /**
     * 启动状态机。只应调用一次；在此之前已被停止的执行不会再启动。
     */
    public void start() {
        try {
            mailbox.execute(this::doStart);
        } catch (RejectedExecutionException e) {
            log.debug("追踪任务 {} 已在启动前结束，忽略启动请求", model.name());
        }
    }

    /**
     * 请求终止子进程。子进程尚未启动时直接以 COMPLETED 结束，已处于终态时忽略。
     */
    public void stop() {
        try {
            mailbox.execute(() -> {
                if (state == TraceState.RUNNING) {
                    log.info("收到停止信号，正在终止追踪任务 {}", model.name());
                    beginStopping();
                } else if (state == TraceState.STARTING) {
                    // 子进程尚未启动，直接结束
                    log.info("追踪任务 {} 在启动完成前收到停止信号", model.name());
                    finish(TraceResult.completed(model.name(), null));
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("追踪任务 {} 已结束，忽略停止信号", model.name());
        }
    }

    /**
     * 阻塞直到执行进入终态，返回最终结果。
     */
    public TraceResult awaitCompletion() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("追踪任务的完成结果不应异常结束", e.getCause());
        }
    }

    public CompletableFuture<TraceResult> completion() {
        return completion;
    }

    public String getName() {
        return model.name();
    }

    public TraceState getState() {
        return state;
    }

    public long getRemaining() {
        return remaining.get();
    }

    private void doStart() {
        if (state != TraceState.STARTING) {
            return;
        }
        try {
            launch();
        } catch (RuntimeException e) {
            log.error("启动追踪任务 {} 时出现意外错误", model.name(), e);
            if (process != null && process.isAlive()) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
            if (!state.isTerminal()) {
                finish(TraceResult.failed(
                        model.name(), null, ErrorKind.PROCESS_SPAWN, "failed to start tracer: " + e.getMessage()));
            }
        }
    }

    private void launch() {
        TracerInvocation invocation;
        try {
            invocation = settings.commandBuilder().build(model, runId);
        } catch (IllegalArgumentException e) {
            log.error("无法为追踪任务 {} 生成命令行: {}", model.name(), e.getMessage());
            finish(TraceResult.failed(model.name(), null, ErrorKind.PROCESS_SPAWN, e.getMessage()));
            return;
        }

        openOutputFile();
        try {
            var processBuilder = new ProcessBuilder(invocation.command()).redirectErrorStream(true);
            processBuilder.environment().putAll(invocation.environment());
            process = processBuilder.start();
        } catch (IOException | RuntimeException e) {
            log.error("启动 tracer 失败，命令: {}", invocation.commandLine(), e);
            finish(TraceResult.failed(
                    model.name(), null, ErrorKind.PROCESS_SPAWN, "failed to spawn tracer: " + e.getMessage()));
            return;
        }
        state = TraceState.RUNNING;
        dataFile = invocation.dataFile();
        log.info("追踪任务 {} 已启动，PID: {}，剩余迭代: {}，命令: {}",
                model.name(), process.pid(), remaining.get(), invocation.commandLine());

        // 进程退出且输出流读完之后才处理退出，保证最后的输出不会丢失
        Process started = process;
        CompletableFuture<Void> readerFuture =
                CompletableFuture.runAsync(() -> readOutput(started), settings.outputReaders());
        started.onExit()
                .thenCombine(readerFuture, (p, v) -> p)
                .whenComplete((p, error) -> submit(() -> onProcessExit(started, error)));

        long period = Math.max(1, model.interval());
        ticker = mailbox.scheduleAtFixedRate(this::tick, period, period, settings.intervalUnit());
    }

    private void readOutput(Process source) {
        try (var reader = new BufferedReader(
                new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (filter == null || filter.matcher(line).find()) {
                    synchronized (outputBuffer) {
                        outputBuffer.add(line);
                    }
                }
            }
        } catch (IOException e) {
            // 主动终止子进程时读取流可能被关闭，这是正常现象
            if (!terminating) {
                throw new UncheckedIOException(e);
            }
            log.debug("追踪任务 {} 的输出流已随进程终止而关闭: {}", model.name(), e.getMessage());
        }
    }

    private void tick() {
        if (state != TraceState.RUNNING) {
            return;
        }
        iteration++;
        flushOutput();
        long left = remaining.updateAndGet(v -> v > 0 ? v - 1 : 0);
        log.debug("追踪任务 {} 完成第 {} 次迭代，剩余 {}", model.name(), iteration, left);
        if (left == 0) {
            log.info("追踪任务 {} 已完成全部迭代，正在结束 tracer", model.name());
            beginStopping();
        }
    }

    private void beginStopping() {
        state = TraceState.STOPPING;
        terminating = true;
        cancel(ticker);
        if (process == null || !process.isAlive()) {
            // 退出回调会随后到达并完成状态迁移
            return;
        }
        // 子进程派生的进程会继承输出管道，必须一起终止，否则输出流永远读不到结尾
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        forcedKill = mailbox.schedule(() -> {
            if (process.isAlive()) {
                log.warn("tracer PID {} 在 {} 内未退出，强制终止", process.pid(), settings.stopGrace());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }, settings.stopGrace().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onProcessExit(Process exited, Throwable error) {
        if (state.isTerminal()) {
            return;
        }
        if (exited.isAlive()) {
            // 读取线程先于进程退出而失败，子进程必须一并结束
            exited.destroyForcibly();
        }
        flushOutput();
        Integer exitCode = exited.isAlive() ? null : exited.exitValue();
        if (state == TraceState.STOPPING) {
            finish(TraceResult.completed(model.name(), exitCode));
        } else if (error != null) {
            Throwable cause = error.getCause() != null ? error.getCause() : error;
            log.error("监控追踪任务 {} 的输出时出错", model.name(), cause);
            finish(TraceResult.failed(model.name(), exitCode, ErrorKind.PROCESS_EXIT,
                    "I/O error while monitoring tracer: " + cause.getMessage()));
        } else if (exitCode != null && exitCode == 0) {
            finish(TraceResult.completed(model.name(), exitCode));
        } else {
            finish(TraceResult.failed(model.name(), exitCode, ErrorKind.PROCESS_EXIT,
                    "tracer exited with code " + exitCode));
        }
    }

    private void finish(TraceResult result) {
        state = result.state();
        cancel(ticker);
        cancel(forcedKill);
        closeOutputFile();
        if (result.isSuccess()) {
            log.info("追踪任务 {} 已完成，退出码: {}", model.name(), result.exitCode());
            if (dataFile != null) {
                log.info("追踪任务 {} 的 tracer 数据文件: {}", model.name(), dataFile);
            }
        } else {
            log.warn("追踪任务 {} 失败 [{}]: {}", model.name(), result.errorKind(), result.message());
        }

        CompletableFuture<Void> deregistered;
        try {
            deregistered = listener.onTerminated(this, result).toCompletableFuture();
        } catch (RuntimeException e) {
            log.error("处理追踪任务 {} 的终止回调时出错", model.name(), e);
            deregistered = CompletableFuture.completedFuture(null);
        }
        deregistered.whenComplete((v, e) -> completion.complete(result));
        mailbox.shutdown();
    }

    private void flushOutput() {
        List<String> lines;
        synchronized (outputBuffer) {
            if (outputBuffer.isEmpty()) {
                return;
            }
            lines = List.copyOf(outputBuffer);
            outputBuffer.clear();
        }
        writeOutputFile(lines);
        try {
            outputSink.report(model.name(), iteration, lines);
        } catch (RuntimeException e) {
            log.warn("转发追踪任务 {} 的输出失败: {}", model.name(), e.getMessage());
        }
    }

    private void openOutputFile() {
        Path directory = settings.commandBuilder().getOutputDirectory();
        Path file = directory.resolve(model.name() + "-" + runId + ".log");
        try {
            Files.createDirectories(directory);
            outputFile = Files.newBufferedWriter(
                    file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("无法创建追踪输出文件 {}，输出只会被转发: {}", file, e.getMessage());
        }
    }

    private void writeOutputFile(List<String> lines) {
        if (outputFile == null) {
            return;
        }
        try {
            for (String line : lines) {
                outputFile.write(line);
                outputFile.newLine();
            }
            outputFile.flush();
        } catch (IOException e) {
            log.warn("写入追踪输出文件失败，停止写文件: {}", e.getMessage());
            closeOutputFile();
        }
    }

    private void closeOutputFile() {
        if (outputFile == null) {
            return;
        }
        try {
            outputFile.close();
        } catch (IOException e) {
            log.warn("关闭追踪输出文件失败: {}", e.getMessage());
        } finally {
            outputFile = null;
        }
    }

    private void submit(Runnable task) {
        try {
            mailbox.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("追踪任务 {} 的邮箱已关闭，丢弃事件", model.name());
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
