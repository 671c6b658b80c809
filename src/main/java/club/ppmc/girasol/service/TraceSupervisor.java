/**
 * TraceSupervisor.java
 *
 * 正在运行的 TraceExecution 的管家：负责准入控制、登记和注销，并把执行的完成结果转发给发起它的连接。
 * 注册表只在该服务自己的单线程邮箱中读写，因此“同名任务同一时刻至多运行一个”无需加锁即可保证。
 * 停止请求只负责发出信号，注册项由执行进入终态时自行注销。
 */
package club.ppmc.girasol.service;

import club.ppmc.girasol.exception.ErrorKind;
import club.ppmc.girasol.exception.TraceException;
import club.ppmc.girasol.model.TraceModel;
import club.ppmc.girasol.model.TraceResult;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TraceSupervisor {

    private final TraceExecutionSettings settings;
    private final ExecutorService mailbox = Executors.newSingleThreadExecutor(r -> {
        var thread = new Thread(r, "trace-supervisor");
        thread.setDaemon(true);
        return thread;
    });

    // 只在邮箱线程中读写
    private final Map<String, RunningExecution> running = new HashMap<>();

    public TraceSupervisor(TraceExecutionSettings settings) {
        this.settings = settings;
    }

    /**
     * 启动一个新的执行。同名执行已在运行时失败（CONFLICT）。
     *
     * @param model 任务定义，可以来自 catalog，也可以是临时提交的定义。
     * @param round 迭代次数，不大于零时使用 model.lasting。
     * @param pattern tracer 输出过滤的正则表达式。
     * @param notifier 发起请求的连接；本地调用时为 null，输出写入日志，完成结果只通过执行本身获知。
     */
    public CompletableFuture<RunningExecution> start(
            TraceModel model, long round, String pattern, OutboundNotifier notifier) {
        return submit(() -> {
            if (!TraceModel.isValidName(model.name())) {
                throw TraceException.invalidName(model.name());
            }
            if (running.containsKey(model.name())) {
                throw new TraceException(ErrorKind.CONFLICT, model.name() + " is already running");
            }
            TraceOutputSink sink = notifier != null ? notifier::sendTraceOutput : TraceSupervisor::logOutput;
            TraceExecution execution;
            try {
                execution = new TraceExecution(
                        model, round, pattern, settings,
                        (terminated, result) -> onTerminated(terminated, result, notifier),
                        sink);
            } catch (PatternSyntaxException e) {
                throw new TraceException(ErrorKind.SERIALIZATION, "invalid output pattern: " + e.getDescription(), e);
            }
            var entry = new RunningExecution(model.name(), execution);
            running.put(model.name(), entry);
            execution.start();
            log.info("已登记追踪任务 {}，当前运行中: {}", model.name(), running.size());
            return entry;
        });
    }

    /**
     * 向指定执行发送停止信号。没有该执行时失败（NOT_FOUND）。
     */
    public CompletableFuture<Void> stop(String name) {
        return submit(() -> {
            RunningExecution entry = running.get(name);
            if (entry == null) {
                throw new TraceException(ErrorKind.NOT_FOUND, name + " is not running");
            }
            entry.handle().stop();
            return null;
        });
    }

    /**
     * 从注册表中移除一个执行，可重复调用。
     */
    public CompletableFuture<Void> deregister(String name) {
        return submit(() -> {
            if (running.remove(name) != null) {
                log.info("已注销追踪任务 {}，当前运行中: {}", name, running.size());
            }
            return null;
        });
    }

    /**
     * 向所有执行发送停止信号，不等待它们结束。
     */
    public CompletableFuture<Void> shutdownAll() {
        return submit(() -> {
            log.info("正在向 {} 个运行中的追踪任务发送停止信号", running.size());
            running.values().forEach(entry -> entry.handle().stop());
            return null;
        });
    }

    /**
     * @return 当前运行中的任务名称，按名称排序。
     */
    public CompletableFuture<List<String>> running() {
        return submit(() -> {
            var names = new ArrayList<>(running.keySet());
            names.sort(null);
            return names;
        });
    }

    @PreDestroy
    public void destroy() {
        shutdownAll();
        mailbox.shutdown();
    }

    private CompletionStage<Void> onTerminated(
            TraceExecution execution, TraceResult result, OutboundNotifier notifier) {
        return deregister(execution.getName()).whenComplete((v, error) -> {
            if (error != null) {
                log.warn("注销追踪任务 {} 失败: {}", execution.getName(), error.getMessage());
            }
            if (notifier != null) {
                notifier.sendTraceFinished(result);
            }
        });
    }

    private static void logOutput(String name, long iteration, List<String> lines) {
        lines.forEach(line -> log.info("[{}#{}] {}", name, iteration, line));
    }

    private <T> CompletableFuture<T> submit(Callable<T> task) {
        var future = new CompletableFuture<T>();
        try {
            mailbox.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (TraceException e) {
                    future.completeExceptionally(e);
                } catch (Exception e) {
                    log.error("处理追踪任务请求时出现意外错误", e);
                    future.completeExceptionally(new TraceException(ErrorKind.PROCESS_SPAWN, e.getMessage(), e));
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new TraceException(ErrorKind.PROCESS_SPAWN, "trace supervisor is shut down"));
        }
        return future;
    }
}
