/**
 * ShutdownCoordinator.java
 *
 * 负责守护进程的有序关闭。顺序固定为：
 * 1. 通知 TraceSupervisor 停止所有执行（只发信号，不等待）；
 * 2. 让 ModelStore 同步刷盘并停止；
 * 3. 关闭应用上下文，从而关闭 WebSocket 监听。
 * Kill 命令通过 requestShutdown() 触发，它只把关闭任务交给专用线程后立即返回；
 * SIGINT/SIGTERM 由 Spring Boot 的关闭钩子关闭上下文，两条路径都会走到 stop() 中的同一段流程。
 * 每一步都受 girasol.shutdown.grace 约束，超时后继续下一步。
 */
package club.ppmc.girasol.service;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ShutdownCoordinator implements SmartLifecycle {

    private final TraceSupervisor traceSupervisor;
    private final ModelStore modelStore;
    private final ApplicationContext applicationContext;
    private final Duration grace;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean sequenceDone = new AtomicBoolean(false);
    private final ExecutorService shutdownThread = Executors.newSingleThreadExecutor(r -> new Thread(r, "girasol-shutdown"));
    private volatile boolean running;

    public ShutdownCoordinator(
            TraceSupervisor traceSupervisor,
            ModelStore modelStore,
            ApplicationContext applicationContext,
            @Value("${girasol.shutdown.grace:5s}") Duration grace) {
        this.traceSupervisor = traceSupervisor;
        this.modelStore = modelStore;
        this.applicationContext = applicationContext;
        this.grace = grace;
    }

    /**
     * 请求有序关闭整个守护进程。立即返回，重复调用无效。
     */
    public void requestShutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("收到关闭请求，开始有序关闭");
        shutdownThread.execute(() -> {
            int exitCode = SpringApplication.exit(applicationContext);
            log.info("应用上下文已关闭，退出码: {}", exitCode);
            System.exit(exitCode);
        });
        shutdownThread.shutdown();
    }

    /**
     * 执行关闭流程的前两步。可重复调用，只会执行一次。
     */
    public void runShutdownSequence() {
        if (!sequenceDone.compareAndSet(false, true)) {
            return;
        }
        await("停止所有追踪任务", traceSupervisor.shutdownAll());
        await("catalog 同步刷盘", modelStore.shutdown());
        log.info("追踪任务已通知停止，catalog 已落盘");
    }

    private void await(String step, Future<?> future) {
        try {
            future.get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} 被中断", step);
        } catch (TimeoutException e) {
            log.warn("{} 超过 {} 仍未完成，继续关闭", step, grace);
        } catch (Exception e) {
            log.error("{} 失败", step, e);
        }
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        runShutdownSequence();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * 在 Web 服务器之前停止，保证监听最后关闭。
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
